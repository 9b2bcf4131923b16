package com.sommerph.attestbackend.model.registry;

public enum PaymentPath {
    NONE,
    CREDIT,
    DIRECT
}
