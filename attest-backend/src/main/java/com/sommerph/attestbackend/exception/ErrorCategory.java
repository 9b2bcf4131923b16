package com.sommerph.attestbackend.exception;

public enum ErrorCategory {
    VALIDATION,
    AUTHORIZATION,
    STATE,
    RESOURCE,
    COLLABORATOR
}
