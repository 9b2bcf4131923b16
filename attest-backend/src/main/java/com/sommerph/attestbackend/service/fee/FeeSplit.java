package com.sommerph.attestbackend.service.fee;

import lombok.Value;

import java.math.BigInteger;

@Value
public class FeeSplit {

    BigInteger treasuryShare;
    BigInteger burnShare;

    public BigInteger total() {
        return treasuryShare.add(burnShare);
    }

}
