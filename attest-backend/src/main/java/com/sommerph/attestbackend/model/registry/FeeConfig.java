package com.sommerph.attestbackend.model.registry;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FeeConfig {

    public static final int TOTAL_BPS = 10_000;

    private BigInteger verificationFee = BigInteger.ZERO;
    private BigInteger crossChainFeePerChain = BigInteger.ZERO;

    // burn share is the remainder: TOTAL_BPS - treasuryBps
    private int treasuryBps;

    private String treasuryWallet;

    // null means the conventional dead address
    private String burnWallet;

    @JsonIgnore
    public int getBurnBps() {
        return TOTAL_BPS - treasuryBps;
    }

}
