package com.sommerph.attestbackend.model.registry;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable audit entry for one qHash. Written once by verifyData.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationRecord {

    private String qHash;
    private String verifier;
    private String userAddress;
    private boolean verified;
    private long timestamp;
    private long blockNumber;
    private String proofId;
    private String verificationType;
    private String verifierId;
    private long nonce;

    @Builder.Default
    private List<Long> targetChainIds = new ArrayList<>();

    private String voucherId;
    private boolean fallbackVoucher;

    private BigInteger feePaid;
    private PaymentPath paymentPath;

}
