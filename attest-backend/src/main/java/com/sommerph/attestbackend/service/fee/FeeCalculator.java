package com.sommerph.attestbackend.service.fee;

import com.sommerph.attestbackend.exception.ProtocolError;
import com.sommerph.attestbackend.exception.ProtocolException;
import com.sommerph.attestbackend.model.registry.FeeConfig;

import java.math.BigInteger;

public class FeeCalculator {

    public static final BigInteger UINT256_MAX = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private FeeCalculator() {
    }

    /**
     * totalFee = verificationFee + crossChainFeePerChain * chainCount, rejected instead of wrapping
     * when any step leaves the uint256 range.
     */
    public static BigInteger totalFee(FeeConfig fees, int chainCount) {
        if (chainCount < 0) {
            throw new ProtocolException(ProtocolError.INVALID_CHAIN_COUNT, chainCount);
        }
        BigInteger perChain = fees.getCrossChainFeePerChain().multiply(BigInteger.valueOf(chainCount));
        if (perChain.compareTo(UINT256_MAX) > 0) {
            throw new ProtocolException(ProtocolError.FEE_OVERFLOW, "crossChainFee x " + chainCount);
        }
        BigInteger total = fees.getVerificationFee().add(perChain);
        if (total.compareTo(UINT256_MAX) > 0) {
            throw new ProtocolException(ProtocolError.FEE_OVERFLOW, "verificationFee + crossChainFee x " + chainCount);
        }
        return total;
    }

    // treasuryShare = floor(fee * treasuryBps / 10000); the burn share takes the remainder
    public static FeeSplit split(BigInteger fee, int treasuryBps) {
        requireBps(treasuryBps);
        BigInteger treasuryShare = fee.multiply(BigInteger.valueOf(treasuryBps))
                .divide(BigInteger.valueOf(FeeConfig.TOTAL_BPS));
        return new FeeSplit(treasuryShare, fee.subtract(treasuryShare));
    }

    public static void requireBps(int bps) {
        if (bps < 0 || bps > FeeConfig.TOTAL_BPS) {
            throw new ProtocolException(ProtocolError.INVALID_BPS, bps);
        }
    }

    public static BigInteger requireUint256(BigInteger value) {
        if (value == null || value.signum() < 0 || value.compareTo(UINT256_MAX) > 0) {
            throw new ProtocolException(ProtocolError.INVALID_AMOUNT, value);
        }
        return value;
    }

}
