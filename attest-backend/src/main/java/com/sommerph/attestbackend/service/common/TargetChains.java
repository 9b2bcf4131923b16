package com.sommerph.attestbackend.service.common;

import com.sommerph.attestbackend.exception.ProtocolError;
import com.sommerph.attestbackend.exception.ProtocolException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class TargetChains {

    public static final int MAX_TARGET_CHAINS = 50;

    private TargetChains() {
    }

    /**
     * Returns a copy of the chain list in submitted order after checking that every id is
     * positive and listed once.
     */
    public static List<Long> validate(List<Long> chainIds, boolean requireNonEmpty) {
        List<Long> chains = chainIds == null ? new ArrayList<>() : new ArrayList<>(chainIds);
        if (requireNonEmpty && chains.isEmpty()) {
            throw new ProtocolException(ProtocolError.EMPTY_TARGET_CHAINS, "[]");
        }
        if (chains.size() > MAX_TARGET_CHAINS) {
            throw new ProtocolException(ProtocolError.TOO_MANY_TARGET_CHAINS, chains.size());
        }
        Set<Long> seen = new HashSet<>();
        for (Long chainId : chains) {
            if (chainId == null || chainId <= 0) {
                throw new ProtocolException(ProtocolError.INVALID_CHAIN_ID, chainId);
            }
            if (!seen.add(chainId)) {
                throw new ProtocolException(ProtocolError.DUPLICATE_CHAIN_ID, chainId);
            }
        }
        return chains;
    }

}
