package com.sommerph.attestbackend.service.spoke;

import com.sommerph.attestbackend.exception.ProtocolError;
import com.sommerph.attestbackend.exception.ProtocolException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The configured spokes, by chain id.
 */
@Slf4j
public class VoucherSpokes {

    private final Map<Long, VoucherSpokeService> spokes = new LinkedHashMap<>();

    public VoucherSpokes(Collection<VoucherSpokeService> configured) {
        for (VoucherSpokeService spoke : configured) {
            if (spokes.putIfAbsent(spoke.getChainId(), spoke) != null) {
                throw new IllegalArgumentException("Spoke for chain " + spoke.getChainId() + " configured twice");
            }
        }
        log.info("Loaded spokes for chains {}", spokes.keySet());
    }

    public VoucherSpokeService forChain(long chainId) {
        VoucherSpokeService spoke = spokes.get(chainId);
        if (spoke == null) {
            throw new ProtocolException(ProtocolError.INVALID_CHAIN_ID, chainId);
        }
        return spoke;
    }

    public Optional<VoucherSpokeService> find(long chainId) {
        return Optional.ofNullable(spokes.get(chainId));
    }

    public Set<Long> getChainIds() {
        return Collections.unmodifiableSet(spokes.keySet());
    }

    public Collection<VoucherSpokeService> all() {
        return Collections.unmodifiableCollection(spokes.values());
    }

}
