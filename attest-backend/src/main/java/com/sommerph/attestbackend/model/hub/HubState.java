package com.sommerph.attestbackend.model.hub;

import com.sommerph.attestbackend.model.common.UnitState;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class HubState extends UnitState {

    private Map<String, Voucher> vouchers = new LinkedHashMap<>();

    // voucherId -> chain ids observed as fulfilled
    private Map<String, Set<Long>> fulfilledOnHub = new LinkedHashMap<>();

    private long voucherCounter;

    private String registry;
    private String feeCollector;
    private BigInteger voucherCreationFee = BigInteger.ZERO;
    private boolean voucherCreationPaused;

    public boolean isFulfilled(String voucherId, long chainId) {
        Set<Long> chains = fulfilledOnHub.get(voucherId);
        return chains != null && chains.contains(chainId);
    }

    public void markFulfilled(String voucherId, long chainId) {
        fulfilledOnHub.computeIfAbsent(voucherId, id -> new LinkedHashSet<>()).add(chainId);
    }

}
