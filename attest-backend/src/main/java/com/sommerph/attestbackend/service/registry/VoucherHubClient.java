package com.sommerph.attestbackend.service.registry;

import java.util.List;

/**
 * Registry-side view of the voucher hub. Implementations report every failure through the
 * result instead of throwing.
 */
public interface VoucherHubClient {

    VoucherCreationResult createVoucher(String hubAddress, String registryAddress, String qHash,
                                        List<Long> targetChainIds, String verifierId);

}
