package com.sommerph.attestbackend.service.registry;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of asking the voucher hub for a voucher: either the created id or the reason it failed.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class VoucherCreationResult {

    String voucherId;
    String failureReason;

    public static VoucherCreationResult created(String voucherId) {
        return new VoucherCreationResult(voucherId, null);
    }

    public static VoucherCreationResult failed(String reason) {
        return new VoucherCreationResult(null, reason == null ? "unknown" : reason);
    }

    public boolean isCreated() {
        return voucherId != null;
    }

}
