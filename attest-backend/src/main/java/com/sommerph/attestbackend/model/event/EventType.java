package com.sommerph.attestbackend.model.event;

public enum EventType {

    // registry
    VERIFICATION_SUCCEEDED,
    VOUCHER_CREATION_FAILED,
    FEE_COLLECTED,
    CHAIN_VERIFICATION_CONFIRMED,
    CHAIN_VERIFICATIONS_BATCH_CONFIRMED,
    VERIFIER_REGISTERED,
    VERIFIER_DEACTIVATED,
    VERIFIER_REACTIVATED,
    CREDITS_DEPOSITED,
    CREDITS_ALLOCATED,
    CREDITS_CONSUMED,
    CREDIT_PAYMENTS_TOGGLED,
    FEES_UPDATED,
    TREASURY_SPLIT_UPDATED,
    FEE_WALLETS_UPDATED,
    VOUCHER_HUB_UPDATED,
    CROSS_CHAIN_PAUSED,
    CROSS_CHAIN_RESUMED,

    // hub
    VOUCHER_CREATED,
    VOUCHER_FULFILLED_ON_HUB,
    VOUCHER_COMPLETED,
    REGISTRY_UPDATED,
    FEE_COLLECTOR_UPDATED,
    VOUCHER_FEE_UPDATED,
    VOUCHER_CREATION_PAUSED,
    VOUCHER_CREATION_RESUMED,

    // spoke
    VOUCHER_FULFILLED,
    BATCH_FULFILLED,
    HUB_UPDATE_ACKNOWLEDGED,

    // shared by every unit
    RELAYER_UPDATED,
    PAUSED,
    UNPAUSED,
    OWNERSHIP_TRANSFERRED,
    TIMELOCK_SCHEDULED,
    TIMELOCK_SUPERSEDED,
    TIMELOCK_EXECUTED,

    // fee token
    TRANSFER,
    APPROVAL

}
