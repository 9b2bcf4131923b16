package com.sommerph.attestbackend.exception;

import lombok.Getter;

/**
 * Rejection reasons of the protocol units.
 * Format: UNIT_NNN, where the unit prefix names the area that raises it.
 */
@Getter
public enum ProtocolError {

    // ===== VALIDATION (VAL_XXX) =====
    INVALID_ADDRESS("VAL_001", ErrorCategory.VALIDATION, "Invalid or zero address"),
    INVALID_QHASH("VAL_002", ErrorCategory.VALIDATION, "Invalid or zero qHash"),
    INVALID_BYTES32("VAL_003", ErrorCategory.VALIDATION, "Invalid or zero 32-byte identifier"),
    EMPTY_PROOF_ID("VAL_004", ErrorCategory.VALIDATION, "Proof id must not be empty"),
    EMPTY_VERIFICATION_TYPE("VAL_005", ErrorCategory.VALIDATION, "Verification type must not be empty"),
    INVALID_CHAIN_ID("VAL_006", ErrorCategory.VALIDATION, "Chain id must be positive"),
    DUPLICATE_CHAIN_ID("VAL_007", ErrorCategory.VALIDATION, "Chain id listed more than once"),
    TOO_MANY_TARGET_CHAINS("VAL_008", ErrorCategory.VALIDATION, "Too many target chains"),
    EMPTY_TARGET_CHAINS("VAL_009", ErrorCategory.VALIDATION, "At least one target chain is required"),
    EMPTY_BATCH("VAL_010", ErrorCategory.VALIDATION, "Batch must not be empty"),
    BATCH_TOO_LARGE("VAL_011", ErrorCategory.VALIDATION, "Batch exceeds the maximum size"),
    LENGTH_MISMATCH("VAL_012", ErrorCategory.VALIDATION, "Array lengths differ"),
    INVALID_AMOUNT("VAL_013", ErrorCategory.VALIDATION, "Amount must be positive"),
    INVALID_BPS("VAL_014", ErrorCategory.VALIDATION, "Basis points must be within [0, 10000]"),
    EMPTY_REASON("VAL_015", ErrorCategory.VALIDATION, "A reason is required"),
    INVALID_CHAIN_COUNT("VAL_016", ErrorCategory.VALIDATION, "Chain count must not be negative"),

    // ===== AUTHORIZATION (AUTH_XXX) =====
    NOT_OWNER("AUTH_001", ErrorCategory.AUTHORIZATION, "Caller is not the owner"),
    NOT_RELAYER("AUTH_002", ErrorCategory.AUTHORIZATION, "Caller is not an authorized relayer"),
    NOT_TRUSTED_RELAYER("AUTH_003", ErrorCategory.AUTHORIZATION, "Caller is not a trusted relayer"),
    NOT_REGISTRY("AUTH_004", ErrorCategory.AUTHORIZATION, "Caller is not the configured registry"),
    NOT_TOKEN_OWNER("AUTH_005", ErrorCategory.AUTHORIZATION, "Caller is not the token owner"),

    // ===== STATE (STATE_XXX) =====
    ALREADY_VERIFIED("STATE_001", ErrorCategory.STATE, "qHash already verified"),
    UNKNOWN_QHASH("STATE_002", ErrorCategory.STATE, "qHash is not verified"),
    VOUCHER_ALREADY_EXISTS("STATE_003", ErrorCategory.STATE, "Voucher id already exists"),
    UNKNOWN_VOUCHER("STATE_004", ErrorCategory.STATE, "Unknown voucher"),
    QHASH_MISMATCH("STATE_005", ErrorCategory.STATE, "qHash does not match the voucher"),
    CHAIN_NOT_TARGETED("STATE_006", ErrorCategory.STATE, "Chain is not a declared target"),
    ALREADY_FULFILLED("STATE_007", ErrorCategory.STATE, "Voucher already fulfilled for chain"),
    CHAIN_ALREADY_CONFIRMED("STATE_008", ErrorCategory.STATE, "Chain verification already confirmed"),
    UNKNOWN_PROPOSAL("STATE_009", ErrorCategory.STATE, "Unknown proposal"),
    TIMELOCK_NOT_EXPIRED("STATE_010", ErrorCategory.STATE, "Timelock has not expired"),
    BATCH_ALREADY_COMPLETED("STATE_011", ErrorCategory.STATE, "Batch already completed"),
    VERIFIER_ALREADY_REGISTERED("STATE_012", ErrorCategory.STATE, "Verifier type already registered"),
    UNKNOWN_VERIFIER("STATE_013", ErrorCategory.STATE, "Unknown verifier"),
    VERIFIER_INACTIVE("STATE_014", ErrorCategory.STATE, "Verifier is inactive"),
    VERIFIER_ALREADY_ACTIVE("STATE_015", ErrorCategory.STATE, "Verifier is already active"),
    PAUSED("STATE_016", ErrorCategory.STATE, "Unit is paused"),
    NOT_PAUSED("STATE_017", ErrorCategory.STATE, "Unit is not paused"),
    CROSS_CHAIN_PAUSED("STATE_018", ErrorCategory.STATE, "Cross-chain operation is paused"),
    VOUCHER_CREATION_PAUSED("STATE_019", ErrorCategory.STATE, "Voucher creation is paused"),
    RELAYER_LIMIT_REACHED("STATE_020", ErrorCategory.STATE, "Relayer limit reached"),
    LAST_RELAYER("STATE_021", ErrorCategory.STATE, "Cannot remove the last relayer"),

    // ===== RESOURCE (RES_XXX) =====
    INSUFFICIENT_ALLOWANCE("RES_001", ErrorCategory.RESOURCE, "Insufficient allowance"),
    INSUFFICIENT_BALANCE("RES_002", ErrorCategory.RESOURCE, "Insufficient balance"),
    INSUFFICIENT_CREDITS("RES_003", ErrorCategory.RESOURCE, "Insufficient credits"),
    FEE_OVERFLOW("RES_004", ErrorCategory.RESOURCE, "Fee computation overflows uint256"),

    // ===== COLLABORATOR (COL_XXX) =====
    VOUCHER_HUB_NOT_CONFIGURED("COL_001", ErrorCategory.COLLABORATOR, "Voucher hub is not configured"),
    VOUCHER_HUB_UNAVAILABLE("COL_002", ErrorCategory.COLLABORATOR, "Voucher hub call failed");

    private final String code;
    private final ErrorCategory category;
    private final String message;

    ProtocolError(String code, ErrorCategory category, String message) {
        this.code = code;
        this.category = category;
        this.message = message;
    }

}
