package com.sommerph.attestbackend.exception;

import lombok.Getter;

import java.util.EnumSet;
import java.util.Set;

/**
 * Typed rejection raised by every protocol entry point. The enclosing ledger transaction
 * is discarded when this propagates out of it.
 */
@Getter
public class ProtocolException extends RuntimeException {

    private static final Set<ProtocolError> ALREADY_DONE = EnumSet.of(
            ProtocolError.ALREADY_VERIFIED,
            ProtocolError.ALREADY_FULFILLED,
            ProtocolError.CHAIN_ALREADY_CONFIRMED,
            ProtocolError.BATCH_ALREADY_COMPLETED);

    private final ProtocolError error;
    private final String identifier;

    public ProtocolException(ProtocolError error, Object identifier) {
        super(error.getCode() + " " + error.getMessage() + ": " + identifier);
        this.error = error;
        this.identifier = String.valueOf(identifier);
    }

    public ErrorCategory getCategory() {
        return error.getCategory();
    }

    /**
     * True when the rejected work was already applied earlier, so a retrying relayer may drop it.
     */
    public boolean isAlreadyDone() {
        return ALREADY_DONE.contains(error);
    }

}
