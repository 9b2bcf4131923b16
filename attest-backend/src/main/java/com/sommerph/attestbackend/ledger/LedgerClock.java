package com.sommerph.attestbackend.ledger;

/**
 * Source of block timestamps, in epoch seconds.
 */
public interface LedgerClock {

    long currentTimestamp();

}
