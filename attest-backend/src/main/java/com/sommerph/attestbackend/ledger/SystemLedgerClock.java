package com.sommerph.attestbackend.ledger;

import java.time.Clock;

public class SystemLedgerClock implements LedgerClock {

    private final Clock clock;

    public SystemLedgerClock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public long currentTimestamp() {
        return clock.instant().getEpochSecond();
    }

}
