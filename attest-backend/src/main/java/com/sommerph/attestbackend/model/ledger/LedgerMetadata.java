package com.sommerph.attestbackend.model.ledger;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Chain-wide counters, written in the same commit as the unit states they describe.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LedgerMetadata {

    public static final String UNIT_ID = "ledger";

    private long blockNumber;
    private long lastSequence;

}
