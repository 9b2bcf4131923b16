package com.sommerph.attestbackend.model.common;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * State every protocol unit carries: ownership, the global pause flag, the relayer set and
 * the timelock book.
 */
@Data
public abstract class UnitState {

    private String address;
    private String owner;
    private boolean paused;
    private Set<String> relayers = new LinkedHashSet<>();

    // proposalId -> unlock timestamp
    private Map<String, Long> timelocks = new LinkedHashMap<>();

    // action type -> the one outstanding value for it
    private Map<String, PendingAction> pendingActions = new LinkedHashMap<>();

    // action type -> proposal id it was last executed from
    private Map<String, String> executedProposals = new LinkedHashMap<>();

}
