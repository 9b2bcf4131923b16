package com.sommerph.attestbackend.ledger;

import com.sommerph.attestbackend.repository.state.LedgerStateRegistry;
import lombok.Getter;

import java.util.function.Supplier;

/**
 * Binds one unit's state type to its slot in the state registry. The genesis supplier
 * provides the state until the unit's first committed transaction persists it.
 * Instances are compared by identity.
 */
public class StateStore<S> {

    @Getter
    private final String unitId;
    @Getter
    private final Class<S> type;
    private final LedgerStateRegistry registry;
    private final Supplier<S> genesis;

    public StateStore(String unitId, Class<S> type, LedgerStateRegistry registry, Supplier<S> genesis) {
        this.unitId = unitId;
        this.type = type;
        this.registry = registry;
        this.genesis = genesis;
    }

    S load() {
        S state = registry.load(unitId, type);
        return state != null ? state : genesis.get();
    }

    /**
     * Writes state directly, bypassing transactions. Intended for migrations and test setup.
     */
    public void overwrite(S state) {
        registry.save(unitId, state);
    }

}
