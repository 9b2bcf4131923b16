package com.sommerph.attestbackend.repository.state;

import java.util.Map;

/**
 * Key-value store for the state object of each protocol unit, keyed by unit id.
 */
public interface LedgerStateRegistry {

    void save(String unitId, Object state);

    /**
     * Writes the states of several units as one commit. Either every state is replaced or,
     * when this throws, none is.
     */
    void saveAll(Map<String, Object> states);

    <S> S load(String unitId, Class<S> type);

    boolean exists(String unitId);

}
