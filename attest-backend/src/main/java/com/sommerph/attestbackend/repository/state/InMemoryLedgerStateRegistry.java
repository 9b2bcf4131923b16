package com.sommerph.attestbackend.repository.state;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class InMemoryLedgerStateRegistry implements LedgerStateRegistry {

    private final Map<String, Object> stateStore = new ConcurrentHashMap<>();

    @Override
    public void save(String unitId, Object state) {
        log.debug("Save state of unit {}", unitId);
        stateStore.put(unitId, state);
    }

    @Override
    public void saveAll(Map<String, Object> states) {
        log.debug("Save state of units {}", states.keySet());
        stateStore.putAll(states);
    }

    @Override
    public <S> S load(String unitId, Class<S> type) {
        log.debug("Load state of unit {}", unitId);
        Object state = stateStore.get(unitId);
        if (state == null) {
            return null;
        }
        try {
            return type.cast(state);
        } catch (ClassCastException e) {
            log.error("State of unit {} is not a {}", unitId, type.getSimpleName(), e);
            throw new IllegalStateException("State of unit " + unitId + " is not a " + type.getSimpleName(), e);
        }
    }

    @Override
    public boolean exists(String unitId) {
        return stateStore.containsKey(unitId);
    }

}
