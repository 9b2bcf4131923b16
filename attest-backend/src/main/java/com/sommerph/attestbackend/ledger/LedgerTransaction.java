package com.sommerph.attestbackend.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sommerph.attestbackend.model.event.EventType;
import com.sommerph.attestbackend.model.event.ProtocolEvent;
import lombok.Getter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Working set of one entry-point call. Unit states are copied on first access and only written
 * back, together with the buffered events, when the outermost call completes.
 */
public class LedgerTransaction {

    private final LedgerTransaction parent;
    @Getter
    private final String operation;
    @Getter
    private final long timestamp;
    @Getter
    private final long blockNumber;
    private final ObjectMapper mapper;

    private final Map<StateStore<?>, Object> working = new LinkedHashMap<>();
    private final List<ProtocolEvent> events = new ArrayList<>();

    LedgerTransaction(LedgerTransaction parent, String operation, long timestamp, long blockNumber, ObjectMapper mapper) {
        this.parent = parent;
        this.operation = operation;
        this.timestamp = timestamp;
        this.blockNumber = blockNumber;
        this.mapper = mapper;
    }

    public <S> S state(StateStore<S> store) {
        Object state = working.get(store);
        if (state == null) {
            S source = parent != null ? parent.state(store) : store.load();
            state = copy(source, store.getType());
            working.put(store, state);
        }
        return store.getType().cast(state);
    }

    public void emit(String unit, EventType type, Map<String, Object> attributes) {
        events.add(ProtocolEvent.builder()
                .blockNumber(blockNumber)
                .timestamp(timestamp)
                .unit(unit)
                .type(type)
                .attributes(new LinkedHashMap<>(attributes))
                .build());
    }

    public boolean isNested() {
        return parent != null;
    }

    public List<ProtocolEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    LedgerTransaction child(String childOperation) {
        return new LedgerTransaction(this, childOperation, timestamp, blockNumber, mapper);
    }

    void mergeIntoParent() {
        parent.working.putAll(working);
        parent.events.addAll(events);
    }

    // unit id -> state to persist when this transaction commits
    Map<String, Object> writes() {
        Map<String, Object> writes = new LinkedHashMap<>();
        working.forEach((store, state) -> writes.put(store.getUnitId(), state));
        return writes;
    }

    private <S> S copy(S source, Class<S> type) {
        try {
            return mapper.readValue(mapper.writeValueAsBytes(source), type);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to copy " + type.getSimpleName() + " for " + operation, e);
        }
    }

}
