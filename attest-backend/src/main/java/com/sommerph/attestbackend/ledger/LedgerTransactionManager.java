package com.sommerph.attestbackend.ledger;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sommerph.attestbackend.model.event.ProtocolEvent;
import com.sommerph.attestbackend.model.ledger.LedgerMetadata;
import com.sommerph.attestbackend.repository.state.LedgerStateRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Serialises all entry points and applies each one atomically. A call made from inside an
 * open transaction runs as a nested transaction: its effects join the caller's on success and
 * are dropped on failure, leaving the caller free to handle the exception.
 *
 * <p>A top-level call writes its unit states together with the block number and event sequence
 * in one registry commit, then publishes its events.
 */
@Slf4j
public class LedgerTransactionManager {

    private final ReentrantLock lock = new ReentrantLock();
    private final ThreadLocal<LedgerTransaction> current = new ThreadLocal<>();
    private final LedgerClock clock;
    private final ProtocolEventLog eventLog;
    private final LedgerStateRegistry stateRegistry;
    private final ObjectMapper mapper;

    private long blockNumber;

    public LedgerTransactionManager(LedgerClock clock, ProtocolEventLog eventLog, LedgerStateRegistry stateRegistry) {
        this.clock = clock;
        this.eventLog = eventLog;
        this.stateRegistry = stateRegistry;
        this.mapper = new ObjectMapper();
        this.mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        LedgerMetadata metadata = stateRegistry.load(LedgerMetadata.UNIT_ID, LedgerMetadata.class);
        if (metadata != null) {
            this.blockNumber = metadata.getBlockNumber();
            eventLog.resumeAfter(metadata.getLastSequence());
            log.info("Resuming ledger at block {} after event #{}", metadata.getBlockNumber(), metadata.getLastSequence());
        }
    }

    public <T> T execute(String operation, Function<LedgerTransaction, T> work) {
        lock.lock();
        try {
            LedgerTransaction parent = current.get();
            return parent != null
                    ? executeNested(parent, operation, work)
                    : executeTopLevel(operation, work);
        } finally {
            lock.unlock();
        }
    }

    private <T> T executeTopLevel(String operation, Function<LedgerTransaction, T> work) {
        LedgerTransaction tx = new LedgerTransaction(null, operation, clock.currentTimestamp(), blockNumber + 1, mapper);
        T result;
        List<ProtocolEvent> committed;
        current.set(tx);
        try {
            result = work.apply(tx);
            committed = List.copyOf(tx.getEvents());
            Map<String, Object> writes = tx.writes();
            writes.put(LedgerMetadata.UNIT_ID,
                    new LedgerMetadata(tx.getBlockNumber(), eventLog.getLastSequence() + committed.size()));
            stateRegistry.saveAll(writes);
            blockNumber = tx.getBlockNumber();
        } catch (RuntimeException e) {
            log.warn("Rejected {}: {}", operation, e.getMessage());
            throw e;
        } finally {
            current.remove();
        }
        // the thread is unbound here, so a subscriber calling back in opens its own transaction
        eventLog.publish(committed);
        return result;
    }

    private <T> T executeNested(LedgerTransaction parent, String operation, Function<LedgerTransaction, T> work) {
        LedgerTransaction tx = parent.child(operation);
        current.set(tx);
        try {
            T result = work.apply(tx);
            tx.mergeIntoParent();
            return result;
        } catch (RuntimeException e) {
            log.debug("Nested call {} reverted: {}", operation, e.getMessage());
            throw e;
        } finally {
            current.set(parent);
        }
    }

    public void run(String operation, Consumer<LedgerTransaction> work) {
        execute(operation, tx -> {
            work.accept(tx);
            return null;
        });
    }

    /**
     * Runs a read-only view. Nothing it touches is ever written back.
     */
    public <T> T query(Function<LedgerTransaction, T> view) {
        lock.lock();
        try {
            LedgerTransaction parent = current.get();
            LedgerTransaction tx = parent != null
                    ? parent.child("query")
                    : new LedgerTransaction(null, "query", clock.currentTimestamp(), blockNumber, mapper);
            return view.apply(tx);
        } finally {
            lock.unlock();
        }
    }

    public long getBlockNumber() {
        lock.lock();
        try {
            return blockNumber;
        } finally {
            lock.unlock();
        }
    }

}
