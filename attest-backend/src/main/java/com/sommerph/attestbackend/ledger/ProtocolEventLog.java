package com.sommerph.attestbackend.ledger;

import com.sommerph.attestbackend.model.event.EventType;
import com.sommerph.attestbackend.model.event.ProtocolEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Committed events in commit order. Relayers and indexers poll it with {@link #since(long)}
 * or register a subscriber.
 */
@Slf4j
public class ProtocolEventLog {

    private final List<ProtocolEvent> events = new CopyOnWriteArrayList<>();
    private final List<Consumer<ProtocolEvent>> subscribers = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    // delivery backlog; only touched by the thread holding the transaction lock
    private final Deque<ProtocolEvent> undelivered = new ArrayDeque<>();
    private boolean delivering;

    /**
     * Appends committed events and notifies subscribers in sequence order. Events committed by a
     * subscriber's own calls are appended at once and delivered after the current backlog.
     */
    void publish(List<ProtocolEvent> committed) {
        for (ProtocolEvent event : committed) {
            event.setSequence(sequence.incrementAndGet());
            events.add(event);
            undelivered.add(event);
            log.info("Event #{} {} from {} at block {}: {}",
                    event.getSequence(), event.getType(), event.getUnit(), event.getBlockNumber(), event.getAttributes());
        }
        if (delivering) {
            return;
        }
        delivering = true;
        try {
            ProtocolEvent event;
            while ((event = undelivered.poll()) != null) {
                deliver(event);
            }
        } finally {
            delivering = false;
        }
    }

    // Sequence numbers continue from a persisted ledger; earlier events are not replayed
    void resumeAfter(long lastSequence) {
        sequence.set(lastSequence);
    }

    public long getLastSequence() {
        return sequence.get();
    }

    private void deliver(ProtocolEvent event) {
        for (Consumer<ProtocolEvent> subscriber : subscribers) {
            try {
                subscriber.accept(event);
            } catch (RuntimeException e) {
                log.error("Subscriber failed on event #{} {}", event.getSequence(), event.getType(), e);
            }
        }
    }

    public void subscribe(Consumer<ProtocolEvent> subscriber) {
        subscribers.add(subscriber);
    }

    public List<ProtocolEvent> all() {
        return List.copyOf(events);
    }

    public List<ProtocolEvent> since(long sequenceExclusive) {
        return events.stream()
                .filter(e -> e.getSequence() > sequenceExclusive)
                .collect(Collectors.toList());
    }

    public List<ProtocolEvent> ofType(EventType type) {
        return events.stream()
                .filter(e -> e.getType() == type)
                .collect(Collectors.toList());
    }

    public List<ProtocolEvent> ofType(String unit, EventType type) {
        return events.stream()
                .filter(e -> e.getUnit().equals(unit) && e.getType() == type)
                .collect(Collectors.toList());
    }

    public Optional<ProtocolEvent> latest(EventType type) {
        for (int i = events.size() - 1; i >= 0; i--) {
            if (events.get(i).getType() == type) {
                return Optional.of(events.get(i));
            }
        }
        return Optional.empty();
    }

}
