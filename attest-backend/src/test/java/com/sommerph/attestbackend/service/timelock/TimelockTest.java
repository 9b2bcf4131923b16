package com.sommerph.attestbackend.service.timelock;

import com.sommerph.attestbackend.exception.ProtocolError;
import com.sommerph.attestbackend.exception.ProtocolException;
import com.sommerph.attestbackend.ledger.LedgerTransactionManager;
import com.sommerph.attestbackend.ledger.ProtocolEventLog;
import com.sommerph.attestbackend.ledger.StateStore;
import com.sommerph.attestbackend.model.event.EventType;
import com.sommerph.attestbackend.model.spoke.SpokeState;
import com.sommerph.attestbackend.repository.state.InMemoryLedgerStateRegistry;
import com.sommerph.attestbackend.support.MutableLedgerClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Timelock")
class TimelockTest {

    private static final String ACTION = "setHub";
    private static final String HUB_1 = "0x0000000000000000000000000000000000000011";
    private static final String HUB_2 = "0x0000000000000000000000000000000000000022";

    private MutableLedgerClock clock;
    private ProtocolEventLog eventLog;
    private LedgerTransactionManager txManager;
    private StateStore<SpokeState> store;
    private Timelock timelock;

    @BeforeEach
    void setUp() {
        clock = new MutableLedgerClock(10_000L);
        eventLog = new ProtocolEventLog();
        InMemoryLedgerStateRegistry stateRegistry = new InMemoryLedgerStateRegistry();
        txManager = new LedgerTransactionManager(clock, eventLog, stateRegistry);
        store = new StateStore<>("spoke-1", SpokeState.class, stateRegistry, SpokeState::new);
        timelock = new Timelock("spoke-1", Duration.ofHours(24));
    }

    private String schedule(String value) {
        return txManager.execute("schedule", tx -> timelock.schedule(tx, tx.state(store), ACTION, List.of(value)));
    }

    private List<String> execute() {
        return txManager.execute("execute", tx -> timelock.execute(tx, tx.state(store), ACTION));
    }

    private SpokeState state() {
        return txManager.query(tx -> tx.state(store));
    }

    private static ProtocolException rejection(Runnable call) {
        try {
            call.run();
        } catch (ProtocolException e) {
            return e;
        }
        throw new AssertionError("expected a ProtocolException");
    }

    private static ProtocolError errorOf(Runnable call) {
        return rejection(call).getError();
    }

    @Test
    @DisplayName("derives the proposal id from the action and its parameters")
    void proposalIdIsDeterministic() {
        assertThat(Timelock.proposalId(ACTION, List.of(HUB_1)))
                .isEqualTo(Timelock.proposalId(ACTION, List.of(HUB_1)))
                .isNotEqualTo(Timelock.proposalId(ACTION, List.of(HUB_2)))
                .isNotEqualTo(Timelock.proposalId("setRegistry", List.of(HUB_1)));
    }

    @Test
    @DisplayName("records the unlock time and the pending value")
    void scheduleRecordsPendingValue() {
        String proposalId = schedule(HUB_1);

        SpokeState state = state();
        assertThat(state.getTimelocks()).containsEntry(proposalId, 10_000L + 86_400L);
        assertThat(state.getPendingActions().get(ACTION).getParams()).containsExactly(HUB_1);
        assertThat(eventLog.latest(EventType.TIMELOCK_SCHEDULED)).hasValueSatisfying(
                event -> assertThat(event.attribute("proposalId")).isEqualTo(proposalId));
    }

    @Nested
    @DisplayName("execute")
    class Execute {

        @Test
        @DisplayName("rejects before the unlock time")
        void beforeUnlock() {
            schedule(HUB_1);
            clock.advance(Duration.ofHours(24).minusSeconds(1));

            assertThat(errorOf(TimelockTest.this::execute)).isEqualTo(ProtocolError.TIMELOCK_NOT_EXPIRED);
            assertThat(state().getPendingActions()).containsKey(ACTION);
        }

        @Test
        @DisplayName("succeeds exactly once at the unlock time")
        void onceAtUnlock() {
            String proposalId = schedule(HUB_1);
            clock.advance(Duration.ofHours(24));

            assertThat(execute()).containsExactly(HUB_1);
            assertThat(state().getTimelocks()).doesNotContainKey(proposalId);
            assertThat(state().getPendingActions()).isEmpty();
            ProtocolException repeat = rejection(TimelockTest.this::execute);
            assertThat(repeat.getError()).isEqualTo(ProtocolError.UNKNOWN_PROPOSAL);
            assertThat(repeat.getIdentifier()).isEqualTo(proposalId);
        }

        @Test
        @DisplayName("rejects when nothing was scheduled")
        void nothingScheduled() {
            assertThat(errorOf(TimelockTest.this::execute)).isEqualTo(ProtocolError.UNKNOWN_PROPOSAL);
        }
    }

    @Nested
    @DisplayName("rescheduling")
    class Rescheduling {

        @Test
        @DisplayName("a different value clears the stale proposal and restarts the delay")
        void differentValueSupersedes() {
            String first = schedule(HUB_1);
            clock.advance(Duration.ofHours(20));
            String second = schedule(HUB_2);

            assertThat(state().getTimelocks()).doesNotContainKey(first).containsKey(second);
            assertThat(eventLog.latest(EventType.TIMELOCK_SUPERSEDED)).hasValueSatisfying(event -> {
                assertThat(event.attribute("proposalId")).isEqualTo(first);
                assertThat(event.attribute("supersededBy")).isEqualTo(second);
            });

            clock.advance(Duration.ofHours(4));
            assertThat(errorOf(TimelockTest.this::execute)).isEqualTo(ProtocolError.TIMELOCK_NOT_EXPIRED);

            clock.advance(Duration.ofHours(20));
            assertThat(execute()).containsExactly(HUB_2);
        }

        @Test
        @DisplayName("the same value keeps its id and restarts the delay")
        void sameValueRestarts() {
            String first = schedule(HUB_1);
            clock.advance(Duration.ofHours(10));
            String again = schedule(HUB_1);

            assertThat(again).isEqualTo(first);
            assertThat(state().getTimelocks()).containsEntry(first, 10_000L + 36_000L + 86_400L);
            assertThat(eventLog.ofType(EventType.TIMELOCK_SUPERSEDED)).isEmpty();
        }
    }

    @Test
    void rejectsNegativeDelay() {
        assertThatThrownBy(() -> new Timelock("x", Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

}
