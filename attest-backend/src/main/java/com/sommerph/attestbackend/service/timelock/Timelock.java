package com.sommerph.attestbackend.service.timelock;

import com.sommerph.attestbackend.exception.ProtocolError;
import com.sommerph.attestbackend.exception.ProtocolException;
import com.sommerph.attestbackend.ledger.LedgerTransaction;
import com.sommerph.attestbackend.model.common.PendingAction;
import com.sommerph.attestbackend.model.common.UnitState;
import com.sommerph.attestbackend.model.event.EventType;
import com.sommerph.attestbackend.util.PackedEncoder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.sommerph.attestbackend.model.event.ProtocolEvent.attrs;

/**
 * Schedule/execute gate for sensitive configuration changes of one unit.
 *
 * <p>Each action type holds at most one pending value. Scheduling a different value for the
 * same action drops the earlier proposal entry, so only the latest one can be executed.
 * There is no cancel; an unwanted proposal is left to lapse or replaced by a new one, which
 * again waits the full delay.
 */
@Slf4j
public class Timelock {

    private final String unit;
    @Getter
    private final long delaySeconds;

    public Timelock(String unit, Duration delay) {
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("Timelock delay of " + unit + " must not be negative");
        }
        this.unit = unit;
        this.delaySeconds = delay.getSeconds();
    }

    public String schedule(LedgerTransaction tx, UnitState state, String action, List<String> params) {
        String proposalId = proposalId(action, params);
        long unlockAt = tx.getTimestamp() + delaySeconds;

        PendingAction previous = state.getPendingActions().get(action);
        if (previous != null && !previous.getProposalId().equals(proposalId)) {
            state.getTimelocks().remove(previous.getProposalId());
            tx.emit(unit, EventType.TIMELOCK_SUPERSEDED, attrs(
                    "action", action,
                    "proposalId", previous.getProposalId(),
                    "supersededBy", proposalId));
        }

        state.getTimelocks().put(proposalId, unlockAt);
        state.getPendingActions().put(action,
                new PendingAction(action, proposalId, new ArrayList<>(params), tx.getTimestamp(), unlockAt));
        log.info("Scheduled {} on {} as proposal {} unlocking at {}", action, unit, proposalId, unlockAt);
        tx.emit(unit, EventType.TIMELOCK_SCHEDULED, attrs(
                "action", action,
                "proposalId", proposalId,
                "params", List.copyOf(params),
                "unlockAt", unlockAt));
        return proposalId;
    }

    /**
     * Consumes the pending value of an action once its delay has passed and returns its parameters.
     * The caller applies them inside the same transaction.
     */
    public List<String> execute(LedgerTransaction tx, UnitState state, String action) {
        PendingAction pending = state.getPendingActions().get(action);
        if (pending == null) {
            String executed = state.getExecutedProposals().get(action);
            throw new ProtocolException(ProtocolError.UNKNOWN_PROPOSAL,
                    executed != null ? executed : "nothing scheduled for " + action);
        }
        String proposalId = proposalId(action, pending.getParams());
        Long unlockAt = state.getTimelocks().get(proposalId);
        if (unlockAt == null || unlockAt == 0L) {
            throw new ProtocolException(ProtocolError.UNKNOWN_PROPOSAL, proposalId);
        }
        if (tx.getTimestamp() < unlockAt) {
            throw new ProtocolException(ProtocolError.TIMELOCK_NOT_EXPIRED, proposalId);
        }

        state.getTimelocks().remove(proposalId);
        state.getPendingActions().remove(action);
        state.getExecutedProposals().put(action, proposalId);
        log.info("Executed {} on {} from proposal {}", action, unit, proposalId);
        tx.emit(unit, EventType.TIMELOCK_EXECUTED, attrs(
                "action", action,
                "proposalId", proposalId,
                "params", List.copyOf(pending.getParams())));
        return pending.getParams();
    }

    // proposalId = keccak256(action, params...), each as a length-prefixed string
    public static String proposalId(String action, List<String> params) {
        PackedEncoder encoder = PackedEncoder.create().sizedString(action);
        params.forEach(encoder::sizedString);
        return encoder.keccak256();
    }

}
