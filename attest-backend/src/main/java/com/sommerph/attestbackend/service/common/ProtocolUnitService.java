package com.sommerph.attestbackend.service.common;

import com.sommerph.attestbackend.exception.ProtocolError;
import com.sommerph.attestbackend.exception.ProtocolException;
import com.sommerph.attestbackend.ledger.LedgerTransaction;
import com.sommerph.attestbackend.ledger.LedgerTransactionManager;
import com.sommerph.attestbackend.ledger.StateStore;
import com.sommerph.attestbackend.model.common.PendingAction;
import com.sommerph.attestbackend.model.common.UnitState;
import com.sommerph.attestbackend.model.event.EventType;
import com.sommerph.attestbackend.service.timelock.Timelock;
import com.sommerph.attestbackend.util.LedgerIds;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import static com.sommerph.attestbackend.model.event.ProtocolEvent.attrs;

/**
 * Surface shared by the registry, the hub and the spokes: ownership, global pause,
 * a bounded relayer set and the unit's timelock.
 */
@Slf4j
public abstract class ProtocolUnitService<S extends UnitState> {

    public static final int MAX_RELAYERS = 10;
    public static final int MIN_RELAYERS = 1;

    protected final String unitName;
    protected final String address;
    protected final LedgerTransactionManager txManager;
    protected final StateStore<S> store;
    protected final Timelock timelock;

    protected ProtocolUnitService(String unitName, String address, LedgerTransactionManager txManager,
                                  StateStore<S> store, Timelock timelock) {
        this.unitName = unitName;
        this.address = address;
        this.txManager = txManager;
        this.store = store;
        this.timelock = timelock;
    }

    public void setRelayer(String caller, String relayer, boolean authorized) {
        log.info("Set relayer {} on {} to {}", relayer, unitName, authorized);
        txManager.run("setRelayer", tx -> {
            S state = tx.state(store);
            requireOwner(state, caller);
            applyRelayerChange(tx, state, LedgerIds.requireAddress(relayer), authorized);
        });
    }

    public void pause(String caller, String reason) {
        log.info("Pause {}: {}", unitName, reason);
        txManager.run("pause", tx -> {
            S state = tx.state(store);
            requireOwner(state, caller);
            String why = requireReason(reason);
            if (state.isPaused()) {
                throw new ProtocolException(ProtocolError.PAUSED, unitName);
            }
            state.setPaused(true);
            tx.emit(unitName, EventType.PAUSED, attrs("by", LedgerIds.normalize(caller), "reason", why));
        });
    }

    public void unpause(String caller, String reason) {
        log.info("Unpause {}: {}", unitName, reason);
        txManager.run("unpause", tx -> {
            S state = tx.state(store);
            requireOwner(state, caller);
            String why = requireReason(reason);
            if (!state.isPaused()) {
                throw new ProtocolException(ProtocolError.NOT_PAUSED, unitName);
            }
            state.setPaused(false);
            tx.emit(unitName, EventType.UNPAUSED, attrs("by", LedgerIds.normalize(caller), "reason", why));
        });
    }

    public void transferOwnership(String caller, String newOwner) {
        log.info("Transfer ownership of {} to {}", unitName, newOwner);
        txManager.run("transferOwnership", tx -> {
            S state = tx.state(store);
            requireOwner(state, caller);
            String next = LedgerIds.requireAddress(newOwner);
            String previous = state.getOwner();
            state.setOwner(next);
            tx.emit(unitName, EventType.OWNERSHIP_TRANSFERRED, attrs("previousOwner", previous, "newOwner", next));
        });
    }

    // ---- views

    public String getUnitName() {
        return unitName;
    }

    public String getAddress() {
        return address;
    }

    public StateStore<S> getStore() {
        return store;
    }

    public long getTimelockDelaySeconds() {
        return timelock.getDelaySeconds();
    }

    public String getOwner() {
        return view(UnitState::getOwner);
    }

    public boolean isPaused() {
        return view(UnitState::isPaused);
    }

    public boolean isRelayer(String account) {
        String relayer = LedgerIds.normalize(account);
        return view(state -> state.getRelayers().contains(relayer));
    }

    public int getRelayerCount() {
        return view(state -> state.getRelayers().size());
    }

    public Optional<PendingAction> getPendingAction(String action) {
        return Optional.ofNullable(view(state -> state.getPendingActions().get(action)));
    }

    public Optional<Long> getTimelockUnlock(String proposalId) {
        String id = LedgerIds.normalize(proposalId);
        return Optional.ofNullable(view(state -> state.getTimelocks().get(id)));
    }

    // ---- helpers for subclasses

    protected <T> T view(Function<S, T> reader) {
        return txManager.query(tx -> reader.apply(tx.state(store)));
    }

    protected String scheduleAction(String caller, String action, List<String> params) {
        log.info("Schedule {} on {} with {}", action, unitName, params);
        return txManager.execute("schedule:" + action, tx -> {
            S state = tx.state(store);
            requireOwner(state, caller);
            return timelock.schedule(tx, state, action, params);
        });
    }

    protected void executeAction(String caller, String action, GovernanceChange<S> change) {
        log.info("Execute {} on {}", action, unitName);
        txManager.run("execute:" + action, tx -> {
            S state = tx.state(store);
            requireOwner(state, caller);
            List<String> params = timelock.execute(tx, state, action);
            change.apply(tx, state, params);
        });
    }

    protected void applyRelayerChange(LedgerTransaction tx, S state, String relayer, boolean authorized) {
        Set<String> relayers = state.getRelayers();
        if (authorized == relayers.contains(relayer)) {
            log.debug("Relayer {} on {} already in requested state", relayer, unitName);
            return;
        }
        if (authorized) {
            if (relayers.size() >= MAX_RELAYERS) {
                throw new ProtocolException(ProtocolError.RELAYER_LIMIT_REACHED, relayer);
            }
            relayers.add(relayer);
        } else {
            if (relayers.size() <= MIN_RELAYERS) {
                throw new ProtocolException(ProtocolError.LAST_RELAYER, relayer);
            }
            relayers.remove(relayer);
        }
        onRelayerChanged(state, relayer, authorized);
        tx.emit(unitName, EventType.RELAYER_UPDATED, attrs(
                "relayer", relayer,
                "authorized", authorized,
                "relayerCount", relayers.size()));
    }

    /**
     * Hook for units that keep further role sets in step with the relayer set.
     */
    protected void onRelayerChanged(S state, String relayer, boolean authorized) {
    }

    protected void requireOwner(S state, String caller) {
        if (caller == null || !caller.equalsIgnoreCase(state.getOwner())) {
            throw new ProtocolException(ProtocolError.NOT_OWNER, caller);
        }
    }

    protected void requireNotPaused(S state) {
        if (state.isPaused()) {
            throw new ProtocolException(ProtocolError.PAUSED, unitName);
        }
    }

    protected String requireRelayer(S state, String caller) {
        String relayer = LedgerIds.normalize(caller);
        if (relayer == null || !state.getRelayers().contains(relayer)) {
            throw new ProtocolException(ProtocolError.NOT_RELAYER, caller);
        }
        return relayer;
    }

    protected static String requireReason(String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ProtocolException(ProtocolError.EMPTY_REASON, reason);
        }
        return reason.trim();
    }

    protected static Set<String> initialRelayers(String unitName, Collection<String> configured) {
        Set<String> relayers = new LinkedHashSet<>();
        if (configured != null) {
            configured.forEach(r -> relayers.add(LedgerIds.requireAddress(r)));
        }
        if (relayers.size() < MIN_RELAYERS || relayers.size() > MAX_RELAYERS) {
            throw new IllegalArgumentException("Unit " + unitName + " needs between " + MIN_RELAYERS
                    + " and " + MAX_RELAYERS + " relayers but got " + relayers.size());
        }
        return relayers;
    }

    /**
     * Applies the parameters of a timelocked action once the delay has passed.
     */
    @FunctionalInterface
    protected interface GovernanceChange<S> {
        void apply(LedgerTransaction tx, S state, List<String> params);
    }

}
