package com.sommerph.attestbackend.service.hub;

import com.sommerph.attestbackend.config.ProtocolProperties;
import com.sommerph.attestbackend.exception.ProtocolError;
import com.sommerph.attestbackend.exception.ProtocolException;
import com.sommerph.attestbackend.ledger.LedgerTransaction;
import com.sommerph.attestbackend.ledger.LedgerTransactionManager;
import com.sommerph.attestbackend.ledger.StateStore;
import com.sommerph.attestbackend.model.event.EventType;
import com.sommerph.attestbackend.model.hub.HubState;
import com.sommerph.attestbackend.model.hub.MinimalVoucherRequest;
import com.sommerph.attestbackend.model.hub.Voucher;
import com.sommerph.attestbackend.repository.state.LedgerStateRegistry;
import com.sommerph.attestbackend.service.common.ProtocolUnitService;
import com.sommerph.attestbackend.service.common.TargetChains;
import com.sommerph.attestbackend.service.fee.FeeCalculator;
import com.sommerph.attestbackend.service.timelock.Timelock;
import com.sommerph.attestbackend.util.LedgerIds;
import com.sommerph.attestbackend.util.PackedEncoder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.sommerph.attestbackend.model.event.ProtocolEvent.attrs;

/**
 * Creates vouchers on behalf of the registry and tracks, per target chain, whether a relayer
 * has reported the voucher as fulfilled on that chain.
 */
@Slf4j
@Service
public class VoucherHubService extends ProtocolUnitService<HubState> {

    public static final String UNIT = "hub";
    public static final int MAX_MINIMAL_BATCH = 100;

    public static final String ACTION_SET_REGISTRY = "setRegistry";
    public static final String ACTION_SET_FEE_COLLECTOR = "setFeeCollector";
    public static final String ACTION_SET_VOUCHER_FEE = "setVoucherCreationFee";

    @Autowired
    public VoucherHubService(ProtocolProperties properties, LedgerStateRegistry stateRegistry,
                             LedgerTransactionManager txManager) {
        this(properties.getHub(), stateRegistry, txManager);
    }

    public VoucherHubService(ProtocolProperties.HubProperties properties, LedgerStateRegistry stateRegistry,
                             LedgerTransactionManager txManager) {
        super(UNIT,
                LedgerIds.requireAddress(properties.getAddress()),
                txManager,
                new StateStore<>(UNIT, HubState.class, stateRegistry, () -> genesis(properties)),
                new Timelock(UNIT, properties.getTimelockDelay()));
    }

    public String createVoucher(String caller, String qHash, List<Long> targetChainIds, String verifierId) {
        log.info("Create voucher for qHash {} targeting {}", qHash, targetChainIds);
        return txManager.execute("createVoucher", tx -> {
            HubState state = tx.state(store);
            String creator = requireRegistry(state, caller);
            requireCreationOpen(state);
            String id = LedgerIds.requireQHash(qHash);
            String verifier = LedgerIds.requireBytes32(verifierId);
            List<Long> targets = TargetChains.validate(targetChainIds, true);
            return storeVoucher(tx, state, creator, id, targets, verifier);
        });
    }

    /**
     * Creates one single-chain voucher per request. Superseded by {@link #createVoucher}, which
     * announces every target chain of a qHash under one id.
     *
     * @return voucher ids in request order
     */
    @Deprecated
    public List<String> createVouchersMinimal(String caller, List<MinimalVoucherRequest> requests) {
        log.info("Create {} minimal vouchers", requests == null ? 0 : requests.size());
        return txManager.execute("createVouchersMinimal", tx -> {
            HubState state = tx.state(store);
            String creator = requireRegistry(state, caller);
            requireCreationOpen(state);
            if (requests == null || requests.isEmpty()) {
                throw new ProtocolException(ProtocolError.EMPTY_BATCH, "minimal vouchers");
            }
            if (requests.size() > MAX_MINIMAL_BATCH) {
                throw new ProtocolException(ProtocolError.BATCH_TOO_LARGE, requests.size());
            }
            List<String> ids = new ArrayList<>();
            for (MinimalVoucherRequest request : requests) {
                String id = LedgerIds.requireQHash(request.getQHash());
                String verifier = LedgerIds.requireBytes32(request.getVerifierId());
                List<Long> targets = TargetChains.validate(List.of(request.getChainId()), true);
                ids.add(storeVoucher(tx, state, creator, id, targets, verifier));
            }
            return ids;
        });
    }

    public void confirmVoucherFulfilledOnHub(String caller, String voucherId, String qHash, long chainId) {
        log.info("Confirm voucher {} fulfilled on chain {}", voucherId, chainId);
        txManager.run("confirmVoucherFulfilledOnHub", tx -> {
            HubState state = tx.state(store);
            requireNotPaused(state);
            String relayer = requireRelayer(state, caller);
            String id = LedgerIds.requireBytes32(voucherId);
            String content = LedgerIds.requireQHash(qHash);

            Voucher voucher = state.getVouchers().get(id);
            if (voucher == null) {
                throw new ProtocolException(ProtocolError.UNKNOWN_VOUCHER, id);
            }
            if (!voucher.getQHash().equals(content)) {
                throw new ProtocolException(ProtocolError.QHASH_MISMATCH, id);
            }
            if (!voucher.getTargetChainIds().contains(chainId)) {
                throw new ProtocolException(ProtocolError.CHAIN_NOT_TARGETED, chainId);
            }
            if (state.isFulfilled(id, chainId)) {
                throw new ProtocolException(ProtocolError.ALREADY_FULFILLED, id + "@" + chainId);
            }

            state.markFulfilled(id, chainId);
            tx.emit(UNIT, EventType.VOUCHER_FULFILLED_ON_HUB, attrs(
                    "voucherId", id,
                    "qHash", content,
                    "chainId", chainId,
                    "relayer", relayer));

            Set<Long> fulfilled = state.getFulfilledOnHub().get(id);
            if (fulfilled.containsAll(voucher.getTargetChainIds())) {
                tx.emit(UNIT, EventType.VOUCHER_COMPLETED, attrs(
                        "voucherId", id,
                        "qHash", content,
                        "chainCount", voucher.getTargetChainIds().size()));
            }
        });
    }

    public void emergencyPauseVoucherCreation(String caller, String reason) {
        log.info("Pause voucher creation: {}", reason);
        txManager.run("emergencyPauseVoucherCreation", tx -> {
            HubState state = tx.state(store);
            requireOwner(state, caller);
            String why = requireReason(reason);
            if (state.isVoucherCreationPaused()) {
                throw new ProtocolException(ProtocolError.VOUCHER_CREATION_PAUSED, UNIT);
            }
            state.setVoucherCreationPaused(true);
            tx.emit(UNIT, EventType.VOUCHER_CREATION_PAUSED, attrs("by", LedgerIds.normalize(caller), "reason", why));
        });
    }

    public void resumeVoucherCreation(String caller, String reason) {
        log.info("Resume voucher creation: {}", reason);
        txManager.run("resumeVoucherCreation", tx -> {
            HubState state = tx.state(store);
            requireOwner(state, caller);
            String why = requireReason(reason);
            if (!state.isVoucherCreationPaused()) {
                throw new ProtocolException(ProtocolError.NOT_PAUSED, UNIT + ":voucher-creation");
            }
            state.setVoucherCreationPaused(false);
            tx.emit(UNIT, EventType.VOUCHER_CREATION_RESUMED, attrs("by", LedgerIds.normalize(caller), "reason", why));
        });
    }

    // ---- timelocked governance

    public String scheduleRegistryUpdate(String caller, String registry) {
        return scheduleAction(caller, ACTION_SET_REGISTRY, List.of(LedgerIds.requireAddress(registry)));
    }

    public void executeRegistryUpdate(String caller) {
        executeAction(caller, ACTION_SET_REGISTRY, (tx, state, params) -> {
            String previous = state.getRegistry();
            state.setRegistry(params.get(0));
            tx.emit(UNIT, EventType.REGISTRY_UPDATED, attrs("previous", previous, "registry", params.get(0)));
        });
    }

    public String scheduleFeeCollectorUpdate(String caller, String feeCollector) {
        return scheduleAction(caller, ACTION_SET_FEE_COLLECTOR, List.of(LedgerIds.requireAddress(feeCollector)));
    }

    public void executeFeeCollectorUpdate(String caller) {
        executeAction(caller, ACTION_SET_FEE_COLLECTOR, (tx, state, params) -> {
            String previous = state.getFeeCollector();
            state.setFeeCollector(params.get(0));
            tx.emit(UNIT, EventType.FEE_COLLECTOR_UPDATED, attrs("previous", previous, "feeCollector", params.get(0)));
        });
    }

    public String scheduleVoucherFeeUpdate(String caller, BigInteger voucherCreationFee) {
        FeeCalculator.requireUint256(voucherCreationFee);
        return scheduleAction(caller, ACTION_SET_VOUCHER_FEE, List.of(voucherCreationFee.toString()));
    }

    public void executeVoucherFeeUpdate(String caller) {
        executeAction(caller, ACTION_SET_VOUCHER_FEE, (tx, state, params) -> {
            BigInteger previous = state.getVoucherCreationFee();
            state.setVoucherCreationFee(new BigInteger(params.get(0)));
            tx.emit(UNIT, EventType.VOUCHER_FEE_UPDATED, attrs(
                    "previous", previous,
                    "voucherCreationFee", state.getVoucherCreationFee()));
        });
    }

    // ---- views

    public Optional<Voucher> getVoucher(String voucherId) {
        String id = LedgerIds.normalize(voucherId);
        return Optional.ofNullable(view(state -> state.getVouchers().get(id)));
    }

    public boolean isFulfilledOnHub(String voucherId, long chainId) {
        String id = LedgerIds.normalize(voucherId);
        return view(state -> state.isFulfilled(id, chainId));
    }

    public long getVoucherCount() {
        return view(HubState::getVoucherCounter);
    }

    public String getRegistryAddress() {
        return view(HubState::getRegistry);
    }

    public String getFeeCollector() {
        return view(HubState::getFeeCollector);
    }

    public BigInteger getVoucherCreationFee() {
        return view(HubState::getVoucherCreationFee);
    }

    public boolean isVoucherCreationPaused() {
        return view(HubState::isVoucherCreationPaused);
    }

    // ---- internals

    private String storeVoucher(LedgerTransaction tx, HubState state, String creator, String qHash,
                                List<Long> targets, String verifierId) {
        long counter = state.getVoucherCounter() + 1;
        String voucherId = voucherId(qHash, verifierId, tx.getTimestamp(), counter);
        if (state.getVouchers().containsKey(voucherId)) {
            throw new ProtocolException(ProtocolError.VOUCHER_ALREADY_EXISTS, voucherId);
        }
        state.setVoucherCounter(counter);
        state.getVouchers().put(voucherId, Voucher.builder()
                .voucherId(voucherId)
                .qHash(qHash)
                .targetChainIds(new ArrayList<>(targets))
                .verifierId(verifierId)
                .createdAt(tx.getTimestamp())
                .active(true)
                .creator(creator)
                .build());
        tx.emit(UNIT, EventType.VOUCHER_CREATED, attrs(
                "voucherId", voucherId,
                "qHash", qHash,
                "targetChainIds", List.copyOf(targets),
                "verifierId", verifierId,
                "creator", creator,
                "voucherCreationFee", state.getVoucherCreationFee()));
        return voucherId;
    }

    // keccak256(qHash, verifierId, timestamp, counter)
    static String voucherId(String qHash, String verifierId, long timestamp, long counter) {
        return PackedEncoder.create()
                .bytes32(qHash)
                .bytes32(verifierId)
                .uint(timestamp)
                .uint(counter)
                .keccak256();
    }

    private static String requireRegistry(HubState state, String caller) {
        if (caller == null || state.getRegistry() == null || !caller.equalsIgnoreCase(state.getRegistry())) {
            throw new ProtocolException(ProtocolError.NOT_REGISTRY, caller);
        }
        return LedgerIds.normalize(caller);
    }

    private void requireCreationOpen(HubState state) {
        requireNotPaused(state);
        if (state.isVoucherCreationPaused()) {
            throw new ProtocolException(ProtocolError.VOUCHER_CREATION_PAUSED, UNIT);
        }
    }

    private static HubState genesis(ProtocolProperties.HubProperties properties) {
        HubState state = new HubState();
        state.setAddress(LedgerIds.requireAddress(properties.getAddress()));
        state.setOwner(LedgerIds.requireAddress(properties.getOwner()));
        state.setRelayers(initialRelayers(UNIT, properties.getRelayers()));
        state.setRegistry(LedgerIds.isZeroAddress(properties.getRegistry()) ? null : LedgerIds.requireAddress(properties.getRegistry()));
        state.setFeeCollector(LedgerIds.isZeroAddress(properties.getFeeCollector()) ? null : LedgerIds.requireAddress(properties.getFeeCollector()));
        state.setVoucherCreationFee(FeeCalculator.requireUint256(properties.getVoucherCreationFee()));
        return state;
    }

}
