package com.sommerph.attestbackend.service.spoke;

import com.sommerph.attestbackend.config.ProtocolProperties;
import com.sommerph.attestbackend.exception.ProtocolError;
import com.sommerph.attestbackend.exception.ProtocolException;
import com.sommerph.attestbackend.ledger.LedgerTransactionManager;
import com.sommerph.attestbackend.ledger.StateStore;
import com.sommerph.attestbackend.model.event.EventType;
import com.sommerph.attestbackend.model.spoke.BatchFulfillmentResult;
import com.sommerph.attestbackend.model.spoke.BatchRecord;
import com.sommerph.attestbackend.model.spoke.FulfillmentParams;
import com.sommerph.attestbackend.model.spoke.SpokeFulfillment;
import com.sommerph.attestbackend.model.spoke.SpokeState;
import com.sommerph.attestbackend.repository.state.LedgerStateRegistry;
import com.sommerph.attestbackend.service.common.ProtocolUnitService;
import com.sommerph.attestbackend.service.timelock.Timelock;
import com.sommerph.attestbackend.util.LedgerIds;
import com.sommerph.attestbackend.util.PackedEncoder;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.sommerph.attestbackend.model.event.ProtocolEvent.attrs;

/**
 * Records, for one target chain, which vouchers relayers have delivered. Re-delivering a
 * voucher is harmless: it is skipped and counted as failed in the batch totals.
 */
@Slf4j
public class VoucherSpokeService extends ProtocolUnitService<SpokeState> {

    public static final String UNIT_PREFIX = "spoke-";
    public static final int MAX_BATCH_SIZE = 100;

    public static final String ACTION_SET_HUB = "setHub";

    private final long chainId;

    public VoucherSpokeService(ProtocolProperties.SpokeProperties properties, LedgerStateRegistry stateRegistry,
                               LedgerTransactionManager txManager) {
        super(unitName(properties.getChainId()),
                LedgerIds.requireAddress(properties.getAddress()),
                txManager,
                new StateStore<>(unitName(properties.getChainId()), SpokeState.class, stateRegistry, () -> genesis(properties)),
                new Timelock(unitName(properties.getChainId()), properties.getTimelockDelay()));
        this.chainId = properties.getChainId();
    }

    public static String unitName(long chainId) {
        if (chainId <= 0) {
            throw new IllegalArgumentException("Spoke chain id must be positive but was " + chainId);
        }
        return UNIT_PREFIX + chainId;
    }

    /**
     * Marks every not yet fulfilled voucher of the batch as fulfilled on this chain. The batch is
     * validated as a whole before anything is applied and its id can complete only once.
     */
    public BatchFulfillmentResult fulfillVoucherBatch(String caller, String batchId, List<FulfillmentParams> params) {
        log.info("Fulfill batch {} of {} vouchers on chain {}", batchId, params == null ? 0 : params.size(), chainId);
        return txManager.execute("fulfillVoucherBatch", tx -> {
            SpokeState state = tx.state(store);
            requireNotPaused(state);
            String relayer = requireRelayer(state, caller);
            String id = LedgerIds.requireBytes32(batchId);
            if (params == null || params.isEmpty()) {
                throw new ProtocolException(ProtocolError.EMPTY_BATCH, id);
            }
            if (params.size() > MAX_BATCH_SIZE) {
                throw new ProtocolException(ProtocolError.BATCH_TOO_LARGE, params.size());
            }
            if (state.getCompletedBatches().containsKey(id)) {
                throw new ProtocolException(ProtocolError.BATCH_ALREADY_COMPLETED, id);
            }

            List<FulfillmentParams> elements = new ArrayList<>();
            PackedEncoder digest = PackedEncoder.create();
            for (FulfillmentParams element : params) {
                FulfillmentParams normalized = FulfillmentParams.builder()
                        .voucherId(LedgerIds.requireBytes32(element.getVoucherId()))
                        .qHash(LedgerIds.requireQHash(element.getQHash()))
                        .verifier(LedgerIds.requireAddress(element.getVerifier()))
                        .verifiedAt(element.getVerifiedAt())
                        .build();
                digest.bytes32(normalized.getVoucherId())
                        .bytes32(normalized.getQHash())
                        .address(normalized.getVerifier())
                        .uint(Math.max(0L, normalized.getVerifiedAt()));
                elements.add(normalized);
            }

            int fulfilled = 0;
            for (FulfillmentParams element : elements) {
                if (state.getFulfillments().containsKey(element.getVoucherId())) {
                    log.debug("Voucher {} already fulfilled on chain {}, skipping", element.getVoucherId(), chainId);
                    continue;
                }
                state.getFulfillments().put(element.getVoucherId(), new SpokeFulfillment(
                        element.getVoucherId(),
                        element.getQHash(),
                        element.getVerifier(),
                        element.getVerifiedAt(),
                        id,
                        relayer,
                        tx.getTimestamp()));
                state.getVoucherByQHash().putIfAbsent(element.getQHash(), element.getVoucherId());
                tx.emit(unitName, EventType.VOUCHER_FULFILLED, attrs(
                        "voucherId", element.getVoucherId(),
                        "qHash", element.getQHash(),
                        "chainId", chainId,
                        "verifier", element.getVerifier(),
                        "batchId", id));
                fulfilled++;
            }

            int failed = elements.size() - fulfilled;
            String contentDigest = digest.keccak256();
            state.getCompletedBatches().put(id,
                    new BatchRecord(id, contentDigest, elements.size(), fulfilled, failed, relayer, tx.getTimestamp()));
            tx.emit(unitName, EventType.BATCH_FULFILLED, attrs(
                    "batchId", id,
                    "chainId", chainId,
                    "total", elements.size(),
                    "fulfilled", fulfilled,
                    "failed", failed,
                    "contentDigest", contentDigest));
            return new BatchFulfillmentResult(id, elements.size(), fulfilled, failed);
        });
    }

    // ---- timelocked governance

    public String scheduleHubUpdate(String caller, String hub) {
        return scheduleAction(caller, ACTION_SET_HUB, List.of(LedgerIds.requireAddress(hub)));
    }

    /**
     * Consumes the pending hub rotation. The hub address is fixed at deployment, so this only
     * records the acknowledgement.
     */
    public void executeHubUpdate(String caller) {
        executeAction(caller, ACTION_SET_HUB, (tx, state, params) ->
                tx.emit(unitName, EventType.HUB_UPDATE_ACKNOWLEDGED, attrs(
                        "proposedHub", params.get(0),
                        "hub", state.getHub())));
    }

    // ---- views

    public long getChainId() {
        return chainId;
    }

    public String getHubAddress() {
        return view(SpokeState::getHub);
    }

    public boolean isVoucherFulfilled(String voucherId) {
        String id = LedgerIds.normalize(voucherId);
        return view(state -> state.getFulfillments().containsKey(id));
    }

    public Optional<SpokeFulfillment> getFulfillment(String voucherId) {
        String id = LedgerIds.normalize(voucherId);
        return Optional.ofNullable(view(state -> state.getFulfillments().get(id)));
    }

    public boolean isContentVerified(String qHash) {
        String content = LedgerIds.normalize(qHash);
        return view(state -> state.getVoucherByQHash().containsKey(content));
    }

    public boolean isBatchCompleted(String batchId) {
        String id = LedgerIds.normalize(batchId);
        return view(state -> state.getCompletedBatches().containsKey(id));
    }

    public Optional<BatchRecord> getBatch(String batchId) {
        String id = LedgerIds.normalize(batchId);
        return Optional.ofNullable(view(state -> state.getCompletedBatches().get(id)));
    }

    private static SpokeState genesis(ProtocolProperties.SpokeProperties properties) {
        SpokeState state = new SpokeState();
        state.setAddress(LedgerIds.requireAddress(properties.getAddress()));
        state.setOwner(LedgerIds.requireAddress(properties.getOwner()));
        state.setRelayers(initialRelayers(unitName(properties.getChainId()), properties.getRelayers()));
        state.setChainId(properties.getChainId());
        state.setHub(LedgerIds.isZeroAddress(properties.getHubAddress()) ? null : LedgerIds.requireAddress(properties.getHubAddress()));
        return state;
    }

}
