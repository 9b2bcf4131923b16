package com.sommerph.attestbackend.service.registry;

import com.sommerph.attestbackend.config.ProtocolProperties;
import com.sommerph.attestbackend.exception.ProtocolError;
import com.sommerph.attestbackend.exception.ProtocolException;
import com.sommerph.attestbackend.ledger.LedgerTransaction;
import com.sommerph.attestbackend.ledger.LedgerTransactionManager;
import com.sommerph.attestbackend.ledger.StateStore;
import com.sommerph.attestbackend.model.event.EventType;
import com.sommerph.attestbackend.model.registry.FeeConfig;
import com.sommerph.attestbackend.model.registry.PaymentPath;
import com.sommerph.attestbackend.model.registry.RegistryState;
import com.sommerph.attestbackend.model.registry.VerificationRecord;
import com.sommerph.attestbackend.model.registry.VerifierInfo;
import com.sommerph.attestbackend.model.registry.VerifyDataRequest;
import com.sommerph.attestbackend.repository.state.LedgerStateRegistry;
import com.sommerph.attestbackend.service.common.ProtocolUnitService;
import com.sommerph.attestbackend.service.common.TargetChains;
import com.sommerph.attestbackend.service.fee.FeeCalculator;
import com.sommerph.attestbackend.service.fee.FeeSplit;
import com.sommerph.attestbackend.service.timelock.Timelock;
import com.sommerph.attestbackend.service.token.FeeToken;
import com.sommerph.attestbackend.util.HashUtils;
import com.sommerph.attestbackend.util.LedgerIds;
import com.sommerph.attestbackend.util.PackedEncoder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.sommerph.attestbackend.model.event.ProtocolEvent.attrs;

/**
 * Hub-chain registry of verified content. Records one immutable verification per qHash,
 * collects the fee for it and asks the voucher hub to announce it to the target chains.
 */
@Slf4j
@Service
public class VerificationRegistryService extends ProtocolUnitService<RegistryState> {

    public static final String UNIT = "registry";
    public static final int MAX_CONFIRMATION_BATCH = 100;

    public static final String ACTION_SET_VOUCHER_HUB = "setVoucherHub";
    public static final String ACTION_SET_FEES = "setFees";
    public static final String ACTION_SET_TREASURY_SPLIT = "setTreasurySplit";
    public static final String ACTION_SET_FEE_WALLETS = "setFeeWallets";

    private final FeeToken feeToken;
    private final VoucherHubClient voucherHubClient;

    @Autowired
    public VerificationRegistryService(ProtocolProperties properties, LedgerStateRegistry stateRegistry,
                                       LedgerTransactionManager txManager, FeeToken feeToken,
                                       VoucherHubClient voucherHubClient) {
        this(properties.getRegistry(), stateRegistry, txManager, feeToken, voucherHubClient);
    }

    public VerificationRegistryService(ProtocolProperties.RegistryProperties properties, LedgerStateRegistry stateRegistry,
                                       LedgerTransactionManager txManager, FeeToken feeToken,
                                       VoucherHubClient voucherHubClient) {
        super(UNIT,
                LedgerIds.requireAddress(properties.getAddress()),
                txManager,
                new StateStore<>(UNIT, RegistryState.class, stateRegistry, () -> genesis(properties)),
                new Timelock(UNIT, properties.getTimelockDelay()));
        this.feeToken = feeToken;
        this.voucherHubClient = voucherHubClient;
    }

    // ---- verification

    public String verifyData(String caller, VerifyDataRequest request) {
        log.info("Verify qHash {} for user {} via relayer {}", request.getQHash(), request.getUserAddress(), caller);
        return txManager.execute("verifyData", tx -> {
            RegistryState state = tx.state(store);
            requireNotPaused(state);
            String relayer = requireRelayer(state, caller);

            String user = LedgerIds.requireAddress(request.getUserAddress());
            String qHash = LedgerIds.requireQHash(request.getQHash());
            if (request.getProofId() == null || request.getProofId().isBlank()) {
                throw new ProtocolException(ProtocolError.EMPTY_PROOF_ID, qHash);
            }
            if (request.getVerificationType() == null || request.getVerificationType().isBlank()) {
                throw new ProtocolException(ProtocolError.EMPTY_VERIFICATION_TYPE, qHash);
            }
            List<Long> targets = TargetChains.validate(request.getTargetChainIds(), false);
            if (!targets.isEmpty() && state.isCrossChainPaused()) {
                throw new ProtocolException(ProtocolError.CROSS_CHAIN_PAUSED, qHash);
            }
            if (state.getVerifications().containsKey(qHash)) {
                throw new ProtocolException(ProtocolError.ALREADY_VERIFIED, qHash);
            }
            String verifierId = HashUtils.verifierId(request.getVerificationType());
            VerifierInfo verifier = state.getVerifiers().get(verifierId);
            if (verifier != null && !verifier.isActive()) {
                throw new ProtocolException(ProtocolError.VERIFIER_INACTIVE, request.getVerificationType());
            }

            BigInteger totalFee = FeeCalculator.totalFee(state.getFees(), targets.size());
            PaymentPath paymentPath = chargeFee(tx, state, relayer, user, qHash, totalFee);

            long nonce = state.getNonces().getOrDefault(user, 0L) + 1;
            state.getNonces().put(user, nonce);

            VerificationRecord record = VerificationRecord.builder()
                    .qHash(qHash)
                    .verifier(relayer)
                    .userAddress(user)
                    .verified(true)
                    .timestamp(tx.getTimestamp())
                    .blockNumber(tx.getBlockNumber())
                    .proofId(request.getProofId())
                    .verificationType(request.getVerificationType())
                    .verifierId(verifierId)
                    .nonce(nonce)
                    .targetChainIds(targets)
                    .voucherId(LedgerIds.ZERO_BYTES32)
                    .feePaid(totalFee)
                    .paymentPath(paymentPath)
                    .build();
            state.getVerifications().put(qHash, record);

            if (!targets.isEmpty()) {
                VoucherCreationResult result = requestVoucher(state, qHash, targets, verifierId);
                if (result.isCreated()) {
                    record.setVoucherId(result.getVoucherId());
                } else {
                    String fallbackId = fallbackVoucherId(qHash, user, tx.getTimestamp(), result.getFailureReason());
                    log.warn("Voucher creation failed for qHash {}, using fallback id {}: {}",
                            qHash, fallbackId, result.getFailureReason());
                    record.setVoucherId(fallbackId);
                    record.setFallbackVoucher(true);
                    tx.emit(UNIT, EventType.VOUCHER_CREATION_FAILED, attrs(
                            "qHash", qHash,
                            "fallbackVoucherId", fallbackId,
                            "reason", result.getFailureReason()));
                }
            }

            state.setTotalVerifications(state.getTotalVerifications() + 1);
            tx.emit(UNIT, EventType.VERIFICATION_SUCCEEDED, attrs(
                    "qHash", qHash,
                    "user", user,
                    "relayer", relayer,
                    "verificationType", request.getVerificationType(),
                    "proofId", request.getProofId(),
                    "voucherIds", List.of(record.getVoucherId()),
                    "targetChainIds", List.copyOf(targets),
                    "nonce", nonce,
                    "fee", totalFee));
            return record.getVoucherId();
        });
    }

    public void confirmChainVerification(String caller, String qHash, long chainId) {
        log.info("Confirm chain {} for qHash {} via {}", chainId, qHash, caller);
        txManager.run("confirmChainVerification", tx -> {
            RegistryState state = tx.state(store);
            requireNotPaused(state);
            String relayer = requireTrustedRelayer(state, caller);
            String id = LedgerIds.requireQHash(qHash);
            requireTargetedChain(state, id, chainId);
            if (isConfirmed(state, id, chainId)) {
                throw new ProtocolException(ProtocolError.CHAIN_ALREADY_CONFIRMED, id + "@" + chainId);
            }
            markConfirmed(tx, state, id, chainId, relayer);
        });
    }

    /**
     * Confirms (qHashes[i], chainIds[i]) pairs in one atomic step. Pairs that are already
     * confirmed are skipped; any invalid pair rejects the whole batch.
     *
     * @return number of newly confirmed pairs
     */
    public int confirmChainVerificationBatch(String caller, List<String> qHashes, List<Long> chainIds) {
        log.info("Confirm batch of {} chain verifications via {}", qHashes == null ? 0 : qHashes.size(), caller);
        return txManager.execute("confirmChainVerificationBatch", tx -> {
            RegistryState state = tx.state(store);
            requireNotPaused(state);
            String relayer = requireTrustedRelayer(state, caller);
            if (qHashes == null || chainIds == null || qHashes.size() != chainIds.size()) {
                throw new ProtocolException(ProtocolError.LENGTH_MISMATCH,
                        (qHashes == null ? 0 : qHashes.size()) + "/" + (chainIds == null ? 0 : chainIds.size()));
            }
            if (qHashes.isEmpty()) {
                throw new ProtocolException(ProtocolError.EMPTY_BATCH, "confirmations");
            }
            if (qHashes.size() > MAX_CONFIRMATION_BATCH) {
                throw new ProtocolException(ProtocolError.BATCH_TOO_LARGE, qHashes.size());
            }

            int confirmed = 0;
            for (int i = 0; i < qHashes.size(); i++) {
                String id = LedgerIds.requireQHash(qHashes.get(i));
                Long chainId = chainIds.get(i);
                if (chainId == null) {
                    throw new ProtocolException(ProtocolError.INVALID_CHAIN_ID, "null at " + i);
                }
                requireTargetedChain(state, id, chainId);
                if (isConfirmed(state, id, chainId)) {
                    continue;
                }
                markConfirmed(tx, state, id, chainId, relayer);
                confirmed++;
            }
            tx.emit(UNIT, EventType.CHAIN_VERIFICATIONS_BATCH_CONFIRMED, attrs(
                    "relayer", relayer,
                    "total", qHashes.size(),
                    "confirmed", confirmed,
                    "skipped", qHashes.size() - confirmed));
            return confirmed;
        });
    }

    // ---- verifier sub-registry

    public String registerVerifier(String caller, String verificationType) {
        log.info("Register verifier {}", verificationType);
        return txManager.execute("registerVerifier", tx -> {
            RegistryState state = tx.state(store);
            requireOwner(state, caller);
            if (verificationType == null || verificationType.isBlank()) {
                throw new ProtocolException(ProtocolError.EMPTY_VERIFICATION_TYPE, verificationType);
            }
            String verifierId = HashUtils.verifierId(verificationType);
            if (state.getVerifiers().containsKey(verifierId)) {
                throw new ProtocolException(ProtocolError.VERIFIER_ALREADY_REGISTERED, verificationType);
            }
            state.getVerifiers().put(verifierId, new VerifierInfo(verifierId, verificationType, true, tx.getTimestamp()));
            state.setActiveVerifierCount(state.getActiveVerifierCount() + 1);
            tx.emit(UNIT, EventType.VERIFIER_REGISTERED, attrs(
                    "verifierId", verifierId,
                    "verificationType", verificationType));
            return verifierId;
        });
    }

    public void deactivateVerifier(String caller, String verifierId) {
        log.info("Deactivate verifier {}", verifierId);
        txManager.run("deactivateVerifier", tx -> {
            RegistryState state = tx.state(store);
            requireOwner(state, caller);
            VerifierInfo info = requireVerifier(state, verifierId);
            if (!info.isActive()) {
                throw new ProtocolException(ProtocolError.VERIFIER_INACTIVE, info.getVerifierId());
            }
            info.setActive(false);
            state.setActiveVerifierCount(state.getActiveVerifierCount() - 1);
            tx.emit(UNIT, EventType.VERIFIER_DEACTIVATED, attrs("verifierId", info.getVerifierId()));
        });
    }

    public void reactivateVerifier(String caller, String verifierId) {
        log.info("Reactivate verifier {}", verifierId);
        txManager.run("reactivateVerifier", tx -> {
            RegistryState state = tx.state(store);
            requireOwner(state, caller);
            VerifierInfo info = requireVerifier(state, verifierId);
            if (info.isActive()) {
                throw new ProtocolException(ProtocolError.VERIFIER_ALREADY_ACTIVE, info.getVerifierId());
            }
            info.setActive(true);
            state.setActiveVerifierCount(state.getActiveVerifierCount() + 1);
            tx.emit(UNIT, EventType.VERIFIER_REACTIVATED, attrs("verifierId", info.getVerifierId()));
        });
    }

    // ---- credits

    /**
     * Pulls tokens from the calling relayer into the registry and books them to its credit pool.
     * The relayer must have approved the registry for the amount.
     */
    public void depositRelayerCredits(String caller, BigInteger amount) {
        log.info("Deposit {} credits for relayer {}", amount, caller);
        txManager.run("depositRelayerCredits", tx -> {
            RegistryState state = tx.state(store);
            requireNotPaused(state);
            String relayer = requireRelayer(state, caller);
            requirePositive(amount);
            feeToken.transferFrom(address, relayer, address, amount);
            BigInteger pool = state.getRelayerCredits().merge(relayer, amount, BigInteger::add);
            tx.emit(UNIT, EventType.CREDITS_DEPOSITED, attrs(
                    "relayer", relayer,
                    "amount", amount,
                    "pool", pool));
        });
    }

    public void allocateUserCredits(String caller, String user, BigInteger amount) {
        log.info("Allocate {} credits to {} from relayer {}", amount, user, caller);
        txManager.run("allocateUserCredits", tx -> {
            RegistryState state = tx.state(store);
            requireNotPaused(state);
            String relayer = requireRelayer(state, caller);
            String account = LedgerIds.requireAddress(user);
            requirePositive(amount);
            BigInteger pool = state.getRelayerCredits().getOrDefault(relayer, BigInteger.ZERO);
            if (pool.compareTo(amount) < 0) {
                throw new ProtocolException(ProtocolError.INSUFFICIENT_CREDITS, relayer);
            }
            state.getRelayerCredits().put(relayer, pool.subtract(amount));
            BigInteger allocation = state.getUserCredits()
                    .computeIfAbsent(relayer, r -> new LinkedHashMap<>())
                    .merge(account, amount, BigInteger::add);
            tx.emit(UNIT, EventType.CREDITS_ALLOCATED, attrs(
                    "relayer", relayer,
                    "user", account,
                    "amount", amount,
                    "allocation", allocation));
        });
    }

    public void setCreditPaymentsEnabled(String caller, boolean enabled) {
        log.info("Set credit payments enabled to {}", enabled);
        txManager.run("setCreditPaymentsEnabled", tx -> {
            RegistryState state = tx.state(store);
            requireOwner(state, caller);
            state.setCreditPaymentsEnabled(enabled);
            tx.emit(UNIT, EventType.CREDIT_PAYMENTS_TOGGLED, attrs("enabled", enabled));
        });
    }

    // ---- emergency controls

    public void emergencyPauseCrossChain(String caller, String reason) {
        log.info("Pause cross-chain operation: {}", reason);
        txManager.run("emergencyPauseCrossChain", tx -> {
            RegistryState state = tx.state(store);
            requireOwner(state, caller);
            String why = requireReason(reason);
            if (state.isCrossChainPaused()) {
                throw new ProtocolException(ProtocolError.CROSS_CHAIN_PAUSED, UNIT);
            }
            state.setCrossChainPaused(true);
            tx.emit(UNIT, EventType.CROSS_CHAIN_PAUSED, attrs("by", LedgerIds.normalize(caller), "reason", why));
        });
    }

    public void resumeCrossChain(String caller, String reason) {
        log.info("Resume cross-chain operation: {}", reason);
        txManager.run("resumeCrossChain", tx -> {
            RegistryState state = tx.state(store);
            requireOwner(state, caller);
            String why = requireReason(reason);
            if (!state.isCrossChainPaused()) {
                throw new ProtocolException(ProtocolError.NOT_PAUSED, UNIT + ":cross-chain");
            }
            state.setCrossChainPaused(false);
            tx.emit(UNIT, EventType.CROSS_CHAIN_RESUMED, attrs("by", LedgerIds.normalize(caller), "reason", why));
        });
    }

    // ---- timelocked governance

    public String scheduleVoucherHubUpdate(String caller, String voucherHub) {
        String hub = LedgerIds.requireAddress(voucherHub);
        return scheduleAction(caller, ACTION_SET_VOUCHER_HUB, List.of(hub));
    }

    public void executeVoucherHubUpdate(String caller) {
        executeAction(caller, ACTION_SET_VOUCHER_HUB, (tx, state, params) -> {
            String previous = state.getVoucherHub();
            state.setVoucherHub(params.get(0));
            tx.emit(UNIT, EventType.VOUCHER_HUB_UPDATED, attrs("previous", previous, "voucherHub", params.get(0)));
        });
    }

    public String scheduleFeeUpdate(String caller, BigInteger verificationFee, BigInteger crossChainFeePerChain) {
        FeeCalculator.requireUint256(verificationFee);
        FeeCalculator.requireUint256(crossChainFeePerChain);
        return scheduleAction(caller, ACTION_SET_FEES, List.of(verificationFee.toString(), crossChainFeePerChain.toString()));
    }

    public void executeFeeUpdate(String caller) {
        executeAction(caller, ACTION_SET_FEES, (tx, state, params) -> {
            FeeConfig fees = state.getFees();
            fees.setVerificationFee(new BigInteger(params.get(0)));
            fees.setCrossChainFeePerChain(new BigInteger(params.get(1)));
            tx.emit(UNIT, EventType.FEES_UPDATED, attrs(
                    "verificationFee", fees.getVerificationFee(),
                    "crossChainFeePerChain", fees.getCrossChainFeePerChain()));
        });
    }

    public String scheduleTreasurySplitUpdate(String caller, int treasuryBps) {
        FeeCalculator.requireBps(treasuryBps);
        return scheduleAction(caller, ACTION_SET_TREASURY_SPLIT, List.of(Integer.toString(treasuryBps)));
    }

    public void executeTreasurySplitUpdate(String caller) {
        executeAction(caller, ACTION_SET_TREASURY_SPLIT, (tx, state, params) -> {
            FeeConfig fees = state.getFees();
            fees.setTreasuryBps(Integer.parseInt(params.get(0)));
            tx.emit(UNIT, EventType.TREASURY_SPLIT_UPDATED, attrs(
                    "treasuryBps", fees.getTreasuryBps(),
                    "burnBps", fees.getBurnBps()));
        });
    }

    /**
     * Schedules new fee destinations. A null or zero burn wallet routes the burn share to the dead address.
     */
    public String scheduleFeeWalletsUpdate(String caller, String treasuryWallet, String burnWallet) {
        String treasury = LedgerIds.requireAddress(treasuryWallet);
        String burn = LedgerIds.isZeroAddress(burnWallet) ? LedgerIds.ZERO_ADDRESS : LedgerIds.requireAddress(burnWallet);
        return scheduleAction(caller, ACTION_SET_FEE_WALLETS, List.of(treasury, burn));
    }

    public void executeFeeWalletsUpdate(String caller) {
        executeAction(caller, ACTION_SET_FEE_WALLETS, (tx, state, params) -> {
            FeeConfig fees = state.getFees();
            fees.setTreasuryWallet(params.get(0));
            fees.setBurnWallet(LedgerIds.isZeroAddress(params.get(1)) ? null : params.get(1));
            tx.emit(UNIT, EventType.FEE_WALLETS_UPDATED, attrs(
                    "treasuryWallet", fees.getTreasuryWallet(),
                    "burnWallet", burnSink(fees)));
        });
    }

    // ---- views

    public Optional<VerificationRecord> getVerification(String qHash) {
        String id = LedgerIds.normalize(qHash);
        return Optional.ofNullable(view(state -> state.getVerifications().get(id)));
    }

    public boolean isVerified(String qHash) {
        return getVerification(qHash).map(VerificationRecord::isVerified).orElse(false);
    }

    public boolean isChainConfirmed(String qHash, long chainId) {
        String id = LedgerIds.normalize(qHash);
        return view(state -> isConfirmed(state, id, chainId));
    }

    public long getNonce(String account) {
        String user = LedgerIds.normalize(account);
        return view(state -> state.getNonces().getOrDefault(user, 0L));
    }

    public long getTotalVerifications() {
        return view(RegistryState::getTotalVerifications);
    }

    public boolean isTrustedRelayer(String account) {
        String relayer = LedgerIds.normalize(account);
        return view(state -> state.getTrustedRelayers().contains(relayer));
    }

    public Optional<VerifierInfo> getVerifier(String verifierId) {
        String id = LedgerIds.normalize(verifierId);
        return Optional.ofNullable(view(state -> state.getVerifiers().get(id)));
    }

    public int getActiveVerifierCount() {
        return view(RegistryState::getActiveVerifierCount);
    }

    public BigInteger getRelayerCredits(String relayer) {
        String account = LedgerIds.normalize(relayer);
        return view(state -> state.getRelayerCredits().getOrDefault(account, BigInteger.ZERO));
    }

    public BigInteger getUserCredits(String relayer, String user) {
        String relayerAccount = LedgerIds.normalize(relayer);
        String userAccount = LedgerIds.normalize(user);
        return view(state -> userCredit(state, relayerAccount, userAccount));
    }

    public FeeConfig getFeeConfig() {
        return view(RegistryState::getFees);
    }

    public BigInteger quoteFee(int chainCount) {
        return view(state -> FeeCalculator.totalFee(state.getFees(), chainCount));
    }

    public boolean isCrossChainPaused() {
        return view(RegistryState::isCrossChainPaused);
    }

    public boolean isCreditPaymentsEnabled() {
        return view(RegistryState::isCreditPaymentsEnabled);
    }

    public String getVoucherHub() {
        return view(RegistryState::getVoucherHub);
    }

    // ---- internals

    @Override
    protected void onRelayerChanged(RegistryState state, String relayer, boolean authorized) {
        // the two roles cannot be granted independently yet
        if (authorized) {
            state.getTrustedRelayers().add(relayer);
        } else {
            state.getTrustedRelayers().remove(relayer);
        }
    }

    private PaymentPath chargeFee(LedgerTransaction tx, RegistryState state, String relayer, String user,
                                  String qHash, BigInteger fee) {
        if (fee.signum() == 0) {
            return PaymentPath.NONE;
        }
        FeeConfig fees = state.getFees();
        FeeSplit split = FeeCalculator.split(fee, fees.getTreasuryBps());
        String burnSink = burnSink(fees);

        if (state.isCreditPaymentsEnabled()) {
            BigInteger allocation = userCredit(state, relayer, user);
            if (allocation.compareTo(fee) >= 0) {
                BigInteger remaining = allocation.subtract(fee);
                state.getUserCredits().get(relayer).put(user, remaining);
                // paid out of the registry's own balance, built up by relayer deposits
                if (split.getTreasuryShare().signum() > 0) {
                    feeToken.transfer(address, fees.getTreasuryWallet(), split.getTreasuryShare());
                }
                if (split.getBurnShare().signum() > 0) {
                    feeToken.transfer(address, burnSink, split.getBurnShare());
                }
                tx.emit(UNIT, EventType.CREDITS_CONSUMED, attrs(
                        "relayer", relayer,
                        "user", user,
                        "amount", fee,
                        "remaining", remaining));
                emitFeeCollected(tx, qHash, user, PaymentPath.CREDIT, fee, split, fees, burnSink);
                return PaymentPath.CREDIT;
            }
        }

        BigInteger allowance = feeToken.allowance(user, address);
        if (allowance.compareTo(fee) < 0) {
            throw new ProtocolException(ProtocolError.INSUFFICIENT_ALLOWANCE, user);
        }
        if (split.getTreasuryShare().signum() > 0) {
            feeToken.transferFrom(address, user, fees.getTreasuryWallet(), split.getTreasuryShare());
        }
        if (split.getBurnShare().signum() > 0) {
            feeToken.transferFrom(address, user, burnSink, split.getBurnShare());
        }
        emitFeeCollected(tx, qHash, user, PaymentPath.DIRECT, fee, split, fees, burnSink);
        return PaymentPath.DIRECT;
    }

    private void emitFeeCollected(LedgerTransaction tx, String qHash, String user, PaymentPath path, BigInteger fee,
                                  FeeSplit split, FeeConfig fees, String burnSink) {
        tx.emit(UNIT, EventType.FEE_COLLECTED, attrs(
                "qHash", qHash,
                "payer", user,
                "path", path.name(),
                "amount", fee,
                "treasuryShare", split.getTreasuryShare(),
                "burnShare", split.getBurnShare(),
                "treasuryWallet", fees.getTreasuryWallet(),
                "burnWallet", burnSink));
    }

    private VoucherCreationResult requestVoucher(RegistryState state, String qHash, List<Long> targets, String verifierId) {
        String hub = state.getVoucherHub();
        if (LedgerIds.isZeroAddress(hub)) {
            return VoucherCreationResult.failed(ProtocolError.VOUCHER_HUB_NOT_CONFIGURED.getCode() + " "
                    + ProtocolError.VOUCHER_HUB_NOT_CONFIGURED.getMessage());
        }
        return voucherHubClient.createVoucher(hub, address, qHash, targets, verifierId);
    }

    // keccak256(qHash, user, timestamp, failure reason)
    static String fallbackVoucherId(String qHash, String user, long timestamp, String reason) {
        return PackedEncoder.create()
                .bytes32(qHash)
                .address(user)
                .uint(timestamp)
                .string(reason)
                .keccak256();
    }

    private String requireTrustedRelayer(RegistryState state, String caller) {
        String relayer = LedgerIds.normalize(caller);
        if (relayer == null || !state.getTrustedRelayers().contains(relayer)) {
            throw new ProtocolException(ProtocolError.NOT_TRUSTED_RELAYER, caller);
        }
        return relayer;
    }

    private static void requireTargetedChain(RegistryState state, String qHash, long chainId) {
        VerificationRecord record = state.getVerifications().get(qHash);
        if (record == null) {
            throw new ProtocolException(ProtocolError.UNKNOWN_QHASH, qHash);
        }
        if (!record.getTargetChainIds().contains(chainId)) {
            throw new ProtocolException(ProtocolError.CHAIN_NOT_TARGETED, chainId);
        }
    }

    private static boolean isConfirmed(RegistryState state, String qHash, long chainId) {
        Set<Long> chains = state.getChainConfirmations().get(qHash);
        return chains != null && chains.contains(chainId);
    }

    private static void markConfirmed(LedgerTransaction tx, RegistryState state, String qHash, long chainId, String relayer) {
        state.getChainConfirmations().computeIfAbsent(qHash, q -> new LinkedHashSet<>()).add(chainId);
        tx.emit(UNIT, EventType.CHAIN_VERIFICATION_CONFIRMED, attrs(
                "qHash", qHash,
                "chainId", chainId,
                "relayer", relayer));
    }

    private static VerifierInfo requireVerifier(RegistryState state, String verifierId) {
        VerifierInfo info = state.getVerifiers().get(LedgerIds.normalize(verifierId));
        if (info == null) {
            throw new ProtocolException(ProtocolError.UNKNOWN_VERIFIER, verifierId);
        }
        return info;
    }

    private static BigInteger userCredit(RegistryState state, String relayer, String user) {
        Map<String, BigInteger> allocations = state.getUserCredits().get(relayer);
        return allocations == null ? BigInteger.ZERO : allocations.getOrDefault(user, BigInteger.ZERO);
    }

    private static String burnSink(FeeConfig fees) {
        return LedgerIds.isZeroAddress(fees.getBurnWallet()) ? LedgerIds.DEAD_ADDRESS : fees.getBurnWallet();
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new ProtocolException(ProtocolError.INVALID_AMOUNT, amount);
        }
    }

    private static RegistryState genesis(ProtocolProperties.RegistryProperties properties) {
        RegistryState state = new RegistryState();
        state.setAddress(LedgerIds.requireAddress(properties.getAddress()));
        state.setOwner(LedgerIds.requireAddress(properties.getOwner()));
        Set<String> relayers = initialRelayers(UNIT, properties.getRelayers());
        state.setRelayers(relayers);
        state.setTrustedRelayers(new LinkedHashSet<>(relayers));

        FeeCalculator.requireBps(properties.getTreasuryBps());
        FeeConfig fees = new FeeConfig();
        fees.setVerificationFee(FeeCalculator.requireUint256(properties.getVerificationFee()));
        fees.setCrossChainFeePerChain(FeeCalculator.requireUint256(properties.getCrossChainFeePerChain()));
        fees.setTreasuryBps(properties.getTreasuryBps());
        fees.setTreasuryWallet(LedgerIds.requireAddress(properties.getTreasuryWallet()));
        fees.setBurnWallet(LedgerIds.isZeroAddress(properties.getBurnWallet()) ? null : LedgerIds.requireAddress(properties.getBurnWallet()));
        state.setFees(fees);

        state.setCreditPaymentsEnabled(properties.isCreditPaymentsEnabled());
        state.setVoucherHub(LedgerIds.isZeroAddress(properties.getVoucherHub()) ? null : LedgerIds.requireAddress(properties.getVoucherHub()));
        return state;
    }

}
