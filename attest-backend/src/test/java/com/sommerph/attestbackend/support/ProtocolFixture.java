package com.sommerph.attestbackend.support;

import com.sommerph.attestbackend.config.ProtocolProperties;
import com.sommerph.attestbackend.ledger.LedgerTransactionManager;
import com.sommerph.attestbackend.ledger.ProtocolEventLog;
import com.sommerph.attestbackend.model.event.EventType;
import com.sommerph.attestbackend.model.event.ProtocolEvent;
import com.sommerph.attestbackend.model.registry.VerifyDataRequest;
import com.sommerph.attestbackend.repository.state.InMemoryLedgerStateRegistry;
import com.sommerph.attestbackend.repository.state.LedgerStateRegistry;
import com.sommerph.attestbackend.service.hub.VoucherHubService;
import com.sommerph.attestbackend.service.registry.InProcessVoucherHubClient;
import com.sommerph.attestbackend.service.registry.VerificationRegistryService;
import com.sommerph.attestbackend.service.registry.VoucherHubClient;
import com.sommerph.attestbackend.service.spoke.VoucherSpokeService;
import com.sommerph.attestbackend.service.spoke.VoucherSpokes;
import com.sommerph.attestbackend.service.token.LedgerFeeToken;
import com.sommerph.attestbackend.util.HashUtils;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Wires the full protocol over the in-memory state registry and a clock the test controls.
 */
public class ProtocolFixture {

    public static final long START = 1_700_000_000L;

    public static final String OWNER = "0x00000000000000000000000000000000000000a1";
    public static final String STRANGER = "0x00000000000000000000000000000000000000a2";
    public static final String RELAYER = "0x00000000000000000000000000000000000000b1";
    public static final String RELAYER_2 = "0x00000000000000000000000000000000000000b2";
    public static final String USER = "0x00000000000000000000000000000000000000c1";
    public static final String USER_2 = "0x00000000000000000000000000000000000000c2";
    public static final String TREASURY = "0x00000000000000000000000000000000000000d1";
    public static final String TOKEN_OWNER = "0x00000000000000000000000000000000000000e1";

    public static final String TOKEN = "0x00000000000000000000000000000000000000f1";
    public static final String REGISTRY = "0x00000000000000000000000000000000000000f2";
    public static final String HUB = "0x00000000000000000000000000000000000000f3";
    public static final String SPOKE_A = "0x00000000000000000000000000000000000000f4";
    public static final String SPOKE_B = "0x00000000000000000000000000000000000000f5";

    public static final long CHAIN_A = 11155111L;
    public static final long CHAIN_B = 11155420L;

    public final MutableLedgerClock clock = new MutableLedgerClock(START);
    public final ProtocolEventLog eventLog = new ProtocolEventLog();
    public final LedgerStateRegistry stateRegistry = new InMemoryLedgerStateRegistry();
    public final LedgerTransactionManager txManager = new LedgerTransactionManager(clock, eventLog, stateRegistry);
    public final ProtocolProperties properties;
    public final LedgerFeeToken token;
    public final VoucherHubService hub;
    public final VerificationRegistryService registry;
    public final VoucherSpokes spokes;

    private ProtocolFixture(ProtocolProperties properties, VoucherHubClient hubClient) {
        this.properties = properties;
        this.token = new LedgerFeeToken(properties.getFeeToken().getAddress(), properties.getFeeToken().getOwner(),
                stateRegistry, txManager);
        this.hub = new VoucherHubService(properties, stateRegistry, txManager);
        this.registry = new VerificationRegistryService(properties, stateRegistry, txManager, token,
                hubClient != null ? hubClient : new InProcessVoucherHubClient(hub));
        List<VoucherSpokeService> spokeServices = new ArrayList<>();
        for (ProtocolProperties.SpokeProperties spoke : properties.getSpokes()) {
            spokeServices.add(new VoucherSpokeService(spoke, stateRegistry, txManager));
        }
        this.spokes = new VoucherSpokes(spokeServices);
    }

    public static ProtocolFixture create() {
        return create(properties -> {
        });
    }

    public static ProtocolFixture create(Consumer<ProtocolProperties> customizer) {
        ProtocolProperties properties = defaultProperties();
        customizer.accept(properties);
        return new ProtocolFixture(properties, null);
    }

    public static ProtocolFixture withHubClient(VoucherHubClient hubClient) {
        return new ProtocolFixture(defaultProperties(), hubClient);
    }

    public static ProtocolProperties defaultProperties() {
        ProtocolProperties properties = new ProtocolProperties();
        properties.getFeeToken().setAddress(TOKEN);
        properties.getFeeToken().setOwner(TOKEN_OWNER);

        ProtocolProperties.RegistryProperties registry = properties.getRegistry();
        registry.setAddress(REGISTRY);
        registry.setOwner(OWNER);
        registry.setRelayers(new ArrayList<>(List.of(RELAYER)));
        registry.setTreasuryWallet(TREASURY);
        registry.setTreasuryBps(7000);
        registry.setVoucherHub(HUB);

        ProtocolProperties.HubProperties hub = properties.getHub();
        hub.setAddress(HUB);
        hub.setOwner(OWNER);
        hub.setRelayers(new ArrayList<>(List.of(RELAYER)));
        hub.setRegistry(REGISTRY);
        hub.setFeeCollector(TREASURY);

        properties.getSpokes().add(spoke(CHAIN_A, SPOKE_A));
        properties.getSpokes().add(spoke(CHAIN_B, SPOKE_B));
        return properties;
    }

    private static ProtocolProperties.SpokeProperties spoke(long chainId, String address) {
        ProtocolProperties.SpokeProperties spoke = new ProtocolProperties.SpokeProperties();
        spoke.setChainId(chainId);
        spoke.setAddress(address);
        spoke.setOwner(OWNER);
        spoke.setRelayers(new ArrayList<>(List.of(RELAYER)));
        spoke.setTimelockDelay(Duration.ofHours(24));
        spoke.setHubAddress(HUB);
        return spoke;
    }

    public static String qHash(String content) {
        return HashUtils.keccak256Hex("content:" + content);
    }

    public static String batchId(String name) {
        return HashUtils.keccak256Hex("batch:" + name);
    }

    public static BigInteger tokens(long amount) {
        return BigInteger.valueOf(amount);
    }

    public static VerifyDataRequest request(String qHash, Long... targetChainIds) {
        return VerifyDataRequest.builder()
                .userAddress(USER)
                .qHash(qHash)
                .targetChainIds(new ArrayList<>(List.of(targetChainIds)))
                .proofId("proof-" + qHash.substring(2, 10))
                .verificationType("kyc-basic")
                .build();
    }

    public void fund(String account, BigInteger amount) {
        token.mint(TOKEN_OWNER, account, amount);
    }

    public List<ProtocolEvent> events(EventType type) {
        return eventLog.ofType(type);
    }

}
