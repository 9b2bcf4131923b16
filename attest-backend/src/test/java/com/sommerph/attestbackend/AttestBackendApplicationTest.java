package com.sommerph.attestbackend;

import com.sommerph.attestbackend.config.ProtocolProperties;
import com.sommerph.attestbackend.ledger.ProtocolEventLog;
import com.sommerph.attestbackend.model.event.EventType;
import com.sommerph.attestbackend.model.registry.VerificationRecord;
import com.sommerph.attestbackend.model.registry.VerifyDataRequest;
import com.sommerph.attestbackend.model.spoke.FulfillmentParams;
import com.sommerph.attestbackend.repository.state.InMemoryLedgerStateRegistry;
import com.sommerph.attestbackend.repository.state.LedgerStateRegistry;
import com.sommerph.attestbackend.service.hub.VoucherHubService;
import com.sommerph.attestbackend.service.registry.VerificationRegistryService;
import com.sommerph.attestbackend.service.spoke.VoucherSpokeService;
import com.sommerph.attestbackend.service.spoke.VoucherSpokes;
import com.sommerph.attestbackend.service.token.FeeToken;
import com.sommerph.attestbackend.util.HashUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class AttestBackendApplicationTest {

    @Autowired
    private ProtocolProperties properties;

    @Autowired
    private LedgerStateRegistry stateRegistry;

    @Autowired
    private FeeToken feeToken;

    @Autowired
    private VerificationRegistryService registry;

    @Autowired
    private VoucherHubService hub;

    @Autowired
    private VoucherSpokes spokes;

    @Autowired
    private ProtocolEventLog eventLog;

    @Test
    @DisplayName("wires every configured unit over in-memory storage")
    void contextLoads() {
        assertThat(stateRegistry).isInstanceOf(InMemoryLedgerStateRegistry.class);
        assertThat(registry.getTimelockDelaySeconds()).isEqualTo(48 * 3600L);
        assertThat(hub.getTimelockDelaySeconds()).isEqualTo(24 * 3600L);
        assertThat(spokes.getChainIds()).containsExactly(11155111L, 11155420L, 421614L, 80002L);
        assertThat(hub.getRegistryAddress()).isEqualTo(registry.getAddress());
    }

    @Test
    @DisplayName("carries a paid verification from the registry to a spoke and back to the hub")
    void verificationFlow() {
        ProtocolProperties.RegistryProperties registryConfig = properties.getRegistry();
        String relayer = registryConfig.getRelayers().get(0);
        String user = "0x00000000000000000000000000000000000000c7";
        String qHash = HashUtils.keccak256Hex("application flow document");
        BigInteger fee = registry.quoteFee(2);

        feeToken.mint(properties.getFeeToken().getOwner(), user, fee);
        feeToken.approve(user, registry.getAddress(), fee);
        String voucherId = registry.verifyData(relayer, VerifyDataRequest.builder()
                .userAddress(user)
                .qHash(qHash)
                .targetChainIds(List.of(11155111L, 80002L))
                .proofId("proof-app-1")
                .verificationType("kyc-basic")
                .build());

        VerificationRecord record = registry.getVerification(qHash).orElseThrow();
        assertThat(record.isFallbackVoucher()).isFalse();
        assertThat(feeToken.balanceOf(registryConfig.getTreasuryWallet()))
                .isEqualTo(fee.multiply(BigInteger.valueOf(registryConfig.getTreasuryBps())).divide(BigInteger.valueOf(10_000)));

        VoucherSpokeService spoke = spokes.forChain(80002L);
        spoke.fulfillVoucherBatch(relayer, HashUtils.keccak256Hex("app batch 1"), List.of(FulfillmentParams.builder()
                .voucherId(voucherId)
                .qHash(qHash)
                .verifier(relayer)
                .verifiedAt(record.getTimestamp())
                .build()));
        hub.confirmVoucherFulfilledOnHub(relayer, voucherId, qHash, 80002L);
        registry.confirmChainVerification(relayer, qHash, 80002L);

        assertThat(spoke.isContentVerified(qHash)).isTrue();
        assertThat(hub.isFulfilledOnHub(voucherId, 80002L)).isTrue();
        assertThat(hub.isFulfilledOnHub(voucherId, 11155111L)).isFalse();
        assertThat(registry.isChainConfirmed(qHash, 80002L)).isTrue();
        assertThat(eventLog.ofType(EventType.VOUCHER_CREATED))
                .anySatisfy(event -> assertThat(event.attribute("voucherId")).isEqualTo(voucherId));
    }

}
