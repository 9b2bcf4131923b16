package com.sommerph.attestbackend.model.registry;

import com.sommerph.attestbackend.model.common.UnitState;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class RegistryState extends UnitState {

    // qHash -> record
    private Map<String, VerificationRecord> verifications = new LinkedHashMap<>();

    // qHash -> confirmed chain ids
    private Map<String, Set<Long>> chainConfirmations = new LinkedHashMap<>();

    private Map<String, Long> nonces = new LinkedHashMap<>();
    private long totalVerifications;

    // granted and revoked together with the relayer set
    private Set<String> trustedRelayers = new LinkedHashSet<>();

    // verifierId -> info
    private Map<String, VerifierInfo> verifiers = new LinkedHashMap<>();
    private int activeVerifierCount;

    private FeeConfig fees = new FeeConfig();

    // relayer -> pooled credits
    private Map<String, BigInteger> relayerCredits = new LinkedHashMap<>();

    // relayer -> user -> allocated credits
    private Map<String, Map<String, BigInteger>> userCredits = new LinkedHashMap<>();

    private boolean creditPaymentsEnabled;
    private boolean crossChainPaused;
    private String voucherHub;

}
