package com.sommerph.attestbackend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "protocol")
public class ProtocolProperties {

    @Valid
    private StorageProperties storage = new StorageProperties();

    @Valid
    private TokenProperties feeToken = new TokenProperties();

    @Valid
    private RegistryProperties registry = new RegistryProperties();

    @Valid
    private HubProperties hub = new HubProperties();

    @Valid
    private List<SpokeProperties> spokes = new ArrayList<>();

    @Data
    public static class StorageProperties {
        // memory | json
        @NotBlank
        private String type = "memory";
        private String path = "./data/ledger";
    }

    @Data
    public static class TokenProperties {
        @NotBlank
        private String address;
        @NotBlank
        private String owner;
    }

    @Data
    public static class UnitProperties {
        @NotBlank
        private String address;
        @NotBlank
        private String owner;
        @NotEmpty
        private List<String> relayers = new ArrayList<>();
        @NotNull
        private Duration timelockDelay = Duration.ofHours(24);
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static class RegistryProperties extends UnitProperties {
        private BigInteger verificationFee = BigInteger.ZERO;
        private BigInteger crossChainFeePerChain = BigInteger.ZERO;
        @Min(0)
        @Max(10000)
        private int treasuryBps = 7000;
        @NotBlank
        private String treasuryWallet;
        // unset means fees are burned to the dead address
        private String burnWallet;
        private boolean creditPaymentsEnabled = true;
        private String voucherHub;

        public RegistryProperties() {
            setTimelockDelay(Duration.ofHours(48));
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static class HubProperties extends UnitProperties {
        private String registry;
        private String feeCollector;
        private BigInteger voucherCreationFee = BigInteger.ZERO;
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static class SpokeProperties extends UnitProperties {
        @Positive
        private long chainId;
        private String hubAddress;
    }

}
