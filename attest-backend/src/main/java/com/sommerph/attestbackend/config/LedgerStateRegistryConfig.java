package com.sommerph.attestbackend.config;

import com.sommerph.attestbackend.repository.state.InMemoryLedgerStateRegistry;
import com.sommerph.attestbackend.repository.state.JsonFileLedgerStateRegistry;
import com.sommerph.attestbackend.repository.state.LedgerStateRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

@Configuration
public class LedgerStateRegistryConfig {

    @Value("${protocol.storage.type:memory}")
    private String registryType;

    @Value("${protocol.storage.path:./data/ledger}")
    private String storagePath;

    @Bean
    public LedgerStateRegistry ledgerStateRegistry() throws IOException {
        return switch (registryType.toLowerCase()) {
            case "json" -> new JsonFileLedgerStateRegistry(storagePath);
            case "memory" -> new InMemoryLedgerStateRegistry();
            default -> throw new IllegalArgumentException("Unsupported registry type: " + registryType);
        };
    }

}
