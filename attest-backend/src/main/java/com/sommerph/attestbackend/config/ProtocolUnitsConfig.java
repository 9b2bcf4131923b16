package com.sommerph.attestbackend.config;

import com.sommerph.attestbackend.ledger.LedgerClock;
import com.sommerph.attestbackend.ledger.LedgerTransactionManager;
import com.sommerph.attestbackend.ledger.ProtocolEventLog;
import com.sommerph.attestbackend.ledger.SystemLedgerClock;
import com.sommerph.attestbackend.repository.state.LedgerStateRegistry;
import com.sommerph.attestbackend.service.spoke.VoucherSpokeService;
import com.sommerph.attestbackend.service.spoke.VoucherSpokes;
import com.sommerph.attestbackend.service.token.FeeToken;
import com.sommerph.attestbackend.service.token.LedgerFeeToken;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

@Configuration
public class ProtocolUnitsConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public LedgerClock ledgerClock(Clock clock) {
        return new SystemLedgerClock(clock);
    }

    @Bean
    public ProtocolEventLog protocolEventLog() {
        return new ProtocolEventLog();
    }

    @Bean
    public LedgerTransactionManager ledgerTransactionManager(LedgerClock ledgerClock, ProtocolEventLog eventLog,
                                                             LedgerStateRegistry stateRegistry) {
        return new LedgerTransactionManager(ledgerClock, eventLog, stateRegistry);
    }

    @Bean
    public FeeToken feeToken(ProtocolProperties properties, LedgerStateRegistry stateRegistry,
                             LedgerTransactionManager txManager) {
        ProtocolProperties.TokenProperties token = properties.getFeeToken();
        return new LedgerFeeToken(token.getAddress(), token.getOwner(), stateRegistry, txManager);
    }

    @Bean
    public VoucherSpokes voucherSpokes(ProtocolProperties properties, LedgerStateRegistry stateRegistry,
                                       LedgerTransactionManager txManager) {
        List<VoucherSpokeService> spokes = properties.getSpokes().stream()
                .map(spoke -> new VoucherSpokeService(spoke, stateRegistry, txManager))
                .collect(Collectors.toList());
        return new VoucherSpokes(spokes);
    }

}
