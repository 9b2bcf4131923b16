package com.sommerph.attestbackend.service.token;

import com.sommerph.attestbackend.exception.ProtocolError;
import com.sommerph.attestbackend.exception.ProtocolException;
import com.sommerph.attestbackend.ledger.LedgerTransaction;
import com.sommerph.attestbackend.ledger.LedgerTransactionManager;
import com.sommerph.attestbackend.ledger.StateStore;
import com.sommerph.attestbackend.model.event.EventType;
import com.sommerph.attestbackend.model.token.TokenState;
import com.sommerph.attestbackend.repository.state.LedgerStateRegistry;
import com.sommerph.attestbackend.util.LedgerIds;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.sommerph.attestbackend.model.event.ProtocolEvent.attrs;

@Slf4j
public class LedgerFeeToken implements FeeToken {

    public static final String UNIT = "fee-token";

    private final String address;
    private final LedgerTransactionManager txManager;
    private final StateStore<TokenState> store;

    public LedgerFeeToken(String address, String owner, LedgerStateRegistry stateRegistry, LedgerTransactionManager txManager) {
        this.address = LedgerIds.requireAddress(address);
        String tokenOwner = LedgerIds.requireAddress(owner);
        this.txManager = txManager;
        this.store = new StateStore<>(UNIT, TokenState.class, stateRegistry, () -> {
            TokenState genesis = new TokenState();
            genesis.setAddress(this.address);
            genesis.setOwner(tokenOwner);
            return genesis;
        });
    }

    @Override
    public String getAddress() {
        return address;
    }

    @Override
    public BigInteger balanceOf(String account) {
        String holder = LedgerIds.normalize(account);
        return txManager.query(tx -> tx.state(store).getBalances().getOrDefault(holder, BigInteger.ZERO));
    }

    @Override
    public BigInteger allowance(String owner, String spender) {
        String holder = LedgerIds.normalize(owner);
        String approved = LedgerIds.normalize(spender);
        return txManager.query(tx -> allowanceOf(tx.state(store), holder, approved));
    }

    @Override
    public void approve(String owner, String spender, BigInteger amount) {
        log.info("Approve {} for spender {} by {}", amount, spender, owner);
        txManager.run("approve", tx -> {
            TokenState state = tx.state(store);
            String holder = LedgerIds.requireAddress(owner);
            String approved = LedgerIds.requireAddress(spender);
            requireNonNegative(amount);
            state.getAllowances().computeIfAbsent(holder, h -> new LinkedHashMap<>()).put(approved, amount);
            tx.emit(UNIT, EventType.APPROVAL, attrs("owner", holder, "spender", approved, "amount", amount));
        });
    }

    @Override
    public void transfer(String from, String to, BigInteger amount) {
        txManager.run("transfer", tx -> move(tx, tx.state(store), LedgerIds.requireAddress(from), LedgerIds.requireAddress(to), amount));
    }

    @Override
    public void transferFrom(String spender, String from, String to, BigInteger amount) {
        txManager.run("transferFrom", tx -> {
            TokenState state = tx.state(store);
            String holder = LedgerIds.requireAddress(from);
            String approved = LedgerIds.requireAddress(spender);
            requireNonNegative(amount);
            BigInteger allowance = allowanceOf(state, holder, approved);
            if (allowance.compareTo(amount) < 0) {
                throw new ProtocolException(ProtocolError.INSUFFICIENT_ALLOWANCE, holder);
            }
            state.getAllowances().computeIfAbsent(holder, h -> new LinkedHashMap<>()).put(approved, allowance.subtract(amount));
            move(tx, state, holder, LedgerIds.requireAddress(to), amount);
        });
    }

    @Override
    public void mint(String caller, String to, BigInteger amount) {
        log.info("Mint {} to {}", amount, to);
        txManager.run("mint", tx -> {
            TokenState state = tx.state(store);
            if (caller == null || !caller.equalsIgnoreCase(state.getOwner())) {
                throw new ProtocolException(ProtocolError.NOT_TOKEN_OWNER, caller);
            }
            String recipient = LedgerIds.requireAddress(to);
            requireNonNegative(amount);
            state.getBalances().merge(recipient, amount, BigInteger::add);
            state.setTotalSupply(state.getTotalSupply().add(amount));
            tx.emit(UNIT, EventType.TRANSFER, attrs("from", LedgerIds.ZERO_ADDRESS, "to", recipient, "amount", amount));
        });
    }

    public StateStore<TokenState> getStore() {
        return store;
    }

    private void move(LedgerTransaction tx, TokenState state, String from, String to, BigInteger amount) {
        requireNonNegative(amount);
        Map<String, BigInteger> balances = state.getBalances();
        BigInteger balance = balances.getOrDefault(from, BigInteger.ZERO);
        if (balance.compareTo(amount) < 0) {
            throw new ProtocolException(ProtocolError.INSUFFICIENT_BALANCE, from);
        }
        balances.put(from, balance.subtract(amount));
        balances.merge(to, amount, BigInteger::add);
        tx.emit(UNIT, EventType.TRANSFER, attrs("from", from, "to", to, "amount", amount));
    }

    private static BigInteger allowanceOf(TokenState state, String owner, String spender) {
        Map<String, BigInteger> approvals = state.getAllowances().get(owner);
        return approvals == null ? BigInteger.ZERO : approvals.getOrDefault(spender, BigInteger.ZERO);
    }

    private static void requireNonNegative(BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw new ProtocolException(ProtocolError.INVALID_AMOUNT, amount);
        }
    }

}
