package com.sommerph.attestbackend.service.token;

import java.math.BigInteger;

/**
 * ERC-20 style token in which protocol fees and relayer credits are denominated.
 * Calls made inside a ledger transaction are applied atomically with it.
 */
public interface FeeToken {

    String getAddress();

    BigInteger balanceOf(String account);

    BigInteger allowance(String owner, String spender);

    void approve(String owner, String spender, BigInteger amount);

    void transfer(String from, String to, BigInteger amount);

    void transferFrom(String spender, String from, String to, BigInteger amount);

    void mint(String caller, String to, BigInteger amount);

}
