package com.sommerph.attestbackend.model.token;

import lombok.Data;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
public class TokenState {

    private String address;
    private String owner;
    private BigInteger totalSupply = BigInteger.ZERO;

    private Map<String, BigInteger> balances = new LinkedHashMap<>();

    // owner -> spender -> allowance
    private Map<String, Map<String, BigInteger>> allowances = new LinkedHashMap<>();

}
