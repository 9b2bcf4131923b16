package com.sommerph.attestbackend.util;

import com.sommerph.attestbackend.exception.ProtocolError;
import com.sommerph.attestbackend.exception.ProtocolException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Format checks and normalisation for addresses (0x + 40 hex) and 32-byte identifiers (0x + 64 hex).
 * Normalised values are lower case.
 */
public class LedgerIds {

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";
    public static final String ZERO_BYTES32 = "0x0000000000000000000000000000000000000000000000000000000000000000";
    public static final String DEAD_ADDRESS = "0x000000000000000000000000000000000000dead";

    private static final Pattern ADDRESS = Pattern.compile("^0x[a-fA-F0-9]{40}$");
    private static final Pattern BYTES32 = Pattern.compile("^0x[a-fA-F0-9]{64}$");

    private LedgerIds() {
    }

    public static boolean isAddress(String value) {
        return value != null && ADDRESS.matcher(value).matches();
    }

    public static boolean isBytes32(String value) {
        return value != null && BYTES32.matcher(value).matches();
    }

    public static boolean isZeroAddress(String value) {
        return value == null || ZERO_ADDRESS.equals(value.toLowerCase(Locale.ROOT));
    }

    public static boolean isZeroBytes32(String value) {
        return value == null || ZERO_BYTES32.equals(value.toLowerCase(Locale.ROOT));
    }

    public static String normalize(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }

    public static String requireAddress(String value) {
        if (!isAddress(value) || isZeroAddress(value)) {
            throw new ProtocolException(ProtocolError.INVALID_ADDRESS, value);
        }
        return normalize(value);
    }

    public static String requireQHash(String value) {
        if (!isBytes32(value) || isZeroBytes32(value)) {
            throw new ProtocolException(ProtocolError.INVALID_QHASH, value);
        }
        return normalize(value);
    }

    public static String requireBytes32(String value) {
        if (!isBytes32(value) || isZeroBytes32(value)) {
            throw new ProtocolException(ProtocolError.INVALID_BYTES32, value);
        }
        return normalize(value);
    }

    static String strip(String hex) {
        return hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    }

}
