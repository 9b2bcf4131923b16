package com.sommerph.attestbackend.util;

import org.bouncycastle.jcajce.provider.digest.Keccak;
import org.bouncycastle.util.encoders.Hex;

import java.nio.charset.StandardCharsets;

public class HashUtils {

    private HashUtils() {
    }

    public static byte[] keccak256(byte[] input) {
        Keccak.Digest256 digest = new Keccak.Digest256();
        return digest.digest(input);
    }

    public static String keccak256Hex(byte[] input) {
        return "0x" + Hex.toHexString(keccak256(input));
    }

    public static String keccak256Hex(String input) {
        return keccak256Hex(input.getBytes(StandardCharsets.UTF_8));
    }

    // verifierId = keccak256(bytes(verificationType))
    public static String verifierId(String verificationType) {
        return keccak256Hex(verificationType);
    }

}
