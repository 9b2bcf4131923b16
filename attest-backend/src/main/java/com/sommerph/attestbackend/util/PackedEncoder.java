package com.sommerph.attestbackend.util;

import org.bouncycastle.util.encoders.Hex;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * Canonical byte encoding of identifier inputs. Fixed-size values are written in their
 * ledger width (bytes32: 32 bytes, address: 20 bytes, uint: 32-byte big-endian word),
 * strings as raw UTF-8.
 */
public class PackedEncoder {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    public static PackedEncoder create() {
        return new PackedEncoder();
    }

    public PackedEncoder bytes32(String hex) {
        byte[] bytes = Hex.decode(LedgerIds.strip(hex));
        if (bytes.length != 32) {
            throw new IllegalArgumentException("Expected 32 bytes but got " + bytes.length + ": " + hex);
        }
        out.writeBytes(bytes);
        return this;
    }

    public PackedEncoder address(String hex) {
        byte[] bytes = Hex.decode(LedgerIds.strip(hex));
        if (bytes.length != 20) {
            throw new IllegalArgumentException("Expected 20 bytes but got " + bytes.length + ": " + hex);
        }
        out.writeBytes(bytes);
        return this;
    }

    public PackedEncoder uint(long value) {
        return uint(BigInteger.valueOf(value));
    }

    public PackedEncoder uint(BigInteger value) {
        if (value.signum() < 0 || value.bitLength() > 256) {
            throw new IllegalArgumentException("Value out of uint256 range: " + value);
        }
        byte[] raw = value.toByteArray();
        byte[] word = new byte[32];
        int length = Math.min(raw.length, 32);
        System.arraycopy(raw, raw.length - length, word, 32 - length, length);
        out.writeBytes(word);
        return this;
    }

    public PackedEncoder string(String value) {
        out.writeBytes(value.getBytes(StandardCharsets.UTF_8));
        return this;
    }

    // length word followed by the UTF-8 bytes, so adjacent strings cannot run into each other
    public PackedEncoder sizedString(String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        uint(bytes.length);
        out.writeBytes(bytes);
        return this;
    }

    public byte[] toBytes() {
        return out.toByteArray();
    }

    public String keccak256() {
        return HashUtils.keccak256Hex(toBytes());
    }

}
