package com.project.chc.crypto;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Hashing, keyed hashing and byte helpers shared by the ledger and the cipher.
 *
 * <p>Hex output is lowercase with no prefix, so a SHA-256 hash is always 64 characters.</p>
 */
public final class CryptoPrimitives {
    public static final int HASH_LENGTH = 32;

    private static final HexFormat HEX = HexFormat.of();

    private static final ThreadLocal<MessageDigest> SHA256 = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    });

    private CryptoPrimitives() {
    }

    public static byte[] sha256(byte[] input) {
        MessageDigest digest = SHA256.get();
        digest.reset();
        return digest.digest(input);
    }

    public static String sha256Hex(byte[] input) {
        return toHex(sha256(input));
    }

    /**
     * HMAC-SHA-256 of {@code message} under {@code key}. Keys of any length are accepted,
     * as HMAC itself allows.
     */
    public static byte[] hmacSha256(byte[] key, byte[] message) {
        if (key == null || message == null) {
            throw new CryptoException("HMAC key and message must not be null");
        }
        HMac mac = new HMac(new SHA256Digest());
        mac.init(new KeyParameter(key));
        mac.update(message, 0, message.length);
        byte[] out = new byte[mac.getMacSize()];
        mac.doFinal(out, 0);
        return out;
    }

    /**
     * XOR of two equal-length arrays.
     *
     * @throws CryptoException if the lengths differ
     */
    public static byte[] xor(byte[] a, byte[] b) {
        if (a == null || b == null) {
            throw new CryptoException("XOR operands must not be null");
        }
        if (a.length != b.length) {
            throw new CryptoException(
                String.format("XOR operands differ in length: %d vs %d", a.length, b.length));
        }
        return xorPrefix(a, b, a.length);
    }

    /**
     * XOR of the first {@code length} bytes of both arrays.
     */
    static byte[] xorPrefix(byte[] data, byte[] pad, int length) {
        byte[] out = new byte[length];
        for (int i = 0; i < length; i++) {
            out[i] = (byte) (data[i] ^ pad[i]);
        }
        return out;
    }

    public static byte[] bigEndian32(int value) {
        return ByteBuffer.allocate(4).putInt(value).array();
    }

    public static byte[] utf8(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    public static String toHex(byte[] input) {
        return HEX.formatHex(input);
    }

    public static byte[] fromHex(String hex) {
        String normalized = hex.startsWith("0x") ? hex.substring(2) : hex;
        return HEX.parseHex(normalized);
    }

    /**
     * Plain decimal rendering of a floating-point value with at least one fractional digit,
     * e.g. {@code 1700000000.0} or {@code 1700000000.25}. Used for timestamps in seed derivation
     * and in the canonical record encoding.
     */
    public static String decimalString(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Value must be finite: " + value);
        }
        String plain = new BigDecimal(Double.toString(value)).toPlainString();
        return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }

    public static void requireLength(byte[] value, int expected, String name) {
        if (value == null) {
            throw new CryptoException(name + " must not be null");
        }
        if (value.length != expected) {
            throw new CryptoException(
                String.format("%s has invalid length: expected %d bytes, got %d", name, expected, value.length));
        }
    }
}
