package com.project.chc.crypto;

import java.util.Objects;

/**
 * XOR wrapping of a file seed for a single principal. Wrapping is self-inverse.
 */
public final class SeedWrap {
    public static final int KEY_LENGTH = 32;

    private SeedWrap() {
    }

    public static byte[] generateUserKey(String principal, String fileId) {
        Objects.requireNonNull(principal, "principal must not be null");
        Objects.requireNonNull(fileId, "fileId must not be null");
        return CryptoPrimitives.sha256(CryptoPrimitives.utf8(principal + ":" + fileId));
    }

    public static byte[] wrap(byte[] seed, byte[] userKey) {
        CryptoPrimitives.requireLength(seed, SeedEngine.SEED_LENGTH, "seed");
        CryptoPrimitives.requireLength(userKey, KEY_LENGTH, "userKey");
        return CryptoPrimitives.xor(seed, userKey);
    }

    public static byte[] unwrap(byte[] wrappedSeed, byte[] userKey) {
        CryptoPrimitives.requireLength(wrappedSeed, SeedEngine.SEED_LENGTH, "wrappedSeed");
        CryptoPrimitives.requireLength(userKey, KEY_LENGTH, "userKey");
        return CryptoPrimitives.xor(wrappedSeed, userKey);
    }
}
