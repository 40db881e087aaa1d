package com.project.chc.crypto;

import java.io.ByteArrayOutputStream;

/**
 * Contextual Hash Chain (CHC) seed derivation and block-chained stream cipher.
 *
 * <p>Keystream for block {@code i} is {@code HMAC(state, bigEndian32(i))}; after each block the
 * state advances to {@code HMAC(state, ciphertextBlock)}. Both directions advance on the
 * ciphertext block, so decryption mirrors encryption exactly.</p>
 *
 * <p>The construction is deterministic and nonce-free: the same seed and plaintext always give
 * the same ciphertext, and there is no integrity tag. A seed must therefore be used for exactly
 * one plaintext; callers guard this by refusing to seal a file id twice.</p>
 */
public final class SeedEngine {
    public static final int SEED_LENGTH = 32;
    public static final int BLOCK_SIZE = 32;
    public static final int OWNER_SECRET_LENGTH = 32;

    private SeedEngine() {
    }

    /**
     * seed = HMAC-SHA256(ownerSecret, recordHash || decimalString(timestamp) || fileId)
     */
    public static byte[] deriveSeed(byte[] ownerSecret, String recordHash, double timestamp, String fileId) {
        CryptoPrimitives.requireLength(ownerSecret, OWNER_SECRET_LENGTH, "ownerSecret");
        if (recordHash == null || fileId == null) {
            throw new CryptoException("recordHash and fileId must not be null");
        }
        String context = recordHash + CryptoPrimitives.decimalString(timestamp) + fileId;
        return CryptoPrimitives.hmacSha256(ownerSecret, CryptoPrimitives.utf8(context));
    }

    public static byte[] encrypt(byte[] plaintext, byte[] seed) {
        return transform(plaintext, seed, true);
    }

    public static byte[] decrypt(byte[] ciphertext, byte[] seed) {
        return transform(ciphertext, seed, false);
    }

    public static int blockCount(int length) {
        return (length + BLOCK_SIZE - 1) / BLOCK_SIZE;
    }

    private static byte[] transform(byte[] input, byte[] seed, boolean encrypting) {
        CryptoPrimitives.requireLength(seed, SEED_LENGTH, "seed");
        if (input == null) {
            throw new CryptoException("input must not be null");
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(input.length);
        byte[] state = seed.clone();
        int blocks = blockCount(input.length);

        for (int i = 0; i < blocks; i++) {
            int start = i * BLOCK_SIZE;
            int len = Math.min(BLOCK_SIZE, input.length - start);
            byte[] block = new byte[len];
            System.arraycopy(input, start, block, 0, len);

            byte[] keystream = CryptoPrimitives.hmacSha256(state, CryptoPrimitives.bigEndian32(i));
            byte[] result = CryptoPrimitives.xorPrefix(block, keystream, len);
            out.writeBytes(result);

            byte[] cipherBlock = encrypting ? result : block;
            state = CryptoPrimitives.hmacSha256(state, cipherBlock);
        }
        return out.toByteArray();
    }
}
