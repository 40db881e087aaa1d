package com.project.chc.crypto;

/**
 * Derives the 32-byte key that wraps a file seed for one principal.
 */
@FunctionalInterface
public interface UserKeyDerivation {

    byte[] deriveUserKey(String principal, String fileId);

    /**
     * SHA-256(principal ":" fileId). Anyone who knows both identifiers can compute it,
     * so a wrapped seed produced with this key offers no secrecy on its own.
     */
    static UserKeyDerivation publicHash() {
        return SeedWrap::generateUserKey;
    }

    /**
     * HKDF-SHA256 keyed by a server-held secret, salted with the file id and bound to the principal.
     * Possession of a wrapped seed is not enough to recover the content seed without that secret.
     */
    static UserKeyDerivation keyed(byte[] serverSecret) {
        if (serverSecret == null || serverSecret.length < 32) {
            throw new CryptoException("server secret for user key derivation must be at least 32 bytes");
        }
        byte[] secret = serverSecret.clone();
        return (principal, fileId) -> HKDFUtil.deriveKey(
                secret,
                CryptoPrimitives.utf8(fileId),
                CryptoPrimitives.utf8("chc-user-key:" + principal),
                SeedWrap.KEY_LENGTH);
    }
}
