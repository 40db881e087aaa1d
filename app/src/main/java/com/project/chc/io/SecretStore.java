package com.project.chc.io;

import java.util.Optional;

/**
 * Holds owner secrets, wrapped seeds and service keys outside the ledger.
 */
public interface SecretStore {

    int SECRET_LENGTH = 32;

    /**
     * The owner's 32-byte secret, generated on first use.
     */
    byte[] getOrCreateOwnerSecret(String owner);

    Optional<byte[]> findOwnerSecret(String owner);

    void putWrappedSeed(String fileId, String principal, byte[] wrappedSeed);

    Optional<byte[]> findWrappedSeed(String fileId, String principal);

    /**
     * @return number of wrapped seeds removed
     */
    int deleteWrappedSeeds(String fileId);

    /**
     * A service-held 32-byte key for {@code purpose}, generated on first use.
     */
    byte[] getOrCreateSystemKey(String purpose);
}
