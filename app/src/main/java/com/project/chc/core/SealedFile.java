package com.project.chc.core;

import java.util.Map;

/**
 * Output of sealing one plaintext.
 *
 * @param fileId       file identifier
 * @param ciphertext   CHC ciphertext, same length as the plaintext
 * @param wrappedSeeds seed wrapped per principal, authorized users first and the owner last
 */
public record SealedFile(String fileId, byte[] ciphertext, Map<String, byte[]> wrappedSeeds) {
    public SealedFile {
        wrappedSeeds = Map.copyOf(wrappedSeeds);
    }
}
