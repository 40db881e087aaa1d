package com.project.chc.io;

/**
 * Supplies the ciphertext for a file once access has been authorized.
 */
@FunctionalInterface
public interface CiphertextSource {
    byte[] load(String fileId);
}
