package com.project.chc.io;

import java.util.Optional;

/**
 * Ciphertext storage keyed by file id, with a SHA-256 checksum per stored object.
 */
public interface CiphertextStore {

    /**
     * Store ciphertext and its descriptor. Size, checksum and storage time are computed here.
     */
    StoredFileInfo put(StoredFileInfo descriptor, byte[] ciphertext);

    /**
     * Read ciphertext, verifying its checksum first.
     *
     * @throws com.project.chc.core.NotFoundException if nothing is stored under {@code fileId}
     * @throws com.project.chc.core.ChecksumMismatchException if the bytes no longer match the checksum
     */
    byte[] get(String fileId);

    Optional<StoredFileInfo> info(String fileId);

    boolean verifyChecksum(String fileId);

    boolean contains(String fileId);

    boolean delete(String fileId);
}
