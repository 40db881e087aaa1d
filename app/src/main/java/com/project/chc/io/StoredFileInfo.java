package com.project.chc.io;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Descriptor kept next to a stored ciphertext.
 *
 * @param fileId           file identifier
 * @param originalName     name the file was uploaded under
 * @param owner            owning principal
 * @param authorizedUsers  authorization snapshot at registration
 * @param recordHash       ledger record hash the seed was derived from
 * @param sizeEncrypted    ciphertext length in bytes
 * @param checksum         SHA-256 hex of the ciphertext
 * @param storedAt         when the ciphertext was written
 * @param encryptionMethod always {@code CHC}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StoredFileInfo(
        String fileId,
        String originalName,
        String owner,
        List<String> authorizedUsers,
        String recordHash,
        long sizeEncrypted,
        String checksum,
        Instant storedAt,
        String encryptionMethod
) {
    public static final String ENCRYPTION_METHOD = "CHC";

    public StoredFileInfo {
        Objects.requireNonNull(fileId, "fileId must not be null");
        authorizedUsers = authorizedUsers == null ? List.of() : List.copyOf(authorizedUsers);
    }

    /**
     * Descriptor before the ciphertext is written; size, checksum and time are filled in by the store.
     */
    public static StoredFileInfo describe(String fileId, String originalName, String owner,
                                          List<String> authorizedUsers, String recordHash) {
        return new StoredFileInfo(fileId, originalName, owner, authorizedUsers, recordHash,
                0, null, null, ENCRYPTION_METHOD);
    }

    public StoredFileInfo withContent(long size, String checksum, Instant storedAt) {
        return new StoredFileInfo(fileId, originalName, owner, authorizedUsers, recordHash,
                size, checksum, storedAt, encryptionMethod);
    }
}
