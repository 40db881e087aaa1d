package com.project.chc.core;

import java.util.List;

/**
 * Security summary for one file.
 *
 * @param fileId             file identifier
 * @param recordHash         current hash of the ledger record
 * @param owner              owning principal
 * @param authorizedUsers    authorization snapshot
 * @param chainValid         whether the chain verifies (after at most one structural repair)
 * @param provenanceValid    whether every registration seal still matches
 * @param unauthorizedAttempts number of denied entries
 * @param successfulAccesses number of granted entries
 * @param failedDecryptions  number of failed entries
 * @param ciphertextIntact   whether the stored ciphertext matches its checksum; false if none is stored
 */
public record SecurityReport(
        String fileId,
        String recordHash,
        String owner,
        List<String> authorizedUsers,
        boolean chainValid,
        boolean provenanceValid,
        long unauthorizedAttempts,
        long successfulAccesses,
        long failedDecryptions,
        boolean ciphertextIntact
) {
    public boolean isSecure() {
        return chainValid && provenanceValid && ciphertextIntact;
    }

    public String accessControlStatus() {
        return unauthorizedAttempts > 0 ? "enforced" : "not_tested";
    }
}
