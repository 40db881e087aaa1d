package com.project.chc.core;

/**
 * The record chain or a provenance seal failed verification and could not be repaired.
 */
public class IntegrityException extends VaultException {
    private final long firstInvalidIndex;

    public IntegrityException(String message, long firstInvalidIndex) {
        super(message);
        this.firstInvalidIndex = firstInvalidIndex;
    }

    /**
     * Index of the first record that failed, or -1 when the ledger is empty.
     */
    public long firstInvalidIndex() {
        return firstInvalidIndex;
    }
}
