package com.project.chc.core;

/**
 * Stored ciphertext no longer matches its recorded SHA-256 checksum.
 */
public class ChecksumMismatchException extends VaultException {
    private final String fileId;

    public ChecksumMismatchException(String fileId, String expected, String actual) {
        super(String.format("Checksum mismatch for file %s: expected %s, got %s", fileId, expected, actual));
        this.fileId = fileId;
    }

    public String fileId() {
        return fileId;
    }
}
