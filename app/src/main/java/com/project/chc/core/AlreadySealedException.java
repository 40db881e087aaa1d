package com.project.chc.core;

/**
 * Sealing was requested for a file id whose ciphertext already exists. Sealing again would
 * reuse the same contextual seed for a second plaintext.
 */
public class AlreadySealedException extends VaultException {
    public AlreadySealedException(String fileId) {
        super("File " + fileId + " is already sealed; refusing to reuse its seed");
    }
}
