package com.project.chc.core;

/**
 * Base type for ledger, storage and access-control failures.
 */
public class VaultException extends RuntimeException {
    public VaultException(String message) {
        super(message);
    }

    public VaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
