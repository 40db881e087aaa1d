package com.project.chc.core;

/**
 * A backing store could not be read or written, or a compare-and-replace lost a race.
 */
public class StorageException extends VaultException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
