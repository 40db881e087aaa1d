package com.project.chc.core;

/**
 * Unknown file id, or no wrapped seed stored for the requesting principal.
 */
public class NotFoundException extends VaultException {
    public NotFoundException(String message) {
        super(message);
    }
}
