package com.project.chc.core;

/**
 * The principal is neither the owner nor in the authorization snapshot of the record.
 */
public class AccessDeniedException extends VaultException {
    private final String fileId;
    private final String principal;

    public AccessDeniedException(String fileId, String principal, String reason) {
        super(String.format("Access denied for %s on file %s: %s", principal, fileId, reason));
        this.fileId = fileId;
        this.principal = principal;
    }

    public String fileId() {
        return fileId;
    }

    public String principal() {
        return principal;
    }
}
