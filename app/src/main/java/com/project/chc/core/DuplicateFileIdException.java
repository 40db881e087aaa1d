package com.project.chc.core;

/**
 * Registration was attempted with a file id that the ledger already contains.
 */
public class DuplicateFileIdException extends VaultException {
    public DuplicateFileIdException(String fileId) {
        super("File id already registered: " + fileId);
    }
}
