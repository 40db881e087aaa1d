package com.project.chc.crypto;

/**
 * Raised for malformed key material: seeds, user keys or owner secrets of the wrong length.
 * The stream cipher carries no integrity tag, so a wrong seed is never reported here.
 */
public class CryptoException extends IllegalArgumentException {
    public CryptoException(String message) {
        super(message);
    }

    public CryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
