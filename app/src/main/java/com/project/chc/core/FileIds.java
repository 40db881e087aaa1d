package com.project.chc.core;

import com.project.chc.crypto.CryptoPrimitives;

/**
 * File id generation: {@code "file_"} plus the first 12 hex characters of
 * SHA-256(filename ":" owner ":" timestamp).
 */
public final class FileIds {
    private static final String PREFIX = "file_";
    private static final int HASH_CHARS = 12;

    private FileIds() {
    }

    public static String generate(String filename, String owner, double timestamp) {
        String data = filename + ":" + owner + ":" + CryptoPrimitives.decimalString(timestamp);
        return PREFIX + CryptoPrimitives.sha256Hex(CryptoPrimitives.utf8(data)).substring(0, HASH_CHARS);
    }
}
