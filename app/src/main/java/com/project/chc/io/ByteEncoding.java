package com.project.chc.io;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

public final class ByteEncoding {

    private ByteEncoding() {
    }

    public static String toBase64(byte[] data) {
        return Base64.getEncoder().encodeToString(data);
    }

    public static byte[] fromBase64(String value) {
        return Base64.getDecoder().decode(value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Replace anything outside {@code [a-zA-Z0-9-_.]} so an identifier can be used as a file name.
     */
    public static String sanitize(String input) {
        return input.replaceAll("[^a-zA-Z0-9\\-_.]", "_");
    }
}
