package com.project.chc.config;

import com.project.chc.crypto.UserKeyDerivation;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * Catalog of supported per-principal key derivations for seed wrapping.
 *
 * <p>{@link #HKDF_SHA256} is the default. {@link #PUBLIC_HASH} reproduces the legacy
 * {@code SHA-256(principal ":" fileId)} derivation and is kept only for reading vaults written with it.</p>
 */
public enum UserKeyMode {
    HKDF_SHA256(
            "hkdf-sha256",
            true,
            "HKDF-SHA256 keyed by a server-held secret; a wrapped seed alone does not reveal the file seed."
    ),
    PUBLIC_HASH(
            "public-hash",
            false,
            "Legacy SHA-256(principal:fileId). Computable by anyone who knows the identifiers."
    );

    private final String id;
    private final boolean secret;
    private final String description;

    UserKeyMode(String id, boolean secret, String description) {
        this.id = id;
        this.secret = secret;
        this.description = description;
    }

    public String id() {
        return id;
    }

    public boolean isSecret() {
        return secret;
    }

    public String description() {
        return description;
    }

    /**
     * Build the derivation for this mode. The server key supplier is consulted only by keyed modes.
     */
    public UserKeyDerivation derivation(Supplier<byte[]> serverKey) {
        return switch (this) {
            case HKDF_SHA256 -> UserKeyDerivation.keyed(serverKey.get());
            case PUBLIC_HASH -> UserKeyDerivation.publicHash();
        };
    }

    public static UserKeyMode fromEnv(String value, UserKeyMode fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (UserKeyMode mode : values()) {
            if (mode.id.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown user key mode: " + value);
    }
}
