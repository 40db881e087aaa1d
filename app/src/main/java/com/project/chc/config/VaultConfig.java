package com.project.chc.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runtime configuration for the vault, resolved from environment variables.
 *
 * @param dataDirectory   base directory for ciphertexts and secrets
 * @param ledgerFile      JSON file holding the record sequence
 * @param vaultSecret     passphrase protecting the secret store at rest; empty means in-memory secrets
 * @param userKeyMode     derivation used to wrap seeds per principal
 * @param autoRepair      whether a failed chain verification triggers one structural repair
 * @param maxFileBytes    largest plaintext accepted by upload
 */
public record VaultConfig(
        Path dataDirectory,
        Path ledgerFile,
        Optional<String> vaultSecret,
        UserKeyMode userKeyMode,
        boolean autoRepair,
        long maxFileBytes
) {
    public static final long DEFAULT_MAX_FILE_BYTES = 16L * 1024 * 1024;

    public VaultConfig {
        Objects.requireNonNull(dataDirectory, "dataDirectory must not be null");
        Objects.requireNonNull(ledgerFile, "ledgerFile must not be null");
        Objects.requireNonNull(vaultSecret, "vaultSecret must not be null");
        Objects.requireNonNull(userKeyMode, "userKeyMode must not be null");
        if (maxFileBytes <= 0) {
            throw new IllegalArgumentException("maxFileBytes must be positive: got " + maxFileBytes);
        }
    }

    public Path ciphertextDirectory() {
        return dataDirectory.resolve("files");
    }

    public Path secretsFile() {
        return dataDirectory.resolve("secrets.json");
    }

    public static VaultConfig defaults(Path dataDirectory) {
        return new VaultConfig(dataDirectory, dataDirectory.resolve("ledger.json"), Optional.empty(),
                UserKeyMode.HKDF_SHA256, true, DEFAULT_MAX_FILE_BYTES);
    }

    public static VaultConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    public static VaultConfig fromEnv(Map<String, String> env) {
        Path dataDir = Paths.get(env.getOrDefault("CHC_DATA_DIR", "data"));
        String ledgerFile = env.get("CHC_LEDGER_FILE");
        Path ledger = ledgerFile == null || ledgerFile.isBlank()
                ? dataDir.resolve("ledger.json")
                : Paths.get(ledgerFile);

        Optional<String> secret = Optional.ofNullable(env.get("CHC_VAULT_SECRET"))
                .filter(s -> !s.isBlank());

        UserKeyMode mode = UserKeyMode.fromEnv(env.get("CHC_USER_KEY_MODE"), UserKeyMode.HKDF_SHA256);

        String repair = env.get("CHC_AUTO_REPAIR");
        boolean autoRepair = repair == null || repair.isBlank() || Boolean.parseBoolean(repair.trim());

        String maxBytes = env.get("CHC_MAX_FILE_BYTES");
        long max;
        try {
            max = maxBytes == null || maxBytes.isBlank() ? DEFAULT_MAX_FILE_BYTES : Long.parseLong(maxBytes.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("CHC_MAX_FILE_BYTES must be a number: " + maxBytes, e);
        }

        return new VaultConfig(dataDir, ledger, secret, mode, autoRepair, max);
    }
}
