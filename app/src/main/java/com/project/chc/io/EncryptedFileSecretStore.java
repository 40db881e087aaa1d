package com.project.chc.io;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.project.chc.core.StorageException;
import com.project.chc.crypto.ErrorLogger;

import javax.crypto.Cipher;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Secret store persisted as a single AES-256-GCM encrypted JSON document.
 *
 * <p>The AES key is derived once per instance with PBKDF2-HMAC-SHA256 from the vault passphrase
 * and the salt recorded in the file. Each write re-encrypts the whole document under a fresh IV.</p>
 */
public class EncryptedFileSecretStore implements SecretStore {

    private static final String FORMAT_MAGIC = "CHC-VAULT-SECRETS";
    private static final int FORMAT_VERSION = 1;
    private static final int SALT_BYTES = 16;
    private static final int IV_BYTES = 12;
    private static final int GCM_TAG_BITS = 128;
    public static final int DEFAULT_PBKDF2_ITERATIONS = 200_000;
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path file;
    private final int iterations;
    private final byte[] salt;
    private final SecretKeySpec key;
    private final Contents contents;

    public EncryptedFileSecretStore(Path file, char[] passphrase) {
        this(file, passphrase, DEFAULT_PBKDF2_ITERATIONS);
    }

    public EncryptedFileSecretStore(Path file, char[] passphrase, int iterations) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        if (passphrase == null || passphrase.length == 0) {
            throw new IllegalArgumentException("passphrase must not be empty");
        }
        if (iterations <= 0) {
            throw new IllegalArgumentException("iterations must be positive: got " + iterations);
        }
        try {
            if (Files.exists(file)) {
                EncryptedSecretsFile stored = MAPPER.readValue(file.toFile(), EncryptedSecretsFile.class);
                validate(stored);
                this.iterations = stored.iterations;
                this.salt = ByteEncoding.fromBase64(stored.salt);
                this.key = deriveKey(passphrase, salt, this.iterations);
                this.contents = MAPPER.readValue(decrypt(stored), Contents.class);
            } else {
                this.iterations = iterations;
                this.salt = new byte[SALT_BYTES];
                RANDOM.nextBytes(salt);
                this.key = deriveKey(passphrase, salt, iterations);
                this.contents = new Contents();
            }
        } catch (GeneralSecurityException e) {
            ErrorLogger.logError("EncryptedFileSecretStore.open", "Failed to unlock secret store " + file, e);
            throw new StorageException("Failed to unlock secret store " + file, e);
        } catch (IOException e) {
            ErrorLogger.logError("EncryptedFileSecretStore.open", "Failed to read secret store " + file, e);
            throw new StorageException("Failed to read secret store " + file, e);
        }
    }

    @Override
    public synchronized byte[] getOrCreateOwnerSecret(String owner) {
        Objects.requireNonNull(owner, "owner must not be null");
        String encoded = contents.ownerSecrets.get(owner);
        if (encoded == null) {
            encoded = ByteEncoding.toBase64(InMemorySecretStore.randomKey());
            contents.ownerSecrets.put(owner, encoded);
            persist();
            ErrorLogger.logInfo("EncryptedFileSecretStore.getOrCreateOwnerSecret", "Generated new secret for owner " + owner);
        }
        return ByteEncoding.fromBase64(encoded);
    }

    @Override
    public synchronized Optional<byte[]> findOwnerSecret(String owner) {
        return Optional.ofNullable(contents.ownerSecrets.get(owner)).map(ByteEncoding::fromBase64);
    }

    @Override
    public synchronized void putWrappedSeed(String fileId, String principal, byte[] wrappedSeed) {
        Objects.requireNonNull(wrappedSeed, "wrappedSeed must not be null");
        contents.wrappedSeeds.computeIfAbsent(fileId, f -> new TreeMap<>())
                .put(principal, ByteEncoding.toBase64(wrappedSeed));
        persist();
    }

    @Override
    public synchronized Optional<byte[]> findWrappedSeed(String fileId, String principal) {
        Map<String, String> seeds = contents.wrappedSeeds.get(fileId);
        if (seeds == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(seeds.get(principal)).map(ByteEncoding::fromBase64);
    }

    @Override
    public synchronized int deleteWrappedSeeds(String fileId) {
        Map<String, String> removed = contents.wrappedSeeds.remove(fileId);
        if (removed == null) {
            return 0;
        }
        persist();
        return removed.size();
    }

    @Override
    public synchronized byte[] getOrCreateSystemKey(String purpose) {
        String encoded = contents.systemKeys.get(purpose);
        if (encoded == null) {
            encoded = ByteEncoding.toBase64(InMemorySecretStore.randomKey());
            contents.systemKeys.put(purpose, encoded);
            persist();
        }
        return ByteEncoding.fromBase64(encoded);
    }

    private void persist() {
        try {
            byte[] iv = new byte[IV_BYTES];
            RANDOM.nextBytes(iv);
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            byte[] ciphertext = cipher.doFinal(MAPPER.writeValueAsBytes(contents));

            EncryptedSecretsFile out = new EncryptedSecretsFile();
            out.format = FORMAT_MAGIC;
            out.version = FORMAT_VERSION;
            out.updatedAt = Instant.now().toString();
            out.kdf = "PBKDF2WithHmacSHA256";
            out.iterations = iterations;
            out.salt = ByteEncoding.toBase64(salt);
            out.iv = ByteEncoding.toBase64(iv);
            out.ciphertext = ByteEncoding.toBase64(ciphertext);

            Path parent = file.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            try {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), out);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (GeneralSecurityException | IOException e) {
            ErrorLogger.logError("EncryptedFileSecretStore.persist", "Failed to write secret store " + file, e);
            throw new StorageException("Failed to write secret store " + file, e);
        }
    }

    private byte[] decrypt(EncryptedSecretsFile stored) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
        cipher.init(Cipher.DECRYPT_MODE, key,
                new GCMParameterSpec(GCM_TAG_BITS, ByteEncoding.fromBase64(stored.iv)));
        return cipher.doFinal(ByteEncoding.fromBase64(stored.ciphertext));
    }

    private static SecretKeySpec deriveKey(char[] secret, byte[] salt, int iterations) throws GeneralSecurityException {
        PBEKeySpec spec = new PBEKeySpec(secret, salt, iterations, 256);
        try {
            return new SecretKeySpec(
                    SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256").generateSecret(spec).getEncoded(),
                    "AES"
            );
        } finally {
            spec.clearPassword();
        }
    }

    private static void validate(EncryptedSecretsFile file) throws IOException {
        if (!FORMAT_MAGIC.equals(file.format)) {
            throw new IOException("Unknown secret store format: " + file.format);
        }
        if (file.version != FORMAT_VERSION) {
            throw new IOException("Unsupported secret store version: " + file.version + " (expected " + FORMAT_VERSION + ")");
        }
    }

    // ----- Serialization payloads -----

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private static final class EncryptedSecretsFile {
        public String format;
        public int version;
        public String updatedAt;
        public String kdf;
        public int iterations;
        public String salt;
        public String iv;
        public String ciphertext;
    }

    private static final class Contents {
        public Map<String, String> ownerSecrets = new TreeMap<>();
        public Map<String, Map<String, String>> wrappedSeeds = new TreeMap<>();
        public Map<String, String> systemKeys = new TreeMap<>();
    }
}
