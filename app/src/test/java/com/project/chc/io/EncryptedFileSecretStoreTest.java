package com.project.chc.io;

import com.project.chc.core.StorageException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EncryptedFileSecretStoreTest {

    // keeps PBKDF2 fast in tests
    private static final int ITERATIONS = 1_000;

    @TempDir
    Path tempDir;

    private EncryptedFileSecretStore open(Path file, String passphrase) {
        return new EncryptedFileSecretStore(file, passphrase.toCharArray(), ITERATIONS);
    }

    @Test
    @DisplayName("Secrets survive reopening with the same passphrase")
    void reopenWithSamePassphrase() {
        Path file = tempDir.resolve("secrets.json");
        EncryptedFileSecretStore store = open(file, "correct horse");
        byte[] ownerSecret = store.getOrCreateOwnerSecret("alice");
        byte[] systemKey = store.getOrCreateSystemKey("ledger-provenance");
        store.putWrappedSeed("f1", "bob", new byte[32]);

        EncryptedFileSecretStore reopened = open(file, "correct horse");
        assertArrayEquals(ownerSecret, reopened.getOrCreateOwnerSecret("alice"));
        assertArrayEquals(ownerSecret, reopened.findOwnerSecret("alice").orElseThrow());
        assertArrayEquals(systemKey, reopened.getOrCreateSystemKey("ledger-provenance"));
        assertArrayEquals(new byte[32], reopened.findWrappedSeed("f1", "bob").orElseThrow());
    }

    @Test
    @DisplayName("Secrets are not written in the clear")
    void fileIsEncrypted() throws Exception {
        Path file = tempDir.resolve("secrets.json");
        open(file, "pw").getOrCreateOwnerSecret("alice-the-owner");

        String raw = Files.readString(file, StandardCharsets.UTF_8);
        assertTrue(raw.contains("CHC-VAULT-SECRETS"));
        assertFalse(raw.contains("alice-the-owner"));
    }

    @Test
    void wrongPassphraseFails() {
        Path file = tempDir.resolve("secrets.json");
        open(file, "right").getOrCreateOwnerSecret("alice");
        assertThrows(StorageException.class, () -> open(file, "wrong"));
    }

    @Test
    void ownerSecretsAreDistinctAndSized() {
        EncryptedFileSecretStore store = open(tempDir.resolve("secrets.json"), "pw");
        byte[] alice = store.getOrCreateOwnerSecret("alice");
        assertEquals(SecretStore.SECRET_LENGTH, alice.length);
        assertFalse(Arrays.equals(alice, store.getOrCreateOwnerSecret("bob")));
        assertTrue(store.findOwnerSecret("carol").isEmpty());
    }

    @Test
    void deleteWrappedSeedsCountsRemoved() {
        EncryptedFileSecretStore store = open(tempDir.resolve("secrets.json"), "pw");
        store.putWrappedSeed("f1", "alice", new byte[32]);
        store.putWrappedSeed("f1", "bob", new byte[32]);
        assertEquals(2, store.deleteWrappedSeeds("f1"));
        assertEquals(0, store.deleteWrappedSeeds("f1"));
        assertTrue(store.findWrappedSeed("f1", "bob").isEmpty());
    }

    @Test
    void rejectsEmptyPassphrase() {
        assertThrows(IllegalArgumentException.class,
                () -> new EncryptedFileSecretStore(tempDir.resolve("s.json"), new char[0]));
    }

    @Test
    @DisplayName("In-memory store hands out copies")
    void inMemoryStoreReturnsCopies() {
        InMemorySecretStore store = new InMemorySecretStore();
        byte[] secret = store.getOrCreateOwnerSecret("alice");
        secret[0] ^= 1;
        assertFalse(Arrays.equals(secret, store.getOrCreateOwnerSecret("alice")));
    }
}
