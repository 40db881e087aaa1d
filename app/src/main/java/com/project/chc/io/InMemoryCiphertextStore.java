package com.project.chc.io;

import com.project.chc.core.ChecksumMismatchException;
import com.project.chc.core.NotFoundException;
import com.project.chc.crypto.CryptoPrimitives;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ciphertexts held in JVM memory. Lost when the process stops.
 */
public class InMemoryCiphertextStore implements CiphertextStore {

    private final Map<String, StoredFileInfo> descriptors = new ConcurrentHashMap<>();
    private final Map<String, byte[]> data = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCiphertextStore() {
        this(Clock.systemUTC());
    }

    public InMemoryCiphertextStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public StoredFileInfo put(StoredFileInfo descriptor, byte[] ciphertext) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        Objects.requireNonNull(ciphertext, "ciphertext must not be null");
        StoredFileInfo stored = descriptor.withContent(
                ciphertext.length, CryptoPrimitives.sha256Hex(ciphertext), clock.instant());
        data.put(descriptor.fileId(), ciphertext.clone());
        descriptors.put(descriptor.fileId(), stored);
        return stored;
    }

    @Override
    public byte[] get(String fileId) {
        StoredFileInfo info = descriptors.get(fileId);
        byte[] ciphertext = data.get(fileId);
        if (info == null || ciphertext == null) {
            throw new NotFoundException("Encrypted file not found: " + fileId);
        }
        String actual = CryptoPrimitives.sha256Hex(ciphertext);
        if (!actual.equals(info.checksum())) {
            throw new ChecksumMismatchException(fileId, info.checksum(), actual);
        }
        return ciphertext.clone();
    }

    @Override
    public Optional<StoredFileInfo> info(String fileId) {
        return Optional.ofNullable(descriptors.get(fileId));
    }

    @Override
    public boolean verifyChecksum(String fileId) {
        try {
            get(fileId);
            return true;
        } catch (ChecksumMismatchException | NotFoundException e) {
            return false;
        }
    }

    @Override
    public boolean contains(String fileId) {
        return data.containsKey(fileId);
    }

    @Override
    public boolean delete(String fileId) {
        boolean removed = data.remove(fileId) != null;
        return descriptors.remove(fileId) != null || removed;
    }

    /**
     * Overwrite stored bytes without updating the checksum. Test hook for tamper scenarios.
     */
    void corrupt(String fileId, byte[] replacement) {
        data.put(fileId, replacement.clone());
    }
}
