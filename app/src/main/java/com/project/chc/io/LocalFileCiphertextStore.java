package com.project.chc.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.project.chc.core.ChecksumMismatchException;
import com.project.chc.core.NotFoundException;
import com.project.chc.core.StorageException;
import com.project.chc.crypto.CryptoPrimitives;
import com.project.chc.crypto.ErrorLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Ciphertexts stored as {@code <fileId>.enc} with a {@code <fileId>.json} descriptor in one directory.
 */
public class LocalFileCiphertextStore implements CiphertextStore {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Path baseDirectory;
    private final Clock clock;

    public LocalFileCiphertextStore(Path baseDirectory) {
        this(baseDirectory, Clock.systemUTC());
    }

    public LocalFileCiphertextStore(Path baseDirectory, Clock clock) {
        this.baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public StoredFileInfo put(StoredFileInfo descriptor, byte[] ciphertext) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        Objects.requireNonNull(ciphertext, "ciphertext must not be null");
        StoredFileInfo stored = descriptor.withContent(
                ciphertext.length, CryptoPrimitives.sha256Hex(ciphertext), clock.instant());
        try {
            Files.createDirectories(baseDirectory);
            Files.write(dataPath(descriptor.fileId()), ciphertext,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            MAPPER.writerWithDefaultPrettyPrinter().writeValue(descriptorPath(descriptor.fileId()).toFile(), stored);
        } catch (IOException e) {
            ErrorLogger.logError("LocalFileCiphertextStore.put", "Failed to store ciphertext for " + descriptor.fileId(), e);
            throw new StorageException("Failed to store ciphertext for " + descriptor.fileId(), e);
        }
        ErrorLogger.logInfo("LocalFileCiphertextStore.put",
                String.format("Stored %d bytes for file %s", ciphertext.length, descriptor.fileId()));
        return stored;
    }

    @Override
    public byte[] get(String fileId) {
        StoredFileInfo info = info(fileId)
                .orElseThrow(() -> new NotFoundException("Encrypted file not found: " + fileId));
        byte[] ciphertext = readData(fileId);
        String actual = CryptoPrimitives.sha256Hex(ciphertext);
        if (!actual.equals(info.checksum())) {
            ErrorLogger.logWarning("LocalFileCiphertextStore.get", "Checksum mismatch for file " + fileId);
            throw new ChecksumMismatchException(fileId, info.checksum(), actual);
        }
        return ciphertext;
    }

    @Override
    public Optional<StoredFileInfo> info(String fileId) {
        Path descriptor = descriptorPath(fileId);
        if (!Files.exists(descriptor)) {
            return Optional.empty();
        }
        try {
            return Optional.of(MAPPER.readValue(descriptor.toFile(), StoredFileInfo.class));
        } catch (IOException e) {
            throw new StorageException("Failed to read descriptor for " + fileId, e);
        }
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
        return Files.exists(dataPath(fileId));
    }

    @Override
    public boolean delete(String fileId) {
        try {
            boolean data = Files.deleteIfExists(dataPath(fileId));
            boolean descriptor = Files.deleteIfExists(descriptorPath(fileId));
            return data || descriptor;
        } catch (IOException e) {
            throw new StorageException("Failed to delete stored file " + fileId, e);
        }
    }

    private byte[] readData(String fileId) {
        Path data = dataPath(fileId);
        if (!Files.exists(data)) {
            throw new NotFoundException("Encrypted file not found: " + fileId);
        }
        try {
            return Files.readAllBytes(data);
        } catch (IOException e) {
            throw new StorageException("Failed to read stored ciphertext for " + fileId, e);
        }
    }

    private Path dataPath(String fileId) {
        return baseDirectory.resolve(ByteEncoding.sanitize(fileId) + ".enc");
    }

    private Path descriptorPath(String fileId) {
        return baseDirectory.resolve(ByteEncoding.sanitize(fileId) + ".json");
    }
}
