package com.project.chc.ledger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.project.chc.core.StorageException;
import com.project.chc.crypto.CryptoPrimitives;
import com.project.chc.crypto.ErrorLogger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;

/**
 * Ledger persisted as a pretty-printed JSON array of records.
 *
 * <p>The revision is the SHA-256 of the file bytes ({@code "absent"} before the first write).
 * Writes go to a temporary sibling file which is then moved over the ledger file.</p>
 */
public class JsonFileRecordStore implements RecordStore {
    static final String ABSENT = "absent";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<LedgerRecord>> RECORD_LIST = new TypeReference<>() { };

    private final Path ledgerFile;

    public JsonFileRecordStore(Path ledgerFile) {
        this.ledgerFile = Objects.requireNonNull(ledgerFile, "ledgerFile must not be null");
    }

    @Override
    public synchronized Snapshot read() {
        if (!Files.exists(ledgerFile)) {
            return new Snapshot(List.of(), ABSENT);
        }
        try {
            byte[] bytes = Files.readAllBytes(ledgerFile);
            List<LedgerRecord> records = MAPPER.readValue(bytes, RECORD_LIST);
            return new Snapshot(records, CryptoPrimitives.sha256Hex(bytes));
        } catch (IOException e) {
            ErrorLogger.logError("JsonFileRecordStore.read", "Failed to read ledger " + ledgerFile, e);
            throw new StorageException("Failed to read ledger " + ledgerFile, e);
        }
    }

    @Override
    public synchronized String compareAndReplace(String expectedRevision, List<LedgerRecord> records) {
        try {
            String current = currentRevision();
            if (!current.equals(expectedRevision)) {
                throw new StorageException(String.format(
                        "Ledger %s changed underneath the writer (expected revision %s, found %s)",
                        ledgerFile, expectedRevision, current));
            }
            byte[] bytes = MAPPER.writerWithDefaultPrettyPrinter().writeValueAsBytes(records);
            Path parent = ledgerFile.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, ledgerFile.getFileName().toString(), ".tmp");
            try {
                Files.write(temp, bytes);
                move(temp);
            } finally {
                Files.deleteIfExists(temp);
            }
            return CryptoPrimitives.sha256Hex(bytes);
        } catch (IOException e) {
            ErrorLogger.logError("JsonFileRecordStore.compareAndReplace", "Failed to write ledger " + ledgerFile, e);
            throw new StorageException("Failed to write ledger " + ledgerFile, e);
        }
    }

    private String currentRevision() throws IOException {
        if (!Files.exists(ledgerFile)) {
            return ABSENT;
        }
        return CryptoPrimitives.sha256Hex(Files.readAllBytes(ledgerFile));
    }

    private void move(Path temp) throws IOException {
        try {
            Files.move(temp, ledgerFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, ledgerFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
