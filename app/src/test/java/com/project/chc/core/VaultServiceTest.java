package com.project.chc.core;

import com.project.chc.config.UserKeyMode;
import com.project.chc.config.VaultConfig;
import com.project.chc.core.InputValidator.InvalidInputException;
import com.project.chc.crypto.SeedEngine;
import com.project.chc.crypto.SeedWrap;
import com.project.chc.crypto.UserKeyDerivation;
import com.project.chc.io.InMemoryCiphertextStore;
import com.project.chc.io.InMemorySecretStore;
import com.project.chc.io.LocalFileCiphertextStore;
import com.project.chc.ledger.AuditEntry;
import com.project.chc.ledger.AuditKind;
import com.project.chc.ledger.InMemoryRecordStore;
import com.project.chc.ledger.Ledger;
import com.project.chc.ledger.LedgerRecord;
import com.project.chc.ledger.ProvenanceSealer;
import com.project.chc.ledger.RecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Vault service")
class VaultServiceTest {

    private static final long MAX_BYTES = 4096;

    private InMemoryRecordStore records;
    private InMemorySecretStore secrets;
    private VaultService vault;

    @BeforeEach
    void setUp() {
        records = new InMemoryRecordStore();
        secrets = new InMemorySecretStore();
        vault = newVault(true, UserKeyDerivation.publicHash());
    }

    private VaultService newVault(boolean autoRepair, UserKeyDerivation userKeys) {
        Ledger ledger = new Ledger(records, new ProvenanceSealer(secrets.getOrCreateSystemKey(VaultService.PROVENANCE_KEY)));
        return new VaultService(ledger, new InMemoryCiphertextStore(), secrets, userKeys, autoRepair, MAX_BYTES);
    }

    private void overwrite(int position, LedgerRecord replacement) {
        RecordStore.Snapshot snapshot = records.read();
        List<LedgerRecord> chain = new ArrayList<>(snapshot.records());
        chain.set(position, replacement);
        records.compareAndReplace(snapshot.revision(), chain);
    }

    private static byte[] payload(int length) {
        byte[] bytes = new byte[length];
        for (int i = 0; i < length; i++) {
            bytes[i] = (byte) (i * 7 + 3);
        }
        return bytes;
    }

    private SealedFile registerAndSeal(String fileId, String owner, List<String> users, byte[] plaintext) {
        Ledger.AppendResult registered = vault.register(fileId, owner, users, Map.of("size", plaintext.length));
        return vault.sealFile(plaintext, secrets.getOrCreateOwnerSecret(owner),
                registered.recordHash(), registered.timestamp(), fileId);
    }

    @Test
    @DisplayName("Construction writes the genesis record")
    void genesisOnConstruction() {
        assertEquals(1, vault.ledger().records().size());
        assertTrue(vault.verifyLedger());
    }

    @Nested
    @DisplayName("End-to-end: alice shares f1 with bob")
    class EndToEnd {

        private byte[] plaintext;
        private SealedFile sealed;

        @BeforeEach
        void seal() {
            plaintext = payload(100);
            sealed = registerAndSeal("f1", "alice", List.of("bob"), plaintext);
        }

        @Test
        void sealProducesSameLengthCiphertextAndWrappedSeeds() {
            assertEquals(100, sealed.ciphertext().length);
            assertEquals(Set.of("bob", "alice"), sealed.wrappedSeeds().keySet());
        }

        @Test
        @DisplayName("Bob unwraps his seed and recovers the 100 bytes")
        void bobRecoversPayload() {
            byte[] bobSeed = SeedWrap.unwrap(sealed.wrappedSeeds().get("bob"), SeedWrap.generateUserKey("bob", "f1"));
            assertArrayEquals(plaintext, SeedEngine.decrypt(sealed.ciphertext(), bobSeed));
            assertArrayEquals(plaintext, vault.openFile("f1", "bob", sealed.ciphertext()));
        }

        @Test
        @DisplayName("Carol is denied, the entry is audited, the hash changes and the chain still verifies")
        void carolIsDenied() {
            String hashBefore = vault.ledger().getByFileId("f1").orElseThrow().hash();

            assertThrows(AccessDeniedException.class, () -> vault.openFile("f1", "carol", sealed.ciphertext()));

            LedgerRecord after = vault.ledger().getByFileId("f1").orElseThrow();
            assertNotEquals(hashBefore, after.hash());
            assertEquals(1, after.auditEntries().size());
            assertEquals(AuditKind.DENIED, after.auditEntries().get(0).kind());
            assertEquals("carol", after.auditEntries().get(0).principal());
            assertTrue(vault.verifyLedger());
        }

        @Test
        void auditTrailReflectsEveryAttempt() {
            vault.openFile("f1", "bob", sealed.ciphertext());
            assertThrows(AccessDeniedException.class, () -> vault.openFile("f1", "carol", sealed.ciphertext()));
            vault.openFile("f1", "alice", sealed.ciphertext());

            List<AuditEntry> trail = vault.getAuditTrail("f1");
            assertEquals(List.of(AuditKind.GRANTED, AuditKind.DENIED, AuditKind.GRANTED),
                    trail.stream().map(AuditEntry::kind).toList());
            assertEquals(List.of("bob", "carol", "alice"), trail.stream().map(AuditEntry::principal).toList());
        }

        @Test
        @DisplayName("Sealing the same file twice is refused")
        void resealRefused() {
            LedgerRecord record = vault.ledger().getByFileId("f1").orElseThrow();
            assertThrows(AlreadySealedException.class, () -> vault.sealFile(payload(10),
                    secrets.getOrCreateOwnerSecret("alice"), record.hash(), record.timestamp(), "f1"));
        }
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        void duplicateFileIdRejected() {
            vault.register("f1", "alice", List.of(), null);
            assertThrows(DuplicateFileIdException.class, () -> vault.register("f1", "mallory", List.of(), null));
            assertEquals(2, vault.ledger().records().size());
        }

        @Test
        void invalidInputRejected() {
            assertThrows(InvalidInputException.class, () -> vault.register("f1", "bad:owner", List.of(), null));
            assertThrows(InvalidInputException.class, () -> vault.register("../f1", "alice", List.of(), null));
            assertThrows(InvalidInputException.class, () -> vault.register("f1", "alice", List.of("x/y"), null));
        }

        @Test
        void authorizedUsersAreNormalized() {
            vault.register("f1", "alice", List.of(" bob", "bob", "carol"), null);
            assertEquals(List.of("bob", "carol"), vault.ledger().getByFileId("f1").orElseThrow().authorizedUsers());
        }

        @Test
        void sealingUnknownFileIsNotFound() {
            assertThrows(NotFoundException.class, () -> vault.sealFile(payload(4),
                    secrets.getOrCreateOwnerSecret("alice"), "00".repeat(32), 1.0, "missing"));
        }

        @Test
        void listAccessibleFiles() {
            vault.register("f1", "alice", List.of("bob"), null);
            vault.register("f2", "carol", List.of(), null);
            assertEquals(List.of("f1"), vault.listAccessibleFiles("bob").stream().map(LedgerRecord::fileId).toList());
        }
    }

    @Nested
    @DisplayName("Integrity gate")
    class IntegrityGate {

        private SealedFile sealed;

        @BeforeEach
        void seal() {
            sealed = registerAndSeal("f1", "alice", List.of("bob"), payload(40));
            registerAndSeal("f2", "alice", List.of(), payload(10));
        }

        @Test
        @DisplayName("A stale hash is repaired once and the read proceeds")
        void staleHashRepaired() {
            overwrite(2, vault.ledger().records().get(2).withHash("00".repeat(32)));
            assertFalse(vault.verifyLedger());

            assertArrayEquals(payload(40), vault.openFile("f1", "bob", sealed.ciphertext()));
            assertTrue(vault.verifyLedger());
        }

        @Test
        @DisplayName("Without auto-repair a broken chain refuses reads")
        void noAutoRepair() {
            VaultService strict = newVault(false, UserKeyDerivation.publicHash());
            overwrite(2, vault.ledger().records().get(2).withHash("00".repeat(32)));

            IntegrityException e = assertThrows(IntegrityException.class,
                    () -> strict.openFile("f1", "bob", sealed.ciphertext()));
            assertEquals(2, e.firstInvalidIndex());
        }

        @Test
        @DisplayName("A damaged genesis record cannot be repaired and surfaces IntegrityException")
        void unrepairableGenesis() {
            overwrite(0, vault.ledger().records().get(0).withPreviousHash("1").rehashed());

            IntegrityException e = assertThrows(IntegrityException.class,
                    () -> vault.openFile("f1", "bob", sealed.ciphertext()));
            assertEquals(0, e.firstInvalidIndex());
            assertThrows(IntegrityException.class, () -> vault.getAuditTrail("f1"));
        }

        @Test
        @DisplayName("An edited authorization snapshot is caught by provenance even after repair")
        void provenanceCatchesEditedSnapshot() {
            LedgerRecord target = vault.ledger().records().get(1);
            overwrite(1, new LedgerRecord(target.index(), target.timestamp(), target.fileId(), target.owner(),
                    List.of("bob", "mallory"), target.previousHash(), target.metadata(), target.auditEntries(),
                    target.provenanceSeal(), target.hash()));

            IntegrityException e = assertThrows(IntegrityException.class,
                    () -> vault.openFile("f1", "mallory", sealed.ciphertext()));
            assertEquals(1, e.firstInvalidIndex());
            assertTrue(vault.verifyLedger(), "structural repair ran");
            assertFalse(vault.securityReport("f1").provenanceValid());
        }

        @Test
        void repairLedgerReportsResult() {
            overwrite(2, vault.ledger().records().get(2).withHash("11".repeat(32)));
            assertFalse(vault.verifyLedger());
            assertTrue(vault.repairLedger());
            assertTrue(vault.verifyLedger());
        }
    }

    @Nested
    @DisplayName("Upload and download")
    class UploadDownload {

        @TempDir
        Path tempDir;

        private VaultService fileBacked;

        @BeforeEach
        void setUp() {
            Ledger ledger = new Ledger(records,
                    new ProvenanceSealer(secrets.getOrCreateSystemKey(VaultService.PROVENANCE_KEY)));
            fileBacked = new VaultService(ledger, new LocalFileCiphertextStore(tempDir), secrets,
                    UserKeyDerivation.keyed(secrets.getOrCreateSystemKey(VaultService.USER_KEY_DERIVATION_KEY)),
                    true, MAX_BYTES);
        }

        @Test
        void uploadThenDownload() {
            byte[] document = "Quarterly figures".getBytes(StandardCharsets.UTF_8);
            UploadReceipt receipt = fileBacked.upload(document, "report.txt", "alice", List.of("bob"));

            assertTrue(receipt.fileId().startsWith("file_"));
            assertEquals(1, receipt.ledgerIndex());
            assertEquals(document.length, receipt.size());
            assertArrayEquals(document, fileBacked.download(receipt.fileId(), "bob"));
            assertArrayEquals(document, fileBacked.download(receipt.fileId(), "alice"));
            assertThrows(AccessDeniedException.class, () -> fileBacked.download(receipt.fileId(), "carol"));

            LedgerRecord record = fileBacked.ledger().getByFileId(receipt.fileId()).orElseThrow();
            assertEquals("report.txt", record.metadata().get("originalFilename"));
            assertEquals(document.length, ((Number) record.metadata().get("size")).intValue());
        }

        @Test
        @DisplayName("Tampered ciphertext aborts before decryption and is audited as failed")
        void tamperedCiphertext() throws Exception {
            UploadReceipt receipt = fileBacked.upload(payload(64), "blob.bin", "alice", List.of("bob"));
            Files.write(tempDir.resolve(receipt.fileId() + ".enc"), new byte[64]);

            assertThrows(ChecksumMismatchException.class, () -> fileBacked.download(receipt.fileId(), "bob"));
            assertEquals(AuditKind.FAILED, fileBacked.getAuditTrail(receipt.fileId()).get(0).kind());
            assertFalse(fileBacked.securityReport(receipt.fileId()).ciphertextIntact());
        }

        @Test
        void oversizedUploadRejected() {
            assertThrows(InvalidInputException.class,
                    () -> fileBacked.upload(new byte[(int) MAX_BYTES + 1], "big.bin", "alice", List.of()));
            assertEquals(1, fileBacked.ledger().records().size());
        }

        @Test
        void securityReportCountsAttempts() {
            UploadReceipt receipt = fileBacked.upload(payload(8), "a.bin", "alice", List.of("bob"));
            fileBacked.download(receipt.fileId(), "bob");
            assertThrows(AccessDeniedException.class, () -> fileBacked.download(receipt.fileId(), "carol"));
            assertThrows(AccessDeniedException.class, () -> fileBacked.download(receipt.fileId(), "dave"));

            SecurityReport report = fileBacked.securityReport(receipt.fileId());
            assertEquals(2, report.unauthorizedAttempts());
            assertEquals(1, report.successfulAccesses());
            assertEquals(0, report.failedDecryptions());
            assertEquals("enforced", report.accessControlStatus());
            assertTrue(report.isSecure());
        }
    }

    @Nested
    @DisplayName("Opening from configuration")
    class FromConfig {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("A persisted vault can be reopened and still serves downloads")
        void reopenPersistedVault() {
            VaultConfig config = new VaultConfig(tempDir, tempDir.resolve("ledger.json"), Optional.of("pass"),
                    UserKeyMode.HKDF_SHA256, true, MAX_BYTES);
            byte[] document = payload(50);
            UploadReceipt receipt = VaultService.open(config).upload(document, "doc.bin", "alice", List.of("bob"));

            VaultService reopened = VaultService.open(config);
            assertTrue(reopened.verifyLedger());
            assertArrayEquals(document, reopened.download(receipt.fileId(), "bob"));
            assertTrue(Files.exists(config.secretsFile()));
            assertTrue(Files.exists(config.ciphertextDirectory().resolve(receipt.fileId() + ".enc")));
        }

        @Test
        @DisplayName("Without a vault secret nothing is written to disk")
        void inMemoryWithoutSecret() {
            VaultConfig config = VaultConfig.defaults(tempDir.resolve("data"));
            VaultService memory = VaultService.open(config);
            UploadReceipt receipt = memory.upload(payload(5), "x.bin", "alice", List.of());

            assertArrayEquals(payload(5), memory.download(receipt.fileId(), "alice"));
            assertFalse(Files.exists(config.ledgerFile()));
        }
    }
}
