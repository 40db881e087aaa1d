package com.project.chc.core;

import com.project.chc.crypto.SeedEngine;
import com.project.chc.crypto.SeedWrap;
import com.project.chc.crypto.UserKeyDerivation;
import com.project.chc.io.InMemorySecretStore;
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

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Access controller")
class AccessControllerTest {

    private FailingWritesStore store;
    private Ledger ledger;
    private InMemorySecretStore secrets;
    private AccessController controller;
    private LedgerRecord record;
    private byte[] seed;

    @BeforeEach
    void setUp() {
        store = new FailingWritesStore();
        ledger = new Ledger(store, new ProvenanceSealer(new byte[32]));
        secrets = new InMemorySecretStore();
        controller = new AccessController(ledger, secrets, UserKeyDerivation.publicHash());

        Ledger.AppendResult result = ledger.append("f1", "alice", List.of("bob"), null);
        record = ledger.getByFileId("f1").orElseThrow();
        seed = SeedEngine.deriveSeed(secrets.getOrCreateOwnerSecret("alice"), result.recordHash(), result.timestamp(), "f1");
    }

    @Nested
    @DisplayName("Authorization snapshot")
    class Authorization {

        @Test
        void ownerAndListedUsersOnly() {
            assertTrue(AccessController.authorize(record, "alice"));
            assertTrue(AccessController.authorize(record, "bob"));
            assertFalse(AccessController.authorize(record, "carol"));
            assertFalse(AccessController.authorize(record, null));
        }

        @Test
        @DisplayName("Later ledger activity does not change who is authorized")
        void snapshotIsStable() {
            ledger.appendAuditEntry("f1", AuditEntry.denied("carol", ledger.now(), "User not in authorized list"));
            ledger.append("f2", "carol", List.of("alice"), null);
            LedgerRecord later = ledger.getByFileId("f1").orElseThrow();

            assertEquals(List.of("bob"), later.authorizedUsers());
            assertFalse(AccessController.authorize(later, "carol"));
        }

        @Test
        void principalsAreUsersThenOwnerWithoutDuplicates() {
            LedgerRecord selfShared = new LedgerRecord(2, 1.0, "f2", "alice", List.of("bob", "alice"),
                    "00", null, List.of(), null, null);
            assertEquals(List.of("bob", "alice"), AccessController.principalsOf(selfShared));
            assertEquals(List.of("bob", "alice"), AccessController.principalsOf(record));
        }
    }

    @Nested
    @DisplayName("Read")
    class Read {

        private byte[] plaintext;
        private byte[] ciphertext;

        @BeforeEach
        void seal() {
            plaintext = "quarterly numbers".getBytes(StandardCharsets.UTF_8);
            ciphertext = SeedEngine.encrypt(plaintext, seed);
            controller.grantSeed(record, seed);
        }

        @Test
        @DisplayName("Wrapped seeds are stored for every principal")
        void grantStoresWrappedSeeds() {
            byte[] bobWrapped = secrets.findWrappedSeed("f1", "bob").orElseThrow();
            assertArrayEquals(seed, SeedWrap.unwrap(bobWrapped, SeedWrap.generateUserKey("bob", "f1")));
            assertTrue(secrets.findWrappedSeed("f1", "alice").isPresent());
            assertTrue(secrets.findWrappedSeed("f1", "carol").isEmpty());
        }

        @Test
        void authorizedReadIsGrantedAndAudited() {
            assertArrayEquals(plaintext, controller.read("f1", "bob", ciphertext));
            assertArrayEquals(plaintext, controller.read("f1", "alice", ciphertext));

            List<AuditEntry> trail = ledger.auditTrail("f1");
            assertEquals(2, trail.size());
            assertTrue(trail.stream().allMatch(e -> e.kind() == AuditKind.GRANTED));
            assertTrue(ledger.verifyIntegrity());
        }

        @Test
        void unauthorizedReadIsDeniedAndAudited() {
            AccessDeniedException e = assertThrows(AccessDeniedException.class,
                    () -> controller.read("f1", "carol", ciphertext));
            assertEquals("carol", e.principal());

            AuditEntry entry = ledger.auditTrail("f1").get(0);
            assertEquals(AuditKind.DENIED, entry.kind());
            assertEquals(AccessController.NOT_AUTHORIZED, entry.reason());
        }

        @Test
        @DisplayName("Unknown file is not found and leaves no audit entry")
        void unknownFile() {
            assertThrows(NotFoundException.class, () -> controller.read("nope", "bob", ciphertext));
            assertEquals(0, ledger.auditTrail("f1").size());
        }

        @Test
        @DisplayName("Authorized principal without a wrapped seed is recorded as failed")
        void missingWrappedSeed() {
            secrets.deleteWrappedSeeds("f1");
            assertThrows(NotFoundException.class, () -> controller.read("f1", "bob", ciphertext));
            assertEquals(AuditKind.FAILED, ledger.auditTrail("f1").get(0).kind());
        }

        @Test
        @DisplayName("A failing ciphertext source is recorded as failed and rethrown")
        void sourceFailure() {
            ChecksumMismatchException failure = new ChecksumMismatchException("f1", "aa", "bb");
            ChecksumMismatchException thrown = assertThrows(ChecksumMismatchException.class,
                    () -> controller.read("f1", "bob", id -> {
                        throw failure;
                    }));
            assertEquals(failure, thrown);

            AuditEntry entry = ledger.auditTrail("f1").get(0);
            assertEquals(AuditKind.FAILED, entry.kind());
            assertEquals(failure.getMessage(), entry.error());
        }

        @Test
        @DisplayName("A failed audit write does not replace the read failure")
        void auditWriteFailureIsSuppressed() {
            ChecksumMismatchException failure = new ChecksumMismatchException("f1", "aa", "bb");
            store.failWrites = true;

            ChecksumMismatchException thrown = assertThrows(ChecksumMismatchException.class,
                    () -> controller.read("f1", "bob", id -> {
                        throw failure;
                    }));
            assertEquals(failure, thrown);
            assertEquals(1, thrown.getSuppressed().length);
            assertTrue(thrown.getSuppressed()[0] instanceof StorageException);
        }

        @Test
        void auditEntriesKeepChainValid() {
            controller.read("f1", "bob", ciphertext);
            assertThrows(AccessDeniedException.class, () -> controller.read("f1", "carol", ciphertext));
            ledger.append("f2", "bob", List.of(), Map.of());
            controller.read("f1", "alice", ciphertext);

            assertTrue(ledger.verifyIntegrity());
            assertEquals(3, ledger.auditTrail("f1").size());
        }
    }

    private static final class FailingWritesStore implements RecordStore {
        private final InMemoryRecordStore delegate = new InMemoryRecordStore();
        boolean failWrites;

        @Override
        public Snapshot read() {
            return delegate.read();
        }

        @Override
        public String compareAndReplace(String expectedRevision, List<LedgerRecord> records) {
            if (failWrites) {
                throw new StorageException("ledger is read-only");
            }
            return delegate.compareAndReplace(expectedRevision, records);
        }
    }
}
