package com.project.chc.ledger;

import com.project.chc.core.NotFoundException;
import com.project.chc.crypto.ErrorLogger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only sequence of hash-linked records.
 *
 * <p>Every mutation reads the whole sequence, changes it in memory and writes it back through a
 * compare-and-replace on the {@link RecordStore}. The cycle runs under this ledger's lock, so callers
 * sharing one instance never lose updates, and a second process writing the same store is rejected
 * rather than overwritten.</p>
 *
 * <p>Appending an audit entry changes that record's hash, which in turn changes the
 * {@code previousHash} of the next record, so hashes are recomputed forward to the tail.</p>
 */
public class Ledger {

    private final RecordStore store;
    private final ProvenanceSealer sealer;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    public Ledger(RecordStore store, ProvenanceSealer sealer) {
        this(store, sealer, Clock.systemUTC());
    }

    public Ledger(RecordStore store, ProvenanceSealer sealer, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.sealer = Objects.requireNonNull(sealer, "sealer must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Registration receipt.
     *
     * @param recordHash hash of the new record at append time
     * @param timestamp  registration time, seconds since the epoch
     * @param index      ledger index assigned to the record
     */
    public record AppendResult(String recordHash, double timestamp, long index) {
    }

    /**
     * Current time in seconds since the epoch, at microsecond precision.
     */
    public double now() {
        Instant instant = clock.instant();
        long micros = instant.getEpochSecond() * 1_000_000L + instant.getNano() / 1_000L;
        return micros / 1_000_000.0;
    }

    /**
     * Write the genesis record if the ledger is empty.
     *
     * @return true if a genesis record was created
     */
    public boolean initialize() {
        lock.lock();
        try {
            RecordStore.Snapshot snapshot = store.read();
            if (!snapshot.records().isEmpty()) {
                return false;
            }
            List<LedgerRecord> chain = new ArrayList<>();
            chain.add(newGenesis());
            store.compareAndReplace(snapshot.revision(), chain);
            ErrorLogger.logInfo("Ledger.initialize", "Genesis record created");
            return true;
        } finally {
            lock.unlock();
        }
    }

    public AppendResult append(String fileId, String owner, List<String> authorizedUsers, Map<String, Object> metadata) {
        Objects.requireNonNull(fileId, "fileId must not be null");
        Objects.requireNonNull(owner, "owner must not be null");
        lock.lock();
        try {
            RecordStore.Snapshot snapshot = store.read();
            List<LedgerRecord> chain = new ArrayList<>(snapshot.records());
            if (chain.isEmpty()) {
                chain.add(newGenesis());
            }
            LedgerRecord tail = chain.get(chain.size() - 1);

            LedgerRecord record = new LedgerRecord(chain.size(), now(), fileId, owner, authorizedUsers,
                    tail.hash(), CanonicalJson.storedForm(metadata), List.of(), null, null);
            record = record.withProvenanceSeal(sealer.seal(record)).rehashed();
            chain.add(record);

            store.compareAndReplace(snapshot.revision(), chain);
            ErrorLogger.logInfo("Ledger.append", String.format("Record #%d added for file %s (hash %s...)",
                    record.index(), fileId, record.hash().substring(0, 16)));
            return new AppendResult(record.hash(), record.timestamp(), record.index());
        } finally {
            lock.unlock();
        }
    }

    /**
     * First record whose file id matches, in ledger order.
     */
    public Optional<LedgerRecord> getByFileId(String fileId) {
        List<LedgerRecord> chain = store.read().records();
        return indexOf(chain, fileId).map(chain::get);
    }

    /**
     * Append an audit entry to the record for {@code fileId} and re-link every later record.
     *
     * @throws NotFoundException if no record has that file id
     */
    public boolean appendAuditEntry(String fileId, AuditEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        lock.lock();
        try {
            RecordStore.Snapshot snapshot = store.read();
            List<LedgerRecord> chain = new ArrayList<>(snapshot.records());
            int position = indexOf(chain, fileId)
                    .orElseThrow(() -> new NotFoundException("File " + fileId + " not found in ledger"));

            chain.set(position, chain.get(position).withAuditEntry(entry).rehashed());
            relinkFrom(chain, position + 1);

            store.compareAndReplace(snapshot.revision(), chain);
            ErrorLogger.logInfo("Ledger.appendAuditEntry", String.format("%s entry for %s logged on file %s",
                    entry.kind().id(), entry.principal(), fileId));
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean verifyIntegrity() {
        return inspectIntegrity().valid();
    }

    /**
     * Walk the chain and report the first violation: genesis sentinel, hash recomputation,
     * then the link to the predecessor for every later record.
     */
    public IntegrityReport inspectIntegrity() {
        List<LedgerRecord> chain = store.read().records();
        if (chain.isEmpty()) {
            return IntegrityReport.failed(-1, "Ledger is empty", 0);
        }

        LedgerRecord genesis = chain.get(0);
        if (genesis.index() != 0 || !LedgerRecord.GENESIS_PREVIOUS_HASH.equals(genesis.previousHash())) {
            return IntegrityReport.failed(0, "Invalid genesis record", chain.size());
        }
        if (!CanonicalJson.hash(genesis).equals(genesis.hash())) {
            return IntegrityReport.failed(0, "Invalid hash at record 0", chain.size());
        }

        for (int i = 1; i < chain.size(); i++) {
            LedgerRecord current = chain.get(i);
            if (!CanonicalJson.hash(current).equals(current.hash())) {
                return IntegrityReport.failed(i, "Invalid hash at record " + i, chain.size());
            }
            if (!current.previousHash().equals(chain.get(i - 1).hash())) {
                return IntegrityReport.failed(i, "Broken link at record " + i, chain.size());
            }
        }
        return IntegrityReport.ok(chain.size());
    }

    /**
     * Check every record's provenance seal against its registration fields. Structural repair
     * never rewrites seals, so a failure here means registration data changed after the fact.
     */
    public IntegrityReport verifyProvenance() {
        List<LedgerRecord> chain = store.read().records();
        for (int i = 0; i < chain.size(); i++) {
            if (!sealer.verify(chain.get(i))) {
                return IntegrityReport.failed(i,
                        "Provenance seal mismatch at record " + i, chain.size());
            }
        }
        return IntegrityReport.ok(chain.size());
    }

    /**
     * Recompute every hash and link so the chain is consistent with its current content.
     *
     * <p>This is a representation repair, not tamper detection: whatever the records now contain,
     * including edits nobody authorized, becomes the certified content. Run
     * {@link #verifyProvenance()} afterwards to find edits to registration data. The genesis
     * sentinel is not rewritten, so a damaged genesis record stays invalid.</p>
     *
     * @return whether the chain verifies after the repair
     */
    public boolean repairIntegrity() {
        lock.lock();
        try {
            RecordStore.Snapshot snapshot = store.read();
            if (snapshot.records().isEmpty()) {
                return false;
            }
            List<LedgerRecord> chain = new ArrayList<>(snapshot.records());
            chain.set(0, chain.get(0).rehashed());
            relinkFrom(chain, 1);

            if (!chain.equals(snapshot.records())) {
                store.compareAndReplace(snapshot.revision(), chain);
                ErrorLogger.logWarning("Ledger.repairIntegrity",
                        "Chain hashes recomputed over " + chain.size() + " records");
            }
            return verifyIntegrity();
        } finally {
            lock.unlock();
        }
    }

    public List<LedgerRecord> records() {
        return store.read().records();
    }

    /**
     * File records (genesis excluded) that {@code principal} owns or was authorized for.
     */
    public List<LedgerRecord> recordsAccessibleBy(String principal) {
        return store.read().records().stream()
                .filter(r -> !r.isGenesis())
                .filter(r -> r.owner().equals(principal) || r.authorizedUsers().contains(principal))
                .toList();
    }

    /**
     * Audit entries of the record for {@code fileId}, oldest first.
     *
     * @throws NotFoundException if no record has that file id
     */
    public List<AuditEntry> auditTrail(String fileId) {
        LedgerRecord record = getByFileId(fileId)
                .orElseThrow(() -> new NotFoundException("File " + fileId + " not found in ledger"));
        return record.auditEntries().stream()
                .sorted(Comparator.comparingDouble(AuditEntry::timestamp))
                .toList();
    }

    private LedgerRecord newGenesis() {
        LedgerRecord genesis = LedgerRecord.genesis(now());
        return genesis.withProvenanceSeal(sealer.seal(genesis)).rehashed();
    }

    private static void relinkFrom(List<LedgerRecord> chain, int start) {
        for (int i = Math.max(start, 1); i < chain.size(); i++) {
            String previous = chain.get(i - 1).hash();
            chain.set(i, chain.get(i).withPreviousHash(previous).rehashed());
        }
    }

    private static Optional<Integer> indexOf(List<LedgerRecord> chain, String fileId) {
        for (int i = 0; i < chain.size(); i++) {
            if (chain.get(i).fileId().equals(fileId)) {
                return Optional.of(i);
            }
        }
        return Optional.empty();
    }
}
