package com.project.chc.ledger;

import java.util.List;

/**
 * Persistence substrate for the ledger: read the whole ordered sequence, or replace it atomically.
 *
 * <p>Replacement is a compare-and-swap on an opaque revision, so a writer working from a stale
 * snapshot fails instead of silently overwriting a concurrent update.</p>
 */
public interface RecordStore {

    Snapshot read();

    /**
     * Replace all records if the store is still at {@code expectedRevision}.
     *
     * @return the new revision
     * @throws com.project.chc.core.StorageException if the revision moved or the store is unavailable
     */
    String compareAndReplace(String expectedRevision, List<LedgerRecord> records);

    record Snapshot(List<LedgerRecord> records, String revision) {
        public Snapshot {
            records = List.copyOf(records);
        }
    }
}
