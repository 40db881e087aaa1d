package com.project.chc.ledger;

import com.project.chc.core.StorageException;

import java.util.List;

/**
 * Record store held in process memory. Revisions are a monotonically increasing counter.
 */
public class InMemoryRecordStore implements RecordStore {
    private List<LedgerRecord> records = List.of();
    private long revision;

    @Override
    public synchronized Snapshot read() {
        return new Snapshot(records, Long.toString(revision));
    }

    @Override
    public synchronized String compareAndReplace(String expectedRevision, List<LedgerRecord> replacement) {
        if (!Long.toString(revision).equals(expectedRevision)) {
            throw new StorageException(String.format(
                    "Record store moved from revision %s to %d", expectedRevision, revision));
        }
        records = List.copyOf(replacement);
        revision++;
        return Long.toString(revision);
    }
}
