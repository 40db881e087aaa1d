package com.project.chc.ledger;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One hash-linked ledger entry describing a registered file and its access history.
 *
 * <p>Only {@code auditEntries} grows after creation. Any change to it, or to
 * {@code previousHash}, requires {@code hash} to be recomputed.</p>
 *
 * @param index           position in the ledger, 0 for genesis
 * @param timestamp       registration time in seconds since the epoch
 * @param fileId          file identifier, unique by registration precondition
 * @param owner           owning principal
 * @param authorizedUsers authorization snapshot taken at registration
 * @param previousHash    hash of the preceding record, {@code "0"} for genesis
 * @param metadata        opaque plaintext facts (size, content hash, name), may be null
 * @param auditEntries    access attempts, append-only
 * @param provenanceSeal  keyed seal over the registration fields, never recomputed
 * @param hash            SHA-256 of the canonical encoding of every other field
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"index", "timestamp", "fileId", "owner", "authorizedUsers", "previousHash",
        "metadata", "auditEntries", "provenanceSeal", "hash"})
public record LedgerRecord(
        long index,
        double timestamp,
        String fileId,
        String owner,
        List<String> authorizedUsers,
        String previousHash,
        Map<String, Object> metadata,
        List<AuditEntry> auditEntries,
        String provenanceSeal,
        String hash
) {
    public static final String GENESIS_PREVIOUS_HASH = "0";
    public static final String GENESIS_FILE_ID = "genesis";
    public static final String GENESIS_OWNER = "system";

    public LedgerRecord {
        Objects.requireNonNull(fileId, "fileId must not be null");
        Objects.requireNonNull(owner, "owner must not be null");
        Objects.requireNonNull(previousHash, "previousHash must not be null");
        authorizedUsers = authorizedUsers == null ? List.of() : List.copyOf(authorizedUsers);
        metadata = metadata == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        auditEntries = auditEntries == null ? List.of() : List.copyOf(auditEntries);
    }

    public static LedgerRecord genesis(double timestamp) {
        return new LedgerRecord(0, timestamp, GENESIS_FILE_ID, GENESIS_OWNER, List.of(),
                GENESIS_PREVIOUS_HASH, Map.of("data", "Genesis Block - CHC Secure Cloud Storage"),
                List.of(), null, null);
    }

    @JsonIgnore
    public boolean isGenesis() {
        return index == 0;
    }

    public LedgerRecord withAuditEntry(AuditEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        List<AuditEntry> grown = new ArrayList<>(auditEntries);
        grown.add(entry);
        return new LedgerRecord(index, timestamp, fileId, owner, authorizedUsers, previousHash,
                metadata, grown, provenanceSeal, hash);
    }

    public LedgerRecord withPreviousHash(String newPreviousHash) {
        return new LedgerRecord(index, timestamp, fileId, owner, authorizedUsers, newPreviousHash,
                metadata, auditEntries, provenanceSeal, hash);
    }

    public LedgerRecord withProvenanceSeal(String seal) {
        return new LedgerRecord(index, timestamp, fileId, owner, authorizedUsers, previousHash,
                metadata, auditEntries, seal, hash);
    }

    public LedgerRecord withHash(String newHash) {
        return new LedgerRecord(index, timestamp, fileId, owner, authorizedUsers, previousHash,
                metadata, auditEntries, provenanceSeal, newHash);
    }

    /**
     * Copy with the hash recomputed over the current field values.
     */
    public LedgerRecord rehashed() {
        return withHash(CanonicalJson.hash(this));
    }
}
