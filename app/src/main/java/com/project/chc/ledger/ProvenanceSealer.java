package com.project.chc.ledger;

import com.project.chc.crypto.CryptoPrimitives;

import java.security.MessageDigest;

/**
 * Keyed seal over the registration fields of a record.
 *
 * <p>The seal is computed once when the record is appended and is never touched by structural
 * repair, so an edit to owner, authorization snapshot or metadata stays detectable even after
 * the chain hashes have been recomputed.</p>
 */
public class ProvenanceSealer {
    private final byte[] key;

    public ProvenanceSealer(byte[] key) {
        if (key == null || key.length < 32) {
            throw new IllegalArgumentException("provenance key must be at least 32 bytes");
        }
        this.key = key.clone();
    }

    public String seal(LedgerRecord record) {
        byte[] body = CanonicalJson.encode(CanonicalJson.registrationBody(record));
        return CryptoPrimitives.toHex(CryptoPrimitives.hmacSha256(key, body));
    }

    public boolean verify(LedgerRecord record) {
        if (record.provenanceSeal() == null) {
            return false;
        }
        byte[] expected = CryptoPrimitives.utf8(seal(record));
        byte[] actual = CryptoPrimitives.utf8(record.provenanceSeal());
        return MessageDigest.isEqual(expected, actual);
    }
}
