package com.project.chc.core;

import com.project.chc.crypto.ErrorLogger;
import com.project.chc.crypto.SeedEngine;
import com.project.chc.crypto.SeedWrap;
import com.project.chc.crypto.UserKeyDerivation;
import com.project.chc.io.CiphertextSource;
import com.project.chc.io.SecretStore;
import com.project.chc.ledger.AuditEntry;
import com.project.chc.ledger.Ledger;
import com.project.chc.ledger.LedgerRecord;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Binds the authorization snapshot in the ledger to per-principal decryption capability.
 *
 * <p>Authorization is a pure function of the record as registered; nothing consulted here can
 * revoke access afterwards. Every attempt that reaches a record, whether granted, denied or failed,
 * is appended to that record's audit entries before the result is returned or the error thrown.</p>
 */
public class AccessController {
    static final String NOT_AUTHORIZED = "User not in authorized list";

    private final Ledger ledger;
    private final SecretStore secrets;
    private final UserKeyDerivation userKeys;

    public AccessController(Ledger ledger, SecretStore secrets, UserKeyDerivation userKeys) {
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
        this.secrets = Objects.requireNonNull(secrets, "secrets must not be null");
        this.userKeys = Objects.requireNonNull(userKeys, "userKeys must not be null");
    }

    public static boolean authorize(LedgerRecord record, String principal) {
        Objects.requireNonNull(record, "record must not be null");
        if (principal == null) {
            return false;
        }
        return principal.equals(record.owner()) || record.authorizedUsers().contains(principal);
    }

    /**
     * Principals that receive a wrapped seed: authorized users in registration order, then the owner.
     */
    public static List<String> principalsOf(LedgerRecord record) {
        Set<String> principals = new LinkedHashSet<>(record.authorizedUsers());
        principals.add(record.owner());
        return List.copyOf(principals);
    }

    /**
     * Wrap {@code seed} for every principal of the record and store the results.
     *
     * @return wrapped seeds keyed by principal
     */
    public Map<String, byte[]> grantSeed(LedgerRecord record, byte[] seed) {
        Map<String, byte[]> wrapped = new LinkedHashMap<>();
        for (String principal : principalsOf(record)) {
            byte[] userKey = userKeys.deriveUserKey(principal, record.fileId());
            byte[] sealed = SeedWrap.wrap(seed, userKey);
            secrets.putWrappedSeed(record.fileId(), principal, sealed);
            wrapped.put(principal, sealed);
        }
        return wrapped;
    }

    public byte[] read(String fileId, String principal, byte[] ciphertext) {
        Objects.requireNonNull(ciphertext, "ciphertext must not be null");
        return read(fileId, principal, id -> ciphertext);
    }

    /**
     * Authorize, unwrap and decrypt. The ciphertext source is consulted only after authorization,
     * so a checksum failure there is recorded as a failed attempt and aborts before decryption.
     *
     * @throws NotFoundException if the file is unknown or the principal has no wrapped seed
     * @throws AccessDeniedException if the principal is not in the authorization snapshot
     */
    public byte[] read(String fileId, String principal, CiphertextSource source) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(principal, "principal must not be null");
        LedgerRecord record = ledger.getByFileId(fileId)
                .orElseThrow(() -> new NotFoundException("File " + fileId + " not found in ledger"));

        if (!authorize(record, principal)) {
            ledger.appendAuditEntry(fileId, AuditEntry.denied(principal, ledger.now(), NOT_AUTHORIZED));
            ErrorLogger.logWarning("AccessController.read",
                    String.format("Unauthorized access attempt by %s on file %s", principal, fileId));
            throw new AccessDeniedException(fileId, principal, NOT_AUTHORIZED);
        }

        byte[] wrapped = secrets.findWrappedSeed(fileId, principal).orElse(null);
        if (wrapped == null) {
            String error = "No wrapped seed stored for " + principal;
            ledger.appendAuditEntry(fileId, AuditEntry.failed(principal, ledger.now(), error));
            throw new NotFoundException(error + " on file " + fileId);
        }

        byte[] plaintext;
        byte[] seed = null;
        try {
            byte[] ciphertext = source.load(fileId);
            seed = SeedWrap.unwrap(wrapped, userKeys.deriveUserKey(principal, fileId));
            plaintext = SeedEngine.decrypt(ciphertext, seed);
        } catch (RuntimeException e) {
            try {
                ledger.appendAuditEntry(fileId, AuditEntry.failed(principal, ledger.now(), describe(e)));
            } catch (RuntimeException auditFailure) {
                e.addSuppressed(auditFailure);
            }
            ErrorLogger.logError("AccessController.read",
                    String.format("Decryption failed for %s on file %s", principal, fileId), e);
            throw e;
        } finally {
            if (seed != null) {
                Arrays.fill(seed, (byte) 0);
            }
        }

        ledger.appendAuditEntry(fileId, AuditEntry.granted(principal, ledger.now()));
        ErrorLogger.logInfo("AccessController.read",
                String.format("Access granted to %s on file %s (%d bytes)", principal, fileId, plaintext.length));
        return plaintext;
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
