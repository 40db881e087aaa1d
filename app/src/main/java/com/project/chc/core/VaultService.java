package com.project.chc.core;

import com.project.chc.config.VaultConfig;
import com.project.chc.crypto.CryptoPrimitives;
import com.project.chc.crypto.ErrorLogger;
import com.project.chc.crypto.SeedEngine;
import com.project.chc.crypto.UserKeyDerivation;
import com.project.chc.io.CiphertextStore;
import com.project.chc.io.EncryptedFileSecretStore;
import com.project.chc.io.InMemoryCiphertextStore;
import com.project.chc.io.InMemorySecretStore;
import com.project.chc.io.LocalFileCiphertextStore;
import com.project.chc.io.SecretStore;
import com.project.chc.io.StoredFileInfo;
import com.project.chc.ledger.AuditEntry;
import com.project.chc.ledger.AuditKind;
import com.project.chc.ledger.InMemoryRecordStore;
import com.project.chc.ledger.IntegrityReport;
import com.project.chc.ledger.JsonFileRecordStore;
import com.project.chc.ledger.Ledger;
import com.project.chc.ledger.LedgerRecord;
import com.project.chc.ledger.ProvenanceSealer;
import com.project.chc.ledger.RecordStore;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point of the vault: registration, sealing, opening, ledger verification and audit.
 *
 * <p>Reads go through an integrity gate. A chain that fails verification gets exactly one
 * structural repair (when enabled); if it still fails, or if any provenance seal no longer matches
 * its registration fields, the read is refused with {@link IntegrityException}.</p>
 */
public class VaultService {
    public static final String PROVENANCE_KEY = "ledger-provenance";
    public static final String USER_KEY_DERIVATION_KEY = "user-key-derivation";

    private final Ledger ledger;
    private final CiphertextStore ciphertexts;
    private final SecretStore secrets;
    private final AccessController accessController;
    private final boolean autoRepair;
    private final long maxFileBytes;
    private final Object registrationLock = new Object();

    public VaultService(Ledger ledger, CiphertextStore ciphertexts, SecretStore secrets,
                        UserKeyDerivation userKeys, boolean autoRepair, long maxFileBytes) {
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
        this.ciphertexts = Objects.requireNonNull(ciphertexts, "ciphertexts must not be null");
        this.secrets = Objects.requireNonNull(secrets, "secrets must not be null");
        this.accessController = new AccessController(ledger, secrets, userKeys);
        this.autoRepair = autoRepair;
        this.maxFileBytes = maxFileBytes;
        ledger.initialize();
    }

    /**
     * Build a vault from configuration. Without {@code CHC_VAULT_SECRET} every store is kept in
     * memory, since secrets that do not survive a restart would leave persisted ciphertexts unreadable.
     */
    public static VaultService open(VaultConfig config) {
        SecretStore secrets;
        RecordStore records;
        CiphertextStore ciphertexts;
        if (config.vaultSecret().isPresent()) {
            secrets = new EncryptedFileSecretStore(config.secretsFile(), config.vaultSecret().get().toCharArray());
            records = new JsonFileRecordStore(config.ledgerFile());
            ciphertexts = new LocalFileCiphertextStore(config.ciphertextDirectory());
        } else {
            ErrorLogger.logWarning("VaultService.open",
                    "CHC_VAULT_SECRET is not set: ledger, ciphertexts and secrets are kept in memory only");
            secrets = new InMemorySecretStore();
            records = new InMemoryRecordStore();
            ciphertexts = new InMemoryCiphertextStore();
        }
        Ledger ledger = new Ledger(records, new ProvenanceSealer(secrets.getOrCreateSystemKey(PROVENANCE_KEY)));
        UserKeyDerivation userKeys = config.userKeyMode()
                .derivation(() -> secrets.getOrCreateSystemKey(USER_KEY_DERIVATION_KEY));
        ErrorLogger.logInfo("VaultService.open", "User key mode: " + config.userKeyMode().id());
        return new VaultService(ledger, ciphertexts, secrets, userKeys, config.autoRepair(), config.maxFileBytes());
    }

    public Ledger ledger() {
        return ledger;
    }

    /**
     * Append a ledger record for a new file.
     *
     * @throws DuplicateFileIdException if the file id is already registered
     */
    public Ledger.AppendResult register(String fileId, String owner, List<String> authorizedUsers,
                                        Map<String, Object> metadata) {
        InputValidator.validateFileId(fileId);
        InputValidator.validatePrincipal(owner);
        List<String> users = InputValidator.normalizePrincipals(authorizedUsers);
        synchronized (registrationLock) {
            if (ledger.getByFileId(fileId).isPresent()) {
                throw new DuplicateFileIdException(fileId);
            }
            return ledger.append(fileId, owner, users, metadata);
        }
    }

    /**
     * Derive the file seed from its registration context, encrypt, and wrap the seed for the
     * owner and every authorized user. The seed itself is never stored.
     *
     * @throws NotFoundException if the file id is not registered
     * @throws AlreadySealedException if the file was sealed before
     */
    public SealedFile sealFile(byte[] plaintext, byte[] ownerSecret, String recordHash,
                               double timestamp, String fileId) {
        Objects.requireNonNull(plaintext, "plaintext must not be null");
        LedgerRecord record = ledger.getByFileId(fileId)
                .orElseThrow(() -> new NotFoundException("File " + fileId + " not found in ledger"));
        if (ciphertexts.contains(fileId) || secrets.findWrappedSeed(fileId, record.owner()).isPresent()) {
            throw new AlreadySealedException(fileId);
        }

        byte[] seed = SeedEngine.deriveSeed(ownerSecret, recordHash, timestamp, fileId);
        try {
            byte[] ciphertext = SeedEngine.encrypt(plaintext, seed);
            Map<String, byte[]> wrapped = accessController.grantSeed(record, seed);
            ErrorLogger.logInfo("VaultService.sealFile", String.format("Sealed %d bytes in %d blocks for file %s",
                    plaintext.length, SeedEngine.blockCount(plaintext.length), fileId));
            return new SealedFile(fileId, ciphertext, wrapped);
        } finally {
            Arrays.fill(seed, (byte) 0);
        }
    }

    /**
     * Decrypt caller-supplied ciphertext for {@code principal}.
     */
    public byte[] openFile(String fileId, String principal, byte[] ciphertext) {
        ensureLedgerIntegrity();
        return accessController.read(fileId, principal, ciphertext);
    }

    /**
     * Register, seal and store a plaintext in one step.
     */
    public UploadReceipt upload(byte[] plaintext, String originalName, String owner, List<String> authorizedUsers) {
        Objects.requireNonNull(plaintext, "plaintext must not be null");
        Objects.requireNonNull(originalName, "originalName must not be null");
        InputValidator.validatePrincipal(owner);
        InputValidator.validateSize(plaintext.length, maxFileBytes, "File size");

        String fileId = FileIds.generate(originalName, owner, ledger.now());
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("originalFilename", originalName);
        metadata.put("size", plaintext.length);
        metadata.put("fileHash", CryptoPrimitives.sha256Hex(plaintext));

        Ledger.AppendResult registered = register(fileId, owner, authorizedUsers, metadata);
        LedgerRecord record = ledger.getByFileId(fileId).orElseThrow();
        byte[] ownerSecret = secrets.getOrCreateOwnerSecret(owner);
        try {
            SealedFile sealed = sealFile(plaintext, ownerSecret, registered.recordHash(), registered.timestamp(), fileId);
            ciphertexts.put(StoredFileInfo.describe(fileId, originalName, owner, record.authorizedUsers(),
                    registered.recordHash()), sealed.ciphertext());
        } finally {
            Arrays.fill(ownerSecret, (byte) 0);
        }
        return new UploadReceipt(fileId, registered.recordHash(), registered.timestamp(),
                registered.index(), record.authorizedUsers(), plaintext.length);
    }

    /**
     * Decrypt a stored file for {@code principal}. The stored checksum is verified before decryption.
     */
    public byte[] download(String fileId, String principal) {
        ensureLedgerIntegrity();
        return accessController.read(fileId, principal, ciphertexts::get);
    }

    public boolean verifyLedger() {
        return ledger.verifyIntegrity();
    }

    public boolean repairLedger() {
        return ledger.repairIntegrity();
    }

    public List<AuditEntry> getAuditTrail(String fileId) {
        ensureLedgerIntegrity();
        return ledger.auditTrail(fileId);
    }

    public List<LedgerRecord> listAccessibleFiles(String principal) {
        return ledger.recordsAccessibleBy(principal);
    }

    /**
     * Summarize chain, provenance and ciphertext state for one file. Unlike reads, this does not
     * throw on integrity failures; it reports them.
     */
    public SecurityReport securityReport(String fileId) {
        boolean chainValid = ledger.verifyIntegrity();
        if (!chainValid && autoRepair) {
            ErrorLogger.logWarning("VaultService.securityReport", "Chain integrity invalid, attempting repair");
            chainValid = ledger.repairIntegrity();
        }
        boolean provenanceValid = ledger.verifyProvenance().valid();
        LedgerRecord record = ledger.getByFileId(fileId)
                .orElseThrow(() -> new NotFoundException("File " + fileId + " not found in ledger"));

        List<AuditEntry> entries = record.auditEntries();
        return new SecurityReport(
                fileId,
                record.hash(),
                record.owner(),
                record.authorizedUsers(),
                chainValid,
                provenanceValid,
                count(entries, AuditKind.DENIED),
                count(entries, AuditKind.GRANTED),
                count(entries, AuditKind.FAILED),
                ciphertexts.verifyChecksum(fileId)
        );
    }

    /**
     * Verify the chain, repair once if allowed, then check provenance seals.
     *
     * @throws IntegrityException if the chain still fails or a seal does not match
     */
    public void ensureLedgerIntegrity() {
        IntegrityReport chain = ledger.inspectIntegrity();
        if (!chain.valid()) {
            ErrorLogger.logError("VaultService.ensureLedgerIntegrity", chain.message(), null);
            if (!autoRepair) {
                throw new IntegrityException(chain.message(), chain.firstInvalidIndex());
            }
            ErrorLogger.logWarning("VaultService.ensureLedgerIntegrity", "Attempting one structural repair");
            if (!ledger.repairIntegrity()) {
                IntegrityReport after = ledger.inspectIntegrity();
                throw new IntegrityException("Ledger still invalid after repair: " + after.message(),
                        after.firstInvalidIndex());
            }
        }
        IntegrityReport provenance = ledger.verifyProvenance();
        if (!provenance.valid()) {
            ErrorLogger.logError("VaultService.ensureLedgerIntegrity", provenance.message(), null);
            throw new IntegrityException(provenance.message(), provenance.firstInvalidIndex());
        }
    }

    private static long count(List<AuditEntry> entries, AuditKind kind) {
        return entries.stream().filter(e -> e.kind() == kind).count();
    }
}
