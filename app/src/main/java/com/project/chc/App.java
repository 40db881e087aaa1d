package com.project.chc;

import com.project.chc.config.UserKeyMode;
import com.project.chc.config.VaultConfig;
import com.project.chc.core.AccessDeniedException;
import com.project.chc.core.SealedFile;
import com.project.chc.core.SecurityReport;
import com.project.chc.core.UploadReceipt;
import com.project.chc.core.VaultService;
import com.project.chc.crypto.CryptoPrimitives;
import com.project.chc.crypto.ErrorLogger;
import com.project.chc.io.SecretStore;
import com.project.chc.io.InMemorySecretStore;
import com.project.chc.ledger.AuditEntry;
import com.project.chc.ledger.Ledger;
import com.project.chc.ledger.LedgerRecord;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * End-to-end demonstration against a throwaway data directory.
 *
 * Registers a file for alice shared with bob, seals it, lets bob open it, has carol try and fail,
 * then shows the chain still verifies and prints the audit trail. A second pass goes through the
 * upload/download path with persisted stores.
 */
public class App {
    public static void main(String[] args) {
        try {
            Path dataDir = Files.createTempDirectory("chc-vault-demo");
            VaultConfig config = new VaultConfig(dataDir, dataDir.resolve("ledger.json"),
                    Optional.of("demo-passphrase"), UserKeyMode.HKDF_SHA256, true,
                    VaultConfig.DEFAULT_MAX_FILE_BYTES);
            System.out.println("Using data directory: " + dataDir.toAbsolutePath());
            System.out.println("User key mode: " + config.userKeyMode().id() + " (" + config.userKeyMode().description() + ")");

            VaultService vault = VaultService.open(config);

            // Explicit register -> seal -> open flow
            SecretStore ownerSecrets = new InMemorySecretStore();
            byte[] payload = new byte[100];
            for (int i = 0; i < payload.length; i++) {
                payload[i] = (byte) i;
            }

            Ledger.AppendResult registered = vault.register("f1", "alice", List.of("bob"), Map.of("size", payload.length));
            System.out.printf("Registered f1 at index %d, record hash %s...%n",
                    registered.index(), registered.recordHash().substring(0, 16));

            SealedFile sealed = vault.sealFile(payload, ownerSecrets.getOrCreateOwnerSecret("alice"),
                    registered.recordHash(), registered.timestamp(), "f1");
            System.out.printf("Sealed %d bytes, wrapped seeds for: %s%n",
                    sealed.ciphertext().length, sealed.wrappedSeeds().keySet());

            byte[] recovered = vault.openFile("f1", "bob", sealed.ciphertext());
            System.out.printf("Bob recovered payload matches: %s%n", Arrays.equals(payload, recovered) ? "YES" : "NO");

            String hashBefore = vault.ledger().getByFileId("f1").map(LedgerRecord::hash).orElseThrow();
            try {
                vault.openFile("f1", "carol", sealed.ciphertext());
                System.out.println("Carol opened f1 (unexpected)");
            } catch (AccessDeniedException e) {
                System.out.println("Carol denied: " + e.getMessage());
            }
            String hashAfter = vault.ledger().getByFileId("f1").map(LedgerRecord::hash).orElseThrow();
            System.out.printf("Record hash changed after audit append: %s%n", hashBefore.equals(hashAfter) ? "NO" : "YES");
            System.out.printf("Ledger verifies: %s%n", vault.verifyLedger() ? "YES" : "NO");

            System.out.println("Audit trail for f1:");
            for (AuditEntry entry : vault.getAuditTrail("f1")) {
                System.out.printf("  %-8s %-6s %s%n", entry.kind().id(), entry.principal(),
                        entry.reason() != null ? entry.reason() : "");
            }

            // Upload/download with stored ciphertext
            byte[] document = "Quarterly figures, internal only.".getBytes(StandardCharsets.UTF_8);
            UploadReceipt receipt = vault.upload(document, "report.txt", "alice", List.of("bob", "dave"));
            System.out.printf("Uploaded report.txt as %s (authorized: %s)%n", receipt.fileId(), receipt.authorizedUsers());

            byte[] downloaded = vault.download(receipt.fileId(), "dave");
            System.out.printf("Dave download checksum: %s%n", CryptoPrimitives.sha256Hex(downloaded));
            System.out.printf("Dave download matches: %s%n", Arrays.equals(document, downloaded) ? "YES" : "NO");

            SecurityReport report = vault.securityReport(receipt.fileId());
            System.out.printf("Security report: chain=%s provenance=%s ciphertext=%s access=%s%n",
                    report.chainValid(), report.provenanceValid(), report.ciphertextIntact(),
                    report.accessControlStatus());
            System.out.printf("Ledger records: %d%n", vault.ledger().records().size());
            ErrorLogger.close();
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }
}
