package com.project.chc;

import com.project.chc.config.VaultConfig;
import com.project.chc.core.InputValidator;
import com.project.chc.core.IntegrityException;
import com.project.chc.core.UploadReceipt;
import com.project.chc.core.VaultService;
import com.project.chc.crypto.ErrorLogger;
import com.project.chc.ledger.AuditEntry;
import com.project.chc.ledger.IntegrityReport;
import com.project.chc.ledger.LedgerRecord;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/**
 * Command line front end for a persisted vault.
 *
 * Configuration comes from the CHC_* environment variables. CHC_VAULT_SECRET must be set,
 * otherwise nothing would survive the process.
 *
 * Usage:
 *   java VaultCli upload &lt;owner&gt; &lt;path&gt; [user,user]
 *   java VaultCli download &lt;fileId&gt; &lt;principal&gt; &lt;outPath&gt;
 *   java VaultCli verify
 *   java VaultCli repair
 *   java VaultCli audit &lt;fileId&gt;
 *   java VaultCli files &lt;principal&gt;
 */
public class VaultCli {
    public static void main(String[] args) {
        int status = run(args);
        ErrorLogger.close();
        System.exit(status);
    }

    static int run(String[] args) {
        return run(args, System.getenv());
    }

    static int run(String[] args, Map<String, String> env) {
        if (args.length < 1) {
            printUsage();
            return 1;
        }
        try {
            VaultConfig config = VaultConfig.fromEnv(env);
            if (config.vaultSecret().isEmpty()) {
                System.err.println("CHC_VAULT_SECRET is not set; the CLI needs a persisted vault.");
                return 1;
            }
            VaultService vault = VaultService.open(config);
            String command = args[0];
            switch (command) {
                case "upload":
                    requireArgs(args, 3);
                    return upload(vault, args[1], Paths.get(args[2]),
                            args.length > 3 ? InputValidator.parsePrincipalList(args[3]) : List.of());
                case "download":
                    requireArgs(args, 4);
                    return download(vault, args[1], args[2], Paths.get(args[3]));
                case "verify":
                    return verify(vault);
                case "repair":
                    return repair(vault);
                case "audit":
                    requireArgs(args, 2);
                    return audit(vault, args[1]);
                case "files":
                    requireArgs(args, 2);
                    return files(vault, args[1]);
                default:
                    System.err.println("Unknown command: " + command);
                    printUsage();
                    return 1;
            }
        } catch (UsageException e) {
            printUsage();
            return 1;
        } catch (IntegrityException e) {
            System.err.println("Ledger integrity failure at record " + e.firstInvalidIndex() + ": " + e.getMessage());
            return 2;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static int upload(VaultService vault, String owner, Path source, List<String> users) throws Exception {
        byte[] plaintext = Files.readAllBytes(source);
        UploadReceipt receipt = vault.upload(plaintext, source.getFileName().toString(), owner, users);
        System.out.println("✓ Uploaded " + source.getFileName());
        System.out.println("  File id:      " + receipt.fileId());
        System.out.println("  Ledger index: " + receipt.ledgerIndex());
        System.out.println("  Record hash:  " + receipt.recordHash());
        System.out.println("  Authorized:   " + receipt.authorizedUsers());
        return 0;
    }

    private static int download(VaultService vault, String fileId, String principal, Path target) throws Exception {
        byte[] plaintext = vault.download(fileId, principal);
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(target, plaintext);
        System.out.printf("✓ Wrote %d bytes to %s%n", plaintext.length, target.toAbsolutePath());
        return 0;
    }

    private static int verify(VaultService vault) {
        IntegrityReport chain = vault.ledger().inspectIntegrity();
        IntegrityReport provenance = vault.ledger().verifyProvenance();
        System.out.printf("Chain:      %s%n", chain.valid() ? "VALID" : "INVALID - " + chain.message());
        System.out.printf("Provenance: %s%n", provenance.valid() ? "VALID" : "INVALID - " + provenance.message());
        System.out.printf("Records:    %d%n", chain.recordCount());
        return chain.valid() && provenance.valid() ? 0 : 2;
    }

    private static int repair(VaultService vault) {
        boolean repaired = vault.repairLedger();
        System.out.println(repaired ? "✓ Chain verifies after repair" : "✗ Chain still invalid after repair");
        if (!vault.ledger().verifyProvenance().valid()) {
            System.out.println("✗ Provenance seals do not match: registration data was edited");
            return 2;
        }
        return repaired ? 0 : 2;
    }

    private static int audit(VaultService vault, String fileId) {
        List<AuditEntry> entries = vault.getAuditTrail(fileId);
        System.out.println("Audit trail for " + fileId + " (" + entries.size() + " entries)");
        for (AuditEntry entry : entries) {
            String detail = entry.reason() != null ? entry.reason() : entry.error() != null ? entry.error() : "";
            System.out.printf("  %.6f  %-8s %-20s %s%n", entry.timestamp(), entry.kind().id(), entry.principal(), detail);
        }
        return 0;
    }

    private static int files(VaultService vault, String principal) {
        List<LedgerRecord> records = vault.listAccessibleFiles(principal);
        System.out.println("Files accessible by " + principal + ": " + records.size());
        for (LedgerRecord record : records) {
            Object name = record.metadata() == null ? null : record.metadata().get("originalFilename");
            System.out.printf("  %-20s owner=%-12s %s%n", record.fileId(), record.owner(), name != null ? name : "");
        }
        return 0;
    }

    private static void requireArgs(String[] args, int count) {
        if (args.length < count) {
            throw new UsageException();
        }
    }

    private static void printUsage() {
        System.err.println("Usage:");
        System.err.println("  java VaultCli upload <owner> <path> [user,user]");
        System.err.println("  java VaultCli download <fileId> <principal> <outPath>");
        System.err.println("  java VaultCli verify");
        System.err.println("  java VaultCli repair");
        System.err.println("  java VaultCli audit <fileId>");
        System.err.println("  java VaultCli files <principal>");
    }

    private static final class UsageException extends RuntimeException {
    }
}
