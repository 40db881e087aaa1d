package com.project.chc.crypto;

import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Centralized logging for ledger, cipher and access-control operations.
 * Writes to the console and appends to a log file ({@code CHC_LOG_FILE}, default {@code chc-vault.log}).
 * Never pass seeds, owner secrets or wrapped seeds to these methods.
 */
public final class ErrorLogger {
    private static final String DEFAULT_LOG_FILE = "chc-vault.log";
    private static final ReentrantLock lock = new ReentrantLock();
    private static PrintWriter logWriter;

    static {
        String configured = System.getenv("CHC_LOG_FILE");
        String logFile = configured == null || configured.isBlank() ? DEFAULT_LOG_FILE : configured;
        try {
            logWriter = new PrintWriter(new FileWriter(logFile, true));
        } catch (IOException e) {
            System.err.println("Failed to initialize vault log file " + logFile + ": " + e.getMessage());
        }
    }

    private ErrorLogger() {
    }

    public static void logError(String operation, String message, Throwable error) {
        lock.lock();
        try {
            String entry = format("ERROR", operation, message);
            System.err.println(entry);
            if (error != null) {
                System.err.println("  Exception: " + error.getClass().getName());
                System.err.println("  Message: " + error.getMessage());
            }
            if (logWriter != null) {
                logWriter.println(entry);
                if (error != null) {
                    logWriter.println("  Exception: " + error.getClass().getName());
                    logWriter.println("  Message: " + error.getMessage());
                    error.printStackTrace(logWriter);
                }
                logWriter.flush();
            }
        } finally {
            lock.unlock();
        }
    }

    public static void logWarning(String operation, String message) {
        write(System.err, format("WARN", operation, message));
    }

    public static void logInfo(String operation, String message) {
        write(System.out, format("INFO", operation, message));
    }

    public static void close() {
        lock.lock();
        try {
            if (logWriter != null) {
                logWriter.close();
                logWriter = null;
            }
        } finally {
            lock.unlock();
        }
    }

    private static void write(java.io.PrintStream console, String entry) {
        lock.lock();
        try {
            console.println(entry);
            if (logWriter != null) {
                logWriter.println(entry);
                logWriter.flush();
            }
        } finally {
            lock.unlock();
        }
    }

    private static String format(String level, String operation, String message) {
        return String.format("[%s] %s in %s: %s", Instant.now(), level, operation, message);
    }
}
