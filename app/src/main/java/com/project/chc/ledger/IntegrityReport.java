package com.project.chc.ledger;

/**
 * Result of walking the ledger.
 *
 * @param valid             whether every check passed
 * @param firstInvalidIndex index of the first failing record, or -1
 * @param message           what failed, or a summary when valid
 * @param recordCount       number of records inspected
 */
public record IntegrityReport(
        boolean valid,
        long firstInvalidIndex,
        String message,
        int recordCount
) {
    public static IntegrityReport ok(int recordCount) {
        return new IntegrityReport(true, -1, "Chain of " + recordCount + " records verified", recordCount);
    }

    public static IntegrityReport failed(long index, String message, int recordCount) {
        return new IntegrityReport(false, index, message, recordCount);
    }
}
