package com.project.chc.core;

import java.util.List;

/**
 * What the caller gets back from an upload.
 */
public record UploadReceipt(
        String fileId,
        String recordHash,
        double timestamp,
        long ledgerIndex,
        List<String> authorizedUsers,
        long size
) {
}
