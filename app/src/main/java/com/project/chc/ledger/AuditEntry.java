package com.project.chc.ledger;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One access attempt recorded against a ledger record.
 *
 * @param kind      granted, denied or failed
 * @param principal who attempted the access
 * @param timestamp seconds since the epoch
 * @param reason    why access was denied, if it was
 * @param error     what went wrong, for failed attempts
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"kind", "principal", "timestamp", "reason", "error"})
public record AuditEntry(
        AuditKind kind,
        String principal,
        double timestamp,
        String reason,
        String error
) {
    public AuditEntry {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(principal, "principal must not be null");
    }

    public static AuditEntry granted(String principal, double timestamp) {
        return new AuditEntry(AuditKind.GRANTED, principal, timestamp, null, null);
    }

    public static AuditEntry denied(String principal, double timestamp, String reason) {
        return new AuditEntry(AuditKind.DENIED, principal, timestamp, reason, null);
    }

    public static AuditEntry failed(String principal, double timestamp, String error) {
        return new AuditEntry(AuditKind.FAILED, principal, timestamp, null, error);
    }
}
