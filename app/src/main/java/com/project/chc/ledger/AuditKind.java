package com.project.chc.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of one access attempt.
 */
public enum AuditKind {
    GRANTED("granted"),
    DENIED("denied"),
    FAILED("failed");

    private final String id;

    AuditKind(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static AuditKind fromId(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Audit kind must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AuditKind kind : values()) {
            if (kind.id.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown audit kind: " + value);
    }
}
