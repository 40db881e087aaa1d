package com.project.chc.core;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Input validation for principals, file ids and upload sizes.
 *
 * <p>Principals may not contain {@code ':'}, because the legacy user key derivation joins
 * principal and file id with a colon and would otherwise be ambiguous.</p>
 */
public final class InputValidator {

    private static final int PRINCIPAL_MAX_LENGTH = 256;
    private static final int FILE_ID_MAX_LENGTH = 128;

    private static final Pattern PRINCIPAL_PATTERN = Pattern.compile(
        "^[a-zA-Z0-9][a-zA-Z0-9@._\\-]{0," + (PRINCIPAL_MAX_LENGTH - 1) + "}$"
    );

    private static final Pattern FILE_ID_PATTERN = Pattern.compile(
        "^[a-zA-Z0-9][a-zA-Z0-9._\\-]{0," + (FILE_ID_MAX_LENGTH - 1) + "}$"
    );

    private static final Pattern DANGEROUS_CHARS = Pattern.compile("[<>\"'`;\\\\|&$/:]");

    private InputValidator() {}

    /**
     * Validate a principal (owner or user) name.
     *
     * @throws InvalidInputException if validation fails
     */
    public static void validatePrincipal(String principal) {
        if (principal == null) {
            throw new InvalidInputException("Principal must not be null");
        }
        if (principal.isBlank()) {
            throw new InvalidInputException("Principal must not be empty");
        }
        if (principal.length() > PRINCIPAL_MAX_LENGTH) {
            throw new InvalidInputException(
                String.format("Principal must be at most %d characters: length %d exceeds maximum",
                    PRINCIPAL_MAX_LENGTH, principal.length())
            );
        }
        if (DANGEROUS_CHARS.matcher(principal).find()) {
            throw new InvalidInputException(
                String.format("Principal contains forbidden characters: '%s'. " +
                    "Allowed characters: alphanumeric, @, ., _, -", principal)
            );
        }
        if (!PRINCIPAL_PATTERN.matcher(principal).matches()) {
            throw new InvalidInputException(
                String.format("Principal has invalid format: '%s'. Must start with an alphanumeric character", principal)
            );
        }
    }

    public static boolean isValidPrincipal(String principal) {
        try {
            validatePrincipal(principal);
            return true;
        } catch (InvalidInputException e) {
            return false;
        }
    }

    public static void validateFileId(String fileId) {
        if (fileId == null || fileId.isBlank()) {
            throw new InvalidInputException("File id must not be empty");
        }
        if (!FILE_ID_PATTERN.matcher(fileId).matches()) {
            throw new InvalidInputException(
                String.format("File id has invalid format: '%s'. Allowed characters: alphanumeric, ., _, -", fileId)
            );
        }
    }

    /**
     * Trim, drop blanks and duplicates, and validate each remaining principal. Order is preserved.
     */
    public static List<String> normalizePrincipals(List<String> principals) {
        if (principals == null) {
            return List.of();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String principal : principals) {
            if (principal == null || principal.isBlank()) {
                continue;
            }
            String trimmed = principal.trim();
            validatePrincipal(trimmed);
            unique.add(trimmed);
        }
        return List.copyOf(unique);
    }

    /**
     * Split a comma-separated principal list, as typed on a command line.
     */
    public static List<String> parsePrincipalList(String commaSeparated) {
        if (commaSeparated == null || commaSeparated.isBlank()) {
            return List.of();
        }
        return normalizePrincipals(List.of(commaSeparated.split(",")));
    }

    public static void validateSize(long size, long max, String fieldName) {
        if (size < 0 || size > max) {
            throw new InvalidInputException(
                String.format("%s must be in range [0, %d]: got %d", fieldName, max, size)
            );
        }
    }

    /**
     * Exception thrown when input validation fails.
     */
    public static class InvalidInputException extends IllegalArgumentException {
        public InvalidInputException(String message) {
            super(message);
        }
    }
}
