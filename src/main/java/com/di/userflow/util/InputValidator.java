package com.di.userflow.util;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.regex.Pattern;

/**
 * Validation of configuration values that end up in SQL text or drive timing.
 * Table names are the only values ever concatenated into SQL, so they are restricted
 * to plain identifiers.
 */
@Slf4j
public final class InputValidator {

    private InputValidator() {}

    // ============================================================================
    // SQL Identifier Validation Patterns
    // ============================================================================

    /**
     * Valid unquoted identifier:
     * - Starts with letter or underscore
     * - Followed by letters, digits or underscores
     * - Max length: 63 characters (PostgreSQL limit)
     */
    private static final Pattern VALID_IDENTIFIER_PATTERN = Pattern.compile(
            "^[a-zA-Z_][a-zA-Z0-9_]{0,62}$"
    );

    /**
     * Whole-word SQL keywords, comment markers, terminators and quotes.
     */
    private static final Pattern SQL_INJECTION_PATTERN = Pattern.compile(
            "(?i)(\\b(SELECT|INSERT|UPDATE|DELETE|DROP|CREATE|ALTER|TRUNCATE|EXEC|EXECUTE|UNION)\\b|--|/\\*|\\*/|;|'|\")"
    );

    private static final int MAX_IDENTIFIER_LENGTH = 63;

    // ============================================================================
    // SQL Identifier Validation
    // ============================================================================

    /**
     * Validates a SQL identifier (table name, schema name, column name).
     *
     * @param identifier     the identifier to validate
     * @param identifierType type of identifier for error messages (e.g. "table name")
     * @return the validated identifier (trimmed)
     * @throws IllegalArgumentException if validation fails
     */
    public static String validateIdentifier(String identifier, String identifierType) {
        if (identifier == null) {
            throw new IllegalArgumentException(String.format("%s cannot be null", identifierType));
        }

        String trimmed = identifier.trim();

        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(String.format("%s cannot be empty", identifierType));
        }

        if (trimmed.length() > MAX_IDENTIFIER_LENGTH) {
            throw new IllegalArgumentException(
                    String.format("%s exceeds maximum length of %d characters: %s",
                            identifierType, MAX_IDENTIFIER_LENGTH, trimmed));
        }

        if (SQL_INJECTION_PATTERN.matcher(trimmed).find()) {
            log.warn("Potential SQL injection attempt detected in {}: {}", identifierType, trimmed);
            throw new IllegalArgumentException(
                    String.format("Invalid %s: contains potentially dangerous SQL patterns. " +
                            "Only alphanumeric characters and underscores are allowed.",
                            identifierType));
        }

        if (!VALID_IDENTIFIER_PATTERN.matcher(trimmed).matches()) {
            throw new IllegalArgumentException(
                    String.format("Invalid %s format: '%s'. " +
                            "Must start with a letter or underscore, followed by letters, digits or underscores.",
                            identifierType, trimmed));
        }

        return trimmed;
    }

    /**
     * Validates a table name (can be schema.table or just table).
     *
     * @param tableName the table name to validate
     * @return the validated table name
     * @throws IllegalArgumentException if validation fails
     */
    public static String validateTableName(String tableName) {
        if (tableName == null || tableName.isBlank()) {
            throw new IllegalArgumentException("Table name cannot be null or empty");
        }

        String trimmed = tableName.trim();
        String[] parts = trimmed.split("\\.", 2);

        if (parts.length == 2) {
            validateIdentifier(parts[0], "Schema name");
            validateIdentifier(parts[1], "Table name");
        } else {
            validateIdentifier(trimmed, "Table name");
        }

        return trimmed;
    }

    // ============================================================================
    // Timing / count Validation
    // ============================================================================

    /**
     * @throws IllegalArgumentException when {@code value} is null, zero or negative
     */
    public static Duration validatePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(
                    String.format("%s must be a positive duration, got: %s", name, value));
        }
        return value;
    }

    /**
     * @throws IllegalArgumentException when {@code value} is null or negative
     */
    public static Duration validateNonNegative(Duration value, String name) {
        if (value == null || value.isNegative()) {
            throw new IllegalArgumentException(
                    String.format("%s must not be negative, got: %s", name, value));
        }
        return value;
    }

    /**
     * @throws IllegalArgumentException when {@code value} is negative or above {@code max}
     */
    public static int validateRetries(int value, int max) {
        if (value < 0 || value > max) {
            throw new IllegalArgumentException(
                    String.format("Retry count must be between 0 and %d, got: %d", max, value));
        }
        return value;
    }
}
