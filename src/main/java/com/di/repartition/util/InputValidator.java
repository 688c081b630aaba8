package com.di.repartition.util;

import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Guards every identifier that ends up spliced into dynamic SQL (row counts, sampling, MIN/MAX).
 * Values never go through here; they are always bound.
 */
@Slf4j
public final class InputValidator {

    private InputValidator() {}

    // ============================================================================
    // Oracle identifier rules
    // ============================================================================

    /**
     * Unquoted Oracle identifier: a letter, then letters, digits, {@code _ $ #}. 128 bytes since 12.2.
     */
    private static final Pattern VALID_IDENTIFIER_PATTERN = Pattern.compile(
            "^[A-Za-z][A-Za-z0-9_$#]{0,127}$"
    );

    /**
     * Statement keywords as whole words, comment markers, terminators and quotes.
     * Word boundaries keep names such as ORDER_ID or CREATED_DATE legal.
     */
    private static final Pattern SQL_INJECTION_PATTERN = Pattern.compile(
            "(?i)(\\b(SELECT|INSERT|UPDATE|DELETE|DROP|CREATE|ALTER|TRUNCATE|EXEC|EXECUTE|UNION|GRANT|REVOKE|MERGE)\\b|--|/\\*|\\*/|;|'|\")"
    );

    private static final int MAX_IDENTIFIER_LENGTH = 128;

    /** Name glob: letters, digits, {@code _ $ #} plus the wildcards {@code * ? %}. */
    private static final Pattern NAME_GLOB_PATTERN = Pattern.compile("^[A-Za-z0-9_$#*?%]{1,128}$");

    // ============================================================================
    // Identifiers
    // ============================================================================

    /**
     * Validates an unquoted Oracle identifier and returns it trimmed and upper-cased.
     *
     * @throws IllegalArgumentException if the identifier is blank, too long, or not a plain identifier
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
            log.warn("Potential SQL injection attempt detected in {}: {}", identifierType, sanitizeForLogging(trimmed));
            throw new IllegalArgumentException(
                    String.format("Invalid %s: contains potentially dangerous SQL patterns", identifierType));
        }
        if (!VALID_IDENTIFIER_PATTERN.matcher(trimmed).matches()) {
            throw new IllegalArgumentException(
                    String.format("Invalid %s format: '%s'. Must start with a letter, followed by letters, digits, _, $ or #.",
                            identifierType, trimmed));
        }
        return trimmed.toUpperCase(Locale.ROOT);
    }

    public static String validateSchemaName(String schemaName) {
        return validateIdentifier(schemaName, "Schema name");
    }

    public static String validateColumnName(String columnName) {
        return validateIdentifier(columnName, "Column name");
    }

    // ============================================================================
    // Name patterns
    // ============================================================================

    /**
     * Converts a table-name glob into a LIKE pattern ({@code *} to {@code %}, {@code ?} to {@code _}),
     * upper-cased. The result is always bound, never spliced.
     */
    public static String globToLike(String glob) {
        if (glob == null || glob.isBlank()) {
            throw new IllegalArgumentException("Table name pattern cannot be null or empty");
        }
        String trimmed = glob.trim();
        if (!NAME_GLOB_PATTERN.matcher(trimmed).matches()) {
            throw new IllegalArgumentException(String.format("Invalid table name pattern: '%s'", trimmed));
        }
        return trimmed.toUpperCase(Locale.ROOT).replace('*', '%').replace('?', '_');
    }

    // ============================================================================
    // Output files
    // ============================================================================

    /**
     * Resolves a caller-supplied file name inside {@code baseDirectory}. Absolute names and names
     * that climb out through {@code ..} are rejected.
     *
     * @throws IllegalArgumentException if the resolved path leaves {@code baseDirectory}
     */
    public static Path resolveWithin(String baseDirectory, String fileName, String fileType) {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException(String.format("%s cannot be null or empty", fileType));
        }
        Path base = Paths.get(baseDirectory).toAbsolutePath().normalize();
        Path requested = Paths.get(fileName.trim());
        Path resolved = base.resolve(requested).normalize();
        if (requested.isAbsolute() || !resolved.startsWith(base) || resolved.equals(base)) {
            log.warn("Rejected {} outside {}: {}", fileType, base, sanitizeForLogging(fileName));
            throw new IllegalArgumentException(
                    String.format("Invalid %s '%s': must be a relative path inside %s", fileType, fileName.trim(), base));
        }
        return resolved;
    }

    // ============================================================================
    // Utility Methods
    // ============================================================================

    /**
     * Masks passwords in JDBC URLs and connection strings.
     */
    public static String sanitizeForLogging(String input) {
        if (input == null) {
            return "null";
        }
        String masked = input.replaceAll("(?i)password=[^;&\\s]+", "password=***");
        // user/password@host
        return masked.replaceAll("(:thin:)([^/@:]+)/[^@]+@", "$1$2/***@");
    }
}
