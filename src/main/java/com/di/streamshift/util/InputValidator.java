package com.di.streamshift.util;

import com.di.streamshift.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.util.regex.Pattern;

/**
 * Validation of user-supplied names and clauses that are spliced into warehouse SQL
 * without quoting (table names, sort key specs, staging URLs).
 */
@Slf4j
public final class InputValidator {

    private InputValidator() {}

    // ============================================================================
    // Patterns
    // ============================================================================

    /**
     * Unquoted warehouse identifier: letter or underscore, then letters, digits,
     * underscores or dollar signs; max 127 bytes.
     */
    private static final Pattern UNQUOTED_IDENTIFIER = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_$]{0,126}$");

    /** Double-quoted identifier; embedded quotes must be doubled. */
    private static final Pattern QUOTED_IDENTIFIER = Pattern.compile("^\"([^\"]|\"\"){1,127}\"$");

    /** {@code [COMPOUND|INTERLEAVED] SORTKEY(col, ...)}. */
    private static final Pattern SORT_KEY_SPEC = Pattern.compile(
            "^(COMPOUND\\s+|INTERLEAVED\\s+)?SORTKEY\\s*\\(\\s*[\\w$\"]+(\\s*,\\s*[\\w$\"]+)*\\s*\\)$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern DIST_STYLE = Pattern.compile("^(EVEN|KEY|ALL|AUTO)$", Pattern.CASE_INSENSITIVE);

    /** Statement terminators and comment openers. */
    private static final Pattern SQL_BREAKOUT = Pattern.compile("(;|--|/\\*|\\*/|')");

    // ============================================================================
    // Identifiers
    // ============================================================================

    /**
     * Validates a single identifier part (quoted or unquoted).
     *
     * @return the trimmed identifier
     * @throws ConfigurationException if the identifier cannot be spliced into SQL safely
     */
    public static String validateIdentifier(String identifier, String identifierType) {
        if (identifier == null || identifier.isBlank()) {
            throw new ConfigurationException(identifierType + " cannot be null or empty");
        }
        String trimmed = identifier.trim();
        if (QUOTED_IDENTIFIER.matcher(trimmed).matches()) {
            return trimmed;
        }
        if (!UNQUOTED_IDENTIFIER.matcher(trimmed).matches()) {
            log.warn("Rejected {}: {}", identifierType, trimmed);
            throw new ConfigurationException(String.format(
                    "Invalid %s '%s': must start with a letter or underscore, followed by letters, "
                            + "digits, underscores or dollar signs, or be double-quoted",
                    identifierType, trimmed));
        }
        return trimmed;
    }

    /**
     * Validates {@code table} or {@code schema.table}.
     *
     * @throws ConfigurationException if either part is invalid
     */
    public static String validateTableName(String tableName) {
        if (tableName == null || tableName.isBlank()) {
            throw new ConfigurationException("Table name cannot be null or empty");
        }
        String trimmed = tableName.trim();
        String[] parts = splitQualified(trimmed);
        if (parts.length == 2) {
            validateIdentifier(parts[0], "Schema name");
            validateIdentifier(parts[1], "Table name");
        } else {
            validateIdentifier(trimmed, "Table name");
        }
        return trimmed;
    }

    /** Splits on the first dot that is outside double quotes. */
    public static String[] splitQualified(String name) {
        boolean inQuotes = false;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '"') {
                inQuotes = !inQuotes;
            } else if (c == '.' && !inQuotes) {
                return new String[] { name.substring(0, i), name.substring(i + 1) };
            }
        }
        return new String[] { name };
    }

    // ============================================================================
    // Clauses
    // ============================================================================

    public static String validateSortKeySpec(String spec) {
        if (spec == null) {
            return null;
        }
        String trimmed = spec.trim();
        if (!SORT_KEY_SPEC.matcher(trimmed).matches()) {
            throw new ConfigurationException("Invalid sortkeyspec '" + trimmed
                    + "': expected [COMPOUND|INTERLEAVED] SORTKEY(col, ...)");
        }
        return trimmed;
    }

    public static String validateDistStyle(String style) {
        if (style == null) {
            return null;
        }
        String trimmed = style.trim();
        if (!DIST_STYLE.matcher(trimmed).matches()) {
            throw new ConfigurationException("Invalid diststyle '" + trimmed + "': expected EVEN, KEY, ALL or AUTO");
        }
        return trimmed.toUpperCase(java.util.Locale.ROOT);
    }

    /**
     * Rejects values that could close the surrounding literal or statement
     * (used for staging URIs embedded in UNLOAD and COPY).
     */
    public static String validateNoBreakout(String value, String what) {
        if (value != null && SQL_BREAKOUT.matcher(value).find()) {
            throw new ConfigurationException(what + " contains characters that are not allowed in warehouse SQL: " + value);
        }
        return value;
    }

    // ============================================================================
    // URLs
    // ============================================================================

    /**
     * Validates a JDBC URL (basic validation).
     *
     * @throws ConfigurationException if the URL does not start with {@code jdbc:}
     */
    public static String validateJdbcUrl(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new ConfigurationException("Parameter 'url' is required");
        }
        String trimmed = jdbcUrl.trim();
        if (!trimmed.toLowerCase(java.util.Locale.ROOT).startsWith("jdbc:")) {
            throw new ConfigurationException("Parameter 'url' must be a JDBC URL starting with 'jdbc:'");
        }
        return trimmed;
    }

    /**
     * Masks secrets in SQL text and JDBC URLs before they are logged or stored in exceptions.
     */
    public static String sanitizeForLogging(String input) {
        if (input == null) {
            return "null";
        }
        return input
                .replaceAll("aws_secret_access_key=[^;']+", "aws_secret_access_key=***")
                .replaceAll("token=[^;']+", "token=***")
                .replaceAll("(?i)password=[^;&]+", "password=***");
    }
}
