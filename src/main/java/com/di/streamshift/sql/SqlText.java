package com.di.streamshift.sql;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;

/**
 * Quoting and escaping rules for warehouse SQL text.
 */
public final class SqlText {

    private SqlText() {}

    static final DateTimeFormatter DATE_LITERAL      = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    /** Seconds plus the full fraction, trailing zeros dropped. */
    static final DateTimeFormatter TIMESTAMP_LITERAL = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm:ss")
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .toFormatter();

    /** {@code name} → {@code "name"}, doubling embedded double quotes. */
    public static String quoteIdentifier(String name) {
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }

    /**
     * String literal with embedded single quotes doubled. Backslashes are doubled too because
     * the warehouse treats a backslash inside a literal as an escape character.
     */
    public static String quoteLiteral(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "''") + "'";
    }

    /**
     * Escapes a complete SELECT so it can sit inside {@code UNLOAD ('...')}: backslashes and
     * single quotes are backslash-escaped on top of the literal quoting already applied.
     */
    public static String escapeForUnload(String select) {
        return select.replace("\\", "\\\\").replace("'", "\\'");
    }

    /**
     * Renders a filter operand as a literal.
     *
     * @return the literal text, or {@code null} when the value type cannot be rendered
     */
    public static String literal(Object value) {
        if (value instanceof String s) {
            return quoteLiteral(s);
        }
        if (value instanceof Boolean b) {
            return b ? "true" : "false";
        }
        if (value instanceof BigDecimal d) {
            return d.toPlainString();
        }
        if (value instanceof Double d) {
            return d.isNaN() || d.isInfinite() ? null : d.toString();
        }
        // untyped decimal literals are float8
        if (value instanceof Float f) {
            return f.isNaN() || f.isInfinite() ? null : f + "::REAL";
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            return value.toString();
        }
        if (value instanceof LocalDate d) {
            return "'" + DATE_LITERAL.format(d) + "'";
        }
        if (value instanceof LocalDateTime ts) {
            return "'" + TIMESTAMP_LITERAL.format(ts) + "'";
        }
        return null;
    }
}
