package com.di.streamshift.jdbc;

import java.util.Map;

/**
 * One row of the warehouse load-error log for the last COPY.
 */
public record LoadError(String startTime, String fileName, Long lineNumber, String columnName,
                        String columnType, String columnLength, String rawFieldValue,
                        Integer errorCode, String errorReason) {

    /** Builds an entry from a row of {@code SqlGenerator.LOAD_ERRORS_QUERY}; keys are case-insensitive. */
    public static LoadError fromRow(Map<String, Object> row) {
        return new LoadError(
                text(row, "starttime"),
                text(row, "filename"),
                number(row, "line_number") == null ? null : number(row, "line_number").longValue(),
                text(row, "colname"),
                text(row, "type"),
                text(row, "col_length"),
                text(row, "raw_field_value"),
                number(row, "err_code") == null ? null : number(row, "err_code").intValue(),
                text(row, "err_reason"));
    }

    /** {@code file:line column 'c' (code): reason}, for exception messages. */
    public String describe() {
        return String.format("%s:%s column '%s' (%s): %s",
                fileName, lineNumber, columnName, errorCode, errorReason);
    }

    private static Object lookup(Map<String, Object> row, String key) {
        for (Map.Entry<String, Object> e : row.entrySet()) {
            if (e.getKey().equalsIgnoreCase(key)) {
                return e.getValue();
            }
        }
        return null;
    }

    // Load-error columns are CHAR padded.
    private static String text(Map<String, Object> row, String key) {
        Object v = lookup(row, key);
        return v == null ? null : v.toString().trim();
    }

    private static Number number(Map<String, Object> row, String key) {
        Object v = lookup(row, key);
        if (v == null || v instanceof Number) {
            return (Number) v;
        }
        return Long.valueOf(v.toString().trim());
    }
}
