package com.di.streamshift.exception;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Error categories used to tag failure log lines and the load/unload error counters.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a new category: add the enum constant (before UNKNOWN) and a matcher in
 * {@link #MATCHERS}.
 */
public enum ErrorCategory {

    CONFIGURATION_ERROR("Configuration error", "Invalid or missing parameters, checked before any I/O"),
    SCHEMA_MAPPING_ERROR("Schema mapping error", "Column type has no warehouse counterpart"),
    LOAD_VERIFICATION_ERROR("Load verification error", "Warehouse load-error log holds rows for this load"),
    STAGING_IO_ERROR("Staging I/O error", "Object store read or write failed"),
    CONNECTION_ERROR("Warehouse connection error", "Failed to establish or maintain the warehouse connection"),
    SQL_SYNTAX_ERROR("SQL syntax error", "Warehouse rejected the statement text"),
    TRANSACTION_ROLLBACK("Transaction rollback", "Transaction was rolled back"),
    PERMISSION_ERROR("Permission denied", "Insufficient privileges for the statement"),
    WAREHOUSE_ERROR("Warehouse error", "General warehouse statement failure"),
    TIMEOUT_ERROR("Timeout error", "Statement exceeded the configured query timeout"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof ConfigurationException, CONFIGURATION_ERROR);
        MATCHERS.put(t -> t instanceof SchemaMappingException, SCHEMA_MAPPING_ERROR);
        MATCHERS.put(t -> t instanceof LoadVerificationException, LOAD_VERIFICATION_ERROR);
        MATCHERS.put(t -> t instanceof StagingIOException, STAGING_IO_ERROR);
        MATCHERS.put(t -> t instanceof IllegalArgumentException, CONFIGURATION_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        if (isTimeoutError(exception)) {
            return TIMEOUT_ERROR;
        }
        if (exception instanceof WarehouseStatementException wse) {
            return categorizeSqlState(wse.getSqlState(), wse.getCause());
        }
        if (exception instanceof SQLException sqlEx) {
            return categorizeSqlState(sqlEx.getSQLState(), sqlEx);
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    private static ErrorCategory categorizeSqlState(String sqlState, Throwable cause) {
        if (sqlState != null && sqlState.length() >= 2) {
            ErrorCategory byState = SQL_STATE_PREFIX.get(sqlState.substring(0, 2));
            if (byState != null) {
                return byState;
            }
        }
        if (cause != null && cause.getMessage() != null) {
            String lower = cause.getMessage().toLowerCase();
            if (containsAny(lower, "timeout", "canceling statement")) return TIMEOUT_ERROR;
            if (containsAny(lower, "connection", "refused", "closed")) return CONNECTION_ERROR;
            if (containsAny(lower, "permission", "access denied", "not authorized")) return PERMISSION_ERROR;
            if (containsAny(lower, "syntax", "parse error")) return SQL_SYNTAX_ERROR;
        }
        return WAREHOUSE_ERROR;
    }

    private static final Map<String, ErrorCategory> SQL_STATE_PREFIX = Map.of(
            "08", CONNECTION_ERROR,
            "42", SQL_SYNTAX_ERROR,
            "40", TRANSACTION_ROLLBACK,
            "57", TIMEOUT_ERROR
    );

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.sql.SQLTimeoutException;
    }

    private static boolean containsAny(String s, String... parts) {
        for (String p : parts) {
            if (s.contains(p)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}
