package com.di.streamshift.exception;

import lombok.Getter;

/**
 * A statement or query rejected by the warehouse. The SQL is stored with credentials masked.
 */
@Getter
public class WarehouseStatementException extends StreamShiftException {

    private final String sql;
    private final String sqlState;

    public WarehouseStatementException(String message, String sql, String sqlState, Throwable cause) {
        super(message, cause);
        this.sql      = sql;
        this.sqlState = sqlState;
    }
}
