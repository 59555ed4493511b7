package com.di.streamshift.jdbc;

import com.di.streamshift.schema.TableSchema;

import java.util.List;
import java.util.Map;

/**
 * One physical warehouse connection. Every method throws
 * {@link com.di.streamshift.exception.WarehouseStatementException} when the warehouse rejects the SQL.
 */
public interface WarehouseConnection extends AutoCloseable {

    /** Executes a statement (or a {@code ;}-separated block) that returns no rows. */
    void execute(String sql);

    /** Executes a query and returns every row, keyed by column label. */
    List<Map<String, Object>> query(String sql);

    /** Result-set schema of {@code sql}, typically a {@code WHERE 1=0} probe. */
    TableSchema describe(String sql);

    /** Seconds; 0 removes the limit. */
    void setQueryTimeout(int seconds);

    @Override
    void close();
}
