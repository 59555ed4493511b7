package com.di.streamshift.jdbc;

import com.di.streamshift.config.Parameters;
import com.di.streamshift.exception.WarehouseStatementException;
import com.di.streamshift.schema.TableSchema;
import com.di.streamshift.sql.SqlGenerator;
import com.di.streamshift.util.InputValidator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;

/**
 * The single place where warehouse SQL runs. Each logical operation gets exactly one
 * connection, opened by {@link #withConnection} and closed on every exit path.
 */
@Slf4j
public class WarehouseGateway {

    private final WarehouseDriver driver;
    private final int defaultQueryTimeoutSec;

    public WarehouseGateway(WarehouseDriver driver, int defaultQueryTimeoutSec) {
        this.driver = driver;
        this.defaultQueryTimeoutSec = defaultQueryTimeoutSec;
    }

    /**
     * Opens a connection for {@code params}, applies the query timeout, runs {@code work}
     * and closes the connection. A close failure is logged and, when {@code work} failed,
     * attached to that failure as suppressed.
     */
    public <T> T withConnection(Parameters params, Function<WarehouseConnection, T> work) {
        WarehouseConnection conn = driver.connect(params.getUrl(), new Properties());
        Throwable primary = null;
        try {
            int timeout = params.getQueryTimeoutSec() != null ? params.getQueryTimeoutSec() : defaultQueryTimeoutSec;
            if (timeout > 0) {
                conn.setQueryTimeout(timeout);
            }
            return work.apply(conn);
        } catch (RuntimeException | Error e) {
            primary = e;
            throw e;
        } finally {
            close(conn, primary);
        }
    }

    /** Executes a statement, logging it with credentials masked. */
    public void execute(WarehouseConnection conn, String sql) {
        String masked = InputValidator.sanitizeForLogging(sql);
        log.info("[GATEWAY] execute: {}", masked);
        long start = System.currentTimeMillis();
        conn.execute(sql);
        log.debug("[GATEWAY] done in {} ms", System.currentTimeMillis() - start);
    }

    public List<Map<String, Object>> query(WarehouseConnection conn, String sql) {
        log.info("[GATEWAY] query: {}", InputValidator.sanitizeForLogging(sql));
        return conn.query(sql);
    }

    /**
     * Whether {@code table} exists, probed with a query that returns no rows. Any failure of the
     * probe means absent.
     */
    public boolean tableExists(WarehouseConnection conn, String table) {
        try {
            query(conn, SqlGenerator.tableExistsProbe(table));
            return true;
        } catch (WarehouseStatementException e) {
            log.debug("[GATEWAY] table {} not found: {}", table, e.getMessage());
            return false;
        }
    }

    /** Schema of a table or parenthesised query, from result-set metadata. */
    public TableSchema resolveSchema(WarehouseConnection conn, String sourceExpr) {
        String probe = SqlGenerator.schemaProbe(sourceExpr);
        log.info("[SCHEMA] resolving schema: {}", probe);
        return conn.describe(probe);
    }

    /** Rows of the load-error log produced by the last COPY on this connection. */
    public List<LoadError> loadErrors(WarehouseConnection conn) {
        List<LoadError> errors = new ArrayList<>();
        for (Map<String, Object> row : query(conn, SqlGenerator.LOAD_ERRORS_QUERY)) {
            errors.add(LoadError.fromRow(row));
        }
        return errors;
    }

    private static void close(WarehouseConnection conn, Throwable primary) {
        try {
            conn.close();
        } catch (RuntimeException e) {
            log.warn("[GATEWAY] failed to close connection: {}", e.getMessage(), e);
            if (primary != null) {
                primary.addSuppressed(e);
            }
        }
    }
}
