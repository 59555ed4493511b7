package com.di.streamshift.jdbc;

import com.di.streamshift.exception.WarehouseStatementException;
import com.di.streamshift.schema.Column;
import com.di.streamshift.schema.TableSchema;
import com.di.streamshift.schema.TypeMapper;
import com.di.streamshift.util.InputValidator;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link WarehouseConnection} over one JDBC connection, driven through a {@link JdbcTemplate}
 * that never closes it.
 */
public class JdbcWarehouseConnection implements WarehouseConnection {

    private final Connection   connection;
    private final JdbcTemplate jdbc;

    public JdbcWarehouseConnection(Connection connection) {
        this.connection = connection;
        this.jdbc       = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
    }

    @Override
    public void execute(String sql) {
        try {
            jdbc.execute(sql);
        } catch (DataAccessException e) {
            throw translate(sql, e);
        }
    }

    @Override
    public List<Map<String, Object>> query(String sql) {
        try {
            return jdbc.queryForList(sql);
        } catch (DataAccessException e) {
            throw translate(sql, e);
        }
    }

    @Override
    public TableSchema describe(String sql) {
        try {
            return jdbc.query(sql, (ResultSet rs) -> {
                ResultSetMetaData meta = rs.getMetaData();
                List<Column> columns = new ArrayList<>(meta.getColumnCount());
                for (int i = 1; i <= meta.getColumnCount(); i++) {
                    columns.add(TypeMapper.fromJdbc(
                            meta.getColumnLabel(i),
                            meta.getColumnType(i),
                            meta.getColumnTypeName(i),
                            meta.getPrecision(i),
                            meta.getScale(i),
                            meta.isNullable(i) != ResultSetMetaData.columnNoNulls));
                }
                return TableSchema.of(columns);
            });
        } catch (DataAccessException e) {
            throw translate(sql, e);
        }
    }

    @Override
    public void setQueryTimeout(int seconds) {
        jdbc.setQueryTimeout(seconds);
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            throw new WarehouseStatementException("Failed to close warehouse connection", null, e.getSQLState(), e);
        }
    }

    private static WarehouseStatementException translate(String sql, DataAccessException e) {
        String masked = InputValidator.sanitizeForLogging(sql);
        Throwable root = e.getMostSpecificCause();
        String sqlState = root instanceof SQLException sqlEx ? sqlEx.getSQLState() : null;
        return new WarehouseStatementException(
                "Warehouse rejected statement: " + InputValidator.sanitizeForLogging(root.getMessage()) + " [SQL: " + masked + "]",
                masked, sqlState, root);
    }
}
