package com.di.streamshift.jdbc;

import com.di.streamshift.exception.WarehouseStatementException;
import com.di.streamshift.util.InputValidator;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * {@link WarehouseDriver} over {@link DriverManager}; the Redshift JDBC driver registers itself
 * for {@code jdbc:redshift:} URLs.
 */
@Slf4j
public class JdbcWarehouseDriver implements WarehouseDriver {

    @Override
    public WarehouseConnection connect(String url, Properties properties) {
        try {
            Connection conn = DriverManager.getConnection(url, properties);
            log.debug("[GATEWAY] connected to {}", InputValidator.sanitizeForLogging(url));
            return new JdbcWarehouseConnection(conn);
        } catch (SQLException e) {
            throw new WarehouseStatementException(
                    "Failed to connect to " + InputValidator.sanitizeForLogging(url) + ": " + e.getMessage(),
                    null, e.getSQLState(), e);
        }
    }
}
