package com.di.streamshift.jdbc;

import java.util.Properties;

/**
 * Opens warehouse connections. Replaceable so the transfer core can run against a fake.
 */
@FunctionalInterface
public interface WarehouseDriver {

    /**
     * @throws com.di.streamshift.exception.WarehouseStatementException when the connection cannot be opened
     */
    WarehouseConnection connect(String url, Properties properties);
}
