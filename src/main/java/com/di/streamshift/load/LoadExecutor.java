package com.di.streamshift.load;

import com.amazonaws.auth.AWSCredentialsProvider;
import com.di.streamshift.config.Parameters;
import com.di.streamshift.config.SaveMode;
import com.di.streamshift.exception.ConfigurationException;
import com.di.streamshift.exception.ErrorCategory;
import com.di.streamshift.exception.LoadVerificationException;
import com.di.streamshift.exception.WarehouseStatementException;
import com.di.streamshift.format.AvroBatchWriter;
import com.di.streamshift.jdbc.LoadError;
import com.di.streamshift.jdbc.WarehouseConnection;
import com.di.streamshift.jdbc.WarehouseGateway;
import com.di.streamshift.schema.Column;
import com.di.streamshift.schema.RowBatch;
import com.di.streamshift.schema.TableSchema;
import com.di.streamshift.schema.TypeMapper;
import com.di.streamshift.sql.SqlGenerator;
import com.di.streamshift.storage.AwsCredentialsClause;
import com.di.streamshift.storage.StagingLocation;
import com.di.streamshift.storage.StagingPathAllocator;
import com.di.streamshift.storage.StagingStorage;
import com.di.streamshift.storage.StagingStorageFactory;
import com.di.streamshift.util.MetricsCollector;
import lombok.extern.slf4j.Slf4j;
import org.apache.avro.Schema;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes a {@link RowBatch} into a warehouse table.
 *
 * <h3>Sequence with a staging table</h3>
 * <ol>
 *   <li>validate the schema and stage the batch as Avro files plus a manifest;</li>
 *   <li>{@code DROP TABLE IF EXISTS staging}, {@code CREATE TABLE IF NOT EXISTS staging (...)};</li>
 *   <li>{@code COPY staging FROM manifest}, then read the load-error log: any row fails the load;</li>
 *   <li>post-actions against the staging table;</li>
 *   <li>overwrite: rename-swap transaction (or a plain rename when the target is absent);
 *       staged append: {@code INSERT INTO target SELECT * FROM staging} in a transaction;</li>
 *   <li>{@code DROP TABLE IF EXISTS staging}, on every path.</li>
 * </ol>
 *
 * <h3>Direct sequence</h3>
 * Append (and the first write under {@code ERROR_IF_EXISTS} / {@code IGNORE}) creates the target
 * if needed and copies straight into it. Overwrite without a staging table drops the target first.
 *
 * <p>A failed step re-raises its original exception after cleanup; cleanup failures are logged
 * and attached as suppressed. Concurrent writes to the same target must be serialised by the caller.
 */
@Slf4j
public class LoadExecutor {

    private final WarehouseGateway       gateway;
    private final StagingStorageFactory  storageFactory;
    private final AWSCredentialsProvider credentialsProvider;
    private final StagingPathAllocator   allocator;
    private final StagingWriter          stagingWriter;
    private final MetricsCollector       metrics;

    public LoadExecutor(WarehouseGateway gateway,
                        StagingStorageFactory storageFactory,
                        AWSCredentialsProvider credentialsProvider,
                        StagingPathAllocator allocator,
                        StagingWriter stagingWriter,
                        MetricsCollector metrics) {
        this.gateway             = gateway;
        this.storageFactory      = storageFactory;
        this.credentialsProvider = credentialsProvider;
        this.allocator           = allocator;
        this.stagingWriter       = stagingWriter;
        this.metrics             = metrics;
    }

    /**
     * Writes {@code data} to {@code params.dbtable} under {@code mode}.
     *
     * @return {@link LoadState#DONE}, or {@link LoadState#SKIPPED} when {@code IGNORE} found the target
     * @throws ConfigurationException      for invalid settings, ambiguous columns, or an existing
     *                                     target under {@code ERROR_IF_EXISTS}; raised before any I/O
     *                                     except the existence probe
     * @throws WarehouseStatementException when a statement fails
     * @throws LoadVerificationException   when the load-error log holds rows after COPY
     */
    public LoadState load(Parameters params, SaveMode mode, RowBatch data) {
        String table = params.requireWritableTable();
        TableSchema schema = applyMaxLengthOverrides(data.schema(), params.getMaxLengthOverrides());
        schema.requireUnambiguousNames();
        TypeMapper.requireMappable(schema);
        Schema avroSchema = AvroBatchWriter.avroSchema(schema);
        String credentials = AwsCredentialsClause.render(params.getAwsIamRole(), credentialsProvider);

        StagingLocation location = allocator.allocate(params.getTempDir());
        long start = System.currentTimeMillis();
        try (MDC.MDCCloseable ignored = MDC.putCloseable("loadId", location.id())) {
            try {
                log.info("[LOAD] writing {} rows to {} (mode={}, staging={})",
                        data.rowCount(), table, mode, location.directoryUri());
                LoadState result = gateway.withConnection(params, conn -> {
                    Load load = new Load(conn, params, schema, avroSchema, table, location, credentials);
                    return load.run(mode, data);
                });
                metrics.recordLoad(System.currentTimeMillis() - start);
                log.info("[LOAD] {} → {} in {} ms", table, result, System.currentTimeMillis() - start);
                return result;
            } catch (RuntimeException e) {
                ErrorCategory category = ErrorCategory.categorize(e);
                metrics.recordLoadError(category, System.currentTimeMillis() - start);
                log.error("[LOAD] write to {} FAILED [{}]: {}", table, category, e.getMessage());
                throw e;
            }
        }
    }

    /**
     * Applies {@code column → length} overrides to string columns.
     *
     * @throws ConfigurationException when an override names a column that is not in {@code schema}
     */
    static TableSchema applyMaxLengthOverrides(TableSchema schema, Map<String, Integer> overrides) {
        if (overrides.isEmpty()) {
            return schema;
        }
        List<Column> columns = new ArrayList<>(schema.columns());
        for (Map.Entry<String, Integer> o : overrides.entrySet()) {
            int index = schema.indexOf(o.getKey());
            if (index < 0) {
                throw new ConfigurationException(String.format(
                        "maxlength override names column '%s', which is not in the schema %s",
                        o.getKey(), schema.names()));
            }
            columns.set(index, columns.get(index).withMaxLength(o.getValue()));
        }
        return TableSchema.of(columns);
    }

    /** One write on one connection. */
    private final class Load {

        private final WarehouseConnection conn;
        private final Parameters          params;
        private final TableSchema         schema;
        private final Schema              avroSchema;
        private final String              table;
        private final StagingLocation     location;
        private final String              credentials;
        private LoadState                 state = LoadState.START;

        Load(WarehouseConnection conn, Parameters params, TableSchema schema, Schema avroSchema, String table,
             StagingLocation location, String credentials) {
            this.conn        = conn;
            this.params      = params;
            this.schema      = schema;
            this.avroSchema  = avroSchema;
            this.table       = table;
            this.location    = location;
            this.credentials = credentials;
        }

        LoadState run(SaveMode mode, RowBatch data) {
            switch (mode) {
                case ERROR_IF_EXISTS:
                    if (gateway.tableExists(conn, table)) {
                        throw new ConfigurationException(String.format(
                                "Table %s already exists (save mode %s)", table, mode));
                    }
                    stage(data);
                    loadDirect(false);
                    break;
                case IGNORE:
                    if (gateway.tableExists(conn, table)) {
                        log.info("[LOAD] table {} exists; save mode {} leaves it untouched", table, mode);
                        return LoadState.SKIPPED;
                    }
                    stage(data);
                    loadDirect(false);
                    break;
                case OVERWRITE:
                    if (params.isUseStagingTable()) {
                        boolean targetExists = gateway.tableExists(conn, table);
                        stage(data);
                        loadThroughStagingTable(targetExists, true);
                    } else {
                        log.warn("[LOAD] overwriting {} without a staging table: the target is dropped before "
                                + "the new data is loaded, and a failure leaves it missing or partial", table);
                        stage(data);
                        loadDirect(true);
                    }
                    break;
                case APPEND:
                default:
                    stage(data);
                    if (params.isStagedAppend()) {
                        gateway.execute(conn, SqlGenerator.createTableSql(schema, table,
                                params.getDistStyle(), params.getDistKey(), params.getSortKeySpec()));
                        loadThroughStagingTable(true, false);
                    } else {
                        loadDirect(false);
                    }
                    break;
            }
            return LoadState.DONE;
        }

        private void stage(RowBatch data) {
            StagingStorage storage = storageFactory.create(credentialsProvider);
            allocator.checkLifecycle(storage, params.getTempDir());
            StagedFiles staged = stagingWriter.write(storage, location, schema, avroSchema, data);
            metrics.recordStagingBytes(staged.totalBytes());
        }

        /**
         * Loads into a fresh staging table, then swaps it in ({@code overwrite}) or merges it.
         */
        private void loadThroughStagingTable(boolean targetExists, boolean overwrite) {
            String staging = SqlGenerator.stagingTableName(table, location.id());
            RuntimeException failure = null;
            try {
                gateway.execute(conn, SqlGenerator.dropTableSql(staging));
                gateway.execute(conn, SqlGenerator.createTableSql(schema, staging,
                        params.getDistStyle(), params.getDistKey(), params.getSortKeySpec()));
                transition(LoadState.STAGING_TABLE_CREATED);

                copyAndVerify(staging);
                runPostActions(staging);

                if (overwrite) {
                    gateway.execute(conn, targetExists
                            ? SqlGenerator.transactionSql(table, staging, location.id())
                            : SqlGenerator.renameSql(staging, table));
                    transition(LoadState.SWAPPED);
                } else {
                    gateway.execute(conn, SqlGenerator.insertFromStagingSql(table, staging));
                    transition(LoadState.MERGED);
                }
            } catch (RuntimeException e) {
                failure = e;
                transition(LoadState.ABORTING);
                throw e;
            } finally {
                cleanup(staging, failure);
            }
        }

        /**
         * Creates (or, with {@code dropFirst}, recreates) the target and copies straight into it.
         */
        private void loadDirect(boolean dropFirst) {
            try {
                if (dropFirst) {
                    gateway.execute(conn, SqlGenerator.dropTableSql(table));
                }
                gateway.execute(conn, SqlGenerator.createTableSql(schema, table,
                        params.getDistStyle(), params.getDistKey(), params.getSortKeySpec()));
                transition(LoadState.STAGING_TABLE_CREATED);
                copyAndVerify(table);
                runPostActions(table);
                transition(LoadState.DONE);
            } catch (RuntimeException e) {
                transition(LoadState.ABORTING);
                transition(LoadState.FAILED);
                throw e;
            }
        }

        /**
         * COPY into {@code target}, then read the load-error log. Rows in the log fail the load even
         * when COPY returned normally. When COPY itself failed the log is still read and attached.
         */
        private void copyAndVerify(String target) {
            try {
                gateway.execute(conn, SqlGenerator.copyQuery(target, location.warehouseManifestUri(), credentials));
            } catch (WarehouseStatementException copyFailure) {
                attachLoadErrors(copyFailure);
                throw copyFailure;
            }
            transition(LoadState.DATA_COPIED);

            List<LoadError> errors = gateway.loadErrors(conn);
            if (!errors.isEmpty()) {
                throw verificationFailure(target, errors);
            }
            transition(LoadState.VERIFIED);
        }

        private void attachLoadErrors(WarehouseStatementException copyFailure) {
            try {
                List<LoadError> errors = gateway.loadErrors(conn);
                if (!errors.isEmpty()) {
                    copyFailure.addSuppressed(verificationFailure(table, errors));
                }
            } catch (RuntimeException e) {
                log.warn("[LOAD] could not read the load-error log after COPY failed: {}", e.getMessage(), e);
                copyFailure.addSuppressed(e);
            }
        }

        private LoadVerificationException verificationFailure(String target, List<LoadError> errors) {
            errors.forEach(e -> log.error("[LOAD] load error: {}", e.describe()));
            String detail = errors.stream().limit(5).map(LoadError::describe).collect(Collectors.joining("; "));
            return new LoadVerificationException(String.format(
                    "COPY into %s reported %d load error(s): %s", target, errors.size(), detail), errors);
        }

        private void runPostActions(String loadedTable) {
            for (String action : params.getPostActions()) {
                gateway.execute(conn, SqlGenerator.postAction(action, loadedTable));
            }
        }

        /** Drops the staging table; never masks {@code failure}. */
        private void cleanup(String staging, RuntimeException failure) {
            transition(LoadState.CLEANUP);
            try {
                gateway.execute(conn, SqlGenerator.dropTableSql(staging));
            } catch (RuntimeException e) {
                log.warn("[LOAD] failed to drop staging table {}: {}", staging, e.getMessage(), e);
                if (failure != null) {
                    failure.addSuppressed(e);
                }
            }
            transition(failure == null ? LoadState.DONE : LoadState.FAILED);
        }

        private void transition(LoadState next) {
            log.debug("[LOAD] {} → {}", state, next);
            state = next;
        }
    }
}
