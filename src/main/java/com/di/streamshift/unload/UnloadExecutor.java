package com.di.streamshift.unload;

import com.amazonaws.auth.AWSCredentialsProvider;
import com.di.streamshift.config.Parameters;
import com.di.streamshift.filter.Filter;
import com.di.streamshift.jdbc.WarehouseGateway;
import com.di.streamshift.schema.TableSchema;
import com.di.streamshift.sql.SqlGenerator;
import com.di.streamshift.storage.AwsCredentialsClause;
import com.di.streamshift.storage.StagingLocation;
import com.di.streamshift.storage.StagingPathAllocator;
import com.di.streamshift.storage.StagingStorage;
import com.di.streamshift.storage.StagingStorageFactory;
import com.di.streamshift.util.MetricsCollector;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.List;

/**
 * Runs an UNLOAD of a projected, filtered table or query into a fresh staging directory and
 * hands back the files as a {@link RowSource}. Filters the generator cannot express are left
 * out of the WHERE clause; the caller re-applies every filter after reading.
 */
@Slf4j
public class UnloadExecutor {

    private final WarehouseGateway       gateway;
    private final StagingStorageFactory  storageFactory;
    private final AWSCredentialsProvider credentialsProvider;
    private final StagingPathAllocator   allocator;
    private final MetricsCollector       metrics;

    public UnloadExecutor(WarehouseGateway gateway,
                          StagingStorageFactory storageFactory,
                          AWSCredentialsProvider credentialsProvider,
                          StagingPathAllocator allocator,
                          MetricsCollector metrics) {
        this.gateway             = gateway;
        this.storageFactory      = storageFactory;
        this.credentialsProvider = credentialsProvider;
        this.allocator           = allocator;
        this.metrics             = metrics;
    }

    /**
     * @param fullSchema schema of the source, used to type filter literals
     * @param columns    projected columns, in output order; empty for a row count
     * @throws com.di.streamshift.exception.WarehouseStatementException when the warehouse rejects the UNLOAD
     */
    public RowSource unload(Parameters params, TableSchema fullSchema, List<String> columns, List<Filter> filters) {
        TableSchema projected = fullSchema.project(columns);
        String credentials = AwsCredentialsClause.render(params.getAwsIamRole(), credentialsProvider);
        StagingLocation location = allocator.allocate(params.getTempDir());
        long start = System.currentTimeMillis();
        try (MDC.MDCCloseable ignored = MDC.putCloseable("unloadId", location.id())) {
            try {
                StagingStorage storage = storageFactory.create(credentialsProvider);
                allocator.checkLifecycle(storage, params.getTempDir());

                String sql = SqlGenerator.unloadQuery(params.sourceExpression(), fullSchema, columns, filters,
                        credentials, location.warehouseDirectoryUri());
                gateway.withConnection(params, conn -> {
                    gateway.execute(conn, sql);
                    return null;
                });

                metrics.recordUnload(System.currentTimeMillis() - start);
                log.info("[UNLOAD] {} column(s) of {} unloaded to {} in {} ms",
                        columns.size(), params.sourceExpression(), location.directoryUri(),
                        System.currentTimeMillis() - start);
                return new RowSource(storage, location, projected);
            } catch (RuntimeException e) {
                metrics.recordUnloadError();
                log.error("[UNLOAD] unload of {} FAILED: {}", params.sourceExpression(), e.getMessage());
                throw e;
            }
        }
    }
}
