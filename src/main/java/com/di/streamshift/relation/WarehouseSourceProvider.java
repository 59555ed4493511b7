package com.di.streamshift.relation;

import com.di.streamshift.config.Parameters;
import com.di.streamshift.config.SaveMode;
import com.di.streamshift.jdbc.WarehouseGateway;
import com.di.streamshift.load.LoadExecutor;
import com.di.streamshift.load.LoadState;
import com.di.streamshift.schema.RowBatch;
import com.di.streamshift.schema.TableSchema;
import com.di.streamshift.unload.UnloadExecutor;
import lombok.RequiredArgsConstructor;

import java.util.Map;

/**
 * Entry point for hosts: turns a flat option map into a {@link WarehouseRelation}.
 */
@RequiredArgsConstructor
public class WarehouseSourceProvider {

    private final WarehouseGateway gateway;
    private final UnloadExecutor   unloadExecutor;
    private final LoadExecutor     loadExecutor;

    /** Read relation; the schema is resolved from the warehouse when first needed. */
    public WarehouseRelation createRelation(Map<String, String> options) {
        return createRelation(options, null);
    }

    /** Read relation with a caller-supplied schema; no schema probe is issued. */
    public WarehouseRelation createRelation(Map<String, String> options, TableSchema userSchema) {
        return new WarehouseRelation(Parameters.fromMap(options), userSchema, gateway, unloadExecutor, loadExecutor);
    }

    /**
     * Writes {@code data} under {@code mode} and returns a relation over the written table.
     *
     * @throws com.di.streamshift.exception.ConfigurationException when {@code options} name a query
     *         instead of a table, or {@code mode} is {@code ERROR_IF_EXISTS} and the table exists
     */
    public WarehouseRelation createRelation(SaveMode mode, Map<String, String> options, RowBatch data) {
        Parameters params = Parameters.fromMap(options);
        params.requireWritableTable();
        LoadState state = loadExecutor.load(params, mode, data);
        // a skipped write leaves the existing table, whose schema may differ from the batch
        TableSchema schema = state == LoadState.SKIPPED ? null : data.schema();
        return new WarehouseRelation(params, schema, gateway, unloadExecutor, loadExecutor);
    }
}
