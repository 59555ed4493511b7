package com.di.streamshift.relation;

import com.di.streamshift.config.Parameters;
import com.di.streamshift.config.SaveMode;
import com.di.streamshift.filter.Filter;
import com.di.streamshift.jdbc.WarehouseGateway;
import com.di.streamshift.load.LoadExecutor;
import com.di.streamshift.schema.RowBatch;
import com.di.streamshift.schema.TableSchema;
import com.di.streamshift.sql.FilterRenderer;
import com.di.streamshift.unload.RowSource;
import com.di.streamshift.unload.UnloadExecutor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * A warehouse table or query. Reads go through UNLOAD, writes through staged COPY.
 * The schema is resolved from the warehouse on first use unless one was supplied.
 */
@Slf4j
public class WarehouseRelation implements PrunedFilteredScan, InsertableRelation {

    private final Parameters       params;
    private final WarehouseGateway gateway;
    private final UnloadExecutor   unloadExecutor;
    private final LoadExecutor     loadExecutor;
    private TableSchema            schema;

    WarehouseRelation(Parameters params, TableSchema userSchema, WarehouseGateway gateway,
                      UnloadExecutor unloadExecutor, LoadExecutor loadExecutor) {
        this.params         = params;
        this.schema         = userSchema;
        this.gateway        = gateway;
        this.unloadExecutor = unloadExecutor;
        this.loadExecutor   = loadExecutor;
    }

    public Parameters parameters() {
        return params;
    }

    @Override
    public synchronized TableSchema schema() {
        if (schema == null) {
            schema = gateway.withConnection(params,
                    conn -> gateway.resolveSchema(conn, params.sourceExpression()));
            log.info("[SCHEMA] resolved {} column(s) for {}", schema.size(), params.sourceExpression());
        }
        return schema;
    }

    @Override
    public List<Filter> unhandledFilters(List<Filter> filters) {
        return FilterRenderer.unhandled(schema(), filters);
    }

    @Override
    public RowSource buildScan(List<String> requiredColumns, List<Filter> filters) {
        return unloadExecutor.unload(params, schema(), requiredColumns, filters);
    }

    @Override
    public void insert(RowBatch data, boolean overwrite) {
        loadExecutor.load(params, overwrite ? SaveMode.OVERWRITE : SaveMode.APPEND, data);
    }
}
