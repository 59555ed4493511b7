package com.di.streamshift.relation;

import com.di.streamshift.config.Parameters;
import com.di.streamshift.config.SaveMode;
import com.di.streamshift.exception.ConfigurationException;
import com.di.streamshift.filter.Filter;
import com.di.streamshift.jdbc.FakeWarehouse;
import com.di.streamshift.jdbc.WarehouseGateway;
import com.di.streamshift.load.LoadExecutor;
import com.di.streamshift.load.LoadState;
import com.di.streamshift.schema.Column;
import com.di.streamshift.schema.LogicalType;
import com.di.streamshift.schema.RowBatch;
import com.di.streamshift.schema.TableSchema;
import com.di.streamshift.unload.UnloadExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Test cases for WarehouseSourceProvider and WarehouseRelation.
 */
@DisplayName("WarehouseSourceProvider Tests")
class WarehouseSourceProviderTest {

    private static final TableSchema SCHEMA = TableSchema.of(
            Column.of("id", LogicalType.INTEGER),
            Column.of("name", LogicalType.STRING));

    private FakeWarehouse warehouse;
    private UnloadExecutor unloadExecutor;
    private LoadExecutor loadExecutor;
    private WarehouseSourceProvider provider;

    @BeforeEach
    void setUp() {
        warehouse = new FakeWarehouse();
        warehouse.describedSchema = SCHEMA;
        unloadExecutor = mock(UnloadExecutor.class);
        loadExecutor = mock(LoadExecutor.class);
        provider = new WarehouseSourceProvider(new WarehouseGateway(warehouse, 0), unloadExecutor, loadExecutor);
    }

    private static Map<String, String> options() {
        Map<String, String> options = new HashMap<>();
        options.put("url", "jdbc:redshift://foo/bar");
        options.put("tempdir", "s3a://bucket/tmp");
        options.put("dbtable", "test_table");
        return options;
    }

    // ============================================================================
    // Read relations
    // ============================================================================

    @Test
    @DisplayName("Should resolve the schema from the warehouse once, on first use")
    void testSchema_ResolvedLazily() {
        WarehouseRelation relation = provider.createRelation(options());
        assertEquals(0, warehouse.opened);

        assertEquals(SCHEMA, relation.schema());
        relation.schema();

        assertEquals(1, warehouse.opened);
        assertEquals(List.of("SELECT * FROM test_table WHERE 1=0"), warehouse.allSql);
    }

    @Test
    @DisplayName("Should use a supplied schema without probing")
    void testSchema_UserSupplied() {
        TableSchema user = TableSchema.of(Column.of("id", LogicalType.LONG));

        assertEquals(user, provider.createRelation(options(), user).schema());
        assertEquals(0, warehouse.opened);
    }

    @Test
    @DisplayName("Should report only filters that cannot be rendered as unhandled")
    void testUnhandledFilters() {
        WarehouseRelation relation = provider.createRelation(options(), SCHEMA);
        Filter pushed = new Filter.GreaterThan("id", 1);
        Filter emptyIn = new Filter.In("id", List.of());
        Filter unknownColumn = new Filter.IsNull("missing");

        assertEquals(List.of(emptyIn, unknownColumn),
                relation.unhandledFilters(List.of(pushed, emptyIn, unknownColumn)));
    }

    @Test
    @DisplayName("Should hand scans to the unload executor with the resolved schema")
    void testBuildScan() {
        WarehouseRelation relation = provider.createRelation(options(), SCHEMA);
        List<Filter> filters = List.of(new Filter.EqualTo("id", 1));

        relation.buildScan(List.of("name"), filters);

        verify(unloadExecutor).unload(relation.parameters(), SCHEMA, List.of("name"), filters);
    }

    @Test
    @DisplayName("Should reject a configuration with neither table nor query")
    void testCreateRelation_MissingSource() {
        Map<String, String> options = options();
        options.remove("dbtable");

        assertThrows(ConfigurationException.class, () -> provider.createRelation(options));
    }

    @Test
    @DisplayName("Should reject an s3:// staging directory for reads before any I/O")
    void testCreateRelation_BlockSchemeRead() {
        Map<String, String> options = options();
        options.put("tempdir", "s3://bucket/tmp");

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> provider.createRelation(options));

        assertTrue(ex.getMessage().contains("Block FileSystem"));
        assertEquals(0, warehouse.opened);
        verify(unloadExecutor, never()).unload(any(), any(), anyList(), anyList());
    }

    // ============================================================================
    // Write relations
    // ============================================================================

    @Test
    @DisplayName("Should write under the requested save mode and return a relation over the table")
    void testCreateRelation_Write() {
        RowBatch data = RowBatch.empty(SCHEMA);
        when(loadExecutor.load(any(Parameters.class), eq(SaveMode.ERROR_IF_EXISTS), eq(data))).thenReturn(LoadState.DONE);

        WarehouseRelation relation = provider.createRelation(SaveMode.ERROR_IF_EXISTS, options(), data);

        assertEquals(SCHEMA, relation.schema());
        assertEquals("test_table", relation.parameters().getTable());
        assertEquals(0, warehouse.opened);
    }

    @Test
    @DisplayName("Should resolve the existing table's schema after a skipped write")
    void testCreateRelation_Skipped() {
        RowBatch data = RowBatch.empty(TableSchema.of(Column.of("other", LogicalType.STRING)));
        when(loadExecutor.load(any(Parameters.class), eq(SaveMode.IGNORE), eq(data))).thenReturn(LoadState.SKIPPED);

        WarehouseRelation relation = provider.createRelation(SaveMode.IGNORE, options(), data);

        assertEquals(SCHEMA, relation.schema());
    }

    @Test
    @DisplayName("Should refuse to write to a query")
    void testCreateRelation_WriteToQuery() {
        Map<String, String> options = options();
        options.remove("dbtable");
        options.put("query", "select 1");

        assertThrows(ConfigurationException.class,
                () -> provider.createRelation(SaveMode.APPEND, options, RowBatch.empty(SCHEMA)));
        verify(loadExecutor, never()).load(any(), any(), any());
    }

    @Test
    @DisplayName("Should reject an s3:// staging directory for writes before any I/O")
    void testCreateRelation_BlockSchemeWrite() {
        Map<String, String> options = options();
        options.put("tempdir", "s3://bucket/tmp");

        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> provider.createRelation(SaveMode.OVERWRITE, options, RowBatch.empty(SCHEMA)));

        assertTrue(ex.getMessage().contains("Block FileSystem"));
        assertEquals(0, warehouse.opened);
        verify(loadExecutor, never()).load(any(), any(), any());
    }

    @Test
    @DisplayName("Should map insert(overwrite) onto the overwrite and append save modes")
    void testInsert() {
        WarehouseRelation relation = provider.createRelation(options(), SCHEMA);
        RowBatch data = RowBatch.empty(SCHEMA);

        relation.insert(data, true);
        relation.insert(data, false);

        verify(loadExecutor).load(relation.parameters(), SaveMode.OVERWRITE, data);
        verify(loadExecutor).load(relation.parameters(), SaveMode.APPEND, data);
        verify(unloadExecutor, never()).unload(any(), any(), anyList(), anyList());
    }
}
