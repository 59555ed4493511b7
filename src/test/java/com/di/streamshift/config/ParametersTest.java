package com.di.streamshift.config;

import com.di.streamshift.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for Parameters.
 */
@DisplayName("Parameters Tests")
class ParametersTest {

    private static Map<String, String> baseOptions() {
        Map<String, String> options = new HashMap<>();
        options.put("url", "jdbc:redshift://foo/bar?user=user&password=password");
        options.put("tempdir", "s3a://test-bucket/temp-dir");
        options.put("dbtable", "test_table");
        return options;
    }

    @Test
    @DisplayName("Should parse recognised keys and apply defaults")
    void testFromMap_Defaults() {
        Parameters params = Parameters.fromMap(baseOptions());

        assertEquals("test_table", params.getTable());
        assertNull(params.getQuery());
        assertTrue(params.isUseStagingTable());
        assertFalse(params.isStagedAppend());
        assertNull(params.getDistStyle());
        assertTrue(params.getPostActions().isEmpty());
        assertNull(params.getQueryTimeoutSec());
        assertEquals("test_table", params.sourceExpression());
    }

    @Test
    @DisplayName("Should parse write options case-insensitively and ignore unknown keys")
    void testFromMap_WriteOptions() {
        Map<String, String> options = baseOptions();
        options.put("UseStagingTable", "false");
        options.put("diststyle", "key");
        options.put("distkey", "id");
        options.put("sortkeyspec", "INTERLEAVED SORTKEY(id, name)");
        options.put("postactions", "GRANT SELECT ON %s TO jeremy; ANALYZE %s ;");
        options.put("querytimeout", "30");
        options.put("some_unknown_key", "whatever");

        Parameters params = Parameters.fromMap(options);

        assertFalse(params.isUseStagingTable());
        assertEquals("KEY", params.getDistStyle());
        assertEquals("id", params.getDistKey());
        assertEquals("INTERLEAVED SORTKEY(id, name)", params.getSortKeySpec());
        assertEquals(List.of("GRANT SELECT ON %s TO jeremy", "ANALYZE %s"), params.getPostActions());
        assertEquals(30, params.getQueryTimeoutSec());
    }

    @Test
    @DisplayName("Should wrap a query as a parenthesised source")
    void testFromMap_Query() {
        Map<String, String> options = baseOptions();
        options.remove("dbtable");
        options.put("query", "select * from test_table");

        Parameters params = Parameters.fromMap(options);

        assertEquals("(select * from test_table)", params.sourceExpression());
        ConfigurationException ex = assertThrows(ConfigurationException.class, params::requireWritableTable);
        assertTrue(ex.getMessage().contains("dbtable"));
    }

    // ============================================================================
    // Required keys
    // ============================================================================

    @Test
    @DisplayName("Should name tempdir when every required key is missing")
    void testFromMap_MissingEverything() {
        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> Parameters.fromMap(Map.of()));
        assertTrue(ex.getMessage().contains("tempdir"));
    }

    @Test
    @DisplayName("Should name url when it is missing")
    void testFromMap_MissingUrl() {
        Map<String, String> options = baseOptions();
        options.remove("url");

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> Parameters.fromMap(options));
        assertTrue(ex.getMessage().contains("url"));
    }

    @Test
    @DisplayName("Should require exactly one of dbtable and query")
    void testFromMap_TableXorQuery() {
        Map<String, String> neither = baseOptions();
        neither.remove("dbtable");
        Map<String, String> both = baseOptions();
        both.put("query", "select 1");

        assertTrue(assertThrows(ConfigurationException.class, () -> Parameters.fromMap(neither))
                .getMessage().contains("dbtable"));
        assertTrue(assertThrows(ConfigurationException.class, () -> Parameters.fromMap(both))
                .getMessage().contains("query"));
    }

    // ============================================================================
    // Staging scheme
    // ============================================================================

    @Test
    @DisplayName("Should reject the block-oriented s3:// scheme")
    void testFromMap_BlockFileSystemScheme() {
        Map<String, String> options = baseOptions();
        options.put("tempdir", "s3://test-bucket/temp-dir");

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> Parameters.fromMap(options));
        assertTrue(ex.getMessage().contains("Block FileSystem"));
        assertTrue(ex.getMessage().contains("s3://"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"s3a://bucket/dir", "s3n://bucket/dir/"})
    @DisplayName("Should accept streaming schemes")
    void testFromMap_StreamingSchemes(String tempDir) {
        Map<String, String> options = baseOptions();
        options.put("tempdir", tempDir);

        assertEquals(tempDir, Parameters.fromMap(options).getTempDir());
    }

    @Test
    @DisplayName("Should reject unsupported schemes by name")
    void testFromMap_UnsupportedScheme() {
        Map<String, String> options = baseOptions();
        options.put("tempdir", "gs://bucket/dir");

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> Parameters.fromMap(options));
        assertTrue(ex.getMessage().contains("'gs'"));
    }

    // ============================================================================
    // Value validation
    // ============================================================================

    @Test
    @DisplayName("Should reject malformed option values")
    void testFromMap_InvalidValues() {
        Map<String, String> badBoolean = baseOptions();
        badBoolean.put("usestagingtable", "yes");
        Map<String, String> badTimeout = baseOptions();
        badTimeout.put("querytimeout", "soon");
        Map<String, String> badStyle = baseOptions();
        badStyle.put("diststyle", "RANDOM");
        Map<String, String> badTable = baseOptions();
        badTable.put("dbtable", "users; DROP TABLE users");

        assertThrows(ConfigurationException.class, () -> Parameters.fromMap(badBoolean));
        assertThrows(ConfigurationException.class, () -> Parameters.fromMap(badTimeout));
        assertThrows(ConfigurationException.class, () -> Parameters.fromMap(badStyle));
        assertThrows(ConfigurationException.class, () -> Parameters.fromMap(badTable));
    }

    @Test
    @DisplayName("Should reject non-positive maxlength overrides")
    void testBuilder_InvalidMaxLengthOverride() {
        assertThrows(ConfigurationException.class, () -> Parameters.builder()
                .url("jdbc:redshift://foo/bar")
                .tempDir("s3a://bucket/dir")
                .table("t")
                .maxLengthOverride("name", 0)
                .build());
    }
}
