package com.di.streamshift.util;

import com.di.streamshift.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for InputValidator utility class.
 */
@DisplayName("InputValidator Tests")
class InputValidatorTest {

    // ============================================================================
    // Table Name Validation Tests
    // ============================================================================

    @ParameterizedTest
    @ValueSource(strings = {"users", "user_data", "user$table", "_private_table", "schema.users",
            "\"MixedCase\"", "s.\"T\"", "\"with \"\"quote\"\"\""})
    @DisplayName("Should accept plain, qualified and quoted table names")
    void testValidateTableName_ValidNames(String tableName) {
        assertEquals(tableName, InputValidator.validateTableName(tableName));
    }

    @Test
    @DisplayName("Should reject null and empty table names")
    void testValidateTableName_NullOrEmpty() {
        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> InputValidator.validateTableName(null));
        assertTrue(ex.getMessage().contains("cannot be null or empty"));
        assertThrows(ConfigurationException.class, () -> InputValidator.validateTableName("  "));
    }

    @Test
    @DisplayName("Should reject table names with SQL injection patterns")
    void testValidateTableName_SqlInjection() {
        String[] sqlInjectionPatterns = {
            "users; DROP TABLE users--",
            "users' OR '1'='1",
            "users UNION SELECT * FROM",
            "users/*comment*/",
            "a.b.c"
        };

        for (String pattern : sqlInjectionPatterns) {
            assertThrows(ConfigurationException.class, () -> InputValidator.validateTableName(pattern), pattern);
        }
    }

    @Test
    @DisplayName("Should reject identifiers exceeding max length")
    void testValidateTableName_TooLong() {
        assertDoesNotThrow(() -> InputValidator.validateTableName("a".repeat(127)));
        assertThrows(ConfigurationException.class, () -> InputValidator.validateTableName("a".repeat(128)));
    }

    @Test
    @DisplayName("Should split on the first dot outside quotes")
    void testSplitQualified() {
        assertArrayEquals(new String[] {"s", "t"}, InputValidator.splitQualified("s.t"));
        assertArrayEquals(new String[] {"\"a.b\"", "t"}, InputValidator.splitQualified("\"a.b\".t"));
        assertArrayEquals(new String[] {"\"a.b\""}, InputValidator.splitQualified("\"a.b\""));
    }

    // ============================================================================
    // Clause Validation Tests
    // ============================================================================

    @ParameterizedTest
    @ValueSource(strings = {"SORTKEY(id)", "COMPOUND SORTKEY(id, name)", "interleaved sortkey (a,b)"})
    @DisplayName("Should accept sort key specs")
    void testValidateSortKeySpec_Valid(String spec) {
        assertEquals(spec, InputValidator.validateSortKeySpec(spec));
    }

    @ParameterizedTest
    @ValueSource(strings = {"SORTKEY(id); DROP TABLE x", "id", "SORTKEY()"})
    @DisplayName("Should reject malformed sort key specs")
    void testValidateSortKeySpec_Invalid(String spec) {
        assertThrows(ConfigurationException.class, () -> InputValidator.validateSortKeySpec(spec));
    }

    @Test
    @DisplayName("Should normalise dist styles to upper case")
    void testValidateDistStyle() {
        assertEquals("KEY", InputValidator.validateDistStyle("key"));
        assertNull(InputValidator.validateDistStyle(null));
        assertThrows(ConfigurationException.class, () -> InputValidator.validateDistStyle("RANDOM"));
    }

    @Test
    @DisplayName("Should reject values that could break out of a SQL literal")
    void testValidateNoBreakout() {
        assertEquals("s3a://bucket/dir", InputValidator.validateNoBreakout("s3a://bucket/dir", "dir"));
        assertThrows(ConfigurationException.class, () -> InputValidator.validateNoBreakout("s3a://b/d';--", "dir"));
    }

    // ============================================================================
    // URL Validation Tests
    // ============================================================================

    @Test
    @DisplayName("Should validate JDBC URLs")
    void testValidateJdbcUrl() {
        assertEquals("jdbc:redshift://host:5439/db", InputValidator.validateJdbcUrl(" jdbc:redshift://host:5439/db "));
        assertThrows(ConfigurationException.class, () -> InputValidator.validateJdbcUrl("http://host"));
        assertThrows(ConfigurationException.class, () -> InputValidator.validateJdbcUrl(null));
    }

    @Test
    @DisplayName("Should mask secrets before logging")
    void testSanitizeForLogging() {
        String sql = "COPY t FROM 's3://b/m' CREDENTIALS 'aws_access_key_id=AK;aws_secret_access_key=SECRET;token=TOK'";
        String masked = InputValidator.sanitizeForLogging(sql);

        assertFalse(masked.contains("SECRET"));
        assertFalse(masked.contains("TOK'"));
        assertTrue(masked.contains("aws_access_key_id=AK"));
        assertEquals("jdbc:redshift://h/db?user=u&password=***",
                InputValidator.sanitizeForLogging("jdbc:redshift://h/db?user=u&password=pw"));
        assertEquals("null", InputValidator.sanitizeForLogging(null));
    }
}
