package com.di.streamshift.storage;

import com.di.streamshift.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for StagingUris.
 */
@DisplayName("StagingUris Tests")
class StagingUrisTest {

    @Test
    @DisplayName("Should rewrite streaming schemes to s3:// for warehouse SQL")
    void testToWarehouseUri() {
        assertEquals("s3://bucket/dir/file", StagingUris.toWarehouseUri("s3a://bucket/dir/file"));
        assertEquals("s3://bucket/dir/file", StagingUris.toWarehouseUri("s3n://bucket/dir/file"));
        assertEquals("s3://bucket/dir/file", StagingUris.toWarehouseUri("s3://bucket/dir/file"));
    }

    @Test
    @DisplayName("Should split bucket and key")
    void testBucketAndKey() {
        assertEquals("bucket", StagingUris.bucket("s3a://bucket/a/b/c"));
        assertEquals("a/b/c", StagingUris.key("s3a://bucket/a/b/c"));
        assertEquals("", StagingUris.key("s3a://bucket"));
        assertEquals("s3n://other/x/y", StagingUris.uri("s3n://bucket/a", "other", "x/y"));
    }

    @Test
    @DisplayName("Should join paths with a single slash")
    void testJoin() {
        assertEquals("s3a://b/dir/child", StagingUris.join("s3a://b/dir", "child"));
        assertEquals("s3a://b/dir/child", StagingUris.join("s3a://b/dir/", "child"));
    }

    @Test
    @DisplayName("Should reject URIs that could break out of a SQL literal")
    void testRequireStreamingScheme_Breakout() {
        assertThrows(ConfigurationException.class,
                () -> StagingUris.requireStreamingScheme("s3a://bucket/dir';DROP"));
    }

    @Test
    @DisplayName("Should reject URIs without a bucket")
    void testRequireStreamingScheme_NoBucket() {
        assertThrows(ConfigurationException.class, () -> StagingUris.requireStreamingScheme("s3a:///dir"));
    }
}
