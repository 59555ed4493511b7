package com.di.streamshift.format;

import com.di.streamshift.exception.StagingIOException;
import com.di.streamshift.storage.InMemoryStagingStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for ManifestWriter and ManifestReader.
 */
@DisplayName("Staging Manifest Tests")
class StagingManifestTest {

    private static final String MANIFEST = "s3a://bucket/tmp/abc/manifest";

    private InMemoryStagingStorage storage;

    @BeforeEach
    void setUp() {
        storage = new InMemoryStagingStorage();
    }

    @Test
    @DisplayName("Should write entries with url, mandatory flag and content length")
    void testWrite() {
        StagingManifest manifest = StagingManifest.builder()
                .entries(List.of(StagingManifest.Entry.builder()
                        .url("s3://bucket/tmp/abc/part-00000.avro")
                        .mandatory(true)
                        .meta(new StagingManifest.Meta(1234))
                        .build()))
                .build();

        new ManifestWriter(storage).write(MANIFEST, manifest);

        String json = new String(storage.files.get(MANIFEST), StandardCharsets.UTF_8);
        assertEquals("{\"entries\":[{\"url\":\"s3://bucket/tmp/abc/part-00000.avro\",\"mandatory\":true,"
                + "\"meta\":{\"content_length\":1234}}]}", json);
    }

    @Test
    @DisplayName("Should read a warehouse-written manifest and ignore fields it does not know")
    void testRead_UnloadManifest() {
        storage.putFile(MANIFEST, ("{\"entries\":["
                + "{\"url\":\"s3://bucket/tmp/abc/0000_part_00\",\"meta\":{\"content_length\":10,\"record_count\":2}},"
                + "{\"url\":\"s3://bucket/tmp/abc/0001_part_00\",\"meta\":{\"content_length\":0,\"record_count\":0}}],"
                + "\"schema\":{\"elements\":[]},\"author\":{\"name\":\"warehouse\"}}").getBytes(StandardCharsets.UTF_8));

        ManifestReader reader = new ManifestReader(storage);
        StagingManifest manifest = reader.read(MANIFEST);

        assertEquals(2, manifest.getEntries().size());
        assertNull(manifest.getEntries().get(0).getMandatory());
        assertEquals(10, manifest.getEntries().get(0).getMeta().getContentLength());
        assertEquals(List.of("s3a://bucket/tmp/abc/0000_part_00", "s3a://bucket/tmp/abc/0001_part_00"),
                reader.fileUris(manifest, MANIFEST));
    }

    @Test
    @DisplayName("Should fail with a staging error on malformed JSON")
    void testRead_Malformed() {
        storage.putFile(MANIFEST, "{not json".getBytes(StandardCharsets.UTF_8));

        assertThrows(StagingIOException.class, () -> new ManifestReader(storage).read(MANIFEST));
    }

    @Test
    @DisplayName("Should fail with a staging error when the manifest is missing")
    void testRead_Missing() {
        assertThrows(StagingIOException.class, () -> new ManifestReader(storage).read(MANIFEST));
    }
}
