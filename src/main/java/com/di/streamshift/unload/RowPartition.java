package com.di.streamshift.unload;

import com.di.streamshift.format.UnloadTextParser;
import com.di.streamshift.schema.Row;
import com.di.streamshift.schema.TableSchema;
import com.di.streamshift.storage.StagingStorage;

import java.io.ByteArrayInputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * One unloaded file. Nothing is fetched until {@link #rows()} is consumed, so partitions can be
 * handed to independent readers.
 */
public class RowPartition {

    private final StagingStorage storage;
    private final String uri;
    private final TableSchema schema;

    RowPartition(StagingStorage storage, String uri, TableSchema schema) {
        this.storage = storage;
        this.uri = uri;
        this.schema = schema;
    }

    public String uri() {
        return uri;
    }

    /** Rows of this file, fetched when the stream is first consumed. */
    public Stream<Row> rows() {
        return StreamSupport.stream(() -> {
            UnloadTextParser parser = new UnloadTextParser(new InputStreamReader(
                    new ByteArrayInputStream(storage.readFile(uri)), StandardCharsets.UTF_8), schema);
            return Spliterators.spliteratorUnknownSize(parser, Spliterator.ORDERED | Spliterator.NONNULL);
        }, Spliterator.ORDERED | Spliterator.NONNULL, false);
    }

    @Override
    public String toString() {
        return "RowPartition[" + uri + "]";
    }
}
