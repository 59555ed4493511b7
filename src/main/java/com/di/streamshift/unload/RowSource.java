package com.di.streamshift.unload;

import com.di.streamshift.exception.StagingIOException;
import com.di.streamshift.format.ManifestReader;
import com.di.streamshift.schema.Row;
import com.di.streamshift.schema.TableSchema;
import com.di.streamshift.storage.StagingLocation;
import com.di.streamshift.storage.StagingStorage;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Lazy handle on the files written by one UNLOAD. Files are enumerated from the UNLOAD manifest,
 * or by listing the directory when no manifest can be read. Row order across partitions is not
 * defined.
 */
@Slf4j
public class RowSource {

    private final StagingStorage  storage;
    private final StagingLocation location;
    private final TableSchema     schema;
    private List<RowPartition>    partitions;

    RowSource(StagingStorage storage, StagingLocation location, TableSchema schema) {
        this.storage  = storage;
        this.location = location;
        this.schema   = schema;
    }

    /** Schema of every returned row: the requested projection, in order. */
    public TableSchema schema() {
        return schema;
    }

    public StagingLocation location() {
        return location;
    }

    public synchronized List<RowPartition> partitions() {
        if (partitions == null) {
            List<RowPartition> found = new ArrayList<>();
            for (String uri : fileUris()) {
                found.add(new RowPartition(storage, uri, schema));
            }
            partitions = List.copyOf(found);
        }
        return partitions;
    }

    /** Every row of every partition, read sequentially. */
    public Stream<Row> rows() {
        return partitions().stream().flatMap(RowPartition::rows);
    }

    private List<String> fileUris() {
        ManifestReader reader = new ManifestReader(storage);
        try {
            return reader.fileUris(reader.read(location.manifestUri()), location.directoryUri());
        } catch (StagingIOException e) {
            log.warn("[UNLOAD] manifest {} unreadable ({}); listing {} instead",
                    location.manifestUri(), e.getMessage(), location.directoryUri());
        }
        List<String> files = new ArrayList<>();
        for (String uri : storage.listChildren(location.directoryUri())) {
            if (!uri.equals(location.manifestUri())) {
                files.add(uri);
            }
        }
        return files;
    }
}
