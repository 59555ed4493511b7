package com.di.streamshift.schema;

import java.util.ArrayList;
import java.util.List;

/**
 * In-memory batch handed to a write: a schema plus rows split into partitions.
 * Each partition is staged as its own intermediate file.
 */
public final class RowBatch {

    private final TableSchema schema;
    private final List<List<Row>> partitions;

    private RowBatch(TableSchema schema, List<List<Row>> partitions) {
        this.schema = schema;
        List<List<Row>> copy = new ArrayList<>(partitions.size());
        for (List<Row> p : partitions) {
            copy.add(List.copyOf(p));
        }
        this.partitions = List.copyOf(copy);
    }

    public static RowBatch of(TableSchema schema, List<Row> rows) {
        return new RowBatch(schema, List.of(rows));
    }

    public static RowBatch partitioned(TableSchema schema, List<List<Row>> partitions) {
        return new RowBatch(schema, partitions);
    }

    public static RowBatch empty(TableSchema schema) {
        return new RowBatch(schema, List.of());
    }

    public TableSchema schema() {
        return schema;
    }

    public List<List<Row>> partitions() {
        return partitions;
    }

    public long rowCount() {
        long n = 0;
        for (List<Row> p : partitions) {
            n += p.size();
        }
        return n;
    }
}
