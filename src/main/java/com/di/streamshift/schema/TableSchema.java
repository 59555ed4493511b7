package com.di.streamshift.schema;

import com.di.streamshift.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered list of columns. Column lookup is case-insensitive, matching the warehouse's
 * identifier folding.
 */
public final class TableSchema {

    private final List<Column> columns;

    private TableSchema(List<Column> columns) {
        this.columns = List.copyOf(columns);
    }

    public static TableSchema of(Column... columns) {
        return new TableSchema(Arrays.asList(columns));
    }

    public static TableSchema of(List<Column> columns) {
        return new TableSchema(columns);
    }

    public List<Column> columns() {
        return columns;
    }

    public int size() {
        return columns.size();
    }

    public Column column(int index) {
        return columns.get(index);
    }

    public List<String> names() {
        List<String> names = new ArrayList<>(columns.size());
        for (Column c : columns) {
            names.add(c.name());
        }
        return names;
    }

    public Optional<Column> find(String name) {
        for (Column c : columns) {
            if (c.name().equalsIgnoreCase(name)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    public int indexOf(String name) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equalsIgnoreCase(name)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Projects this schema onto {@code requiredColumns}, in the requested order.
     *
     * @throws ConfigurationException if a requested column is unknown
     */
    public TableSchema project(List<String> requiredColumns) {
        List<Column> projected = new ArrayList<>(requiredColumns.size());
        for (String name : requiredColumns) {
            projected.add(find(name).orElseThrow(() ->
                    new ConfigurationException("Unknown column in projection: " + name)));
        }
        return new TableSchema(projected);
    }

    /**
     * Fails when two columns fold to the same lower-case name.
     *
     * @throws ConfigurationException naming both colliding columns
     */
    public void requireUnambiguousNames() {
        Map<String, String> seen = new HashMap<>();
        for (Column c : columns) {
            String folded = c.name().toLowerCase(Locale.ROOT);
            String previous = seen.putIfAbsent(folded, c.name());
            if (previous != null) {
                throw new ConfigurationException(String.format(
                        "Column names '%s' and '%s' are ambiguous: the warehouse folds identifiers to lower case",
                        previous, c.name()));
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TableSchema other && columns.equals(other.columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return "TableSchema" + columns;
    }
}
