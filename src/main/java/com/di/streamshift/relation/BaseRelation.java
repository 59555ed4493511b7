package com.di.streamshift.relation;

import com.di.streamshift.filter.Filter;
import com.di.streamshift.schema.TableSchema;

import java.util.List;

/**
 * A table-like source the engine can plan against. What else it can do is declared by the
 * capability interfaces it implements ({@link PrunedFilteredScan}, {@link InsertableRelation}).
 */
public interface BaseRelation {

    TableSchema schema();

    /** Filters this relation cannot evaluate itself; the engine must apply them after the scan. */
    default List<Filter> unhandledFilters(List<Filter> filters) {
        return filters;
    }
}
