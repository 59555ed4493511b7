package com.di.streamshift.relation;

import com.di.streamshift.filter.Filter;
import com.di.streamshift.unload.RowSource;

import java.util.List;

/** Scan capability with column pruning and filter pushdown. */
public interface PrunedFilteredScan extends BaseRelation {

    /**
     * @param requiredColumns columns to return, in order
     * @param filters         conjunction of predicates; unsupported ones may be ignored
     */
    RowSource buildScan(List<String> requiredColumns, List<Filter> filters);
}
