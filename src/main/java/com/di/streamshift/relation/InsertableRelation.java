package com.di.streamshift.relation;

import com.di.streamshift.schema.RowBatch;

/** Insert capability. */
public interface InsertableRelation extends BaseRelation {

    /** Appends {@code data}, or replaces the table contents when {@code overwrite} is set. */
    void insert(RowBatch data, boolean overwrite);
}
