package com.di.streamshift.config;

/** What a write does when the target table already exists. */
public enum SaveMode {
    /** Add rows to the target, creating it when missing. */
    APPEND,
    /** Replace the target's contents. Always loads through a staging table unless disabled. */
    OVERWRITE,
    /** Fail when the target exists. */
    ERROR_IF_EXISTS,
    /** Do nothing when the target exists. */
    IGNORE
}
