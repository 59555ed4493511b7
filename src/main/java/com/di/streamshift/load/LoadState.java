package com.di.streamshift.load;

/**
 * Progress of one write. {@link #ABORTING} is entered from any non-terminal state on failure
 * and always passes through {@link #CLEANUP} to {@link #FAILED}.
 */
public enum LoadState {
    START,
    STAGING_TABLE_CREATED,
    DATA_COPIED,
    VERIFIED,
    SWAPPED,
    MERGED,
    CLEANUP,
    DONE,
    /** Save mode {@code IGNORE} found an existing target; nothing was written. */
    SKIPPED,
    ABORTING,
    FAILED
}
