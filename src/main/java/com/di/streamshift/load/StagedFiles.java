package com.di.streamshift.load;

import com.di.streamshift.storage.StagingLocation;

/**
 * Result of staging one batch: the files are listed by the manifest at {@code location.manifestUri()}.
 */
public record StagedFiles(StagingLocation location, int fileCount, long rowCount, long totalBytes) {
}
