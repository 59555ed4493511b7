package com.di.streamshift.storage;

import com.amazonaws.auth.AWSCredentialsProvider;

/**
 * Creates the storage client for one operation.
 */
@FunctionalInterface
public interface StagingStorageFactory {

    StagingStorage create(AWSCredentialsProvider credentials);
}
