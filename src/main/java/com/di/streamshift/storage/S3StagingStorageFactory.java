package com.di.streamshift.storage;

import com.amazonaws.ClientConfiguration;
import com.amazonaws.auth.AWSCredentialsProvider;
import com.amazonaws.regions.DefaultAwsRegionProviderChain;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds {@link S3StagingStorage} instances. Region comes from the default provider chain,
 * falling back to {@code us-east-1}.
 */
@Slf4j
public class S3StagingStorageFactory implements StagingStorageFactory {

    private static final int SOCKET_TIMEOUT_MS  = 15 * 60 * 1000;
    private static final int CONNECT_TIMEOUT_MS = 60 * 1000;

    @Override
    public StagingStorage create(AWSCredentialsProvider credentials) {
        ClientConfiguration clientConfig = new ClientConfiguration();
        clientConfig.setSocketTimeout(SOCKET_TIMEOUT_MS);
        clientConfig.setConnectionTimeout(CONNECT_TIMEOUT_MS);

        String region;
        try {
            region = new DefaultAwsRegionProviderChain().getRegion();
        } catch (Exception e) {
            log.debug("[STAGING] no region from provider chain ({}); using us-east-1", e.getMessage());
            region = "us-east-1";
        }
        return new S3StagingStorage(AmazonS3ClientBuilder.standard()
                .withClientConfiguration(clientConfig)
                .withCredentials(credentials)
                .withRegion(region)
                .build());
    }
}
