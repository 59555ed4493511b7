package com.di.streamshift.config;

import com.amazonaws.auth.AWSCredentialsProvider;
import com.amazonaws.auth.DefaultAWSCredentialsProviderChain;
import com.di.streamshift.storage.S3StagingStorageFactory;
import com.di.streamshift.storage.StagingPathAllocator;
import com.di.streamshift.storage.StagingStorageFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the S3 staging client factory and the AWS credentials used both by that client and
 * in the warehouse's CREDENTIALS clause. Credentials come from the SDK default chain
 * (environment, system properties, profile, container, instance role).
 */
@Configuration
public class StagingStorageConfig {

    @Bean
    @ConditionalOnMissingBean(AWSCredentialsProvider.class)
    public AWSCredentialsProvider awsCredentialsProvider() {
        return DefaultAWSCredentialsProviderChain.getInstance();
    }

    @Bean
    @ConditionalOnMissingBean(StagingStorageFactory.class)
    public StagingStorageFactory stagingStorageFactory() {
        return new S3StagingStorageFactory();
    }

    @Bean
    @ConditionalOnMissingBean(StagingPathAllocator.class)
    public StagingPathAllocator stagingPathAllocator(StreamShiftProperties properties) {
        return new StagingPathAllocator(properties.getStaging());
    }
}
