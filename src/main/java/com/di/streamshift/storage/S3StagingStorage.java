package com.di.streamshift.storage;

import com.amazonaws.AmazonClientException;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.model.BucketLifecycleConfiguration;
import com.amazonaws.services.s3.model.DeleteObjectsRequest;
import com.amazonaws.services.s3.model.ListObjectsV2Request;
import com.amazonaws.services.s3.model.ListObjectsV2Result;
import com.amazonaws.services.s3.model.ObjectMetadata;
import com.amazonaws.services.s3.model.S3Object;
import com.amazonaws.services.s3.model.S3ObjectSummary;
import com.amazonaws.services.s3.model.lifecycle.LifecycleFilter;
import com.amazonaws.services.s3.model.lifecycle.LifecycleFilterPredicate;
import com.amazonaws.services.s3.model.lifecycle.LifecyclePrefixPredicate;
import com.amazonaws.util.IOUtils;
import com.di.streamshift.exception.StagingIOException;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * {@link StagingStorage} over the AWS SDK S3 client.
 */
@Slf4j
public class S3StagingStorage implements StagingStorage {

    private static final int DELETE_BATCH = 1000;

    private final AmazonS3 s3Client;

    public S3StagingStorage(AmazonS3 s3Client) {
        this.s3Client = s3Client;
    }

    @Override
    public void putFile(String uri, byte[] bytes) {
        String bucket = StagingUris.bucket(uri);
        String key    = StagingUris.key(uri);
        ObjectMetadata metadata = new ObjectMetadata();
        metadata.setContentLength(bytes.length);
        try {
            s3Client.putObject(bucket, key, new ByteArrayInputStream(bytes), metadata);
            log.debug("[STAGING] put {} ({} bytes)", uri, bytes.length);
        } catch (AmazonClientException e) {
            throw new StagingIOException("Failed to write staging file " + uri, e);
        }
    }

    @Override
    public byte[] readFile(String uri) {
        try (S3Object object = s3Client.getObject(StagingUris.bucket(uri), StagingUris.key(uri));
             InputStream in = object.getObjectContent()) {
            return IOUtils.toByteArray(in);
        } catch (AmazonClientException | IOException e) {
            throw new StagingIOException("Failed to read staging file " + uri, e);
        }
    }

    @Override
    public List<String> listChildren(String dirUri) {
        String bucket = StagingUris.bucket(dirUri);
        String prefix = StagingUris.key(StagingUris.withTrailingSlash(dirUri));
        List<String> children = new ArrayList<>();
        try {
            ListObjectsV2Request request = new ListObjectsV2Request()
                    .withBucketName(bucket)
                    .withPrefix(prefix);
            ListObjectsV2Result result;
            do {
                result = s3Client.listObjectsV2(request);
                for (S3ObjectSummary summary : result.getObjectSummaries()) {
                    children.add(StagingUris.uri(dirUri, bucket, summary.getKey()));
                }
                request.setContinuationToken(result.getNextContinuationToken());
            } while (result.isTruncated());
        } catch (AmazonClientException e) {
            throw new StagingIOException("Failed to list staging directory " + dirUri, e);
        }
        return children;
    }

    @Override
    public void deleteRecursive(String dirUri) {
        String bucket = StagingUris.bucket(dirUri);
        List<String> keys = new ArrayList<>();
        for (String child : listChildren(dirUri)) {
            keys.add(StagingUris.key(child));
        }
        try {
            for (int i = 0; i < keys.size(); i += DELETE_BATCH) {
                List<String> batch = keys.subList(i, Math.min(i + DELETE_BATCH, keys.size()));
                s3Client.deleteObjects(new DeleteObjectsRequest(bucket)
                        .withKeys(batch.toArray(String[]::new))
                        .withQuiet(true));
            }
            log.info("[STAGING] deleted {} objects under {}", keys.size(), dirUri);
        } catch (AmazonClientException e) {
            throw new StagingIOException("Failed to delete staging directory " + dirUri, e);
        }
    }

    @Override
    public boolean hasLifecycleRule(String bucket, String prefix) {
        BucketLifecycleConfiguration config;
        try {
            config = s3Client.getBucketLifecycleConfiguration(bucket);
        } catch (AmazonClientException e) {
            throw new StagingIOException("Failed to read lifecycle configuration of bucket " + bucket, e);
        }
        if (config == null || config.getRules() == null) {
            return false;
        }
        for (BucketLifecycleConfiguration.Rule rule : config.getRules()) {
            if (BucketLifecycleConfiguration.ENABLED.equals(rule.getStatus())
                    && prefix.startsWith(rulePrefix(rule))) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void configureLifecycleRule(String bucket, String prefix, int expireAfterDays) {
        try {
            BucketLifecycleConfiguration config = s3Client.getBucketLifecycleConfiguration(bucket);
            List<BucketLifecycleConfiguration.Rule> rules = new ArrayList<>();
            if (config != null && config.getRules() != null) {
                rules.addAll(config.getRules());
            }
            rules.add(new BucketLifecycleConfiguration.Rule()
                    .withId("streamshift-staging-" + UUID.randomUUID())
                    .withFilter(new LifecycleFilter(new LifecyclePrefixPredicate(prefix)))
                    .withExpirationInDays(expireAfterDays)
                    .withStatus(BucketLifecycleConfiguration.ENABLED));
            s3Client.setBucketLifecycleConfiguration(bucket, new BucketLifecycleConfiguration(rules));
            log.info("[STAGING] lifecycle rule added: s3://{}/{}* expires after {} day(s)", bucket, prefix, expireAfterDays);
        } catch (AmazonClientException e) {
            throw new StagingIOException("Failed to configure lifecycle rule on bucket " + bucket, e);
        }
    }

    @SuppressWarnings("deprecation")
    private static String rulePrefix(BucketLifecycleConfiguration.Rule rule) {
        LifecycleFilter filter = rule.getFilter();
        if (filter != null) {
            LifecycleFilterPredicate predicate = filter.getPredicate();
            if (predicate instanceof LifecyclePrefixPredicate p) {
                return p.getPrefix() == null ? "" : p.getPrefix();
            }
            // tag or AND predicates do not cover arbitrary staging objects
            return predicate == null ? "" : "\u0000";
        }
        return rule.getPrefix() == null ? "" : rule.getPrefix();
    }
}
