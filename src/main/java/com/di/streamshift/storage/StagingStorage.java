package com.di.streamshift.storage;

import java.util.List;

/**
 * Object-store capability used for staging. URIs are full {@code s3a://} / {@code s3n://}
 * URIs; "directories" are key prefixes ending in {@code /}.
 */
public interface StagingStorage {

    void putFile(String uri, byte[] bytes);

    byte[] readFile(String uri);

    /** URIs of every object stored under {@code dirUri}. */
    List<String> listChildren(String dirUri);

    void deleteRecursive(String dirUri);

    /** Whether an enabled lifecycle rule expires objects under {@code prefix}. */
    boolean hasLifecycleRule(String bucket, String prefix);

    /** Adds a rule expiring objects under {@code prefix} after {@code expireAfterDays}. */
    void configureLifecycleRule(String bucket, String prefix, int expireAfterDays);
}
