package com.di.streamshift.storage;

import com.amazonaws.auth.AWSCredentialsProvider;
import com.di.streamshift.exception.StagingIOException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Staging storage held in a map, keyed by full URI. Also its own factory.
 */
public class InMemoryStagingStorage implements StagingStorage, StagingStorageFactory {

    public final Map<String, byte[]> files = new ConcurrentSkipListMap<>();
    public final List<String> lifecycleRules = new ArrayList<>();
    public boolean hasRule;
    public String failPutsMatching;

    @Override
    public StagingStorage create(AWSCredentialsProvider credentials) {
        return this;
    }

    @Override
    public void putFile(String uri, byte[] bytes) {
        if (failPutsMatching != null && uri.contains(failPutsMatching)) {
            throw new StagingIOException("Failed to write staging file " + uri, new IOException("injected"));
        }
        files.put(uri, bytes.clone());
    }

    @Override
    public byte[] readFile(String uri) {
        byte[] bytes = files.get(uri);
        if (bytes == null) {
            throw new StagingIOException("Failed to read staging file " + uri, new IOException("not found"));
        }
        return bytes;
    }

    @Override
    public List<String> listChildren(String dirUri) {
        String prefix = StagingUris.withTrailingSlash(dirUri);
        List<String> out = new ArrayList<>();
        for (String uri : files.keySet()) {
            if (uri.startsWith(prefix)) {
                out.add(uri);
            }
        }
        return out;
    }

    @Override
    public void deleteRecursive(String dirUri) {
        listChildren(dirUri).forEach(files::remove);
    }

    @Override
    public boolean hasLifecycleRule(String bucket, String prefix) {
        return hasRule;
    }

    @Override
    public void configureLifecycleRule(String bucket, String prefix, int expireAfterDays) {
        lifecycleRules.add(bucket + "/" + prefix + ":" + expireAfterDays);
        hasRule = true;
    }

    public List<String> filesUnder(String dirUri) {
        return listChildren(dirUri);
    }
}
