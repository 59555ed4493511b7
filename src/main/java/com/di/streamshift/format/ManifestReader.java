package com.di.streamshift.format;

import com.di.streamshift.exception.StagingIOException;
import com.di.streamshift.storage.StagingStorage;
import com.di.streamshift.storage.StagingUris;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a {@link StagingManifest} back from staging storage.
 */
@Slf4j
public class ManifestReader {

    private final StagingStorage storage;
    private final ObjectMapper   objectMapper;

    public ManifestReader(StagingStorage storage) {
        this.storage      = storage;
        this.objectMapper = new ObjectMapper();
    }

    public StagingManifest read(String manifestUri) {
        byte[] bytes = storage.readFile(manifestUri);
        try {
            StagingManifest manifest = objectMapper.readValue(bytes, StagingManifest.class);
            log.debug("[STAGING] manifest read: {} entries from {}", manifest.getEntries().size(), manifestUri);
            return manifest;
        } catch (IOException e) {
            throw new StagingIOException("Failed to parse manifest " + manifestUri, e);
        }
    }

    /**
     * Entry URLs rewritten into the scheme of {@code stagingUri}, so the staging client can read them.
     */
    public List<String> fileUris(StagingManifest manifest, String stagingUri) {
        List<String> uris = new ArrayList<>();
        for (StagingManifest.Entry entry : manifest.getEntries()) {
            String url = entry.getUrl();
            uris.add(StagingUris.uri(stagingUri, StagingUris.bucket(url), StagingUris.key(url)));
        }
        return uris;
    }
}
