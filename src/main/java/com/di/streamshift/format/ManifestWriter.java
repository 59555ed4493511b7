package com.di.streamshift.format;

import com.di.streamshift.exception.StagingIOException;
import com.di.streamshift.storage.StagingStorage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * Serialises a {@link StagingManifest} to JSON and stores it next to the files it lists.
 */
@Slf4j
public class ManifestWriter {

    private final StagingStorage storage;
    private final ObjectMapper   objectMapper;

    public ManifestWriter(StagingStorage storage) {
        this.storage      = storage;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Writes the manifest to {@code manifestUri} and returns that URI.
     */
    public String write(String manifestUri, StagingManifest manifest) {
        byte[] json;
        try {
            json = objectMapper.writeValueAsBytes(manifest);
        } catch (JsonProcessingException e) {
            throw new StagingIOException("Failed to serialise manifest for " + manifestUri, e);
        }
        storage.putFile(manifestUri, json);
        log.info("[STAGING] manifest written: {} files → {}", manifest.getEntries().size(), manifestUri);
        return manifestUri;
    }
}
