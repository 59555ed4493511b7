package com.di.streamshift.storage;

import com.di.streamshift.config.StreamShiftProperties;
import com.di.streamshift.exception.StagingIOException;
import lombok.extern.slf4j.Slf4j;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Hands out a fresh, never reused sub-directory of the staging root for each operation.
 * Staged files are left in place afterwards; an object-store lifecycle rule expires them.
 */
@Slf4j
public class StagingPathAllocator {

    private final Supplier<String> idSupplier;
    private final StreamShiftProperties.Staging settings;

    public StagingPathAllocator(StreamShiftProperties.Staging settings) {
        this(settings, () -> UUID.randomUUID().toString().replace("-", ""));
    }

    public StagingPathAllocator(StreamShiftProperties.Staging settings, Supplier<String> idSupplier) {
        this.settings   = settings;
        this.idSupplier = idSupplier;
    }

    /**
     * @param root staging root, already validated by {@code StagingUris.requireStreamingScheme}
     */
    public StagingLocation allocate(String root) {
        String id = idSupplier.get();
        return new StagingLocation(id, StagingUris.withTrailingSlash(StagingUris.join(root, id)));
    }

    /**
     * Warns (or installs a rule) when no lifecycle rule expires objects under {@code root}.
     * Lookup failures are logged and do not stop the operation.
     */
    public void checkLifecycle(StagingStorage storage, String root) {
        if (!settings.isLifecycleCheck()) {
            return;
        }
        String bucket = StagingUris.bucket(root);
        String prefix = StagingUris.key(root);
        try {
            if (storage.hasLifecycleRule(bucket, prefix)) {
                return;
            }
            if (settings.isAutoConfigureLifecycle()) {
                storage.configureLifecycleRule(bucket, prefix, settings.getExpireAfterDays());
            } else {
                log.warn("[STAGING] bucket '{}' has no lifecycle rule covering '{}'; staged files will not expire. "
                        + "Add an expiration rule or enable streamshift.staging.auto-configure-lifecycle", bucket, prefix);
            }
        } catch (StagingIOException e) {
            log.warn("[STAGING] could not check lifecycle configuration of bucket '{}': {}", bucket, e.getMessage());
        }
    }
}
