package com.di.streamshift.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Process-wide defaults. Per-operation settings travel in {@link Parameters}.
 *
 * <pre>
 * streamshift:
 *   staging:
 *     write-concurrency: 4
 *     lifecycle-check: true
 *     auto-configure-lifecycle: false
 *     expire-after-days: 1
 *   warehouse:
 *     default-query-timeout-sec: 0
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "streamshift")
public class StreamShiftProperties {

    private Staging   staging   = new Staging();
    private Warehouse warehouse = new Warehouse();

    @Data
    public static class Staging {

        /** Parallel writers used to stage row partitions. */
        private int writeConcurrency = 4;

        /** Warn when no enabled lifecycle rule covers the staging prefix. */
        private boolean lifecycleCheck = true;

        /** Install an expiration rule instead of only warning. */
        private boolean autoConfigureLifecycle = false;

        private int expireAfterDays = 1;
    }

    @Data
    public static class Warehouse {

        /** Per-statement timeout in seconds; 0 = none. */
        private int defaultQueryTimeoutSec = 0;
    }
}
