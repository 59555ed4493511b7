package com.di.streamshift.util;

import com.di.streamshift.exception.ErrorCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;

/**
 * Metrics for loads, unloads and staged bytes.
 */
@Slf4j
public class MetricsCollector {

    private final MeterRegistry meterRegistry;

    private final Timer loadTimer;
    private final Timer unloadTimer;
    private final Counter unloadCounter;
    private final Counter unloadErrorCounter;
    private final DistributionSummary stagingBytesDistribution;

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.loadTimer = Timer.builder("streamshift.load.duration")
                .description("Time taken by a write, staging included")
                .register(meterRegistry);

        this.unloadTimer = Timer.builder("streamshift.unload.duration")
                .description("Time taken by an UNLOAD")
                .register(meterRegistry);

        this.unloadCounter = Counter.builder("streamshift.unload.total")
                .description("Total number of unloads")
                .tag("status", "success")
                .register(meterRegistry);

        this.unloadErrorCounter = Counter.builder("streamshift.unload.total")
                .description("Total number of failed unloads")
                .tag("status", "error")
                .register(meterRegistry);

        this.stagingBytesDistribution = DistributionSummary.builder("streamshift.staging.bytes")
                .description("Bytes written to staging per write")
                .baseUnit("bytes")
                .register(meterRegistry);
    }

    public void recordLoad(long durationMs) {
        loadCounter("success", "NONE").increment();
        loadTimer.record(durationMs, TimeUnit.MILLISECONDS);
        log.debug("Recorded load: durationMs={}", durationMs);
    }

    /**
     * Records a failed write under its {@link ErrorCategory}.
     */
    public void recordLoadError(ErrorCategory category, long durationMs) {
        loadCounter("error", category.name()).increment();
        loadTimer.record(durationMs, TimeUnit.MILLISECONDS);
        log.debug("Recorded load error: category={}", category);
    }

    public void recordUnload(long durationMs) {
        unloadCounter.increment();
        unloadTimer.record(durationMs, TimeUnit.MILLISECONDS);
        log.debug("Recorded unload: durationMs={}", durationMs);
    }

    public void recordUnloadError() {
        unloadErrorCounter.increment();
        log.debug("Recorded unload error");
    }

    public void recordStagingBytes(long bytes) {
        stagingBytesDistribution.record(bytes);
    }

    private Counter loadCounter(String status, String category) {
        // Registration is idempotent: the registry returns the existing meter for the same id.
        return Counter.builder("streamshift.load.total")
                .description("Total number of writes")
                .tag("status", status)
                .tag("category", category)
                .register(meterRegistry);
    }
}
