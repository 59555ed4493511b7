package com.di.streamshift.load;

import com.di.streamshift.exception.StagingIOException;
import com.di.streamshift.exception.StreamShiftException;
import com.di.streamshift.format.AvroBatchWriter;
import com.di.streamshift.format.ManifestWriter;
import com.di.streamshift.format.StagingManifest;
import com.di.streamshift.schema.Row;
import com.di.streamshift.schema.RowBatch;
import com.di.streamshift.schema.TableSchema;
import com.di.streamshift.storage.StagingLocation;
import com.di.streamshift.storage.StagingStorage;
import com.di.streamshift.storage.StagingUris;
import lombok.extern.slf4j.Slf4j;
import org.apache.avro.Schema;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

/**
 * Persists a {@link RowBatch} to its staging location: one Avro file per partition, written in
 * parallel, then a manifest listing them. Runs before any warehouse statement.
 */
@Slf4j
public class StagingWriter {

    private final int maxConcurrent;

    public StagingWriter(int maxConcurrent) {
        this.maxConcurrent = Math.max(1, maxConcurrent);
    }

    /**
     * @param schema     schema of the target table (max-length overrides applied)
     * @param avroSchema {@link AvroBatchWriter#avroSchema} of {@code schema}
     * @throws StagingIOException     when a file or the manifest cannot be written
     * @throws com.di.streamshift.exception.SchemaMappingException when a value does not fit its column
     */
    public StagedFiles write(StagingStorage storage, StagingLocation location, TableSchema schema,
                             Schema avroSchema, RowBatch batch) {
        List<List<Row>> partitions = batch.partitions().isEmpty() ? List.of(List.of()) : batch.partitions();
        StagingManifest.Entry[] entries = new StagingManifest.Entry[partitions.size()];

        runParallel(partitions.size(), i -> {
            String uri = location.partFile(i);
            byte[] bytes = AvroBatchWriter.write(schema, avroSchema, partitions.get(i));
            storage.putFile(uri, bytes);
            entries[i] = StagingManifest.Entry.builder()
                    .url(StagingUris.toWarehouseUri(uri))
                    .mandatory(true)
                    .meta(new StagingManifest.Meta(bytes.length))
                    .build();
        });

        long totalBytes = 0;
        for (StagingManifest.Entry e : entries) {
            totalBytes += e.getMeta().getContentLength();
        }
        new ManifestWriter(storage).write(location.manifestUri(),
                StagingManifest.builder().entries(new ArrayList<>(Arrays.asList(entries))).build());
        log.info("[STAGING] staged {} rows in {} file(s), {} bytes → {}",
                batch.rowCount(), entries.length, totalBytes, location.directoryUri());
        return new StagedFiles(location, entries.length, batch.rowCount(), totalBytes);
    }

    /**
     * Runs {@code task} for every partition index on a fixed pool, waits for all of them, and
     * rethrows the first failure with the others attached as suppressed.
     */
    private void runParallel(int count, PartitionTask task) {
        ThreadFactory   tf       = r -> { var t = new Thread(r, "staging-writer"); t.setDaemon(true); return t; };
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(maxConcurrent, count), tf);
        Map<String, String> mdc  = MDC.getCopyOfContextMap();

        ConcurrentLinkedQueue<Throwable> errors  = new ConcurrentLinkedQueue<>();
        List<CompletableFuture<Void>>    futures = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int partition = i;
            futures.add(CompletableFuture
                    .runAsync(() -> {
                        if (mdc != null) {
                            MDC.setContextMap(mdc);
                        }
                        try {
                            task.run(partition);
                        } finally {
                            MDC.clear();
                        }
                    }, executor)
                    // keep allOf() waiting for every partition
                    .exceptionally(ex -> {
                        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                        log.error("[STAGING] partition {} FAILED: {}", partition, cause.getMessage());
                        errors.add(cause);
                        return null;
                    }));
        }

        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).get();
        } catch (ExecutionException e) {
            throw new StagingIOException("Staging write failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StagingIOException("Staging write interrupted", e);
        } finally {
            executor.shutdownNow();
        }

        if (!errors.isEmpty()) {
            Throwable first = errors.poll();
            StreamShiftException failure = first instanceof StreamShiftException sse
                    ? sse
                    : new StagingIOException(String.format("Staging write failed for %d of %d partition(s)",
                            errors.size() + 1, count), first);
            errors.forEach(failure::addSuppressed);
            throw failure;
        }
    }

    @FunctionalInterface
    private interface PartitionTask {
        void run(int partition);
    }
}
