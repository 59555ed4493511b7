package com.di.streamshift.storage;

/**
 * A freshly allocated staging directory owned by one read or write.
 *
 * @param id           unique suffix, shared with the staging table name of a write
 * @param directoryUri directory URI in the configured scheme, ending with {@code /}
 */
public record StagingLocation(String id, String directoryUri) {

    public static final String MANIFEST_FILE = "manifest";

    /** {@code <dir>/part-NNNNN.avro}. */
    public String partFile(int partition) {
        return directoryUri + String.format("part-%05d.avro", partition);
    }

    public String manifestUri() {
        return directoryUri + MANIFEST_FILE;
    }

    /** Directory as referenced from warehouse SQL ({@code s3://}). */
    public String warehouseDirectoryUri() {
        return StagingUris.toWarehouseUri(directoryUri);
    }

    public String warehouseManifestUri() {
        return StagingUris.toWarehouseUri(manifestUri());
    }
}
