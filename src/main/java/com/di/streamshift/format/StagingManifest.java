package com.di.streamshift.format;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Warehouse manifest: the exact list of files a COPY must load, or an UNLOAD wrote.
 *
 * <pre>
 * {"entries": [{"url": "s3://bucket/dir/part-00000.avro", "mandatory": true,
 *               "meta": {"content_length": 1234}}]}
 * </pre>
 *
 * URLs use the warehouse's {@code s3://} scheme. UNLOAD manifests may omit {@code mandatory}
 * and carry extra fields, which are ignored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StagingManifest {

    @Builder.Default
    private List<Entry> entries = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Entry {

        private String  url;

        /** COPY fails when a mandatory file is missing. */
        private Boolean mandatory;

        private Meta    meta;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Meta {

        @JsonProperty("content_length")
        private long contentLength;
    }
}
