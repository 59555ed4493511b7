package com.di.streamshift.storage;

import com.di.streamshift.exception.ConfigurationException;
import com.di.streamshift.util.InputValidator;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;

/**
 * Parsing and rewriting of staging URIs ({@code s3a://bucket/key}, {@code s3n://bucket/key}).
 */
public final class StagingUris {

    /** Streaming filesystem schemes accepted for staging. */
    public static final Set<String> STREAMING_SCHEMES = Set.of("s3a", "s3n");

    private StagingUris() {}

    /**
     * Checks {@code uri} uses a streaming scheme.
     *
     * @return {@code uri} unchanged
     * @throws ConfigurationException naming the scheme when it is the legacy block scheme or unknown
     */
    public static String requireStreamingScheme(String uri) {
        String scheme = scheme(uri);
        if ("s3".equals(scheme)) {
            throw new ConfigurationException(String.format(
                    "Staging directory '%s' uses the S3 Block FileSystem scheme 's3://', which is not supported; "
                            + "use the streaming schemes s3a:// or s3n:// instead", uri));
        }
        if (!STREAMING_SCHEMES.contains(scheme)) {
            throw new ConfigurationException(String.format(
                    "Staging directory '%s' uses unsupported scheme '%s'; expected one of %s",
                    uri, scheme, STREAMING_SCHEMES));
        }
        InputValidator.validateNoBreakout(uri, "Staging directory");
        bucket(uri);
        return uri;
    }

    /** The same location as the warehouse addresses it: {@code s3a://} / {@code s3n://} → {@code s3://}. */
    public static String toWarehouseUri(String uri) {
        String scheme = scheme(uri);
        return STREAMING_SCHEMES.contains(scheme) ? "s3" + uri.substring(scheme.length()) : uri;
    }

    public static String bucket(String uri) {
        String host = parse(uri).getHost();
        if (host == null || host.isEmpty()) {
            throw new ConfigurationException("Staging URI has no bucket: " + uri);
        }
        return host;
    }

    /** Object key without the leading slash; empty for the bucket root. */
    public static String key(String uri) {
        String path = parse(uri).getRawPath();
        return path == null || path.isEmpty() ? "" : path.substring(1);
    }

    /** Rebuilds a URI for {@code key} in {@code bucket}, keeping the scheme of {@code like}. */
    public static String uri(String like, String bucket, String key) {
        return scheme(like) + "://" + bucket + "/" + key;
    }

    public static String join(String dir, String child) {
        return withTrailingSlash(dir) + child;
    }

    public static String withTrailingSlash(String uri) {
        return uri.endsWith("/") ? uri : uri + "/";
    }

    public static String scheme(String uri) {
        String scheme = parse(uri).getScheme();
        if (scheme == null) {
            throw new ConfigurationException("Staging URI has no scheme: " + uri);
        }
        return scheme.toLowerCase(Locale.ROOT);
    }

    private static URI parse(String uri) {
        try {
            return new URI(uri);
        } catch (URISyntaxException e) {
            throw new ConfigurationException("Malformed staging URI: " + uri, e);
        }
    }
}
