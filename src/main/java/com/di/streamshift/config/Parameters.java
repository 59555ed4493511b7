package com.di.streamshift.config;

import com.di.streamshift.exception.ConfigurationException;
import com.di.streamshift.storage.StagingUris;
import com.di.streamshift.util.InputValidator;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Validated, immutable settings of one read or write.
 *
 * <p>Invariants checked on construction:
 * <ul>
 *   <li>{@code url} and {@code tempDir} are present;</li>
 *   <li>exactly one of {@code table} / {@code query} is set;</li>
 *   <li>{@code tempDir} uses a streaming S3 scheme ({@code s3a://} or {@code s3n://});</li>
 *   <li>table name, dist style and sort key spec are safe to splice into SQL.</li>
 * </ul>
 */
@Value
public class Parameters {

    public static final String URL               = "url";
    public static final String TEMPDIR           = "tempdir";
    public static final String DBTABLE           = "dbtable";
    public static final String QUERY             = "query";
    public static final String USE_STAGING_TABLE = "usestagingtable";
    public static final String STAGED_APPEND     = "stagedappend";
    public static final String DIST_STYLE        = "diststyle";
    public static final String DIST_KEY          = "distkey";
    public static final String SORT_KEY_SPEC     = "sortkeyspec";
    public static final String POST_ACTIONS      = "postactions";
    public static final String QUERY_TIMEOUT     = "querytimeout";
    public static final String AWS_IAM_ROLE      = "aws_iam_role";

    String url;
    String tempDir;
    /** Target table, or a parenthesised subquery (read only). */
    String table;
    String query;
    boolean useStagingTable;
    boolean stagedAppend;
    String distStyle;
    String distKey;
    String sortKeySpec;
    List<String> postActions;
    /** Seconds; {@code null} falls back to the process default. */
    Integer queryTimeoutSec;
    String awsIamRole;
    /** Column name → VARCHAR length, applied on top of column metadata. */
    Map<String, Integer> maxLengthOverrides;

    @Builder
    private Parameters(String url, String tempDir, String table, String query,
                       Boolean useStagingTable, boolean stagedAppend,
                       String distStyle, String distKey, String sortKeySpec,
                       @Singular List<String> postActions, Integer queryTimeoutSec, String awsIamRole,
                       @Singular Map<String, Integer> maxLengthOverrides) {
        if (tempDir == null || tempDir.isBlank()) {
            throw new ConfigurationException("Parameter 'tempdir' is required");
        }
        this.tempDir         = StagingUris.requireStreamingScheme(tempDir.trim());
        this.url             = InputValidator.validateJdbcUrl(url);
        boolean hasTable = table != null && !table.isBlank();
        boolean hasQuery = query != null && !query.isBlank();
        if (hasTable == hasQuery) {
            throw new ConfigurationException(
                    "You must specify a table through parameter 'dbtable' or a query through parameter 'query', but not both");
        }
        this.table           = hasTable ? validateTableOrSubquery(table.trim()) : null;
        this.query           = hasQuery ? query.trim() : null;
        this.useStagingTable = useStagingTable == null || useStagingTable;
        this.stagedAppend    = stagedAppend;
        this.distStyle       = InputValidator.validateDistStyle(distStyle);
        this.distKey         = distKey == null ? null : distKey.trim();
        this.sortKeySpec     = InputValidator.validateSortKeySpec(sortKeySpec);
        this.postActions     = List.copyOf(postActions);
        if (queryTimeoutSec != null && queryTimeoutSec < 0) {
            throw new ConfigurationException("Parameter 'querytimeout' must not be negative: " + queryTimeoutSec);
        }
        this.queryTimeoutSec = queryTimeoutSec;
        this.awsIamRole      = awsIamRole == null || awsIamRole.isBlank()
                ? null : InputValidator.validateNoBreakout(awsIamRole.trim(), "Parameter 'aws_iam_role'");
        for (Map.Entry<String, Integer> e : maxLengthOverrides.entrySet()) {
            if (e.getValue() == null || e.getValue() <= 0) {
                throw new ConfigurationException("maxlength override for column '" + e.getKey() + "' must be positive");
            }
        }
        this.maxLengthOverrides = Map.copyOf(maxLengthOverrides);
    }

    /**
     * Parses the flat option map. Unknown keys are ignored.
     *
     * @throws ConfigurationException naming the first missing or invalid key
     */
    public static Parameters fromMap(Map<String, String> options) {
        Map<String, String> o = lowerCaseKeys(options);
        ParametersBuilder b = builder()
                .url(o.get(URL))
                .tempDir(o.get(TEMPDIR))
                .table(o.get(DBTABLE))
                .query(o.get(QUERY))
                .useStagingTable(o.containsKey(USE_STAGING_TABLE) ? parseBoolean(USE_STAGING_TABLE, o.get(USE_STAGING_TABLE)) : null)
                .stagedAppend(o.containsKey(STAGED_APPEND) && parseBoolean(STAGED_APPEND, o.get(STAGED_APPEND)))
                .distStyle(o.get(DIST_STYLE))
                .distKey(o.get(DIST_KEY))
                .sortKeySpec(o.get(SORT_KEY_SPEC))
                .awsIamRole(o.get(AWS_IAM_ROLE));
        if (o.containsKey(QUERY_TIMEOUT)) {
            b.queryTimeoutSec(parseInt(QUERY_TIMEOUT, o.get(QUERY_TIMEOUT)));
        }
        if (o.get(POST_ACTIONS) != null) {
            b.postActions(splitPostActions(o.get(POST_ACTIONS)));
        }
        return b.build();
    }

    /**
     * SQL source for reads: the table name, or {@code (query)}.
     */
    public String sourceExpression() {
        return table != null ? table : "(" + query + ")";
    }

    /**
     * Table name for writes.
     *
     * @throws ConfigurationException when this read-only configuration names a query
     */
    public String requireWritableTable() {
        if (table == null || table.startsWith("(")) {
            throw new ConfigurationException(
                    "For save operations you must specify a table name with parameter 'dbtable'; 'query' is read-only");
        }
        return table;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static String validateTableOrSubquery(String table) {
        if (table.startsWith("(") && table.endsWith(")")) {
            return table;
        }
        return InputValidator.validateTableName(table);
    }

    private static List<String> splitPostActions(String raw) {
        List<String> actions = new ArrayList<>();
        for (String s : raw.split(";")) {
            if (!s.isBlank()) {
                actions.add(s.trim());
            }
        }
        return actions;
    }

    private static Map<String, String> lowerCaseKeys(Map<String, String> options) {
        Map<String, String> out = new java.util.HashMap<>();
        for (Map.Entry<String, String> e : options.entrySet()) {
            out.put(e.getKey().toLowerCase(Locale.ROOT), e.getValue());
        }
        return out;
    }

    private static boolean parseBoolean(String key, String value) {
        if ("true".equalsIgnoreCase(value)) return true;
        if ("false".equalsIgnoreCase(value)) return false;
        throw new ConfigurationException("Parameter '" + key + "' must be true or false, got: " + value);
    }

    private static int parseInt(String key, String value) {
        if (value == null) {
            throw new ConfigurationException("Parameter '" + key + "' must be an integer, got: null");
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Parameter '" + key + "' must be an integer, got: " + value, e);
        }
    }
}
