package com.di.streamshift.sql;

import com.di.streamshift.filter.Filter;
import com.di.streamshift.schema.Column;
import com.di.streamshift.schema.TableSchema;
import com.di.streamshift.schema.TypeMapper;
import com.di.streamshift.util.InputValidator;

import java.util.List;
import java.util.StringJoiner;

/**
 * Builds every statement the transfer core sends to the warehouse. No I/O.
 *
 * <p>Column identifiers are always double-quoted. Table names are validated by
 * {@link InputValidator#validateTableName} and emitted as given, so a caller can pass
 * either a plain or a quoted name.
 */
public final class SqlGenerator {

    /** Marker written by UNLOAD for SQL NULL, so empty strings survive the round trip. */
    public static final String NULL_MARKER = "@NULL@";

    /** Load-error rows produced by the most recent COPY in this session. */
    public static final String LOAD_ERRORS_QUERY =
            "SELECT le.starttime, le.filename, le.line_number, le.colname, le.type, le.col_length,"
          + " le.raw_field_value, le.err_code, le.err_reason"
          + " FROM stl_load_errors le WHERE le.query = pg_last_copy_id()";

    private SqlGenerator() {}

    // ------------------------------------------------------------------
    // Read path
    // ------------------------------------------------------------------

    /**
     * {@code SELECT <cols> FROM <source> [WHERE ...]} for the given projection. An empty
     * projection selects a constant so row counts are preserved.
     */
    public static String selectQuery(String sourceExpr, TableSchema fullSchema,
                                     List<String> columns, List<Filter> filters) {
        String columnList;
        if (columns.isEmpty()) {
            columnList = "1";
        } else {
            StringJoiner cols = new StringJoiner(", ");
            for (String c : columns) {
                cols.add(SqlText.quoteIdentifier(c));
            }
            columnList = cols.toString();
        }
        String where = FilterRenderer.whereClause(fullSchema, filters);
        return "SELECT " + columnList + " FROM " + sourceExpr + (where.isEmpty() ? "" : " " + where);
    }

    /**
     * {@code UNLOAD ('<select>') TO '<destination>' WITH CREDENTIALS '<creds>' ESCAPE NULL AS '@NULL@' MANIFEST}.
     *
     * @param sourceExpr      bare table name or parenthesised query
     * @param destinationUri  staging directory; must end with {@code /}
     */
    public static String unloadQuery(String sourceExpr, TableSchema fullSchema, List<String> columns,
                                     List<Filter> filters, String credentialsClause, String destinationUri) {
        String select = selectQuery(sourceExpr, fullSchema, columns, filters);
        return "UNLOAD ('" + SqlText.escapeForUnload(select) + "')"
             + " TO " + SqlText.quoteLiteral(destinationUri)
             + " WITH CREDENTIALS " + SqlText.quoteLiteral(credentialsClause)
             + " ESCAPE NULL AS '" + NULL_MARKER + "' MANIFEST";
    }

    /** Probe that returns no rows but exposes the result-set metadata of {@code sourceExpr}. */
    public static String schemaProbe(String sourceExpr) {
        return "SELECT * FROM " + sourceExpr + " WHERE 1=0";
    }

    // ------------------------------------------------------------------
    // Write path
    // ------------------------------------------------------------------

    /**
     * {@code CREATE TABLE IF NOT EXISTS <name> (<col> <type>, ...) [DISTSTYLE s] [DISTKEY (k)] [SORTKEY (...)]}.
     *
     * @param distStyle   {@code EVEN | KEY | ALL | AUTO} or {@code null}
     * @param distKey     distribution key column or {@code null}
     * @param sortKeySpec full {@code [COMPOUND|INTERLEAVED] SORTKEY(...)} clause or {@code null}
     */
    public static String createTableSql(TableSchema schema, String tableName,
                                        String distStyle, String distKey, String sortKeySpec) {
        schema.requireUnambiguousNames();
        StringJoiner cols = new StringJoiner(", ", "(", ")");
        for (Column c : schema.columns()) {
            cols.add(SqlText.quoteIdentifier(c.name()) + " " + TypeMapper.toWarehouseType(c));
        }
        StringBuilder sql = new StringBuilder("CREATE TABLE IF NOT EXISTS ")
                .append(tableName).append(' ').append(cols);
        if (distStyle != null) {
            sql.append(" DISTSTYLE ").append(distStyle);
        }
        if (distKey != null) {
            sql.append(" DISTKEY (").append(SqlText.quoteIdentifier(distKey)).append(')');
        }
        if (sortKeySpec != null) {
            sql.append(' ').append(sortKeySpec);
        }
        return sql.toString();
    }

    /**
     * Bulk load from an Avro manifest. Nulls travel as Avro null branches; dates and
     * timestamps travel as text in the formats below.
     */
    public static String copyQuery(String table, String manifestUri, String credentialsClause) {
        return "COPY " + table
             + " FROM " + SqlText.quoteLiteral(manifestUri)
             + " CREDENTIALS " + SqlText.quoteLiteral(credentialsClause)
             + " FORMAT AS AVRO 'auto' DATEFORMAT 'YYYY-MM-DD HH:MI:SS' TIMEFORMAT 'auto' MANIFEST";
    }

    /**
     * Rename-based swap executed as one multi-statement block: either every statement
     * commits or none does.
     */
    public static String transactionSql(String targetTable, String stagingTable, String backupSuffix) {
        String backup = withSuffix(targetTable, "_backup_" + backupSuffix);
        return "BEGIN;\n"
             + "ALTER TABLE " + targetTable + " RENAME TO " + unqualified(backup) + ";\n"
             + "ALTER TABLE " + stagingTable + " RENAME TO " + unqualified(targetTable) + ";\n"
             + "DROP TABLE " + backup + ";\n"
             + "END;";
    }

    /** Used instead of {@link #transactionSql} when the target does not exist yet. */
    public static String renameSql(String fromTable, String toTable) {
        return "ALTER TABLE " + fromTable + " RENAME TO " + unqualified(toTable);
    }

    /** Append step when loading through the staging table. */
    public static String insertFromStagingSql(String targetTable, String stagingTable) {
        return "BEGIN;\n"
             + "INSERT INTO " + targetTable + " SELECT * FROM " + stagingTable + ";\n"
             + "END;";
    }

    public static String dropTableSql(String table) {
        return "DROP TABLE IF EXISTS " + table;
    }

    public static String tableExistsProbe(String table) {
        return "SELECT 1 FROM " + table + " WHERE 1=0";
    }

    /** {@code <target>_staging_<suffix>}, in the target's schema. */
    public static String stagingTableName(String targetTable, String suffix) {
        return withSuffix(targetTable, "_staging_" + suffix);
    }

    /**
     * Post-action with every {@code %s} replaced by the table that was loaded.
     */
    public static String postAction(String template, String table) {
        return template.replace("%s", table);
    }

    /**
     * Appends {@code suffix} to the table part of a possibly qualified, possibly quoted name:
     * {@code s."T"} + {@code _x} → {@code s."T_x"}.
     */
    static String withSuffix(String table, String suffix) {
        String[] parts = InputValidator.splitQualified(table);
        String name = parts[parts.length - 1];
        String suffixed = name.endsWith("\"") && name.length() >= 2
                ? name.substring(0, name.length() - 1) + suffix + "\""
                : name + suffix;
        return parts.length == 2 ? parts[0] + "." + suffixed : suffixed;
    }

    /**
     * Table name without its schema qualifier, as required on the right-hand side of
     * {@code RENAME TO}. A quoted name keeps its quotes around the suffixed part.
     */
    static String unqualified(String table) {
        String[] parts = InputValidator.splitQualified(table);
        return parts[parts.length - 1];
    }
}
