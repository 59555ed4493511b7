package com.di.streamshift.schema;

import com.di.streamshift.exception.SchemaMappingException;
import lombok.extern.slf4j.Slf4j;

import java.sql.Types;
import java.util.Locale;

/**
 * Bidirectional mapping between engine logical types and warehouse column types.
 *
 * <pre>
 *   BOOLEAN    ↔ BOOLEAN
 *   BYTE       → SMALLINT          (no 8-bit integer in the warehouse)
 *   SHORT      ↔ SMALLINT / INT2
 *   INTEGER    ↔ INTEGER  / INT4
 *   LONG       ↔ BIGINT   / INT8
 *   FLOAT      ↔ REAL     / FLOAT4
 *   DOUBLE     ↔ DOUBLE PRECISION / FLOAT8
 *   DECIMAL    ↔ DECIMAL(p,s) / NUMERIC
 *   STRING     ↔ VARCHAR(n) when maxlength is set, TEXT otherwise; CHAR / BPCHAR read as STRING
 *   DATE       ↔ DATE
 *   TIMESTAMP  ↔ TIMESTAMP / TIMESTAMPTZ
 * </pre>
 * BINARY, ARRAY, MAP and STRUCT have no warehouse counterpart and fail fast.
 */
@Slf4j
public final class TypeMapper {

    private TypeMapper() {}

    /**
     * Warehouse DDL type for a column.
     *
     * @throws SchemaMappingException naming the column and its logical type when unmapped
     */
    public static String toWarehouseType(Column column) {
        return switch (column.type()) {
            case BOOLEAN   -> "BOOLEAN";
            case BYTE, SHORT -> "SMALLINT";
            case INTEGER   -> "INTEGER";
            case LONG      -> "BIGINT";
            case FLOAT     -> "REAL";
            case DOUBLE    -> "DOUBLE PRECISION";
            case DECIMAL   -> decimalType(column);
            case STRING    -> column.maxLength() != null ? "VARCHAR(" + column.maxLength() + ")" : "TEXT";
            case DATE      -> "DATE";
            case TIMESTAMP -> "TIMESTAMP";
            case BINARY, ARRAY, MAP, STRUCT -> throw new SchemaMappingException(String.format(
                    "Column '%s' has logical type %s, which has no warehouse column type",
                    column.name(), column.type()));
        };
    }

    /** Checks every column maps before any DDL is rendered. */
    public static void requireMappable(TableSchema schema) {
        for (Column c : schema.columns()) {
            toWarehouseType(c);
        }
    }

    private static String decimalType(Column column) {
        int precision = column.precision() > 0 ? column.precision() : Column.DEFAULT_DECIMAL_PRECISION;
        int scale     = column.precision() > 0 ? column.scale()     : Column.DEFAULT_DECIMAL_SCALE;
        return "DECIMAL(" + precision + "," + scale + ")";
    }

    /**
     * Logical column for a result-set column reported by the driver.
     *
     * @param jdbcType  {@link java.sql.Types} code
     * @param typeName  driver type name, used when the code is ambiguous
     * @param precision column precision / display size
     * @param scale     column scale
     * @throws SchemaMappingException when neither code nor name is recognised
     */
    public static Column fromJdbc(String name, int jdbcType, String typeName,
                                  int precision, int scale, boolean nullable) {
        LogicalType type = switch (jdbcType) {
            case Types.BOOLEAN, Types.BIT -> LogicalType.BOOLEAN;
            case Types.TINYINT, Types.SMALLINT -> LogicalType.SHORT;
            case Types.INTEGER -> LogicalType.INTEGER;
            case Types.BIGINT  -> LogicalType.LONG;
            case Types.REAL    -> LogicalType.FLOAT;
            case Types.FLOAT, Types.DOUBLE -> LogicalType.DOUBLE;
            case Types.NUMERIC, Types.DECIMAL -> LogicalType.DECIMAL;
            case Types.CHAR, Types.VARCHAR, Types.LONGVARCHAR,
                 Types.NCHAR, Types.NVARCHAR, Types.LONGNVARCHAR -> LogicalType.STRING;
            case Types.DATE -> LogicalType.DATE;
            case Types.TIMESTAMP, Types.TIMESTAMP_WITH_TIMEZONE -> LogicalType.TIMESTAMP;
            default -> fromWarehouseTypeName(typeName);
        };
        if (type == LogicalType.DECIMAL) {
            return new Column(name, type, nullable, null, precision, scale);
        }
        return new Column(name, type, nullable, null, 0, 0);
    }

    /**
     * Logical type for a warehouse type name such as {@code int8} or {@code character varying}.
     *
     * @throws SchemaMappingException for names outside the mapping table
     */
    public static LogicalType fromWarehouseTypeName(String typeName) {
        if (typeName == null) {
            throw new SchemaMappingException("Column type name is missing");
        }
        String t = typeName.trim().toLowerCase(Locale.ROOT);
        int paren = t.indexOf('(');
        if (paren > 0) {
            t = t.substring(0, paren).trim();
        }
        return switch (t) {
            case "boolean", "bool" -> LogicalType.BOOLEAN;
            case "smallint", "int2" -> LogicalType.SHORT;
            case "integer", "int", "int4" -> LogicalType.INTEGER;
            case "bigint", "int8" -> LogicalType.LONG;
            case "real", "float4" -> LogicalType.FLOAT;
            case "double precision", "float8", "float" -> LogicalType.DOUBLE;
            case "decimal", "numeric" -> LogicalType.DECIMAL;
            case "varchar", "character varying", "char", "character", "bpchar", "nchar",
                 "nvarchar", "text" -> LogicalType.STRING;
            case "date" -> LogicalType.DATE;
            case "timestamp", "timestamp without time zone", "timestamptz",
                 "timestamp with time zone" -> LogicalType.TIMESTAMP;
            default -> {
                log.warn("[SCHEMA] unmapped warehouse type '{}'", typeName);
                throw new SchemaMappingException("Warehouse column type '" + typeName + "' has no logical type");
            }
        };
    }
}
