package com.di.streamshift.util;

import com.di.streamshift.exception.SchemaMappingException;
import com.di.streamshift.schema.Column;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;

/**
 * Value conversions at the two ends of the staging area.
 *
 * <ul>
 *   <li>{@link #toStagingValue} turns an engine value into what the Avro writer stores:
 *       byte/short widened to int, decimals as plain strings, dates and timestamps as text in
 *       the formats the COPY statement declares.</li>
 *   <li>{@link #fromUnloadText} parses one unescaped field of UNLOAD output back into the
 *       engine value class of its column.</li>
 * </ul>
 *
 * Both also accept the JDBC temporal classes ({@link java.sql.Date}, {@link java.sql.Timestamp}).
 */
@Slf4j
public final class TypeConverter {

    /** Date text written to staging; matches {@code DATEFORMAT 'YYYY-MM-DD HH:MI:SS'}. */
    public static final DateTimeFormatter STAGING_DATE_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /** Timestamp text written to staging; millisecond precision. */
    public static final DateTimeFormatter STAGING_TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

    /**
     * {@code yyyy-MM-dd HH:mm:ss} with an optional fraction of up to nine digits and an optional
     * offset ({@code +00}, {@code -05}, {@code +05:30}) as written for TIMESTAMPTZ columns.
     */
    public static final DateTimeFormatter UNLOAD_TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .optionalStart()
            .appendOffset("+HH:mm", "+00")
            .optionalEnd()
            .toFormatter();

    private TypeConverter() {
    }

    // ------------------------------------------------------------------
    // Write side
    // ------------------------------------------------------------------

    /**
     * Converts an engine value to its staging representation.
     *
     * @throws SchemaMappingException when the value cannot represent the column type
     */
    public static Object toStagingValue(Object value, Column column) {
        if (value == null) {
            return null;
        }
        String name = column.name();
        switch (column.type()) {
            case BOOLEAN:
                return convertToBoolean(value, name);
            case BYTE:
            case SHORT:
            case INTEGER:
                return convertToInteger(value, name);
            case LONG:
                return convertToLong(value, name);
            case FLOAT:
                return convertToFloat(value, name);
            case DOUBLE:
                return convertToDouble(value, name);
            case DECIMAL:
                return convertToDecimal(value, name).toPlainString();
            case STRING:
                return value.toString();
            case DATE:
                return STAGING_DATE_FORMAT.format(convertToDate(value, name).atStartOfDay());
            case TIMESTAMP:
                return STAGING_TIMESTAMP_FORMAT.format(convertToTimestamp(value, name));
            default:
                throw new SchemaMappingException(String.format(
                        "Column '%s' has type %s, which cannot be staged", name, column.type()));
        }
    }

    // ------------------------------------------------------------------
    // Read side
    // ------------------------------------------------------------------

    /**
     * Parses UNLOAD text for {@code column}. {@code null} stays {@code null}.
     */
    public static Object fromUnloadText(String text, Column column) {
        if (text == null) {
            return null;
        }
        String name = column.name();
        try {
            switch (column.type()) {
                case BOOLEAN:
                    return parseBoolean(text, name);
                case BYTE:
                    return Byte.valueOf(text.trim());
                case SHORT:
                    return Short.valueOf(text.trim());
                case INTEGER:
                    return Integer.valueOf(text.trim());
                case LONG:
                    return Long.valueOf(text.trim());
                case FLOAT:
                    return Float.valueOf(text.trim());
                case DOUBLE:
                    return Double.valueOf(text.trim());
                case DECIMAL:
                    return new BigDecimal(text.trim());
                case STRING:
                    return text;
                case DATE:
                    return LocalDate.parse(text.trim());
                case TIMESTAMP:
                    return parseUnloadTimestamp(text.trim());
                default:
                    throw new SchemaMappingException(String.format(
                            "Column '%s' has type %s, which cannot be read from unloaded text", name, column.type()));
            }
        } catch (NumberFormatException | DateTimeException e) {
            throw new SchemaMappingException(String.format(
                    "Cannot parse '%s' as %s for column '%s'", text, column.type(), name), e);
        }
    }

    // ------------------------------------------------------------------
    // Single-type conversions
    // ------------------------------------------------------------------

    public static Boolean convertToBoolean(Object value, String fieldName) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return parseBoolean((String) value, fieldName);
        }
        throw cannotConvert(value, "Boolean", fieldName);
    }

    public static Integer convertToInteger(Object value, String fieldName) {
        if (value instanceof Integer) {
            return (Integer) value;
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Long) {
            long longValue = ((Number) value).longValue();
            if (longValue < Integer.MIN_VALUE || longValue > Integer.MAX_VALUE) {
                throw new SchemaMappingException(String.format(
                        "Value %d is out of range for Integer (field '%s')", longValue, fieldName));
            }
            return (int) longValue;
        }
        throw cannotConvert(value, "Integer", fieldName);
    }

    public static Long convertToLong(Object value, String fieldName) {
        if (value instanceof Long) {
            return (Long) value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        throw cannotConvert(value, "Long", fieldName);
    }

    public static Float convertToFloat(Object value, String fieldName) {
        if (value instanceof Float) {
            return (Float) value;
        }
        if (value instanceof Number && !(value instanceof Double) && !(value instanceof BigDecimal)) {
            return ((Number) value).floatValue();
        }
        throw cannotConvert(value, "Float", fieldName);
    }

    public static Double convertToDouble(Object value, String fieldName) {
        if (value instanceof Double) {
            return (Double) value;
        }
        if (value instanceof Number && !(value instanceof BigDecimal)) {
            return ((Number) value).doubleValue();
        }
        throw cannotConvert(value, "Double", fieldName);
    }

    public static BigDecimal convertToDecimal(Object value, String fieldName) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof Double || value instanceof Float) {
            return new BigDecimal(value.toString());
        }
        if (value instanceof String) {
            try {
                return new BigDecimal(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new SchemaMappingException(String.format(
                        "Cannot parse '%s' as decimal for field '%s'", value, fieldName), e);
            }
        }
        throw cannotConvert(value, "BigDecimal", fieldName);
    }

    public static LocalDate convertToDate(Object value, String fieldName) {
        if (value instanceof LocalDate) {
            return (LocalDate) value;
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate();
        }
        if (value instanceof LocalDateTime) {
            log.debug("Truncated LocalDateTime to LocalDate for DATE field '{}'", fieldName);
            return ((LocalDateTime) value).toLocalDate();
        }
        throw cannotConvert(value, "LocalDate", fieldName);
    }

    public static LocalDateTime convertToTimestamp(Object value, String fieldName) {
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof java.sql.Timestamp) {
            return ((java.sql.Timestamp) value).toLocalDateTime();
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        }
        throw cannotConvert(value, "LocalDateTime", fieldName);
    }

    /** Offset timestamps are normalised to UTC. */
    private static LocalDateTime parseUnloadTimestamp(String text) {
        TemporalAccessor parsed = UNLOAD_TIMESTAMP_FORMAT.parse(text);
        LocalDateTime local = LocalDateTime.from(parsed);
        if (!parsed.isSupported(ChronoField.OFFSET_SECONDS)) {
            return local;
        }
        return local.atOffset(ZoneOffset.from(parsed))
                .withOffsetSameInstant(ZoneOffset.UTC)
                .toLocalDateTime();
    }

    private static Boolean parseBoolean(String text, String fieldName) {
        switch (text.trim().toLowerCase(java.util.Locale.ROOT)) {
            case "t":
            case "true":
                return Boolean.TRUE;
            case "f":
            case "false":
                return Boolean.FALSE;
            default:
                throw new SchemaMappingException(String.format(
                        "Cannot parse '%s' as boolean for field '%s'", text, fieldName));
        }
    }

    private static SchemaMappingException cannotConvert(Object value, String target, String fieldName) {
        return new SchemaMappingException(String.format(
                "Cannot convert %s to %s for field '%s'", value.getClass().getName(), target, fieldName));
    }
}
