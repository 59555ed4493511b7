package com.di.streamshift.schema;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * One field of a {@link TableSchema}.
 *
 * @param name      column name as supplied by the engine (case preserved)
 * @param type      logical type
 * @param nullable  whether nulls are allowed
 * @param maxLength optional {@code maxlength} metadata for string columns; {@code null} when absent
 * @param precision decimal precision (0 when not a decimal)
 * @param scale     decimal scale
 */
public record Column(String name, LogicalType type, boolean nullable, Integer maxLength,
                     int precision, int scale) {

    public static final int DEFAULT_DECIMAL_PRECISION = 38;
    public static final int DEFAULT_DECIMAL_SCALE     = 18;

    public Column {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (maxLength != null && maxLength <= 0) {
            throw new IllegalArgumentException("maxlength must be positive for column " + name + ": " + maxLength);
        }
    }

    public static Column of(String name, LogicalType type) {
        return new Column(name, type, true, null, 0, 0);
    }

    public static Column string(String name, int maxLength) {
        return new Column(name, LogicalType.STRING, true, maxLength, 0, 0);
    }

    public static Column decimal(String name, int precision, int scale) {
        return new Column(name, LogicalType.DECIMAL, true, null, precision, scale);
    }

    public Column withMaxLength(int length) {
        return new Column(name, type, nullable, length, precision, scale);
    }

    public OptionalInt maxLengthMetadata() {
        return maxLength == null ? OptionalInt.empty() : OptionalInt.of(maxLength);
    }
}
