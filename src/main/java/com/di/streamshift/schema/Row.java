package com.di.streamshift.schema;

import java.util.Arrays;
import java.util.List;

/**
 * Positional row of values. Value classes per logical type: Boolean, Byte, Short, Integer,
 * Long, Float, Double, BigDecimal, String, {@link java.time.LocalDate},
 * {@link java.time.LocalDateTime}. A {@code null} element is SQL NULL.
 */
public final class Row {

    private final Object[] values;

    private Row(Object[] values) {
        this.values = values;
    }

    public static Row of(Object... values) {
        return new Row(values.clone());
    }

    public static Row of(List<?> values) {
        return new Row(values.toArray());
    }

    public int size() {
        return values.length;
    }

    public Object get(int index) {
        return values[index];
    }

    public boolean isNull(int index) {
        return values[index] == null;
    }

    public List<Object> values() {
        return Arrays.asList(values.clone());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Row other && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Row" + Arrays.toString(values);
    }
}
