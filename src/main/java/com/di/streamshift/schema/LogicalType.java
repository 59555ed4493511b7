package com.di.streamshift.schema;

/**
 * Column types of the compute engine's logical schema. Not every engine type has a
 * warehouse counterpart; see {@link TypeMapper}.
 */
public enum LogicalType {
    BOOLEAN,
    BYTE,
    SHORT,
    INTEGER,
    LONG,
    FLOAT,
    DOUBLE,
    DECIMAL,
    STRING,
    DATE,
    TIMESTAMP,
    BINARY,
    ARRAY,
    MAP,
    STRUCT
}
