package com.di.streamshift.format;

import com.di.streamshift.exception.SchemaMappingException;
import com.di.streamshift.exception.StagingIOException;
import com.di.streamshift.schema.Row;
import com.di.streamshift.schema.TableSchema;
import com.di.streamshift.sql.SqlGenerator;
import com.di.streamshift.util.TypeConverter;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazily decodes one UNLOAD output file: {@code |}-delimited, newline-terminated records
 * written with {@code ESCAPE} and {@code NULL AS '@NULL@'}.
 *
 * <p>A backslash makes the next character literal, so escaped delimiters, newlines, carriage
 * returns, quotes and backslashes stay inside the field. Only an unescaped {@code @NULL@} field is
 * SQL NULL.
 */
public class UnloadTextParser implements Iterator<Row>, Closeable {

    public static final char DELIMITER = '|';
    private static final char ESCAPE   = '\\';

    private final Reader reader;
    private final TableSchema schema;

    private long recordNumber;
    private Row next;
    private boolean done;

    public UnloadTextParser(Reader reader, TableSchema schema) {
        this.reader = reader instanceof BufferedReader ? reader : new BufferedReader(reader);
        this.schema = schema;
    }

    @Override
    public boolean hasNext() {
        if (next == null && !done) {
            List<Field> fields = readRecord();
            if (fields == null) {
                done = true;
            } else {
                next = toRow(fields);
            }
        }
        return next != null;
    }

    @Override
    public Row next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Row row = next;
        next = null;
        return row;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }

    private Row toRow(List<Field> fields) {
        recordNumber++;
        // An empty projection unloads a constant column; only the row count matters.
        if (schema.size() == 0) {
            return Row.of();
        }
        if (fields.size() != schema.size()) {
            throw new SchemaMappingException(String.format(
                    "Unloaded record %d has %d fields but %d columns were requested",
                    recordNumber, fields.size(), schema.size()));
        }
        Object[] values = new Object[fields.size()];
        for (int i = 0; i < values.length; i++) {
            Field f = fields.get(i);
            values[i] = f.isNull() ? null : TypeConverter.fromUnloadText(f.text, schema.column(i));
        }
        return Row.of(values);
    }

    /** Next record, or {@code null} at end of input. */
    private List<Field> readRecord() {
        try {
            int c = reader.read();
            if (c == -1) {
                return null;
            }
            List<Field> fields = new ArrayList<>();
            StringBuilder text = new StringBuilder();
            boolean escaped = false;
            while (c != -1 && c != '\n') {
                if (c == ESCAPE) {
                    int literal = reader.read();
                    if (literal == -1) {
                        throw new SchemaMappingException(
                                "Unloaded record " + (recordNumber + 1) + " ends with a dangling escape character");
                    }
                    text.append((char) literal);
                    escaped = true;
                } else if (c == DELIMITER) {
                    fields.add(new Field(text.toString(), escaped));
                    text.setLength(0);
                    escaped = false;
                } else if (c != '\r' || !peekNewline()) {
                    text.append((char) c);
                }
                c = reader.read();
            }
            fields.add(new Field(text.toString(), escaped));
            return fields;
        } catch (IOException e) {
            throw new StagingIOException("Failed to read unloaded data", e);
        }
    }

    /** Whether the next character is a newline; consumes nothing. */
    private boolean peekNewline() throws IOException {
        reader.mark(1);
        int c = reader.read();
        reader.reset();
        return c == '\n';
    }

    private static final class Field {
        final String text;
        final boolean escaped;

        Field(String text, boolean escaped) {
            this.text = text;
            this.escaped = escaped;
        }

        boolean isNull() {
            return !escaped && SqlGenerator.NULL_MARKER.equals(text);
        }
    }
}
