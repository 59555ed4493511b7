package com.di.streamshift.format;

import com.di.streamshift.exception.ConfigurationException;
import com.di.streamshift.exception.SchemaMappingException;
import com.di.streamshift.exception.StagingIOException;
import com.di.streamshift.schema.Column;
import com.di.streamshift.schema.Row;
import com.di.streamshift.schema.TableSchema;
import com.di.streamshift.util.TypeConverter;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.SchemaParseException;
import org.apache.avro.file.DataFileWriter;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericDatumWriter;
import org.apache.avro.generic.GenericRecord;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * Serialises one row partition as an Avro object container file for {@code COPY ... FORMAT AS AVRO 'auto'}.
 * The warehouse matches Avro field names to column names case-insensitively.
 */
public final class AvroBatchWriter {

    static final String RECORD_NAME = "topLevelRecord";
    static final String NAMESPACE   = "com.di.streamshift";

    private AvroBatchWriter() {}

    /**
     * Avro schema of the staged files. Nullable columns become {@code ["null", T]} unions.
     *
     * @throws ConfigurationException when a column name is not a legal Avro field name
     */
    public static Schema avroSchema(TableSchema schema) {
        SchemaBuilder.FieldAssembler<Schema> fields = SchemaBuilder
                .record(RECORD_NAME)
                .namespace(NAMESPACE)
                .fields();
        try {
            for (Column column : schema.columns()) {
                SchemaBuilder.BaseFieldTypeBuilder<Schema> type = column.nullable()
                        ? fields.name(column.name()).type().nullable()
                        : fields.name(column.name()).type();
                fields = fieldType(type, column).noDefault();
            }
        } catch (SchemaParseException e) {
            throw new ConfigurationException(
                    "Column names must be valid Avro names ([A-Za-z_][A-Za-z0-9_]*): " + e.getMessage(), e);
        }
        return fields.endRecord();
    }

    /**
     * Writes {@code rows} to an in-memory container file.
     */
    public static byte[] write(TableSchema schema, Schema avroSchema, List<Row> rows) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (DataFileWriter<GenericRecord> writer = new DataFileWriter<>(new GenericDatumWriter<GenericRecord>(avroSchema))) {
            writer.create(avroSchema, out);
            long rowNumber = 0;
            for (Row row : rows) {
                writer.append(toRecord(schema, avroSchema, row, rowNumber++));
            }
        } catch (IOException e) {
            throw new StagingIOException("Failed to encode staged Avro file", e);
        }
        return out.toByteArray();
    }

    private static GenericRecord toRecord(TableSchema schema, Schema avroSchema, Row row, long rowNumber) {
        if (row.size() != schema.size()) {
            throw new SchemaMappingException(String.format(
                    "Row %d has %d values but the schema has %d columns", rowNumber, row.size(), schema.size()));
        }
        GenericRecord record = new GenericData.Record(avroSchema);
        for (int i = 0; i < schema.size(); i++) {
            Column column = schema.column(i);
            Object value = TypeConverter.toStagingValue(row.get(i), column);
            if (value == null && !column.nullable()) {
                throw new SchemaMappingException(String.format(
                        "Column '%s' is not nullable but row %d holds null", column.name(), rowNumber));
            }
            record.put(i, value);
        }
        return record;
    }

    private static SchemaBuilder.FieldDefault<Schema, ?> fieldType(SchemaBuilder.BaseFieldTypeBuilder<Schema> type,
                                                                 Column column) {
        switch (column.type()) {
            case BOOLEAN:
                return type.booleanType();
            case BYTE:
            case SHORT:
            case INTEGER:
                return type.intType();
            case LONG:
                return type.longType();
            case FLOAT:
                return type.floatType();
            case DOUBLE:
                return type.doubleType();
            case DECIMAL:
            case STRING:
            case DATE:
            case TIMESTAMP:
                return type.stringType();
            default:
                throw new SchemaMappingException(String.format(
                        "Column '%s' has type %s, which has no staging representation", column.name(), column.type()));
        }
    }
}
