package com.di.streamshift.format;

import com.di.streamshift.exception.ConfigurationException;
import com.di.streamshift.exception.SchemaMappingException;
import com.di.streamshift.schema.Column;
import com.di.streamshift.schema.LogicalType;
import com.di.streamshift.schema.Row;
import com.di.streamshift.schema.TableSchema;
import org.apache.avro.Schema;
import org.apache.avro.file.DataFileStream;
import org.apache.avro.generic.GenericDatumReader;
import org.apache.avro.generic.GenericRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for AvroBatchWriter.
 */
@DisplayName("AvroBatchWriter Tests")
class AvroBatchWriterTest {

    private static final TableSchema SCHEMA = TableSchema.of(
            new Column("id", LogicalType.LONG, false, null, 0, 0),
            Column.of("small", LogicalType.SHORT),
            Column.of("flag", LogicalType.BOOLEAN),
            Column.decimal("amount", 10, 2),
            Column.of("day", LogicalType.DATE),
            Column.of("at", LogicalType.TIMESTAMP),
            Column.of("name", LogicalType.STRING));

    private static List<GenericRecord> readBack(byte[] bytes) throws IOException {
        List<GenericRecord> records = new ArrayList<>();
        try (DataFileStream<GenericRecord> in = new DataFileStream<>(new ByteArrayInputStream(bytes),
                new GenericDatumReader<>())) {
            in.forEach(records::add);
        }
        return records;
    }

    // ============================================================================
    // Schema
    // ============================================================================

    @Test
    @DisplayName("Should map nullable columns to unions and keep required columns plain")
    void testAvroSchema_Nullability() {
        Schema schema = AvroBatchWriter.avroSchema(SCHEMA);

        assertEquals("com.di.streamshift.topLevelRecord", schema.getFullName());
        assertEquals(Schema.Type.LONG, schema.getField("id").schema().getType());
        Schema small = schema.getField("small").schema();
        assertEquals(Schema.Type.UNION, small.getType());
        assertTrue(small.getTypes().stream().anyMatch(s -> s.getType() == Schema.Type.INT));
        assertTrue(small.getTypes().stream().anyMatch(s -> s.getType() == Schema.Type.NULL));
    }

    @Test
    @DisplayName("Should stage decimals, dates and timestamps as strings")
    void testAvroSchema_TextTypes() {
        Schema schema = AvroBatchWriter.avroSchema(SCHEMA);

        for (String name : List.of("amount", "day", "at", "name")) {
            assertTrue(schema.getField(name).schema().getTypes().stream()
                    .anyMatch(s -> s.getType() == Schema.Type.STRING), name);
        }
    }

    @Test
    @DisplayName("Should reject column names that are not valid Avro names")
    void testAvroSchema_InvalidName() {
        assertThrows(ConfigurationException.class,
                () -> AvroBatchWriter.avroSchema(TableSchema.of(Column.of("bad name", LogicalType.STRING))));
    }

    @Test
    @DisplayName("Should reject column types without a staging representation")
    void testAvroSchema_UnsupportedType() {
        assertThrows(SchemaMappingException.class,
                () -> AvroBatchWriter.avroSchema(TableSchema.of(Column.of("blob", LogicalType.BINARY))));
    }

    // ============================================================================
    // Records
    // ============================================================================

    @Test
    @DisplayName("Should write values in their staging representation")
    void testWrite_Values() throws IOException {
        Schema avro = AvroBatchWriter.avroSchema(SCHEMA);
        byte[] bytes = AvroBatchWriter.write(SCHEMA, avro, List.of(
                Row.of(1L, (short) 7, true, new BigDecimal("12.50"), LocalDate.of(2015, 7, 1),
                        LocalDateTime.of(2015, 7, 1, 0, 0, 0, 1_000_000), "Unicode's樂趣"),
                Row.of(2L, null, null, null, null, null, null)));

        List<GenericRecord> records = readBack(bytes);

        assertEquals(2, records.size());
        GenericRecord first = records.get(0);
        assertEquals(1L, first.get("id"));
        assertEquals(7, first.get("small"));
        assertEquals(true, first.get("flag"));
        assertEquals("12.50", first.get("amount").toString());
        assertEquals("2015-07-01 00:00:00", first.get("day").toString());
        assertEquals("2015-07-01 00:00:00.001", first.get("at").toString());
        assertEquals("Unicode's樂趣", first.get("name").toString());

        GenericRecord second = records.get(1);
        assertEquals(2L, second.get("id"));
        assertNull(second.get("small"));
        assertNull(second.get("name"));
    }

    @Test
    @DisplayName("Should write a valid container with no records for an empty partition")
    void testWrite_Empty() throws IOException {
        byte[] bytes = AvroBatchWriter.write(SCHEMA, AvroBatchWriter.avroSchema(SCHEMA), List.of());

        assertTrue(bytes.length > 0);
        assertTrue(readBack(bytes).isEmpty());
    }

    @Test
    @DisplayName("Should reject null in a required column")
    void testWrite_NullInRequiredColumn() {
        Schema avro = AvroBatchWriter.avroSchema(SCHEMA);

        SchemaMappingException ex = assertThrows(SchemaMappingException.class,
                () -> AvroBatchWriter.write(SCHEMA, avro, List.of(Row.of(null, null, null, null, null, null, null))));
        assertTrue(ex.getMessage().contains("'id'"));
    }

    @Test
    @DisplayName("Should reject a row whose width differs from the schema")
    void testWrite_RowWidthMismatch() {
        Schema avro = AvroBatchWriter.avroSchema(SCHEMA);

        assertThrows(SchemaMappingException.class,
                () -> AvroBatchWriter.write(SCHEMA, avro, List.of(Row.of(1L, (short) 1))));
    }
}
