package org.recdiff.bson;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.bson.BsonDateTime;
import org.bson.BsonDecimal128;
import org.bson.BsonDocument;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.junit.jupiter.api.Test;
import org.recdiff.engine.ChangeEntry;
import org.recdiff.engine.ChangeKind;
import org.recdiff.engine.RecordDiffer;
import org.recdiff.model.Absent;
import org.recdiff.model.FieldDescriptor;
import org.recdiff.model.MapRecord;
import org.recdiff.model.RecordCollection;
import org.recdiff.model.RecordType;
import org.recdiff.selector.FieldSelector;

class BsonRecordsTest {
    @Test
    void infersNestedTypesAndKeyedArrays() {
        BsonDocument first = BsonDocument.parse(
            "{\"_id\": 1, \"name\": \"Ann\", \"address\": {\"city\": \"Oslo\"},"
                + " \"lines\": [{\"_id\": \"l1\", \"qty\": 1}], \"tags\": [\"a\"]}");
        BsonDocument second = BsonDocument.parse("{\"_id\": 2, \"address\": {\"zip\": \"0150\"}, \"lines\": []}");

        RecordType type = BsonRecords.inferType("Customer", first, second);

        assertEquals(List.of("_id"), type.identityFields());
        RecordType address = type.field("address").orElseThrow().recordType().orElseThrow();
        assertEquals("Customer.address", address.name());
        assertTrue(address.hasField("city"));
        assertTrue(address.hasField("zip"));
        RecordType line = type.field("lines").orElseThrow().itemType().orElseThrow();
        assertEquals(List.of("_id"), line.identityFields());
        assertTrue(type.field("tags").orElseThrow().itemType().isEmpty());
    }

    @Test
    void convertsDocumentsBySchema() {
        RecordType line = RecordType.builder("Line").field("_id").field("qty").identity("_id").build();
        RecordType order = RecordType.builder("Order")
            .field("_id")
            .field("total")
            .field("placedAt")
            .field(FieldDescriptor.builder("lines").itemType(line).build())
            .field(FieldDescriptor.builder("byWarehouse").itemType(line).build())
            .build();
        BsonDocument document = new BsonDocument()
            .append("_id", BsonDocument.parse("{\"v\": 7}").get("v"))
            .append("total", new BsonDecimal128(Decimal128.parse("10.50")))
            .append("placedAt", new BsonDateTime(1_000L))
            .append("lines", BsonDocument.parse("{\"a\": [{\"_id\": \"l1\", \"qty\": 2}]}").get("a"))
            .append("byWarehouse", BsonDocument.parse("{\"w1\": {\"_id\": \"l9\", \"qty\": 1}}"))
            .append("undeclared", BsonDocument.parse("{\"v\": true}").get("v"));

        MapRecord record = BsonRecords.toRecord(order, document);

        assertEquals(7, record.get("_id"));
        assertEquals(new BigDecimal("10.50"), record.get("total"));
        assertEquals(Instant.ofEpochMilli(1_000L), record.get("placedAt"));
        RecordCollection lines = assertInstanceOf(RecordCollection.class, record.get("lines"));
        assertEquals(0, lines.entries().get(0).key());
        assertEquals(2, lines.entries().get(0).item().get("qty"));
        RecordCollection byWarehouse = assertInstanceOf(RecordCollection.class, record.get("byWarehouse"));
        assertEquals("w1", byWarehouse.entries().get(0).key());
        assertEquals(5, record.values().size());
        assertSame(Absent.VALUE, MapRecord.builder(order).build().get("lines"));
    }

    @Test
    void rejectsScalarsWhereCollectionsAreDeclared() {
        RecordType line = RecordType.builder("Line").field("_id").build();
        RecordType order = RecordType.builder("Order").field(FieldDescriptor.builder("lines").itemType(line).build()).build();

        IllegalArgumentException error = assertThrows(
            IllegalArgumentException.class,
            () -> BsonRecords.toRecord(order, BsonDocument.parse("{\"lines\": 5}")));
        assertTrue(error.getMessage().contains("Order.lines must be an array or a document"));
        assertThrows(
            IllegalArgumentException.class,
            () -> BsonRecords.toRecord(order, BsonDocument.parse("{\"lines\": [1]}")));
        assertNull(BsonRecords.toRecord(order, BsonDocument.parse("{\"lines\": null}")).get("lines"));
    }

    @Test
    void comparesSnapshotsOfTheSameDocument() {
        Document before = Document.parse(
            "{\"_id\": 1, \"name\": \"Ann\", \"lines\": [{\"_id\": \"a\", \"qty\": 1}, {\"_id\": \"b\", \"qty\": 1}]}");
        Document after = Document.parse(
            "{\"_id\": 1, \"name\": \"Ann\", \"lines\": [{\"_id\": \"b\", \"qty\": 3}, {\"_id\": \"a\", \"qty\": 1}]}");
        RecordType type = BsonRecords.inferType(
            "Order",
            BsonDocument.parse(before.toJson()),
            BsonDocument.parse(after.toJson()));

        List<ChangeEntry> entries = RecordDiffer.standard()
            .diff(BsonRecords.toRecord(type, before), BsonRecords.toRecord(type, after))
            .entries();

        assertEquals(
            List.of(new ChangeEntry(
                ChangeKind.MODIFIED,
                FieldSelector.of("lines", 1, "qty"),
                FieldSelector.of("lines", 0, "qty"))),
            entries);
    }

    @Test
    void mapsBsonValuesToJavaValues() {
        BsonDocument document = BsonDocument.parse(
            "{\"n\": null, \"l\": {\"$numberLong\": \"5\"}, \"d\": 1.5, \"arr\": [1, \"x\"], \"doc\": {\"k\": true}}");

        assertNull(BsonRecords.toJava(document.get("n")));
        assertEquals(5L, BsonRecords.toJava(document.get("l")));
        assertEquals(1.5d, BsonRecords.toJava(document.get("d")));
        assertEquals(List.of(1, "x"), BsonRecords.toJava(document.get("arr")));
        assertEquals(Map.of("k", true), BsonRecords.toJava(document.get("doc")));
        assertInstanceOf(Decimal128.class, BsonRecords.toJava(new BsonDecimal128(Decimal128.NaN)));
    }
}
