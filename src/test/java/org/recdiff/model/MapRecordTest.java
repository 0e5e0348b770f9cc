package org.recdiff.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MapRecordTest {
    private static final RecordType PERSON = RecordType.builder("Person")
        .field("id")
        .field("name")
        .field(FieldDescriptor.builder("updatedAt").extraneous(true).build())
        .identity("id")
        .build();

    @Test
    void unsetSlotsReadAsAbsentWhileNullIsAValue() {
        MapRecord record = MapRecord.builder(PERSON).set("id", 7).set("name", null).build();

        assertEquals(7, record.get("id"));
        assertNull(record.get("name"));
        assertSame(Absent.VALUE, record.get("updatedAt"));
        assertSame(Absent.VALUE, record.get("undeclared"));
    }

    @Test
    void settingAbsentClearsTheSlot() {
        MapRecord record = MapRecord.builder(PERSON).set("name", "Ann").set("name", Absent.VALUE).build();

        assertTrue(record.values().isEmpty());
        assertSame(Absent.VALUE, record.get("name"));
    }

    @Test
    void rejectsUndeclaredFields() {
        IllegalArgumentException error = assertThrows(
            IllegalArgumentException.class,
            () -> MapRecord.builder(PERSON).set("age", 3));
        assertTrue(error.getMessage().contains("'age' is not declared by Person"));
    }

    @Test
    void equalityRequiresTheSameTypeInstance() {
        RecordType lookalike = RecordType.builder("Person").field("id").field("name").build();

        MapRecord first = MapRecord.builder(PERSON).set("id", 1).build();
        MapRecord second = MapRecord.builder(PERSON).set("id", 1).build();
        MapRecord alien = MapRecord.builder(lookalike).set("id", 1).build();

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, alien);
    }

    @Test
    void recordTypeValidatesItsDeclaration() {
        assertThrows(IllegalArgumentException.class, () -> RecordType.builder(" ").build());
        assertThrows(
            IllegalArgumentException.class,
            () -> RecordType.builder("T").field("a").field("a"));
        assertThrows(
            IllegalArgumentException.class,
            () -> RecordType.builder("T").field("a").identity("b").build());
        assertEquals(List.of("id"), PERSON.identityFields());
        assertTrue(PERSON.field("updatedAt").orElseThrow().extraneous());
    }

    @Test
    void collectionsSynthesizeKeysPerBackingShape() {
        MapRecord ann = MapRecord.builder(PERSON).set("id", 1).build();
        MapRecord bob = MapRecord.builder(PERSON).set("id", 2).build();

        RecordCollection list = RecordCollection.ofList(PERSON, List.of(ann, bob));
        RecordCollection map = RecordCollection.ofMap(PERSON, Map.of("ann", ann));
        RecordCollection set = RecordCollection.ofSet(PERSON, List.of(bob));

        assertEquals(List.of(new CollectionEntry(0, ann), new CollectionEntry(1, bob)), list.entries());
        assertEquals(List.of(new CollectionEntry("ann", ann)), map.entries());
        assertEquals(List.of(new CollectionEntry(null, bob)), set.entries());
        assertSame(PERSON, set.itemType());
    }

    @Test
    void collectionsRejectItemsOfAnotherType() {
        RecordType robot = RecordType.builder("Robot").field("id").identity("id").build();
        MapRecord ann = MapRecord.builder(PERSON).set("id", 1).build();
        MapRecord unit = MapRecord.builder(robot).set("id", 1).build();

        IllegalArgumentException error = assertThrows(
            IllegalArgumentException.class,
            () -> RecordCollection.ofList(PERSON, List.of(ann, unit)));
        assertEquals("collection of Person cannot hold an item of type Robot", error.getMessage());
        assertThrows(IllegalArgumentException.class, () -> RecordCollection.ofMap(PERSON, Map.of("unit", unit)));
        assertThrows(IllegalArgumentException.class, () -> RecordCollection.ofSet(robot, List.of(ann)));
    }

    @Test
    void valueContainersExposeTheirItemHook() {
        ValueList<String> list = ValueList.of(List.of("a-1"), value -> value.toString().replace("-", ""));
        ValueMap<String, String> map = ValueMap.of(Map.of("k", "B"), value -> value.toString().toLowerCase());

        assertEquals("a-1", list.get(0));
        assertEquals("a1", list.compareItemAs("a-1"));
        assertEquals("B", map.get("k"));
        assertEquals("b", map.compareItemAs("B"));
    }
}
