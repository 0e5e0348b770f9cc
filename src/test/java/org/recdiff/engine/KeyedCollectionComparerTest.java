package org.recdiff.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.recdiff.model.DiffRecord;
import org.recdiff.model.FieldDescriptor;
import org.recdiff.model.MapRecord;
import org.recdiff.model.RecordCollection;
import org.recdiff.model.RecordType;
import org.recdiff.selector.FieldSelector;
import org.recdiff.selector.MultiFieldSelector;

class KeyedCollectionComparerTest {
    private static final RecordType ITEM = RecordType.builder("Item")
        .field("sku")
        .field("qty")
        .field("note")
        .identity("sku")
        .build();
    private static final RecordType ORDER = RecordType.builder("Order")
        .field("id")
        .field(FieldDescriptor.builder("items").itemType(ITEM).build())
        .identity("id")
        .build();
    private static final RecordType TAG = RecordType.builder("Tag").field("label").field("color").build();

    private final RecordDiffer differ = RecordDiffer.standard();

    @Test
    void matchedIdentityWithChangedContentIsModifiedNotReplaced() {
        MapRecord base = order(item("A", 1), item("B", 2));
        MapRecord other = order(item("A", 1), item("B", 3));

        assertEquals(List.of(at(ChangeKind.MODIFIED, "items", 1, "qty")), differ.diff(base, other).entries());
    }

    @Test
    void reorderingIsNotADifference() {
        assertTrue(differ.diff(order(item("A", 1), item("B", 2)), order(item("B", 2), item("A", 1))).isEmpty());
    }

    @Test
    void matchedPairsKeepTheirOwnPositions() {
        MapRecord base = order(item("A", 1), item("B", 2));
        MapRecord other = order(item("B", 3), item("A", 1));

        assertEquals(
            List.of(new ChangeEntry(
                ChangeKind.MODIFIED,
                FieldSelector.of("items", 1, "qty"),
                FieldSelector.of("items", 0, "qty"))),
            differ.diff(base, other).entries());
    }

    @Test
    void reportsRemovedThenAddedThenMatched() {
        MapRecord base = order(item("A", 1), item("B", 1), item("C", 1));
        MapRecord other = order(item("D", 1), item("C", 2), item("A", 1));

        assertEquals(
            List.of(
                new ChangeEntry(ChangeKind.REMOVED, FieldSelector.of("items", 1), FieldSelector.of("items")),
                new ChangeEntry(ChangeKind.ADDED, FieldSelector.of("items"), FieldSelector.of("items", 0)),
                new ChangeEntry(
                    ChangeKind.MODIFIED,
                    FieldSelector.of("items", 2, "qty"),
                    FieldSelector.of("items", 1, "qty"))),
            differ.diff(base, other).entries());
    }

    @Test
    void duplicateIdentitiesAreReconciledOneByOne() {
        MapRecord base = order(item("A", 1), item("A", 1));
        MapRecord other = order(item("A", 1));

        assertEquals(
            List.of(new ChangeEntry(ChangeKind.REMOVED, FieldSelector.of("items", 1), FieldSelector.of("items"))),
            differ.diff(base, other).entries());
    }

    @Test
    void cleanPairsAreReportedBeforeTheirFields() {
        ComparisonOptions options = ComparisonOptions.builder().unchanged(true).build();

        assertEquals(
            List.of(
                at(ChangeKind.UNCHANGED, "id"),
                at(ChangeKind.UNCHANGED, "items", 0),
                at(ChangeKind.UNCHANGED, "items", 0, "qty"),
                at(ChangeKind.UNCHANGED, "items", 0, "sku")),
            differ.diff(order(item("A", 1)), order(item("A", 1)), options).entries());

        assertEquals(
            List.of(
                at(ChangeKind.UNCHANGED, "id"),
                at(ChangeKind.MODIFIED, "items", 0, "qty"),
                at(ChangeKind.UNCHANGED, "items", 0, "sku")),
            differ.diff(order(item("A", 1)), order(item("A", 2)), options).entries());
    }

    @Test
    void mapAndSetBackedCollectionsUseTheirOwnKeys() {
        Map<String, DiffRecord> baseItems = new LinkedHashMap<>();
        baseItems.put("first", item("A", 1));
        baseItems.put("second", item("B", 1));
        Map<String, DiffRecord> otherItems = new LinkedHashMap<>();
        otherItems.put("renamed", item("A", 5));

        assertEquals(
            List.of(
                new ChangeEntry(ChangeKind.REMOVED, FieldSelector.of("second"), FieldSelector.empty()),
                new ChangeEntry(ChangeKind.MODIFIED, FieldSelector.of("first", "qty"), FieldSelector.of("renamed", "qty"))),
            differ.diff(RecordCollection.ofMap(ITEM, baseItems), RecordCollection.ofMap(ITEM, otherItems)).entries());

        assertEquals(
            List.of(new ChangeEntry(ChangeKind.ADDED, FieldSelector.empty(), FieldSelector.of((Object) null))),
            differ.diff(
                RecordCollection.ofSet(ITEM, List.of(item("A", 1))),
                RecordCollection.ofSet(ITEM, List.of(item("A", 1), item("B", 1)))).entries());
    }

    @Test
    void typesWithoutIdentityFieldsAreIdentifiedByContent() {
        MapRecord red = MapRecord.builder(TAG).set("label", "x").set("color", "red").build();
        MapRecord blue = MapRecord.builder(TAG).set("label", "x").set("color", "blue").build();

        assertEquals(
            List.of(
                new ChangeEntry(ChangeKind.REMOVED, FieldSelector.of(0), FieldSelector.empty()),
                new ChangeEntry(ChangeKind.ADDED, FieldSelector.empty(), FieldSelector.of(0))),
            differ.diff(RecordCollection.ofList(TAG, List.of(red)), RecordCollection.ofList(TAG, List.of(blue)))
                .entries());
    }

    @Test
    void duckTypingUsesTheBaseItemTypeOnBothSides() {
        RecordType importedItem = RecordType.builder("ImportedItem").field("sku").field("qty").field("note").build();
        RecordCollection base = RecordCollection.ofList(ITEM, List.of(item("A", 1), item("B", 1)));
        RecordCollection other = RecordCollection.ofList(importedItem, List.of(
            MapRecord.builder(importedItem).set("sku", "B").set("qty", 1).build(),
            MapRecord.builder(importedItem).set("sku", "A").set("qty", 4).build()));

        assertEquals(
            List.of(new ChangeEntry(ChangeKind.MODIFIED, FieldSelector.of(0, "qty"), FieldSelector.of(1, "qty"))),
            differ.diff(base, other, Map.of(ComparisonOptions.DUCK_TYPE, true)).entries());
        assertThrows(RecordTypeMismatchException.class, () -> differ.diffStream(base, other));
    }

    @Test
    void filterRestrictsComparedItemFields() {
        MapRecord base = order(MapRecord.builder(ITEM).set("sku", "A").set("qty", 1).set("note", "x").build());
        MapRecord other = MapRecord.builder(ORDER)
            .set("id", 99)
            .set("items", RecordCollection.ofList(ITEM, List.of(
                MapRecord.builder(ITEM).set("sku", "A").set("qty", 2).set("note", "y").build())))
            .build();
        List<ChangeEntry> expected = List.of(at(ChangeKind.MODIFIED, "items", 0, "qty"));

        ComparisonOptions built = ComparisonOptions.builder()
            .compareFilter(
                FieldSelector.of("items", MultiFieldSelector.ANY, "qty"),
                FieldSelector.of("items", MultiFieldSelector.ANY, "sku"))
            .build();
        assertEquals(expected, differ.diff(base, other, built).entries());
        assertEquals(
            expected,
            differ.diff(base, other, Map.of(ComparisonOptions.COMPARE_FILTER, List.of("items.*.qty", "items.*.sku")))
                .entries());
    }

    @Test
    void mixedIdentityArityFailsFast() {
        IdentityExtractor inconsistent = (record, declaredType, selector, normalizer) ->
            "A".equals(record.get("sku")) ? "A" : new CompositeIdentity(List.of(record.get("sku"), 1));
        ComparisonOptions options = ComparisonOptions.builder().identityExtractor(inconsistent).build();

        UnsupportedComparisonException error = assertThrows(
            UnsupportedComparisonException.class,
            () -> differ.diff(order(item("A", 1)), order(item("B", 1)), options));
        assertEquals("identity.mixed_arity", error.featureKey());
        assertTrue(error.getMessage().contains(".items"));
    }

    private static MapRecord item(String sku, int qty) {
        return MapRecord.builder(ITEM).set("sku", sku).set("qty", qty).build();
    }

    private static MapRecord order(MapRecord... items) {
        return MapRecord.builder(ORDER)
            .set("id", 99)
            .set("items", RecordCollection.ofList(ITEM, List.of(items)))
            .build();
    }

    private static ChangeEntry at(ChangeKind kind, Object... path) {
        return new ChangeEntry(kind, FieldSelector.of(path), FieldSelector.of(path));
    }
}
