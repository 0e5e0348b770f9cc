package org.recdiff.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Collection of identity-bearing records viewed as {@code (key, item)} pairs.
 *
 * <p>List-backed collections use the item position as key, map-backed collections use the map key
 * and set-backed collections use {@code null} for every item.
 */
public final class RecordCollection implements Iterable<CollectionEntry> {
    private final RecordType itemType;
    private final List<CollectionEntry> entries;

    private RecordCollection(RecordType itemType, List<CollectionEntry> entries) {
        this.itemType = Objects.requireNonNull(itemType, "itemType");
        this.entries = Collections.unmodifiableList(entries);
    }

    /**
     * @throws IllegalArgumentException when an item's type is not {@code itemType}
     */
    public static RecordCollection ofList(RecordType itemType, List<? extends DiffRecord> items) {
        Objects.requireNonNull(items, "items");
        List<CollectionEntry> entries = new ArrayList<>(items.size());
        int index = 0;
        for (DiffRecord item : items) {
            entries.add(new CollectionEntry(index++, requireItem(itemType, item)));
        }
        return new RecordCollection(itemType, entries);
    }

    public static RecordCollection ofMap(RecordType itemType, Map<String, ? extends DiffRecord> items) {
        Objects.requireNonNull(items, "items");
        List<CollectionEntry> entries = new ArrayList<>(items.size());
        for (Map.Entry<String, ? extends DiffRecord> entry : items.entrySet()) {
            entries.add(new CollectionEntry(
                Objects.requireNonNull(entry.getKey(), "key"),
                requireItem(itemType, entry.getValue())));
        }
        return new RecordCollection(itemType, entries);
    }

    public static RecordCollection ofSet(RecordType itemType, Collection<? extends DiffRecord> items) {
        Objects.requireNonNull(items, "items");
        List<CollectionEntry> entries = new ArrayList<>(items.size());
        for (DiffRecord item : items) {
            entries.add(new CollectionEntry(null, requireItem(itemType, item)));
        }
        return new RecordCollection(itemType, entries);
    }

    public RecordType itemType() {
        return itemType;
    }

    public List<CollectionEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    @Override
    public Iterator<CollectionEntry> iterator() {
        return entries.iterator();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RecordCollection)) {
            return false;
        }
        RecordCollection that = (RecordCollection) other;
        return itemType == that.itemType && entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(itemType), entries);
    }

    @Override
    public String toString() {
        return "RecordCollection<" + itemType.name() + ">" + entries;
    }

    private static DiffRecord requireItem(RecordType itemType, DiffRecord item) {
        Objects.requireNonNull(itemType, "itemType");
        Objects.requireNonNull(item, "collection items must not be null");
        if (item.type() != itemType) {
            throw new IllegalArgumentException(
                "collection of " + itemType.name() + " cannot hold an item of type " + item.type().name());
        }
        return item;
    }
}
