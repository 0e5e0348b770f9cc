package org.recdiff.engine;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import org.recdiff.model.Absent;
import org.recdiff.selector.FieldSelector;

/**
 * Reconciles containers of plain values, using each normalized value as its own identity.
 *
 * <p>Matched values are equal by construction, so there is no recursive phase.
 */
abstract class UnkeyedComparer implements Comparer {

    /**
     * The container's {@code (key, value)} pairs in iteration order.
     */
    abstract List<Item> items(Object container);

    @Override
    public Iterator<ChangeEntry> compare(
        Object base,
        Object other,
        FieldSelector basePath,
        FieldSelector otherPath,
        ComparisonOptions options
    ) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(other, "other");
        return ChangeCursor.deferred(() -> reconcile(base, other, basePath, otherPath, options));
    }

    private Iterator<ChangeEntry> reconcile(
        Object base,
        Object other,
        FieldSelector basePath,
        FieldSelector otherPath,
        ComparisonOptions options
    ) {
        OccurrenceMultiset<Object> baseValues = index(base, base, options);
        OccurrenceMultiset<Object> otherValues = index(other, options.duckType() ? base : other, options);
        OccurrenceMultiset.Reconciliation<Object> reconciliation =
            OccurrenceMultiset.reconcile(baseValues, otherValues);

        Iterator<ChangeEntry> removed = ChangeCursor.map(
            reconciliation.removed().iterator(),
            occurrence -> new ChangeEntry(ChangeKind.REMOVED, basePath.plus(occurrence.key()), otherPath));
        Iterator<ChangeEntry> added = ChangeCursor.map(
            reconciliation.added().iterator(),
            occurrence -> new ChangeEntry(ChangeKind.ADDED, basePath, otherPath.plus(occurrence.key())));
        if (!options.unchanged()) {
            return ChangeCursor.concat(removed, added);
        }
        Iterator<ChangeEntry> unchanged = ChangeCursor.map(
            reconciliation.matched().iterator(),
            match -> new ChangeEntry(
                ChangeKind.UNCHANGED,
                basePath.plus(match.base().key()),
                otherPath.plus(match.other().key())));
        return ChangeCursor.concat(removed, added, unchanged);
    }

    /**
     * @param hookSource container whose item hook applies; the base container when duck typing
     */
    private OccurrenceMultiset<Object> index(Object container, Object hookSource, ComparisonOptions options) {
        ValueNormalizer normalizer = options.normalizer();
        OccurrenceMultiset<Object> values = new OccurrenceMultiset<>();
        for (Item item : items(container)) {
            Object value = normalizer.normalizeItem(item.value(), hookSource);
            if (Absent.is(value) && options.ignoreEmptySlots()) {
                continue;
            }
            values.add(CanonicalKeys.of(value), item.key(), value);
        }
        return values;
    }

    record Item(Object key, Object value) {
    }
}
