package org.recdiff.engine;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import org.recdiff.model.CollectionEntry;
import org.recdiff.model.DiffRecord;
import org.recdiff.model.RecordCollection;
import org.recdiff.model.RecordType;
import org.recdiff.selector.FieldSelector;
import org.recdiff.selector.MultiFieldSelector;

/**
 * Reconciles two collections of identity-bearing records, then compares matched pairs field by field.
 *
 * <p>A matched identity says nothing about content, so every matched pair is compared recursively.
 */
final class KeyedCollectionComparer implements Comparer {
    static final KeyedCollectionComparer INSTANCE = new KeyedCollectionComparer();

    private KeyedCollectionComparer() {
    }

    @Override
    public Iterator<ChangeEntry> compare(
        Object base,
        Object other,
        FieldSelector basePath,
        FieldSelector otherPath,
        ComparisonOptions options
    ) {
        RecordCollection baseCollection = (RecordCollection) Objects.requireNonNull(base, "base");
        RecordCollection otherCollection = (RecordCollection) Objects.requireNonNull(other, "other");
        return ChangeCursor.deferred(() -> reconcile(baseCollection, otherCollection, basePath, otherPath, options));
    }

    private static Iterator<ChangeEntry> reconcile(
        RecordCollection base,
        RecordCollection other,
        FieldSelector basePath,
        FieldSelector otherPath,
        ComparisonOptions options
    ) {
        RecordType declaredType = options.duckType() ? base.itemType() : null;
        MultiFieldSelector selector = options.compareFilter()
            .map(filter -> filter.get(basePath).get(MultiFieldSelector.ANY))
            .orElse(null);
        IdentityShapeGuard guard = new IdentityShapeGuard(basePath);

        OccurrenceMultiset<DiffRecord> baseItems = index(base, declaredType, selector, guard, options);
        OccurrenceMultiset<DiffRecord> otherItems = index(other, declaredType, selector, guard, options);
        OccurrenceMultiset.Reconciliation<DiffRecord> reconciliation =
            OccurrenceMultiset.reconcile(baseItems, otherItems);

        Iterator<ChangeEntry> removed = ChangeCursor.map(
            reconciliation.removed().iterator(),
            occurrence -> new ChangeEntry(ChangeKind.REMOVED, basePath.plus(occurrence.key()), otherPath));
        Iterator<ChangeEntry> added = ChangeCursor.map(
            reconciliation.added().iterator(),
            occurrence -> new ChangeEntry(ChangeKind.ADDED, basePath, otherPath.plus(occurrence.key())));
        Iterator<ChangeEntry> matched = ChangeCursor.flatMap(
            reconciliation.matched().iterator(),
            match -> compareMatch(match, basePath, otherPath, options));
        return ChangeCursor.concat(removed, added, matched);
    }

    private static OccurrenceMultiset<DiffRecord> index(
        RecordCollection collection,
        RecordType declaredType,
        MultiFieldSelector selector,
        IdentityShapeGuard guard,
        ComparisonOptions options
    ) {
        OccurrenceMultiset<DiffRecord> items = new OccurrenceMultiset<>();
        for (CollectionEntry entry : collection) {
            Object identity = options.identityExtractor()
                .extract(entry.item(), declaredType, selector, options.normalizer());
            guard.check(identity);
            items.add(CanonicalKeys.of(identity), entry.key(), entry.item());
        }
        return items;
    }

    private static Iterator<ChangeEntry> compareMatch(
        OccurrenceMultiset.Match<DiffRecord> match,
        FieldSelector basePath,
        FieldSelector otherPath,
        ComparisonOptions options
    ) {
        FieldSelector itemBasePath = basePath.plus(match.base().key());
        FieldSelector itemOtherPath = otherPath.plus(match.other().key());
        Iterator<ChangeEntry> nested = RecordComparer.INSTANCE
            .compare(match.base().item(), match.other().item(), itemBasePath, itemOtherPath, options);
        if (!options.unchanged()) {
            return nested;
        }
        return ChangeCursor.deferred(() -> withCleanMarker(nested, itemBasePath, itemOtherPath));
    }

    /**
     * Prefixes a pair's entries with an UNCHANGED entry for the pair itself when every nested entry is
     * UNCHANGED. Only the entries up to the first real change are buffered.
     */
    private static Iterator<ChangeEntry> withCleanMarker(
        Iterator<ChangeEntry> nested,
        FieldSelector itemBasePath,
        FieldSelector itemOtherPath
    ) {
        List<ChangeEntry> peeked = new ArrayList<>();
        while (nested.hasNext()) {
            ChangeEntry entry = nested.next();
            peeked.add(entry);
            if (entry.kind() != ChangeKind.UNCHANGED) {
                return ChangeCursor.concat(peeked.iterator(), nested);
            }
        }
        peeked.add(0, new ChangeEntry(ChangeKind.UNCHANGED, itemBasePath, itemOtherPath));
        return peeked.iterator();
    }

    /**
     * The first identity fixes whether identities are scalar or composite, and of which arity.
     */
    private static final class IdentityShapeGuard {
        private static final int SCALAR = -1;

        private final FieldSelector path;
        private Integer arity;

        private IdentityShapeGuard(FieldSelector path) {
            this.path = path;
        }

        private void check(Object identity) {
            int observed = identity instanceof CompositeIdentity composite ? composite.arity() : SCALAR;
            if (arity == null) {
                arity = observed;
                return;
            }
            if (arity != observed) {
                throw new UnsupportedComparisonException(
                    "identity.mixed_arity",
                    "cannot reconcile " + describe(arity) + " and " + describe(observed)
                        + " identities in collection at " + path.path());
            }
        }

        private static String describe(int arity) {
            return arity == SCALAR ? "scalar" : arity + "-part";
        }
    }
}
