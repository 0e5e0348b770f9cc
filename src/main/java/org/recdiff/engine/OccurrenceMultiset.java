package org.recdiff.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered multiset keyed by identity, remembering where every occurrence came from.
 *
 * <p>The n-th occurrence of an identity on one side only matches the n-th occurrence of the same
 * identity on the other side, so duplicates are reconciled one by one instead of collapsing.
 */
final class OccurrenceMultiset<T> {
    private final Map<Object, List<Occurrence<T>>> byIdentity = new HashMap<>();
    private final List<Occurrence<T>> occurrences = new ArrayList<>();

    void add(Object identity, Object key, T item) {
        List<Occurrence<T>> seen = byIdentity.computeIfAbsent(identity, ignored -> new ArrayList<>());
        Occurrence<T> occurrence = new Occurrence<>(identity, seen.size(), key, item);
        seen.add(occurrence);
        occurrences.add(occurrence);
    }

    /**
     * Occurrences in insertion order.
     */
    List<Occurrence<T>> occurrences() {
        return Collections.unmodifiableList(occurrences);
    }

    Occurrence<T> find(Object identity, int ordinal) {
        List<Occurrence<T>> seen = byIdentity.get(identity);
        if (seen == null || ordinal >= seen.size()) {
            return null;
        }
        return seen.get(ordinal);
    }

    int size() {
        return occurrences.size();
    }

    static <T> Reconciliation<T> reconcile(OccurrenceMultiset<T> base, OccurrenceMultiset<T> other) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(other, "other");
        List<Occurrence<T>> removed = new ArrayList<>();
        List<Match<T>> matched = new ArrayList<>();
        for (Occurrence<T> occurrence : base.occurrences) {
            Occurrence<T> counterpart = other.find(occurrence.identity(), occurrence.ordinal());
            if (counterpart == null) {
                removed.add(occurrence);
            } else {
                matched.add(new Match<>(occurrence, counterpart));
            }
        }
        List<Occurrence<T>> added = new ArrayList<>();
        for (Occurrence<T> occurrence : other.occurrences) {
            if (base.find(occurrence.identity(), occurrence.ordinal()) == null) {
                added.add(occurrence);
            }
        }
        return new Reconciliation<>(removed, added, matched);
    }

    record Occurrence<T>(Object identity, int ordinal, Object key, T item) {
    }

    record Match<T>(Occurrence<T> base, Occurrence<T> other) {
    }

    /**
     * Base-only occurrences in base order, other-only occurrences in other order, matches in base order.
     */
    record Reconciliation<T>(List<Occurrence<T>> removed, List<Occurrence<T>> added, List<Match<T>> matched) {
    }
}
