package org.recdiff.engine;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.recdiff.model.CollectionEntry;
import org.recdiff.model.DiffRecord;
import org.recdiff.model.RecordCollection;

/**
 * Converts normalized values into hashable keys whose equality matches value equality.
 *
 * <p>Numbers become stripped {@link BigDecimal}s so that {@code 1}, {@code 1L} and {@code 1.0} share a
 * key; arrays become lists.
 */
final class CanonicalKeys {
    private CanonicalKeys() {
    }

    static Object of(Object value) {
        return of(value, null, null);
    }

    /**
     * With an extractor, nested records and record collections are reduced to their identities.
     */
    static Object of(Object value, ValueNormalizer normalizer, IdentityExtractor extractor) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return canonicalNumber(number);
        }
        if (value instanceof DiffRecord record) {
            return extractor == null ? record : extractor.extract(record, null, null, normalizer);
        }
        if (value instanceof RecordCollection collection) {
            if (extractor == null) {
                return collection;
            }
            List<Object> identities = new ArrayList<>(collection.size());
            for (CollectionEntry entry : collection) {
                identities.add(extractor.extract(entry.item(), null, null, normalizer));
            }
            return Collections.unmodifiableList(identities);
        }
        if (value instanceof List<?> list) {
            List<Object> items = new ArrayList<>(list.size());
            for (Object item : list) {
                items.add(of(normalizeNested(item, normalizer), normalizer, extractor));
            }
            return Collections.unmodifiableList(items);
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> entries = new HashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                entries.put(
                    of(entry.getKey(), normalizer, extractor),
                    of(normalizeNested(entry.getValue(), normalizer), normalizer, extractor));
            }
            return Collections.unmodifiableMap(entries);
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> items = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                items.add(of(normalizeNested(Array.get(value, i), normalizer), normalizer, extractor));
            }
            return Collections.unmodifiableList(items);
        }
        return value;
    }

    private static Object normalizeNested(Object value, ValueNormalizer normalizer) {
        return normalizer == null ? value : normalizer.normalizeValue(value);
    }

    private static Object canonicalNumber(Number number) {
        if (number instanceof Double || number instanceof Float) {
            double doubleValue = number.doubleValue();
            if (!Double.isFinite(doubleValue)) {
                return doubleValue;
            }
        }
        try {
            return new BigDecimal(number.toString()).stripTrailingZeros();
        } catch (NumberFormatException ignored) {
            return number;
        }
    }
}
