package org.recdiff.model;

import java.util.AbstractMap;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Read-only map view whose values are cleaned up by a hook before comparison.
 */
public final class ValueMap<K, V> extends AbstractMap<K, V> implements ItemNormalizing {
    private final Map<K, V> items;
    private final UnaryOperator<Object> itemHook;

    private ValueMap(Map<K, V> items, UnaryOperator<Object> itemHook) {
        this.items = Objects.requireNonNull(items, "items");
        this.itemHook = Objects.requireNonNull(itemHook, "itemHook");
    }

    public static <K, V> ValueMap<K, V> of(Map<K, V> items, UnaryOperator<Object> itemHook) {
        return new ValueMap<>(items, itemHook);
    }

    @Override
    public Set<Entry<K, V>> entrySet() {
        return Collections.unmodifiableMap(items).entrySet();
    }

    @Override
    public V get(Object key) {
        return items.get(key);
    }

    @Override
    public boolean containsKey(Object key) {
        return items.containsKey(key);
    }

    @Override
    public Object compareItemAs(Object item) {
        return itemHook.apply(item);
    }
}
