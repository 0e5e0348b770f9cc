package org.recdiff.model;

import java.util.AbstractList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Read-only list view whose items are cleaned up by a hook before comparison.
 */
public final class ValueList<E> extends AbstractList<E> implements ItemNormalizing {
    private final List<E> items;
    private final UnaryOperator<Object> itemHook;

    private ValueList(List<E> items, UnaryOperator<Object> itemHook) {
        this.items = Objects.requireNonNull(items, "items");
        this.itemHook = Objects.requireNonNull(itemHook, "itemHook");
    }

    public static <E> ValueList<E> of(List<E> items, UnaryOperator<Object> itemHook) {
        return new ValueList<>(items, itemHook);
    }

    @Override
    public E get(int index) {
        return items.get(index);
    }

    @Override
    public int size() {
        return items.size();
    }

    @Override
    public Object compareItemAs(Object item) {
        return itemHook.apply(item);
    }
}
