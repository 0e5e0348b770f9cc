package org.recdiff.engine;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;

/**
 * Multiset comparison of lists and arrays; the key of an item is its position.
 */
final class SequenceComparer extends UnkeyedComparer {
    static final SequenceComparer INSTANCE = new SequenceComparer();

    private SequenceComparer() {
    }

    @Override
    List<Item> items(Object container) {
        if (container instanceof List<?> list) {
            List<Item> items = new ArrayList<>(list.size());
            int index = 0;
            for (Object value : list) {
                items.add(new Item(index++, value));
            }
            return items;
        }
        int length = Array.getLength(container);
        List<Item> items = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            items.add(new Item(i, Array.get(container, i)));
        }
        return items;
    }
}
