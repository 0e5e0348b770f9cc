package org.recdiff.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Multiset comparison of scalar-valued maps; keys only locate values, they do not pair them.
 */
final class MappingComparer extends UnkeyedComparer {
    static final MappingComparer INSTANCE = new MappingComparer();

    private MappingComparer() {
    }

    @Override
    List<Item> items(Object container) {
        Map<?, ?> map = (Map<?, ?>) container;
        List<Item> items = new ArrayList<>(map.size());
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            items.add(new Item(entry.getKey(), entry.getValue()));
        }
        return items;
    }
}
