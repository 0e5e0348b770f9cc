package org.recdiff.selector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Subset tree over record paths, used to restrict a comparison to selected fields.
 *
 * <p>A path is contained when it lies below a selected path or leads towards one. {@link #ANY} matches
 * every component at its level, which is how all keys of a collection are selected.
 */
public final class MultiFieldSelector {
    public static final Object ANY = Wildcard.ANY;

    private static final MultiFieldSelector ALL = new MultiFieldSelector(true, Map.of());
    private static final MultiFieldSelector NONE = new MultiFieldSelector(false, Map.of());

    private final boolean complete;
    private final Map<Object, MultiFieldSelector> heads;

    private MultiFieldSelector(boolean complete, Map<Object, MultiFieldSelector> heads) {
        this.complete = complete;
        this.heads = heads;
    }

    public static MultiFieldSelector all() {
        return ALL;
    }

    public static MultiFieldSelector none() {
        return NONE;
    }

    public static MultiFieldSelector of(FieldSelector... selectors) {
        List<FieldSelector> paths = new ArrayList<>(selectors.length);
        Collections.addAll(paths, selectors);
        return of(paths);
    }

    public static MultiFieldSelector of(List<FieldSelector> selectors) {
        Objects.requireNonNull(selectors, "selectors");
        Node root = new Node();
        for (FieldSelector selector : selectors) {
            root.add(Objects.requireNonNull(selector, "selector").components(), 0);
        }
        return root.freeze();
    }

    /**
     * True when every path under this node is selected.
     */
    public boolean isComplete() {
        return complete;
    }

    public boolean contains(FieldSelector selector) {
        Objects.requireNonNull(selector, "selector");
        return contains(selector.components(), 0);
    }

    /**
     * Sub-tree selected below {@code component}; wildcard branches are merged in.
     */
    public MultiFieldSelector get(Object component) {
        if (complete) {
            return ALL;
        }
        MultiFieldSelector exact = component == ANY ? null : heads.get(component);
        MultiFieldSelector wildcard = heads.get(ANY);
        if (exact == null) {
            return wildcard == null ? NONE : wildcard;
        }
        if (wildcard == null) {
            return exact;
        }
        return merge(exact, wildcard);
    }

    public MultiFieldSelector get(FieldSelector selector) {
        MultiFieldSelector node = this;
        for (Object component : selector.components()) {
            node = node.get(component);
        }
        return node;
    }

    private boolean contains(List<Object> components, int index) {
        if (complete) {
            return true;
        }
        if (index == components.size()) {
            return !heads.isEmpty();
        }
        Object component = components.get(index);
        MultiFieldSelector exact = heads.get(component);
        if (exact != null && exact.contains(components, index + 1)) {
            return true;
        }
        MultiFieldSelector wildcard = heads.get(ANY);
        return wildcard != null && wildcard.contains(components, index + 1);
    }

    private static MultiFieldSelector merge(MultiFieldSelector left, MultiFieldSelector right) {
        if (left.complete || right.complete) {
            return ALL;
        }
        Map<Object, MultiFieldSelector> merged = new LinkedHashMap<>(left.heads);
        for (Map.Entry<Object, MultiFieldSelector> entry : right.heads.entrySet()) {
            MultiFieldSelector existing = merged.get(entry.getKey());
            merged.put(entry.getKey(), existing == null ? entry.getValue() : merge(existing, entry.getValue()));
        }
        return new MultiFieldSelector(false, Collections.unmodifiableMap(merged));
    }

    @Override
    public String toString() {
        if (complete) {
            return "*all*";
        }
        return heads.toString();
    }

    private enum Wildcard {
        ANY;

        @Override
        public String toString() {
            return "*";
        }
    }

    private static final class Node {
        private boolean complete;
        private final Map<Object, Node> children = new LinkedHashMap<>();

        private void add(List<Object> components, int index) {
            if (complete) {
                return;
            }
            if (index == components.size()) {
                complete = true;
                children.clear();
                return;
            }
            children.computeIfAbsent(components.get(index), ignored -> new Node()).add(components, index + 1);
        }

        private MultiFieldSelector freeze() {
            if (complete) {
                return ALL;
            }
            Map<Object, MultiFieldSelector> heads = new LinkedHashMap<>();
            for (Map.Entry<Object, Node> entry : children.entrySet()) {
                heads.put(entry.getKey(), entry.getValue().freeze());
            }
            return new MultiFieldSelector(false, Collections.unmodifiableMap(heads));
        }
    }
}
