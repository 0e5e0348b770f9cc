package org.recdiff.selector;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Immutable path to a location in a record tree.
 *
 * <p>Components are field names, collection keys (strings or integers) or {@code null} for items of
 * set-backed collections.
 */
public final class FieldSelector {
    private static final FieldSelector EMPTY = new FieldSelector(List.of());
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final List<Object> components;

    private FieldSelector(List<Object> components) {
        this.components = components;
    }

    public static FieldSelector empty() {
        return EMPTY;
    }

    public static FieldSelector of(Object... components) {
        return of(Arrays.asList(components));
    }

    public static FieldSelector of(List<?> components) {
        Objects.requireNonNull(components, "components");
        if (components.isEmpty()) {
            return EMPTY;
        }
        return new FieldSelector(Collections.unmodifiableList(new ArrayList<>(components)));
    }

    public FieldSelector plus(Object component) {
        List<Object> extended = new ArrayList<>(components.size() + 1);
        extended.addAll(components);
        extended.add(component);
        return new FieldSelector(Collections.unmodifiableList(extended));
    }

    public FieldSelector plus(FieldSelector suffix) {
        Objects.requireNonNull(suffix, "suffix");
        if (suffix.components.isEmpty()) {
            return this;
        }
        if (components.isEmpty()) {
            return suffix;
        }
        List<Object> extended = new ArrayList<>(components.size() + suffix.components.size());
        extended.addAll(components);
        extended.addAll(suffix.components);
        return new FieldSelector(Collections.unmodifiableList(extended));
    }

    public List<Object> components() {
        return components;
    }

    public int length() {
        return components.size();
    }

    public boolean isEmpty() {
        return components.isEmpty();
    }

    public Object get(int index) {
        return components.get(index);
    }

    public FieldSelector tail(int fromIndex) {
        return of(components.subList(fromIndex, components.size()));
    }

    public boolean startsWith(FieldSelector prefix) {
        Objects.requireNonNull(prefix, "prefix");
        if (prefix.length() > length()) {
            return false;
        }
        return components.subList(0, prefix.length()).equals(prefix.components);
    }

    /**
     * Dotted rendering, e.g. {@code .items[2].name}; the empty selector renders as {@code .}.
     */
    public String path() {
        if (components.isEmpty()) {
            return ".";
        }
        StringBuilder sb = new StringBuilder();
        for (Object component : components) {
            if (component == null) {
                sb.append("[?]");
            } else if (component instanceof Number) {
                sb.append('[').append(component).append(']');
            } else if (component instanceof String name && IDENTIFIER.matcher(name).matches()) {
                sb.append('.').append(name);
            } else {
                sb.append("[\"").append(String.valueOf(component).replace("\"", "\\\"")).append("\"]");
            }
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof FieldSelector)) {
            return false;
        }
        return components.equals(((FieldSelector) other).components);
    }

    @Override
    public int hashCode() {
        return components.hashCode();
    }

    @Override
    public String toString() {
        return path();
    }
}
