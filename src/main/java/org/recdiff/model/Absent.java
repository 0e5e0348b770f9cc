package org.recdiff.model;

/**
 * Marker for a slot that holds no value, distinct from {@code null}.
 */
public enum Absent {
    VALUE;

    public static boolean is(Object value) {
        return value == VALUE;
    }

    @Override
    public String toString() {
        return "(not set)";
    }
}
