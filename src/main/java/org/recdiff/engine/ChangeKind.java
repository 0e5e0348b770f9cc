package org.recdiff.engine;

/**
 * Kind of an individual difference, ordered by severity.
 */
public enum ChangeKind {
    UNCHANGED(1, "none", "UNCHANGED"),
    ADDED(2, "added", "ADDED"),
    REMOVED(3, "removed", "REMOVED"),
    MODIFIED(4, "modified", "MODIFIED");

    private final int index;
    private final String token;
    private final String displayName;

    ChangeKind(int index, String token, String displayName) {
        this.index = index;
        this.token = token;
        this.displayName = displayName;
    }

    public int index() {
        return index;
    }

    public String token() {
        return token;
    }

    public String displayName() {
        return displayName;
    }

    public static ChangeKind fromIndex(int index) {
        for (ChangeKind kind : values()) {
            if (kind.index == index) {
                return kind;
            }
        }
        throw new IllegalArgumentException("unsupported change kind index: " + index + " (expected: 1-4)");
    }

    /**
     * Resolves a canonical token ({@code none}, {@code added}, ...) or a display name
     * ({@code UNCHANGED}, {@code ADDED}, ...).
     */
    public static ChangeKind fromText(String rawValue) {
        if (rawValue == null) {
            throw new IllegalArgumentException("change kind must not be null");
        }
        String value = rawValue.trim();
        for (ChangeKind kind : values()) {
            if (kind.token.equals(value) || kind.displayName.equals(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException(
            "unsupported change kind: " + rawValue + " (expected: none|added|removed|modified)");
    }

    public static ChangeKind of(Object value) {
        if (value instanceof ChangeKind kind) {
            return kind;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            long index = ((Number) value).longValue();
            if (index < Integer.MIN_VALUE || index > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("unsupported change kind index: " + index + " (expected: 1-4)");
            }
            return fromIndex((int) index);
        }
        if (value instanceof String text) {
            return fromText(text);
        }
        throw new IllegalArgumentException("unsupported change kind: " + value);
    }
}
