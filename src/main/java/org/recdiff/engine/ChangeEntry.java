package org.recdiff.engine;

import java.util.Objects;
import org.recdiff.selector.FieldSelector;

/**
 * One reported difference: its kind plus its location in the base and in the other tree.
 *
 * <p>Both paths are always present. When a location exists on one side only, the path on the other side
 * points at the enclosing collection.
 */
public final class ChangeEntry {
    private final ChangeKind kind;
    private final FieldSelector basePath;
    private final FieldSelector otherPath;

    public ChangeEntry(ChangeKind kind, FieldSelector basePath, FieldSelector otherPath) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.basePath = Objects.requireNonNull(basePath, "basePath");
        this.otherPath = Objects.requireNonNull(otherPath, "otherPath");
    }

    public static ChangeEntry of(Object kind, FieldSelector basePath, FieldSelector otherPath) {
        return new ChangeEntry(ChangeKind.of(kind), basePath, otherPath);
    }

    public ChangeKind kind() {
        return kind;
    }

    public FieldSelector basePath() {
        return basePath;
    }

    public FieldSelector otherPath() {
        return otherPath;
    }

    /**
     * The most specific path of the two, or {@code (base/other)} when neither extends the other.
     */
    public String location() {
        if (basePath.equals(otherPath)) {
            return otherPath.path();
        }
        if (basePath.length() > otherPath.length() && basePath.startsWith(otherPath)) {
            return basePath.path();
        }
        if (otherPath.length() > basePath.length() && otherPath.startsWith(basePath)) {
            return otherPath.path();
        }
        return "(" + basePath.path() + "/" + otherPath.path() + ")";
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ChangeEntry)) {
            return false;
        }
        ChangeEntry that = (ChangeEntry) other;
        return kind == that.kind && basePath.equals(that.basePath) && otherPath.equals(that.otherPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, basePath, otherPath);
    }

    @Override
    public String toString() {
        return "<ChangeEntry: " + kind.displayName() + " " + location() + ">";
    }
}
