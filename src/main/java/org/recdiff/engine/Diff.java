package org.recdiff.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Materialized comparison result, tagged with the names of the two compared types.
 */
public final class Diff {
    private final String baseTypeName;
    private final String otherTypeName;
    private final List<ChangeEntry> entries;

    public Diff(String baseTypeName, String otherTypeName, List<ChangeEntry> entries) {
        this.baseTypeName = requireText(baseTypeName, "baseTypeName");
        this.otherTypeName = requireText(otherTypeName, "otherTypeName");
        this.entries = copyEntries(entries);
    }

    public String baseTypeName() {
        return baseTypeName;
    }

    public String otherTypeName() {
        return otherTypeName;
    }

    public List<ChangeEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int count(ChangeKind kind) {
        Objects.requireNonNull(kind, "kind");
        int count = 0;
        for (ChangeEntry entry : entries) {
            if (entry.kind() == kind) {
                count++;
            }
        }
        return count;
    }

    public String summary() {
        String what = baseTypeName.equals(otherTypeName)
            ? baseTypeName
            : baseTypeName + " vs " + otherTypeName;
        return what + ": " + entries.size() + " item(s)";
    }

    @Override
    public String toString() {
        return "<Diff " + summary() + ">";
    }

    private static List<ChangeEntry> copyEntries(List<ChangeEntry> source) {
        Objects.requireNonNull(source, "entries");
        return List.copyOf(new ArrayList<>(source));
    }

    private static String requireText(String value, String fieldName) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value.trim();
    }
}
