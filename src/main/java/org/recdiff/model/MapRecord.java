package org.recdiff.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable {@link DiffRecord} backed by a map of set slots.
 */
public final class MapRecord implements DiffRecord {
    private final RecordType type;
    private final Map<String, Object> values;

    private MapRecord(RecordType type, Map<String, Object> values) {
        this.type = type;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static Builder builder(RecordType type) {
        return new Builder(type);
    }

    @Override
    public RecordType type() {
        return type;
    }

    @Override
    public Object get(String fieldName) {
        if (!values.containsKey(fieldName)) {
            return Absent.VALUE;
        }
        return values.get(fieldName);
    }

    /**
     * Set slots only; unset fields are missing from the map.
     */
    public Map<String, Object> values() {
        return values;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof MapRecord)) {
            return false;
        }
        MapRecord that = (MapRecord) other;
        return type == that.type && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(type), values);
    }

    @Override
    public String toString() {
        return type.name() + values;
    }

    public static final class Builder {
        private final RecordType type;
        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder(RecordType type) {
            this.type = Objects.requireNonNull(type, "type");
        }

        public Builder set(String fieldName, Object value) {
            if (!type.hasField(fieldName)) {
                throw new IllegalArgumentException(
                    "field '" + fieldName + "' is not declared by " + type.name());
            }
            if (Absent.is(value)) {
                values.remove(fieldName);
            } else {
                values.put(fieldName, value);
            }
            return this;
        }

        public MapRecord build() {
            return new MapRecord(type, values);
        }
    }
}
