package org.recdiff.model;

import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Metadata for one field of a {@link RecordType}.
 */
public final class FieldDescriptor {
    private final String name;
    private final boolean extraneous;
    private final UnaryOperator<Object> compareAs;
    private final RecordType recordType;
    private final RecordType itemType;

    private FieldDescriptor(Builder builder) {
        this.name = requireText(builder.name, "name");
        this.extraneous = builder.extraneous;
        this.compareAs = builder.compareAs;
        this.recordType = builder.recordType;
        this.itemType = builder.itemType;
        if (recordType != null && itemType != null) {
            throw new IllegalArgumentException(
                "field '" + name + "' cannot declare both a record type and an item type");
        }
    }

    public static FieldDescriptor of(String name) {
        return builder(name).build();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    /**
     * Extraneous fields are skipped by comparisons unless explicitly included.
     */
    public boolean extraneous() {
        return extraneous;
    }

    public Optional<UnaryOperator<Object>> compareAs() {
        return Optional.ofNullable(compareAs);
    }

    /**
     * Declared type of a nested record stored in this field.
     */
    public Optional<RecordType> recordType() {
        return Optional.ofNullable(recordType);
    }

    /**
     * Declared item type when this field holds a {@link RecordCollection}.
     */
    public Optional<RecordType> itemType() {
        return Optional.ofNullable(itemType);
    }

    @Override
    public String toString() {
        return "FieldDescriptor[" + name + (extraneous ? ", extraneous" : "") + "]";
    }

    private static String requireText(String value, String fieldName) {
        String normalized = value == null ? null : value.trim();
        if (normalized == null || normalized.isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }

    public static final class Builder {
        private final String name;
        private boolean extraneous;
        private UnaryOperator<Object> compareAs;
        private RecordType recordType;
        private RecordType itemType;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder extraneous(boolean extraneous) {
            this.extraneous = extraneous;
            return this;
        }

        public Builder compareAs(UnaryOperator<Object> compareAs) {
            this.compareAs = compareAs;
            return this;
        }

        public Builder recordType(RecordType recordType) {
            this.recordType = recordType;
            return this;
        }

        public Builder itemType(RecordType itemType) {
            this.itemType = itemType;
            return this;
        }

        public FieldDescriptor build() {
            return new FieldDescriptor(this);
        }
    }
}
