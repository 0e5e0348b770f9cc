package org.recdiff.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Declared shape of a record: an ordered set of fields plus the fields that identify an instance.
 *
 * <p>Types compare by identity; two separately built types with the same fields are different types.
 */
public final class RecordType {
    private final String name;
    private final Map<String, FieldDescriptor> fields;
    private final List<String> identityFields;

    private RecordType(Builder builder) {
        this.name = requireText(builder.name, "name");
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
        for (String identityField : builder.identityFields) {
            if (!fields.containsKey(identityField)) {
                throw new IllegalArgumentException(
                    "identity field '" + identityField + "' is not declared by " + name);
            }
        }
        this.identityFields = List.copyOf(builder.identityFields);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    /**
     * Fields in declaration order.
     */
    public Map<String, FieldDescriptor> fields() {
        return fields;
    }

    public Optional<FieldDescriptor> field(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    public boolean hasField(String fieldName) {
        return fields.containsKey(fieldName);
    }

    /**
     * Primary key fields; empty when the type declares none.
     */
    public List<String> identityFields() {
        return identityFields;
    }

    @Override
    public String toString() {
        return name;
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
        private final Map<String, FieldDescriptor> fields = new LinkedHashMap<>();
        private final List<String> identityFields = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder field(String fieldName) {
            return field(FieldDescriptor.of(fieldName));
        }

        public Builder field(FieldDescriptor descriptor) {
            Objects.requireNonNull(descriptor, "descriptor");
            if (fields.putIfAbsent(descriptor.name(), descriptor) != null) {
                throw new IllegalArgumentException("duplicate field '" + descriptor.name() + "' in " + name);
            }
            return this;
        }

        public Builder identity(String... fieldNames) {
            identityFields.clear();
            for (String fieldName : fieldNames) {
                identityFields.add(Objects.requireNonNull(fieldName, "fieldName"));
            }
            return this;
        }

        public RecordType build() {
            return new RecordType(this);
        }
    }
}
