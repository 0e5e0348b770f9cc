package org.recdiff.obs;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Correlation metadata emitted with every structured log event of one diff run.
 */
public final class DiffRunContext {
    private final String runId;
    private final String baseType;
    private final String otherType;
    private final String operation;

    private DiffRunContext(Builder builder) {
        this.runId = requireText(builder.runId, "runId");
        this.baseType = requireText(builder.baseType, "baseType");
        this.otherType = requireText(builder.otherType, "otherType");
        this.operation = normalize(builder.operation);
    }

    public static DiffRunContext of(String runId, String baseType, String otherType) {
        return builder(runId, baseType, otherType).build();
    }

    public static Builder builder(String runId, String baseType, String otherType) {
        return new Builder(runId, baseType, otherType);
    }

    public String runId() {
        return runId;
    }

    public String baseType() {
        return baseType;
    }

    public String otherType() {
        return otherType;
    }

    public Optional<String> operation() {
        return Optional.ofNullable(operation);
    }

    public Map<String, Object> asFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("runId", runId);
        fields.put("baseType", baseType);
        fields.put("otherType", otherType);
        if (operation != null) {
            fields.put("operation", operation);
        }
        return fields;
    }

    private static String requireText(String value, String fieldName) {
        String normalized = normalize(value);
        if (normalized == null) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static final class Builder {
        private final String runId;
        private final String baseType;
        private final String otherType;
        private String operation;

        private Builder(String runId, String baseType, String otherType) {
            this.runId = Objects.requireNonNull(runId, "runId");
            this.baseType = Objects.requireNonNull(baseType, "baseType");
            this.otherType = Objects.requireNonNull(otherType, "otherType");
        }

        public Builder operation(String operation) {
            this.operation = operation;
            return this;
        }

        public DiffRunContext build() {
            return new DiffRunContext(this);
        }
    }
}
