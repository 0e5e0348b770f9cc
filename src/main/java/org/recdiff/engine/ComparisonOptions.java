package org.recdiff.engine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.recdiff.selector.FieldSelector;
import org.recdiff.selector.MultiFieldSelector;

/**
 * Immutable settings for one comparison run.
 *
 * <p>Instances are never mutated once built, so one instance may be shared by nested comparisons and by
 * concurrent runs.
 */
public final class ComparisonOptions {
    public static final String IGNORE_WHITESPACE = "ignoreWhitespace";
    public static final String IGNORE_CASE = "ignoreCase";
    public static final String UNICODE_NORMAL = "unicodeNormal";
    public static final String UNCHANGED = "unchanged";
    public static final String IGNORE_EMPTY_SLOTS = "ignoreEmptySlots";
    public static final String DUCK_TYPE = "duckType";
    public static final String EXTRANEOUS = "extraneous";
    public static final String COMPARE_FILTER = "compareFilter";
    public static final String VALUE_EQUALITY = "valueEquality";
    public static final String IDENTITY_EXTRACTOR = "identityExtractor";

    private static final Set<String> SUPPORTED_KEYS = Set.of(
        IGNORE_WHITESPACE,
        IGNORE_CASE,
        UNICODE_NORMAL,
        UNCHANGED,
        IGNORE_EMPTY_SLOTS,
        DUCK_TYPE,
        EXTRANEOUS,
        COMPARE_FILTER,
        VALUE_EQUALITY,
        IDENTITY_EXTRACTOR
    );
    private static final String WILDCARD = "*";
    private static final ComparisonOptions DEFAULTS = builder().build();

    private final boolean ignoreWhitespace;
    private final boolean ignoreCase;
    private final boolean unicodeNormal;
    private final boolean unchanged;
    private final boolean ignoreEmptySlots;
    private final boolean duckType;
    private final boolean extraneous;
    private final MultiFieldSelector compareFilter;
    private final ValueEquality valueEquality;
    private final IdentityExtractor identityExtractor;
    private final ValueNormalizer normalizer;

    private ComparisonOptions(Builder builder) {
        this.ignoreWhitespace = builder.ignoreWhitespace;
        this.ignoreCase = builder.ignoreCase;
        this.unicodeNormal = builder.unicodeNormal;
        this.unchanged = builder.unchanged;
        this.ignoreEmptySlots = builder.ignoreEmptySlots;
        this.duckType = builder.duckType;
        this.extraneous = builder.extraneous;
        this.compareFilter = builder.compareFilter;
        this.valueEquality = builder.valueEquality == null ? ValueEquality.numericAware() : builder.valueEquality;
        this.identityExtractor = builder.identityExtractor == null
            ? PrimaryKeyIdentityExtractor.INSTANCE
            : builder.identityExtractor;
        this.normalizer = new ValueNormalizer(this);
    }

    public static ComparisonOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds options from named values, as found in option files or passed inline.
     */
    public static ComparisonOptions fromMap(Map<String, ?> values) {
        return builder().apply(values).build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.ignoreWhitespace = ignoreWhitespace;
        builder.ignoreCase = ignoreCase;
        builder.unicodeNormal = unicodeNormal;
        builder.unchanged = unchanged;
        builder.ignoreEmptySlots = ignoreEmptySlots;
        builder.duckType = duckType;
        builder.extraneous = extraneous;
        builder.compareFilter = compareFilter;
        builder.valueEquality = valueEquality;
        builder.identityExtractor = identityExtractor;
        return builder;
    }

    public ComparisonOptions withOverrides(Map<String, ?> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        return toBuilder().apply(overrides).build();
    }

    public boolean ignoreWhitespace() {
        return ignoreWhitespace;
    }

    public boolean ignoreCase() {
        return ignoreCase;
    }

    public boolean unicodeNormal() {
        return unicodeNormal;
    }

    public boolean unchanged() {
        return unchanged;
    }

    public boolean ignoreEmptySlots() {
        return ignoreEmptySlots;
    }

    public boolean duckType() {
        return duckType;
    }

    public boolean extraneous() {
        return extraneous;
    }

    public Optional<MultiFieldSelector> compareFilter() {
        return Optional.ofNullable(compareFilter);
    }

    public ValueEquality valueEquality() {
        return valueEquality;
    }

    public IdentityExtractor identityExtractor() {
        return identityExtractor;
    }

    public ValueNormalizer normalizer() {
        return normalizer;
    }

    /**
     * True when a compare filter is configured and does not contain {@code selector}.
     */
    public boolean isFiltered(FieldSelector selector) {
        return compareFilter != null && !compareFilter.contains(selector);
    }

    public Map<String, Object> asFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(IGNORE_WHITESPACE, ignoreWhitespace);
        fields.put(IGNORE_CASE, ignoreCase);
        fields.put(UNICODE_NORMAL, unicodeNormal);
        fields.put(UNCHANGED, unchanged);
        fields.put(IGNORE_EMPTY_SLOTS, ignoreEmptySlots);
        fields.put(DUCK_TYPE, duckType);
        fields.put(EXTRANEOUS, extraneous);
        fields.put(COMPARE_FILTER, compareFilter == null ? null : compareFilter.toString());
        return fields;
    }

    @Override
    public String toString() {
        return "ComparisonOptions" + asFields();
    }

    static MultiFieldSelector parseFilter(Object rawValue) {
        if (rawValue == null) {
            return null;
        }
        if (rawValue instanceof MultiFieldSelector selector) {
            return selector;
        }
        if (!(rawValue instanceof List<?> rawPaths)) {
            throw new IllegalArgumentException(COMPARE_FILTER + " must be a list of paths");
        }
        List<FieldSelector> paths = new ArrayList<>(rawPaths.size());
        for (int i = 0; i < rawPaths.size(); i++) {
            paths.add(parsePath(rawPaths.get(i), COMPARE_FILTER + "[" + i + "]"));
        }
        return MultiFieldSelector.of(paths);
    }

    private static FieldSelector parsePath(Object rawPath, String fieldName) {
        if (rawPath instanceof FieldSelector selector) {
            return selector;
        }
        List<?> rawComponents;
        if (rawPath instanceof String dotted) {
            if (dotted.isBlank()) {
                throw new IllegalArgumentException(fieldName + " must not be blank");
            }
            rawComponents = Arrays.asList(dotted.trim().split("\\."));
        } else if (rawPath instanceof List<?> list) {
            rawComponents = list;
        } else {
            throw new IllegalArgumentException(fieldName + " must be a dotted string or a list of components");
        }
        List<Object> components = new ArrayList<>(rawComponents.size());
        for (Object rawComponent : rawComponents) {
            components.add(parseComponent(rawComponent, fieldName));
        }
        return FieldSelector.of(components);
    }

    private static Object parseComponent(Object rawComponent, String fieldName) {
        if (rawComponent == MultiFieldSelector.ANY || WILDCARD.equals(rawComponent)) {
            return MultiFieldSelector.ANY;
        }
        if (rawComponent instanceof Integer || rawComponent instanceof Long) {
            return ((Number) rawComponent).intValue();
        }
        if (rawComponent instanceof String text) {
            if (text.isEmpty()) {
                throw new IllegalArgumentException(fieldName + " contains an empty component");
            }
            if (text.chars().allMatch(Character::isDigit)) {
                return Integer.valueOf(text);
            }
            return text;
        }
        throw new IllegalArgumentException(fieldName + " contains an unsupported component: " + rawComponent);
    }

    private static boolean readFlag(Object rawValue, String fieldName) {
        if (rawValue instanceof Boolean flag) {
            return flag;
        }
        throw new IllegalArgumentException(fieldName + " must be a boolean");
    }

    public static final class Builder {
        private boolean ignoreWhitespace = true;
        private boolean ignoreCase;
        private boolean unicodeNormal = true;
        private boolean unchanged;
        private boolean ignoreEmptySlots;
        private boolean duckType;
        private boolean extraneous;
        private MultiFieldSelector compareFilter;
        private ValueEquality valueEquality;
        private IdentityExtractor identityExtractor;

        private Builder() {
        }

        public Builder ignoreWhitespace(boolean ignoreWhitespace) {
            this.ignoreWhitespace = ignoreWhitespace;
            return this;
        }

        public Builder ignoreCase(boolean ignoreCase) {
            this.ignoreCase = ignoreCase;
            return this;
        }

        public Builder unicodeNormal(boolean unicodeNormal) {
            this.unicodeNormal = unicodeNormal;
            return this;
        }

        public Builder unchanged(boolean unchanged) {
            this.unchanged = unchanged;
            return this;
        }

        public Builder ignoreEmptySlots(boolean ignoreEmptySlots) {
            this.ignoreEmptySlots = ignoreEmptySlots;
            return this;
        }

        public Builder duckType(boolean duckType) {
            this.duckType = duckType;
            return this;
        }

        public Builder extraneous(boolean extraneous) {
            this.extraneous = extraneous;
            return this;
        }

        public Builder compareFilter(MultiFieldSelector compareFilter) {
            this.compareFilter = compareFilter;
            return this;
        }

        public Builder compareFilter(FieldSelector... paths) {
            this.compareFilter = MultiFieldSelector.of(paths);
            return this;
        }

        public Builder valueEquality(ValueEquality valueEquality) {
            this.valueEquality = valueEquality;
            return this;
        }

        public Builder identityExtractor(IdentityExtractor identityExtractor) {
            this.identityExtractor = identityExtractor;
            return this;
        }

        public Builder apply(Map<String, ?> values) {
            Objects.requireNonNull(values, "values");
            for (Map.Entry<String, ?> entry : values.entrySet()) {
                String key = entry.getKey();
                if (!SUPPORTED_KEYS.contains(key)) {
                    throw new IllegalArgumentException("unsupported comparison option: " + key);
                }
                Object value = entry.getValue();
                switch (key) {
                    case IGNORE_WHITESPACE -> ignoreWhitespace = readFlag(value, key);
                    case IGNORE_CASE -> ignoreCase = readFlag(value, key);
                    case UNICODE_NORMAL -> unicodeNormal = readFlag(value, key);
                    case UNCHANGED -> unchanged = readFlag(value, key);
                    case IGNORE_EMPTY_SLOTS -> ignoreEmptySlots = readFlag(value, key);
                    case DUCK_TYPE -> duckType = readFlag(value, key);
                    case EXTRANEOUS -> extraneous = readFlag(value, key);
                    case COMPARE_FILTER -> compareFilter = parseFilter(value);
                    case VALUE_EQUALITY -> valueEquality = requireInstance(value, ValueEquality.class, key);
                    case IDENTITY_EXTRACTOR -> identityExtractor = requireInstance(value, IdentityExtractor.class, key);
                    default -> throw new IllegalArgumentException("unsupported comparison option: " + key);
                }
            }
            return this;
        }

        public ComparisonOptions build() {
            return new ComparisonOptions(this);
        }

        private static <T> T requireInstance(Object value, Class<T> type, String fieldName) {
            if (value == null || type.isInstance(value)) {
                return type.cast(value);
            }
            throw new IllegalArgumentException(fieldName + " must be a " + type.getSimpleName());
        }
    }
}
