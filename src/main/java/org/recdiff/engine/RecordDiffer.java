package org.recdiff.engine;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Stream;
import org.recdiff.model.DiffRecord;
import org.recdiff.model.RecordCollection;
import org.recdiff.obs.DiffRunContext;
import org.recdiff.obs.DiscardingJsonLinesLogger;
import org.recdiff.obs.JsonLinesLogger;
import org.recdiff.selector.FieldSelector;

/**
 * Entry point for structural comparisons.
 *
 * <p>{@code diffStream} returns a lazy, single-pass stream: differences are computed as the stream is
 * consumed, so a caller can stop after the first interesting entry. {@code diff} materializes the stream
 * into a {@link Diff}.
 *
 * <p>Options are given either as a prepared {@link ComparisonOptions} or as inline named values
 * (see {@link ComparisonOptions#fromMap}), never both.
 */
public final class RecordDiffer {
    private static final RecordDiffer STANDARD = new RecordDiffer(DiscardingJsonLinesLogger.INSTANCE);

    private final JsonLinesLogger logger;
    private final Supplier<String> runIds;

    public RecordDiffer(JsonLinesLogger logger) {
        this(logger, () -> UUID.randomUUID().toString());
    }

    public RecordDiffer(JsonLinesLogger logger, Supplier<String> runIds) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.runIds = Objects.requireNonNull(runIds, "runIds");
    }

    /**
     * Shared instance that does not log.
     */
    public static RecordDiffer standard() {
        return STANDARD;
    }

    public Stream<ChangeEntry> diffStream(Object base, Object other) {
        return diffStream(base, other, null, Map.of());
    }

    public Stream<ChangeEntry> diffStream(Object base, Object other, ComparisonOptions options) {
        return diffStream(base, other, options, Map.of());
    }

    public Stream<ChangeEntry> diffStream(Object base, Object other, Map<String, ?> inlineOptions) {
        return diffStream(base, other, null, inlineOptions);
    }

    /**
     * @throws DiffOptionsConflictException when both {@code options} and non-empty {@code inlineOptions}
     *     are given
     * @throws RecordTypeMismatchException when the roots have different types and duck typing is off
     */
    public Stream<ChangeEntry> diffStream(
        Object base,
        Object other,
        ComparisonOptions options,
        Map<String, ?> inlineOptions
    ) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(other, "other");
        DiffRunContext context = runContext(base, other, "diffStream");
        try {
            ComparisonOptions resolved = resolveOptions(options, inlineOptions);
            logger.info("diff started", context, resolved.asFields());
            return ChangeCursor.stream(dispatch(base, other, resolved));
        } catch (RuntimeException e) {
            logFailure(context, e);
            throw e;
        }
    }

    public Diff diff(Object base, Object other) {
        return diff(base, other, null, Map.of());
    }

    public Diff diff(Object base, Object other, ComparisonOptions options) {
        return diff(base, other, options, Map.of());
    }

    public Diff diff(Object base, Object other, Map<String, ?> inlineOptions) {
        return diff(base, other, null, inlineOptions);
    }

    public Diff diff(Object base, Object other, ComparisonOptions options, Map<String, ?> inlineOptions) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(other, "other");
        DiffRunContext context = runContext(base, other, "diff");
        List<ChangeEntry> entries;
        try {
            ComparisonOptions resolved = resolveOptions(options, inlineOptions);
            logger.info("diff started", context, resolved.asFields());
            entries = new ArrayList<>();
            dispatch(base, other, resolved).forEachRemaining(entries::add);
        } catch (RuntimeException e) {
            logFailure(context, e);
            throw e;
        }
        Diff result = new Diff(typeName(base), typeName(other), entries);
        logger.info("diff completed", context, countFields(result));
        return result;
    }

    static String typeName(Object value) {
        if (value instanceof DiffRecord record) {
            return record.type().name();
        }
        if (value instanceof RecordCollection collection) {
            return collection.itemType().name();
        }
        switch (ValueShape.of(value)) {
            case SEQUENCE:
                return value instanceof List<?> ? "List" : "Array";
            case SCALAR_MAPPING:
                return "Map";
            default:
                String simpleName = value.getClass().getSimpleName();
                return simpleName.isEmpty() ? value.getClass().getName() : simpleName;
        }
    }

    private static ComparisonOptions resolveOptions(ComparisonOptions options, Map<String, ?> inlineOptions) {
        boolean hasInline = inlineOptions != null && !inlineOptions.isEmpty();
        if (options != null && hasInline) {
            throw new DiffOptionsConflictException(
                "comparison options and inline option values are mutually exclusive (inline keys: "
                    + inlineOptions.keySet() + ")");
        }
        if (options != null) {
            return options;
        }
        return hasInline ? ComparisonOptions.fromMap(inlineOptions) : ComparisonOptions.defaults();
    }

    private static Iterator<ChangeEntry> dispatch(Object base, Object other, ComparisonOptions options) {
        ValueShape shape = ValueShape.of(base);
        if (!shape.structured()) {
            throw new UnsupportedComparisonException(
                "root.scalar",
                "cannot diff a scalar root value of type " + typeName(base));
        }
        if (ValueShape.of(other) != shape) {
            throw new RecordTypeMismatchException(typeName(base), typeName(other));
        }
        if (shape == ValueShape.KEYED_COLLECTION && !options.duckType() && !shape.sameDeclaredType(base, other)) {
            throw new RecordTypeMismatchException(typeName(base), typeName(other));
        }
        return shape.comparer().compare(base, other, FieldSelector.empty(), FieldSelector.empty(), options);
    }

    private DiffRunContext runContext(Object base, Object other, String operation) {
        return DiffRunContext.builder(runIds.get(), typeName(base), typeName(other))
            .operation(operation)
            .build();
    }

    private void logFailure(DiffRunContext context, RuntimeException failure) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("errorType", failure.getClass().getSimpleName());
        fields.put("errorMessage", failure.getMessage());
        if (failure instanceof UnsupportedComparisonException unsupported) {
            fields.put("featureKey", unsupported.featureKey());
        }
        logger.error("diff failed", context, fields);
    }

    private static Map<String, Object> countFields(Diff result) {
        Map<ChangeKind, Integer> counts = new EnumMap<>(ChangeKind.class);
        for (ChangeKind kind : ChangeKind.values()) {
            counts.put(kind, result.count(kind));
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("total", result.size());
        for (Map.Entry<ChangeKind, Integer> entry : counts.entrySet()) {
            fields.put(entry.getKey().token(), entry.getValue());
        }
        return fields;
    }
}
