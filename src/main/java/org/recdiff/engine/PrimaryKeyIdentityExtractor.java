package org.recdiff.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import org.recdiff.model.DiffRecord;
import org.recdiff.model.FieldDescriptor;
import org.recdiff.model.RecordType;
import org.recdiff.selector.FieldSelector;
import org.recdiff.selector.MultiFieldSelector;

/**
 * Default identity: the declared identity fields of the record type, or every compared field when the
 * type declares none.
 *
 * <p>A single declared identity field yields a scalar identity; everything else yields a
 * {@link CompositeIdentity}. Nested records contribute their own identity.
 */
public final class PrimaryKeyIdentityExtractor implements IdentityExtractor {
    public static final PrimaryKeyIdentityExtractor INSTANCE = new PrimaryKeyIdentityExtractor();

    private PrimaryKeyIdentityExtractor() {
    }

    @Override
    public Object extract(
        DiffRecord record,
        RecordType declaredType,
        MultiFieldSelector selector,
        ValueNormalizer normalizer
    ) {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(normalizer, "normalizer");
        RecordType type = declaredType == null ? record.type() : declaredType;
        List<String> keyFields = keyFields(type, selector);

        List<Object> parts = new ArrayList<>(keyFields.size());
        for (String fieldName : keyFields) {
            FieldDescriptor field = type.fields().get(fieldName);
            MultiFieldSelector nestedSelector = selector == null ? null : selector.get(fieldName);
            parts.add(identityValue(record.get(fieldName), field, nestedSelector, normalizer));
        }
        if (parts.size() == 1 && !type.identityFields().isEmpty()) {
            return parts.get(0);
        }
        return new CompositeIdentity(parts);
    }

    private Object identityValue(
        Object raw,
        FieldDescriptor field,
        MultiFieldSelector selector,
        ValueNormalizer normalizer
    ) {
        Object value = normalizer.normalizeSlot(raw, field);
        if (value instanceof DiffRecord nested) {
            return extract(nested, null, selector, normalizer);
        }
        return CanonicalKeys.of(value, normalizer, this);
    }

    private static List<String> keyFields(RecordType type, MultiFieldSelector selector) {
        List<String> candidates;
        if (type.identityFields().isEmpty()) {
            candidates = new ArrayList<>();
            for (String fieldName : new TreeSet<>(type.fields().keySet())) {
                if (!type.fields().get(fieldName).extraneous()) {
                    candidates.add(fieldName);
                }
            }
        } else {
            candidates = type.identityFields();
        }
        if (selector == null) {
            return candidates;
        }
        List<String> selected = new ArrayList<>(candidates.size());
        for (String fieldName : candidates) {
            if (selector.contains(FieldSelector.of(fieldName))) {
                selected.add(fieldName);
            }
        }
        return selected;
    }
}
