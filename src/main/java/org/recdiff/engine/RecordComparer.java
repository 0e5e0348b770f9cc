package org.recdiff.engine;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;
import org.recdiff.model.Absent;
import org.recdiff.model.DiffRecord;
import org.recdiff.model.FieldDescriptor;
import org.recdiff.selector.FieldSelector;

/**
 * Field-by-field comparison of two records, descending into structured field values.
 */
final class RecordComparer implements Comparer {
    static final RecordComparer INSTANCE = new RecordComparer();

    private RecordComparer() {
    }

    /**
     * @throws RecordTypeMismatchException immediately, when the record types differ and duck typing is off
     */
    @Override
    public Iterator<ChangeEntry> compare(
        Object base,
        Object other,
        FieldSelector basePath,
        FieldSelector otherPath,
        ComparisonOptions options
    ) {
        DiffRecord baseRecord = (DiffRecord) Objects.requireNonNull(base, "base");
        DiffRecord otherRecord = (DiffRecord) Objects.requireNonNull(other, "other");
        if (!options.duckType() && baseRecord.type() != otherRecord.type()) {
            throw new RecordTypeMismatchException(baseRecord.type().name(), otherRecord.type().name());
        }

        // fields of the base type only; the other side is looked up by name
        List<FieldDescriptor> fields = new ArrayList<>(new TreeMap<>(baseRecord.type().fields()).values());
        return ChangeCursor.flatMap(
            fields.iterator(),
            field -> compareField(baseRecord, otherRecord, field, basePath, otherPath, options));
    }

    private static Iterator<ChangeEntry> compareField(
        DiffRecord base,
        DiffRecord other,
        FieldDescriptor field,
        FieldSelector basePath,
        FieldSelector otherPath,
        ComparisonOptions options
    ) {
        FieldSelector fieldBasePath = basePath.plus(field.name());
        FieldSelector fieldOtherPath = otherPath.plus(field.name());
        if (options.isFiltered(fieldBasePath)) {
            return ChangeCursor.empty();
        }
        if (field.extraneous() && !options.extraneous()) {
            return ChangeCursor.empty();
        }

        ValueNormalizer normalizer = options.normalizer();
        Object baseValue = normalizer.normalizeSlot(base.get(field.name()), field);
        Object otherValue = normalizer.normalizeSlot(other.get(field.name()), field);

        if (Absent.is(baseValue) && Absent.is(otherValue)) {
            return ChangeCursor.empty();
        }
        if (Absent.is(baseValue)) {
            return ChangeCursor.of(new ChangeEntry(ChangeKind.ADDED, fieldBasePath, fieldOtherPath));
        }
        if (Absent.is(otherValue)) {
            return ChangeCursor.of(new ChangeEntry(ChangeKind.REMOVED, fieldBasePath, fieldOtherPath));
        }

        ValueShape shape = ValueShape.of(baseValue);
        if (shape.structured()
            && shape == ValueShape.of(otherValue)
            && (options.duckType() || shape.sameDeclaredType(baseValue, otherValue))) {
            return shape.comparer().compare(baseValue, otherValue, fieldBasePath, fieldOtherPath, options);
        }
        if (!options.valueEquality().valuesEqual(baseValue, otherValue)) {
            return ChangeCursor.of(new ChangeEntry(ChangeKind.MODIFIED, fieldBasePath, fieldOtherPath));
        }
        if (options.unchanged()) {
            return ChangeCursor.of(new ChangeEntry(ChangeKind.UNCHANGED, fieldBasePath, fieldOtherPath));
        }
        return ChangeCursor.empty();
    }
}
