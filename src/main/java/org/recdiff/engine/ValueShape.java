package org.recdiff.engine;

import java.util.List;
import java.util.Map;
import org.recdiff.model.DiffRecord;
import org.recdiff.model.RecordCollection;

/**
 * Closed classification of comparable values; each structured shape has exactly one comparer.
 */
public enum ValueShape {
    SCALAR,
    RECORD,
    SEQUENCE,
    KEYED_COLLECTION,
    SCALAR_MAPPING;

    public static ValueShape of(Object value) {
        if (value instanceof DiffRecord) {
            return RECORD;
        }
        if (value instanceof RecordCollection) {
            return KEYED_COLLECTION;
        }
        if (value instanceof List<?> || value != null && value.getClass().isArray()) {
            return SEQUENCE;
        }
        if (value instanceof Map<?, ?>) {
            return SCALAR_MAPPING;
        }
        return SCALAR;
    }

    public boolean structured() {
        return this != SCALAR;
    }

    /**
     * True when both values of this shape carry the same declared type. Records must share a record
     * type and keyed collections an item type; sequences and mappings always match.
     */
    boolean sameDeclaredType(Object left, Object right) {
        return switch (this) {
            case RECORD -> ((DiffRecord) left).type() == ((DiffRecord) right).type();
            case KEYED_COLLECTION -> ((RecordCollection) left).itemType() == ((RecordCollection) right).itemType();
            default -> true;
        };
    }

    Comparer comparer() {
        return switch (this) {
            case RECORD -> RecordComparer.INSTANCE;
            case KEYED_COLLECTION -> KeyedCollectionComparer.INSTANCE;
            case SEQUENCE -> SequenceComparer.INSTANCE;
            case SCALAR_MAPPING -> MappingComparer.INSTANCE;
            case SCALAR -> throw new UnsupportedComparisonException(
                "shape.scalar",
                "scalar values are compared by equality, not structurally");
        };
    }
}
