package org.recdiff.model;

/**
 * A typed record instance that can be compared field by field.
 */
public interface DiffRecord {
    RecordType type();

    /**
     * Returns the value stored in the named slot, or {@link Absent#VALUE} when the slot is not set
     * or the field is not declared by this record's type.
     */
    Object get(String fieldName);
}
