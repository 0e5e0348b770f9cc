package org.recdiff.model;

/**
 * One {@code (key, item)} pair of a {@link RecordCollection}; the key is {@code null} for set-backed
 * collections.
 */
public record CollectionEntry(Object key, DiffRecord item) {
}
