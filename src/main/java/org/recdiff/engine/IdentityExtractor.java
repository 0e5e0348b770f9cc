package org.recdiff.engine;

import org.recdiff.model.DiffRecord;
import org.recdiff.model.RecordType;
import org.recdiff.selector.MultiFieldSelector;

/**
 * Derives the value that identifies "the same logical item" across two collection snapshots.
 */
@FunctionalInterface
public interface IdentityExtractor {
    /**
     * @param record the collection item
     * @param declaredType the type whose identity fields apply when duck typing, otherwise {@code null}
     * @param selector restricts the fields that may contribute, or {@code null} for no restriction
     * @param normalizer slot normalization applied to every contributing value
     * @return a scalar identity or a {@link CompositeIdentity}
     */
    Object extract(DiffRecord record, RecordType declaredType, MultiFieldSelector selector, ValueNormalizer normalizer);
}
