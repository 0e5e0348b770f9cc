package org.recdiff.engine;

import java.util.Iterator;
import org.recdiff.selector.FieldSelector;

/**
 * Compares two values of one {@link ValueShape} and lazily yields their differences.
 */
interface Comparer {
    /**
     * @return a cursor that computes each entry when it is pulled
     */
    Iterator<ChangeEntry> compare(
        Object base,
        Object other,
        FieldSelector basePath,
        FieldSelector otherPath,
        ComparisonOptions options
    );
}
