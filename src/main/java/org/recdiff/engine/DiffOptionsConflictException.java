package org.recdiff.engine;

/**
 * Thrown when a caller passes both a prepared {@link ComparisonOptions} and inline option values.
 */
public final class DiffOptionsConflictException extends IllegalArgumentException {
    public DiffOptionsConflictException(final String message) {
        super(message);
    }
}
