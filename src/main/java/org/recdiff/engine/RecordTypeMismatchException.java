package org.recdiff.engine;

/**
 * Thrown when two records of different declared types are compared without duck typing.
 */
public final class RecordTypeMismatchException extends RuntimeException {
    private final String baseTypeName;
    private final String otherTypeName;

    public RecordTypeMismatchException(final String baseTypeName, final String otherTypeName) {
        super("cannot compare " + baseTypeName + " with " + otherTypeName);
        this.baseTypeName = baseTypeName;
        this.otherTypeName = otherTypeName;
    }

    public String baseTypeName() {
        return baseTypeName;
    }

    public String otherTypeName() {
        return otherTypeName;
    }
}
