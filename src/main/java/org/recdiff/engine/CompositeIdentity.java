package org.recdiff.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Identity made of several normalized values, compared element-wise.
 */
public record CompositeIdentity(List<Object> parts) {
    public CompositeIdentity {
        parts = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(parts, "parts")));
    }

    public int arity() {
        return parts.size();
    }
}
