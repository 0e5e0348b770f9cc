package org.recdiff.model;

/**
 * Capability of a container that cleans up its items before they are compared.
 */
public interface ItemNormalizing {
    Object compareItemAs(Object item);
}
