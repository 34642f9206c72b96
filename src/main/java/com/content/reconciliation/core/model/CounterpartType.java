package com.content.reconciliation.core.model;

/**
 * What the product side of a {@link MatchCandidate} refers to.
 */
public enum CounterpartType {
    /**
     * An orphaned product-side entity in the registry.
     */
    ENTITY,

    /**
     * A product-platform video descriptor supplied from outside the registry.
     */
    ASSET
}
