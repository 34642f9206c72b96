package com.content.reconciliation.verification;

/**
 * Applies one approved proposal to the registry.
 *
 * <p>Implementations signal a stale proposal (one whose entities no longer exist
 * or no longer fit) by throwing
 * {@link com.content.reconciliation.core.model.UnknownEntityException} or
 * {@link IllegalArgumentException}; the workflow skips and reports it.</p>
 *
 * @param <T> proposal payload type
 */
@FunctionalInterface
public interface ProposalApplier<T> {

    void apply(T payload);
}
