package com.content.reconciliation.consolidation;

/**
 * Listener for consolidation events, e.g. to drop presentation caches
 * that still reference the retired entity.
 */
public interface ConsolidationListener {

    /**
     * Called after a successful consolidation.
     *
     * @param keepEntityId    the surviving entity
     * @param discardEntityId the entity that was removed from the registry
     */
    void onConsolidated(String keepEntityId, String discardEntityId);
}
