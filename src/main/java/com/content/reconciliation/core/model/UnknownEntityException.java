package com.content.reconciliation.core.model;

/**
 * Thrown when an entity id is not live in the registry, typically because the
 * entity was consumed by a consolidation.
 */
public class UnknownEntityException extends RuntimeException {

    private final String entityId;

    public UnknownEntityException(String entityId) {
        super("Entity not found: " + entityId);
        this.entityId = entityId;
    }

    public String getEntityId() {
        return entityId;
    }
}
