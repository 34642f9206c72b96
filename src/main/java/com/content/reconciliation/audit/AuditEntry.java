package com.content.reconciliation.audit;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One line of the audit trail.
 *
 * @param action     what happened
 * @param entityId   canonical entity or video id concerned, null for batch-level events
 * @param actorId    who caused it, {@link AuditService#SYSTEM_ACTOR} for automatic steps
 * @param details    action-specific values such as the discarded entity id
 * @param recordedAt when the entry was written
 */
public record AuditEntry(
        AuditAction action,
        String entityId,
        String actorId,
        Map<String, Object> details,
        Instant recordedAt
) {
    public AuditEntry {
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(recordedAt, "recordedAt is required");
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    static AuditEntry now(AuditAction action, String entityId, String actorId, Map<String, Object> details) {
        return new AuditEntry(action, entityId, actorId, details, Instant.now());
    }
}
