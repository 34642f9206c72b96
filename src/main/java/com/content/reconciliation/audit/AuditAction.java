package com.content.reconciliation.audit;

/**
 * Types of auditable actions in the reconciliation engine.
 */
public enum AuditAction {
    ENTITY_CREATED,
    RECORD_REJECTED,
    ENTITY_CONSOLIDATED,
    PRODUCT_CONTESTED,
    LINK_RECORDED,
    LINK_RENAMED,
    PROPOSALS_STAGED,
    PROPOSAL_COMMITTED,
    PROPOSAL_SKIPPED,
    WORKFLOW_CLEARED
}
