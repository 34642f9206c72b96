package com.content.reconciliation.verification;

/**
 * Pipeline stage of a multi-step import: title matching first, then product naming.
 */
public enum WorkflowStage {
    MATCHING,
    NAMING
}
