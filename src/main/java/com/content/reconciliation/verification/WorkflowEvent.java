package com.content.reconciliation.verification;

/**
 * Events that drive {@link WorkflowTransitions}.
 */
public enum WorkflowEvent {
    STAGE,
    REVIEW,
    COMMIT,
    FINISH,
    CLEAR
}
