package com.content.reconciliation.verification;

/**
 * States of the verification workflow.
 */
public enum WorkflowState {
    /**
     * Nothing staged.
     */
    IDLE,
    /**
     * Proposals produced, registry untouched.
     */
    STAGED,
    /**
     * Proposals presented with per-proposal selection.
     */
    REVIEWING,
    /**
     * Selected proposals applied.
     */
    COMMITTED
}
