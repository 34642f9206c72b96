package com.content.reconciliation.verification;

/**
 * Pure transition function of the verification workflow.
 *
 * <pre>
 * IDLE --STAGE--> STAGED --REVIEW--> REVIEWING --COMMIT--> COMMITTED --FINISH--> IDLE
 * STAGE from any state re-stages (previous uncommitted proposals are dropped)
 * CLEAR from any state --> IDLE
 * </pre>
 */
public final class WorkflowTransitions {

    private WorkflowTransitions() {
        // Utility class
    }

    /**
     * @throws IllegalWorkflowTransitionException if the event is not legal in {@code state}
     */
    public static WorkflowState next(WorkflowState state, WorkflowEvent event) {
        switch (event) {
            case CLEAR:
                return WorkflowState.IDLE;
            case STAGE:
                return WorkflowState.STAGED;
            case REVIEW:
                if (state == WorkflowState.STAGED) {
                    return WorkflowState.REVIEWING;
                }
                break;
            case COMMIT:
                if (state == WorkflowState.REVIEWING) {
                    return WorkflowState.COMMITTED;
                }
                break;
            case FINISH:
                if (state == WorkflowState.COMMITTED) {
                    return WorkflowState.IDLE;
                }
                break;
            default:
                break;
        }
        throw new IllegalWorkflowTransitionException(state, event);
    }

    public static boolean isAllowed(WorkflowState state, WorkflowEvent event) {
        try {
            next(state, event);
            return true;
        } catch (IllegalWorkflowTransitionException e) {
            return false;
        }
    }
}
