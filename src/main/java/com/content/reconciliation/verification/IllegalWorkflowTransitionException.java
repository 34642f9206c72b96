package com.content.reconciliation.verification;

/**
 * Thrown when an event is not legal in the workflow's current state.
 */
public class IllegalWorkflowTransitionException extends RuntimeException {

    private final WorkflowState state;
    private final WorkflowEvent event;

    public IllegalWorkflowTransitionException(WorkflowState state, WorkflowEvent event) {
        super("Event " + event + " is not allowed in state " + state);
        this.state = state;
        this.event = event;
    }

    public WorkflowState getState() {
        return state;
    }

    public WorkflowEvent getEvent() {
        return event;
    }
}
