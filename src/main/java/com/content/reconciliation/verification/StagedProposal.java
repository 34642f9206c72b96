package com.content.reconciliation.verification;

import java.util.Objects;

/**
 * A proposal held by the workflow together with the reviewer's selection.
 *
 * @param <T> proposal payload, a match candidate or a name suggestion
 */
public class StagedProposal<T> {
    private final String id;
    private T payload;
    private boolean selected;

    public StagedProposal(String id, T payload, boolean selected) {
        this.id = Objects.requireNonNull(id, "id is required");
        this.payload = Objects.requireNonNull(payload, "payload is required");
        this.selected = selected;
    }

    public String getId() {
        return id;
    }

    public T getPayload() {
        return payload;
    }

    void setPayload(T payload) {
        this.payload = Objects.requireNonNull(payload, "payload is required");
    }

    public boolean isSelected() {
        return selected;
    }

    void setSelected(boolean selected) {
        this.selected = selected;
    }

    @Override
    public String toString() {
        return "StagedProposal{" +
                "id='" + id + '\'' +
                ", selected=" + selected +
                ", payload=" + payload +
                '}';
    }
}
