package com.content.reconciliation.core.model;

import java.util.Objects;

/**
 * Proposed display-name simplification for one product id.
 */
public record NameSuggestion(String productId, String originalName, String proposedName) {
    public NameSuggestion {
        Objects.requireNonNull(productId, "productId is required");
        originalName = originalName != null ? originalName : productId;
        proposedName = proposedName != null ? proposedName : originalName;
    }

    public NameSuggestion withProposedName(String name) {
        return new NameSuggestion(productId, originalName, name);
    }
}
