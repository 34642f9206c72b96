package com.content.reconciliation.verification;

import java.util.Map;

/**
 * External collaborator that proposes simplified product display names.
 */
@FunctionalInterface
public interface NameSuggestionProvider {

    /**
     * @param originalNames original product names keyed by product id
     * @return proposed names keyed by product id; missing entries keep the draft name
     * @throws RuntimeException on provider failure, in which case drafts are used
     */
    Map<String, String> simplify(Map<String, String> originalNames);
}
