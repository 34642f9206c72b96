package com.content.reconciliation.verification;

import com.content.reconciliation.aggregate.EntityRegistry;
import com.content.reconciliation.core.model.CanonicalEntity;
import com.content.reconciliation.core.model.MatchCandidate;
import com.content.reconciliation.core.model.NameSuggestion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds naming-stage drafts for the product ids of committed matches and asks the
 * configured {@link NameSuggestionProvider} for simplified names. When the provider
 * fails, the truncated drafts are used.
 */
public class NamingSuggestionService {
    private static final Logger log = LoggerFactory.getLogger(NamingSuggestionService.class);

    private final EntityRegistry registry;
    private final NameSuggestionProvider provider;
    private final TruncatingNameSuggestionProvider fallback = new TruncatingNameSuggestionProvider();

    public NamingSuggestionService(EntityRegistry registry, NameSuggestionProvider provider) {
        this.registry = registry;
        this.provider = provider;
    }

    public List<NameSuggestion> suggest(List<MatchCandidate> committedMatches) {
        Map<String, String> originalNames = new LinkedHashMap<>();
        for (MatchCandidate candidate : committedMatches) {
            for (String productId : candidate.productIds()) {
                originalNames.putIfAbsent(productId, originalName(productId, candidate));
            }
        }
        if (originalNames.isEmpty()) {
            return List.of();
        }

        Map<String, String> drafts = fallback.simplify(originalNames);
        Map<String, String> proposed;
        try {
            proposed = provider.simplify(originalNames);
        } catch (RuntimeException e) {
            log.warn("naming.providerFailed products={} error={}", originalNames.size(), e.getMessage());
            proposed = drafts;
        }

        List<NameSuggestion> suggestions = new ArrayList<>(originalNames.size());
        for (Map.Entry<String, String> entry : originalNames.entrySet()) {
            String productId = entry.getKey();
            String name = proposed != null ? proposed.get(productId) : null;
            if (name == null || name.isBlank()) {
                name = drafts.get(productId);
            }
            suggestions.add(new NameSuggestion(productId, entry.getValue(), name));
        }
        log.info("naming.suggested products={}", suggestions.size());
        return suggestions;
    }

    private String originalName(String productId, MatchCandidate candidate) {
        Optional<CanonicalEntity> owner = registry.findByProductId(productId);
        if (owner.isPresent()) {
            String title = owner.get().getProductTitle(productId);
            if (title != null && !title.isBlank()) {
                return title;
            }
        }
        if (candidate.counterpartTitle() != null && !candidate.counterpartTitle().isBlank()) {
            return candidate.counterpartTitle();
        }
        return productId;
    }
}
