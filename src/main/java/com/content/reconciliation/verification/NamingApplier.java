package com.content.reconciliation.verification;

import com.content.reconciliation.aggregate.EntityRegistry;
import com.content.reconciliation.core.model.CanonicalEntity;
import com.content.reconciliation.core.model.NameSuggestion;
import com.content.reconciliation.core.model.UnknownEntityException;
import com.content.reconciliation.link.LinkRegistry;

import java.util.Optional;

/**
 * Applies a selected display name to every link whose primary product id matches
 * and to the entity owning that product id.
 */
public class NamingApplier implements ProposalApplier<NameSuggestion> {

    private final EntityRegistry registry;
    private final LinkRegistry linkRegistry;

    public NamingApplier(EntityRegistry registry, LinkRegistry linkRegistry) {
        this.registry = registry;
        this.linkRegistry = linkRegistry;
    }

    @Override
    public void apply(NameSuggestion suggestion) {
        String name = suggestion.proposedName();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Blank display name for product " + suggestion.productId());
        }
        int renamed = linkRegistry.renameByPrimaryProductId(suggestion.productId(), name.trim());
        Optional<CanonicalEntity> owner = registry.findByProductId(suggestion.productId());
        if (owner.isEmpty() && renamed == 0) {
            throw new UnknownEntityException(suggestion.productId());
        }
        owner.ifPresent(entity -> entity.setDisplayNameOverride(name.trim()));
    }
}
