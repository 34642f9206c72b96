package com.content.reconciliation.verification;

import com.content.reconciliation.aggregate.EntityRegistry;
import com.content.reconciliation.consolidation.ConsolidationOperator;
import com.content.reconciliation.core.model.CanonicalEntity;
import com.content.reconciliation.core.model.ContentLink;
import com.content.reconciliation.core.model.CounterpartType;
import com.content.reconciliation.core.model.MatchCandidate;
import com.content.reconciliation.link.LinkRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Applies an approved match candidate to the registry and records the resulting link.
 *
 * <p>An entity counterpart is consolidated into the video entity. An asset
 * counterpart's product ids are claimed by the video entity; any entity already
 * holding one of them is consolidated into it.</p>
 */
public class MatchApplier implements ProposalApplier<MatchCandidate> {
    private static final Logger log = LoggerFactory.getLogger(MatchApplier.class);

    private static final String REVIEWER = "REVIEWER";

    private final EntityRegistry registry;
    private final ConsolidationOperator consolidator;
    private final LinkRegistry linkRegistry;

    public MatchApplier(EntityRegistry registry, ConsolidationOperator consolidator, LinkRegistry linkRegistry) {
        this.registry = registry;
        this.consolidator = consolidator;
        this.linkRegistry = linkRegistry;
    }

    @Override
    public void apply(MatchCandidate candidate) {
        CanonicalEntity video = registry.require(candidate.videoEntityId());
        if (!video.hasVideoId()) {
            throw new IllegalArgumentException("Entity " + video.getId() + " has no video id");
        }

        if (candidate.counterpartType() == CounterpartType.ENTITY) {
            registry.require(candidate.counterpartId());
            consolidator.consolidate(video.getId(), candidate.counterpartId(), REVIEWER);
        } else {
            if (candidate.productIds().isEmpty()) {
                throw new IllegalArgumentException("Asset " + candidate.counterpartId() + " carries no product ids");
            }
            for (String productId : candidate.productIds()) {
                Optional<CanonicalEntity> owner = registry.findByProductId(productId);
                if (owner.isEmpty()) {
                    registry.claimProductId(video, productId, candidate.counterpartTitle());
                } else if (!owner.get().getId().equals(video.getId())) {
                    consolidator.consolidate(video.getId(), owner.get().getId(), REVIEWER);
                }
            }
        }

        if (video.hasProductIds()) {
            linkRegistry.record(new ContentLink(null, video.getVideoId(), List.copyOf(video.getProductIds()),
                    video.getOriginalTitle(), false, video.getPublishDate(), video.getDuration(), null));
        }
        log.debug("match.applied videoEntityId={} counterpartId={} type={}",
                video.getId(), candidate.counterpartId(), candidate.counterpartType());
    }
}
