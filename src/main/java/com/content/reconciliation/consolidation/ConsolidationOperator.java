package com.content.reconciliation.consolidation;

import com.content.reconciliation.aggregate.EntityRegistry;
import com.content.reconciliation.audit.AuditAction;
import com.content.reconciliation.audit.AuditService;
import com.content.reconciliation.core.model.CanonicalEntity;
import com.content.reconciliation.core.model.ChannelKind;
import com.content.reconciliation.logging.LogContext;
import com.content.reconciliation.matching.DescriptorComparators;
import com.content.reconciliation.metrics.MetricsService;
import com.content.reconciliation.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Merges two canonical entities into one.
 *
 * <p>Every additive field of the discarded entity is added to the kept one, so the
 * numeric outcome is the same whichever side is kept. Identity is not symmetric:
 * the survivor keeps its own id, video id and titles, and only takes the
 * discarded entity's identifiers and descriptors where it has none. Callers should
 * keep the more canonical side, usually the one carrying a video id.</p>
 */
public class ConsolidationOperator {
    private static final Logger log = LoggerFactory.getLogger(ConsolidationOperator.class);

    private final EntityRegistry registry;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final List<ConsolidationListener> listeners = new CopyOnWriteArrayList<>();

    public ConsolidationOperator(EntityRegistry registry, AuditService auditService) {
        this(registry, auditService, new NoOpMetricsService());
    }

    public ConsolidationOperator(EntityRegistry registry, AuditService auditService,
                                 MetricsService metricsService) {
        this.registry = registry;
        this.auditService = auditService;
        this.metricsService = metricsService;
    }

    public void addListener(ConsolidationListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConsolidationListener listener) {
        listeners.remove(listener);
    }

    /**
     * Folds {@code discardId} into {@code keepId} and removes it from the registry.
     *
     * @param keepId    surviving entity
     * @param discardId entity to retire
     * @param actorId   who requested the consolidation
     * @return the surviving entity
     * @throws com.content.reconciliation.core.model.UnknownEntityException if either id is not live
     * @throws IllegalArgumentException if both ids are the same
     */
    public CanonicalEntity consolidate(String keepId, String discardId, String actorId) {
        if (keepId.equals(discardId)) {
            throw new IllegalArgumentException("Cannot consolidate an entity with itself: " + keepId);
        }
        CanonicalEntity keep = registry.require(keepId);
        CanonicalEntity discard = registry.require(discardId);

        try (LogContext logCtx = LogContext.forConsolidation(
                LogContext.generateCorrelationId(), keepId, discardId)) {
            log.info("consolidate.starting keepEntityId={} discardEntityId={} actor={}",
                    keepId, discardId, actorId);

            for (ChannelKind kind : ChannelKind.values()) {
                keep.addRevenue(kind, discard.getRevenue(kind));
            }
            keep.addEngagement(discard.getViews(), discard.getClicks(),
                    discard.getOrderedItems(), discard.getShippedItems());

            // Index entries move first so identifier uniqueness holds throughout
            registry.retire(discard, keep);

            if (!keep.hasVideoId() && discard.hasVideoId()) {
                keep.setVideoId(discard.getVideoId());
            }
            for (String productId : discard.getProductIds()) {
                keep.addProductId(productId, discard.getProductTitle(productId));
            }
            keep.offerVideoTitle(discard.getVideoTitle());
            keep.offerProductTitle(discard.getProductTitle());
            if (keep.getDisplayNameOverride() == null) {
                keep.setDisplayNameOverride(discard.getDisplayNameOverride());
            }
            if (keep.getDuration() == null || keep.getDuration().isBlank()) {
                keep.setDuration(discard.getDuration());
            }
            keep.setPublishDate(DescriptorComparators.earlierDate(keep.getPublishDate(), discard.getPublishDate()));

            for (String earlier : discard.getConsolidatedIds()) {
                keep.recordConsolidated(earlier);
            }
            keep.recordConsolidated(discardId);

            auditService.record(AuditAction.ENTITY_CONSOLIDATED, keepId, actorId, Map.of(
                    "discardEntityId", discardId,
                    "total", keep.getTotal().toPlainString()
            ));
            metricsService.incrementEntityConsolidated();

            log.info("consolidate.completed keepEntityId={} discardEntityId={} total={}",
                    keepId, discardId, keep.getTotal());
            notifyListeners(keepId, discardId);
            return keep;
        }
    }

    public CanonicalEntity consolidate(String keepId, String discardId) {
        return consolidate(keepId, discardId, AuditService.SYSTEM_ACTOR);
    }

    private void notifyListeners(String keepId, String discardId) {
        for (ConsolidationListener listener : listeners) {
            try {
                listener.onConsolidated(keepId, discardId);
            } catch (Exception e) {
                log.warn("Consolidation listener failed for {} <- {}: {}", keepId, discardId, e.getMessage());
            }
        }
    }
}
