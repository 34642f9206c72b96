package com.content.reconciliation.aggregate;

import com.content.reconciliation.audit.AuditAction;
import com.content.reconciliation.audit.AuditService;
import com.content.reconciliation.consolidation.ConsolidationOperator;
import com.content.reconciliation.core.model.CanonicalEntity;
import com.content.reconciliation.core.model.ChannelKind;
import com.content.reconciliation.core.model.ContentLink;
import com.content.reconciliation.core.model.RawChannelRecord;
import com.content.reconciliation.logging.LogContext;
import com.content.reconciliation.matching.DescriptorComparators;
import com.content.reconciliation.metrics.MetricsService;
import com.content.reconciliation.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Folds raw channel records into the canonical registry.
 *
 * <p>Each record resolves to one owning entity through the registry's identifier
 * indexes, then its amount is added to the accumulator of its channel kind and its
 * counters to the entity's engagement totals. Money is exact, so the final
 * accumulators do not depend on record order or on how records are split into
 * batches. Callers must not fold the same source batch twice: re-ingestion
 * detection is their responsibility.</p>
 *
 * <p>Malformed records (no identifier and an empty title key, or negative
 * amounts) are rejected and reported in the {@link FoldResult}; they never abort
 * the batch.</p>
 */
public class RevenueAggregator {
    private static final Logger log = LoggerFactory.getLogger(RevenueAggregator.class);

    public static final int DEFAULT_CHUNK_SIZE = 500;

    private final EntityRegistry registry;
    private final IdentifierResolver resolver;
    private final ConsolidationOperator consolidator;
    private final int chunkSize;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final Map<String, ProductShare> shares = new HashMap<>();

    public RevenueAggregator(EntityRegistry registry, IdentifierResolver resolver,
                             ConsolidationOperator consolidator, AuditService auditService) {
        this(registry, resolver, consolidator, DEFAULT_CHUNK_SIZE, auditService, new NoOpMetricsService());
    }

    public RevenueAggregator(EntityRegistry registry, IdentifierResolver resolver,
                             ConsolidationOperator consolidator, int chunkSize,
                             AuditService auditService, MetricsService metricsService) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0");
        }
        this.registry = registry;
        this.resolver = resolver;
        this.consolidator = consolidator;
        this.chunkSize = chunkSize;
        this.auditService = auditService;
        this.metricsService = metricsService;
    }

    public FoldResult fold(List<RawChannelRecord> records) {
        return fold(records, ProgressCallback.NOOP);
    }

    /**
     * Folds the records in chunks, handing the running result to the callback after
     * each chunk. The result is identical to folding them in one pass.
     */
    public FoldResult fold(List<RawChannelRecord> records, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        Instant start = Instant.now();
        FoldCounters counters = new FoldCounters();

        try (LogContext logCtx = LogContext.forFold(LogContext.generateCorrelationId(), records.size())) {
            log.info("fold.starting records={} chunkSize={}", records.size(), chunkSize);

            for (int from = 0; from < records.size(); from += chunkSize) {
                int to = Math.min(from + chunkSize, records.size());
                for (int i = from; i < to; i++) {
                    foldOne(i, records.get(i), counters);
                }
                cb.onChunkFolded(to, records.size(), counters.toResult());
            }

            FoldResult result = counters.toResult();
            metricsService.recordFoldDuration(Duration.between(start, Instant.now()));
            log.info("fold.completed recordsFolded={} entitiesCreated={} consolidations={} rejected={} registrySize={}",
                    result.recordsFolded(), result.entitiesCreated(), result.consolidations(),
                    result.recordsRejected(), registry.size());
            return result;
        }
    }

    /**
     * Applies persisted links: every entity owning a linked product id is consolidated
     * into the linked video's entity and unowned product ids are claimed by it, so
     * later product records fold straight into the video entity. Links whose video
     * is not in the registry are ignored, and so are product ids already held by
     * another video's entity.
     *
     * @return number of links applied
     */
    public int applyLinks(Collection<ContentLink> links) {
        int applied = 0;
        for (ContentLink link : links) {
            Optional<CanonicalEntity> videoEntity = registry.findByVideoId(link.videoId());
            if (videoEntity.isEmpty()) {
                log.debug("link.skipped videoId={} reason=video not in registry", link.videoId());
                continue;
            }
            CanonicalEntity target = videoEntity.get();
            for (String productId : link.productIds()) {
                Optional<CanonicalEntity> owner = registry.findByProductId(productId);
                if (owner.isEmpty()) {
                    registry.claimProductId(target, productId, null);
                } else if (owner.get().getId().equals(target.getId())) {
                    continue;
                } else if (owner.get().hasVideoId()) {
                    log.warn("link.productSkipped videoId={} productId={} ownerEntityId={} reason=held by another video",
                            link.videoId(), productId, owner.get().getId());
                } else {
                    consolidator.consolidate(target.getId(), owner.get().getId());
                }
            }
            if (link.displayNameOverride() != null && !link.displayNameOverride().isBlank()) {
                target.setDisplayNameOverride(link.displayNameOverride());
            }
            applied++;
        }
        log.info("links.applied applied={} total={}", applied, links.size());
        return applied;
    }

    private void foldOne(int position, RawChannelRecord record, FoldCounters counters) {
        String invalid = validate(record);
        if (invalid != null) {
            reject(position, record, invalid, counters);
            return;
        }
        Optional<RecordKey> key = resolver.resolve(record);
        if (key.isEmpty()) {
            reject(position, record, "record has no identifier and no usable title", counters);
            return;
        }

        CanonicalEntity owner = resolveOwner(record, key.get(), counters);
        if (!record.hasVideoId() && record.hasProductId()) {
            shares.computeIfAbsent(record.productId(), ProductShare::new).add(record);
        }

        if (record.kind().isVideo()) {
            owner.offerVideoTitle(record.title());
        } else {
            owner.offerProductTitle(record.title());
        }
        owner.addRevenue(record.kind(), record.amount());
        owner.addEngagement(record.views(), record.clicks(), record.orderedItems(), record.shippedItems());

        if ((owner.getDuration() == null || owner.getDuration().isBlank())
                && DescriptorComparators.toSeconds(record.duration()) != null) {
            owner.setDuration(record.duration().trim());
        }
        if (record.date() != null && !record.date().isBlank()) {
            owner.setPublishDate(DescriptorComparators.earlierDate(owner.getPublishDate(), record.date().trim()));
        }

        counters.folded++;
        metricsService.incrementRecordFolded(record.kind());
    }

    /**
     * Video records always land on their video's entity and product-only records on
     * whichever entity holds the product id. A product seen with exactly one video is
     * held by that video's entity; once a second video shows up it is contested and
     * moves, with its product-only revenue, to an entity of its own. The outcome is
     * therefore the same whatever order the records arrive in.
     */
    private CanonicalEntity resolveOwner(RawChannelRecord record, RecordKey key, FoldCounters counters) {
        if (record.hasVideoId()) {
            CanonicalEntity owner = registry.findByVideoId(record.videoId())
                    .orElseGet(() -> create(key, record.title(), record.kind(), counters));
            if (record.hasProductId()) {
                attachProduct(owner, record, counters);
            }
            return owner;
        }
        if (record.hasProductId()) {
            return registry.findByProductId(record.productId())
                    .orElseGet(() -> create(key, record.title(), record.kind(), counters));
        }
        return registry.findByTitleKey(key.value())
                .orElseGet(() -> create(key, record.title(), record.kind(), counters));
    }

    private void attachProduct(CanonicalEntity videoEntity, RawChannelRecord record, FoldCounters counters) {
        ProductShare share = shares.computeIfAbsent(record.productId(), ProductShare::new);
        share.addVideoId(record.videoId());

        Optional<CanonicalEntity> holder = registry.findByProductId(record.productId());
        if (holder.isEmpty()) {
            if (!share.isContested()) {
                registry.claimProductId(videoEntity, record.productId(), record.title());
            }
            return;
        }
        CanonicalEntity current = holder.get();
        if (current.getId().equals(videoEntity.getId())) {
            return;
        }
        if (current.hasVideoId()) {
            detach(current, share, record.kind(), counters);
        } else if (!share.isContested()) {
            // The record bridges two entities; the video side survives
            log.info("fold.bridge videoEntityId={} productEntityId={}", videoEntity.getId(), current.getId());
            consolidator.consolidate(videoEntity.getId(), current.getId());
            counters.consolidations++;
        }
    }

    private void detach(CanonicalEntity holder, ProductShare share, ChannelKind channel, FoldCounters counters) {
        String productId = share.productId();
        String title = holder.getProductTitle(productId);
        registry.releaseProductId(holder, productId);
        share.withdrawFrom(holder);

        CanonicalEntity productEntity = create(new RecordKey(RecordKey.KeyType.PRODUCT, productId),
                title, channel, counters);
        share.depositInto(productEntity);
        productEntity.offerProductTitle(title);

        auditService.record(AuditAction.PRODUCT_CONTESTED, productEntity.getId(), AuditService.SYSTEM_ACTOR,
                Map.of("productId", productId, "previousEntityId", holder.getId()));
        log.info("fold.productContested productId={} previousEntityId={} entityId={}",
                productId, holder.getId(), productEntity.getId());
    }

    private CanonicalEntity create(RecordKey key, String title, ChannelKind channel, FoldCounters counters) {
        String entityId = key.entityId();
        for (int suffix = 2; registry.contains(entityId); suffix++) {
            entityId = key.entityId() + "#" + suffix;
        }
        CanonicalEntity entity = registry.add(CanonicalEntity.builder().id(entityId).build());
        if (key.type() == RecordKey.KeyType.VIDEO) {
            registry.claimVideoId(entity, key.value());
        } else if (key.type() == RecordKey.KeyType.PRODUCT) {
            registry.claimProductId(entity, key.value(), title);
        } else {
            registry.claimTitleKey(entity, key.value());
        }

        counters.created++;
        metricsService.incrementEntityCreated();
        auditService.record(AuditAction.ENTITY_CREATED, entityId, AuditService.SYSTEM_ACTOR,
                Map.of("channel", channel.name(), "keyType", key.type().name()));
        log.debug("entity.created entityId={} channel={}", entityId, channel);
        return entity;
    }

    private static String validate(RawChannelRecord record) {
        if (record.amount().signum() < 0) {
            return "negative amount " + record.amount().toPlainString();
        }
        if (record.views() < 0 || record.clicks() < 0 || record.orderedItems() < 0 || record.shippedItems() < 0) {
            return "negative engagement counter";
        }
        return null;
    }

    private void reject(int position, RawChannelRecord record, String reason, FoldCounters counters) {
        counters.rejections.add(new FoldResult.Rejection(position, record, reason));
        metricsService.incrementRecordRejected();
        auditService.record(AuditAction.RECORD_REJECTED, null, AuditService.SYSTEM_ACTOR,
                Map.of("position", position, "channel", record.kind().name(), "reason", reason));
        log.warn("fold.rejected position={} channel={} reason={}", position, record.kind(), reason);
    }

    private static final class FoldCounters {
        int folded;
        int created;
        int consolidations;
        final List<FoldResult.Rejection> rejections = new ArrayList<>();

        FoldResult toResult() {
            return new FoldResult(folded, created, consolidations, rejections);
        }
    }
}
