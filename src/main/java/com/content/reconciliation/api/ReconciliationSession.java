package com.content.reconciliation.api;

import com.content.reconciliation.aggregate.EntityRegistry;
import com.content.reconciliation.aggregate.FoldResult;
import com.content.reconciliation.aggregate.IdentifierResolver;
import com.content.reconciliation.aggregate.ProgressCallback;
import com.content.reconciliation.aggregate.RevenueAggregator;
import com.content.reconciliation.audit.AuditService;
import com.content.reconciliation.consolidation.ConsolidationOperator;
import com.content.reconciliation.core.model.CanonicalEntity;
import com.content.reconciliation.core.model.ContentLink;
import com.content.reconciliation.core.model.MatchCandidate;
import com.content.reconciliation.core.model.NameSuggestion;
import com.content.reconciliation.core.model.ProductVideoAsset;
import com.content.reconciliation.core.model.RawChannelRecord;
import com.content.reconciliation.core.model.VideoProductMapping;
import com.content.reconciliation.link.LinkRegistry;
import com.content.reconciliation.matching.AssetCatalog;
import com.content.reconciliation.matching.CandidateMatcher;
import com.content.reconciliation.metrics.MetricsService;
import com.content.reconciliation.rules.TitleNormalizer;
import com.content.reconciliation.verification.MatchApplier;
import com.content.reconciliation.verification.NameSuggestionProvider;
import com.content.reconciliation.verification.NamingApplier;
import com.content.reconciliation.verification.NamingSuggestionService;
import com.content.reconciliation.verification.VerificationWorkflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;

/**
 * One reconciliation run: a canonical registry, its content links and a
 * verification workflow. Single-writer; callers must not share a session
 * across threads without their own synchronization.
 */
public class ReconciliationSession {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationSession.class);

    private final EntityRegistry registry = new EntityRegistry();
    private final LinkRegistry linkRegistry;
    private final ConsolidationOperator consolidator;
    private final RevenueAggregator aggregator;
    private final CandidateMatcher matcher;
    private final AssetCatalog assetCatalog;
    private final NamingSuggestionService namingService;
    private final VerificationWorkflow workflow;

    ReconciliationSession(ReconciliationOptions options, TitleNormalizer normalizer, AuditService auditService,
                          MetricsService metricsService, NameSuggestionProvider nameSuggestionProvider) {
        this.linkRegistry = new LinkRegistry(auditService);
        this.consolidator = new ConsolidationOperator(registry, auditService, metricsService);
        this.aggregator = new RevenueAggregator(registry, new IdentifierResolver(normalizer), consolidator,
                options.getFoldChunkSize(), auditService, metricsService);
        this.matcher = new CandidateMatcher(normalizer, options.getMatchingPolicy(), metricsService);
        this.assetCatalog = new AssetCatalog(normalizer);
        this.namingService = new NamingSuggestionService(registry, nameSuggestionProvider);
        this.workflow = new VerificationWorkflow(
                new MatchApplier(registry, consolidator, linkRegistry),
                new NamingApplier(registry, linkRegistry),
                auditService,
                metricsService);
    }

    public FoldResult ingest(ReconciliationInput input) {
        return ingest(input, ProgressCallback.NOOP);
    }

    /**
     * Loads the input's links, folds its video, product and sponsored records,
     * then applies every known link to the registry.
     */
    public FoldResult ingest(ReconciliationInput input, ProgressCallback callback) {
        log.info("session.ingest records={} links={}", input.recordCount(), input.links().size());
        linkRegistry.load(input.links());
        FoldResult result = aggregator.fold(input.videoRecords(), callback)
                .plus(aggregator.fold(input.productRecords(), callback))
                .plus(aggregator.fold(input.sponsoredRecords(), callback));
        aggregator.applyLinks(linkRegistry.all());
        return result;
    }

    /**
     * Folds one more batch of records. The batch must not repeat records already folded.
     */
    public FoldResult fold(List<RawChannelRecord> records) {
        return aggregator.fold(records);
    }

    /**
     * Matches orphaned video entities against orphaned product entities and stages
     * the candidates for review.
     */
    public List<MatchCandidate> proposeMatches() {
        List<MatchCandidate> candidates = matcher.matchEntities(registry.all());
        workflow.stageMatches(candidates);
        return candidates;
    }

    /**
     * Matches orphaned video entities against product-platform assets, after joining
     * the assets with the title-to-product mappings, and stages the candidates.
     */
    public List<MatchCandidate> proposeMatches(Collection<ProductVideoAsset> assets,
                                               Collection<VideoProductMapping> mappings) {
        List<ProductVideoAsset> joined = assetCatalog.join(assets, mappings);
        List<MatchCandidate> candidates = matcher.matchAssets(registry.all(), joined);
        workflow.stageMatches(candidates);
        return candidates;
    }

    /**
     * Stages display-name suggestions for the product ids of the last committed matches.
     */
    public List<NameSuggestion> proposeNames() {
        List<NameSuggestion> suggestions = namingService.suggest(workflow.getCommittedMatches());
        workflow.stageNaming(suggestions);
        return suggestions;
    }

    public VerificationWorkflow workflow() {
        return workflow;
    }

    /**
     * Manually merges {@code discardId} into {@code keepId}. When the survivor ends up
     * with both a video id and product ids, a manual link is recorded.
     */
    public CanonicalEntity consolidate(String keepId, String discardId, String actorId) {
        CanonicalEntity keep = consolidator.consolidate(keepId, discardId, actorId);
        if (keep.hasVideoId() && keep.hasProductIds()) {
            linkRegistry.record(new ContentLink(null, keep.getVideoId(), List.copyOf(keep.getProductIds()),
                    keep.getOriginalTitle(), true, keep.getPublishDate(), keep.getDuration(), null));
        }
        return keep;
    }

    public CanonicalEntity consolidate(String keepId, String discardId) {
        return consolidate(keepId, discardId, AuditService.SYSTEM_ACTOR);
    }

    public List<CanonicalEntity> rankedEntities() {
        return view().ranked();
    }

    public RegistryView view() {
        return RegistryView.of(registry.all());
    }

    public List<ContentLink> links() {
        return linkRegistry.all();
    }

    public EntityRegistry registry() {
        return registry;
    }

    public ConsolidationOperator consolidator() {
        return consolidator;
    }
}
