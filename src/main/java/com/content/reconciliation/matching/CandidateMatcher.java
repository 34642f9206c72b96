package com.content.reconciliation.matching;

import com.content.reconciliation.core.model.CanonicalEntity;
import com.content.reconciliation.core.model.CounterpartType;
import com.content.reconciliation.core.model.MatchBasis;
import com.content.reconciliation.core.model.MatchCandidate;
import com.content.reconciliation.core.model.ProductVideoAsset;
import com.content.reconciliation.logging.LogContext;
import com.content.reconciliation.metrics.MetricsService;
import com.content.reconciliation.metrics.NoOpMetricsService;
import com.content.reconciliation.rules.TitleNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Proposes scored links between orphaned video entities and product-side counterparts.
 *
 * <p>Scoring is additive over three weak signals: normalized title, duration and
 * date. Counterparts are found through an inverted index keyed by normalized title
 * and sorted duration and date indexes, so the usual path never compares every pair.
 * The date index is consulted only when a date match alone can reach the minimum score.
 * Substring containment is a fallback for videos with no exact title hit and only
 * runs when both collections are below {@link MatchingPolicy#substringScanLimit()}.</p>
 *
 * <p>The matcher never picks a winner: several candidates may reference the same
 * entity on either side and are all handed to the reviewer.</p>
 */
public class CandidateMatcher {
    private static final Logger log = LoggerFactory.getLogger(CandidateMatcher.class);

    private static final Comparator<MatchCandidate> RANKING =
            Comparator.comparingInt(MatchCandidate::score).reversed()
                    .thenComparing(MatchCandidate::videoEntityId)
                    .thenComparing(MatchCandidate::counterpartId);

    private final TitleNormalizer normalizer;
    private final MatchingPolicy policy;
    private final MetricsService metricsService;

    public CandidateMatcher(TitleNormalizer normalizer, MatchingPolicy policy) {
        this(normalizer, policy, new NoOpMetricsService());
    }

    public CandidateMatcher(TitleNormalizer normalizer, MatchingPolicy policy, MetricsService metricsService) {
        this.normalizer = normalizer;
        this.policy = policy;
        this.metricsService = metricsService;
    }

    public MatchingPolicy getPolicy() {
        return policy;
    }

    /**
     * Matches orphaned video entities against orphaned product-side entities.
     */
    public List<MatchCandidate> matchEntities(Collection<CanonicalEntity> entities) {
        List<MatchSubject> videos = entities.stream()
                .filter(CanonicalEntity::isVideoOrphan)
                .map(MatchSubject::ofEntity)
                .collect(Collectors.toList());
        List<MatchSubject> products = entities.stream()
                .filter(CanonicalEntity::isProductOrphan)
                .map(MatchSubject::ofEntity)
                .collect(Collectors.toList());
        return match(videos, products, CounterpartType.ENTITY);
    }

    /**
     * Matches orphaned video entities against product-platform assets. Assets that
     * carry no product ids cannot link anything and are ignored.
     */
    public List<MatchCandidate> matchAssets(Collection<CanonicalEntity> entities,
                                            Collection<ProductVideoAsset> assets) {
        List<MatchSubject> videos = entities.stream()
                .filter(CanonicalEntity::isVideoOrphan)
                .map(MatchSubject::ofEntity)
                .collect(Collectors.toList());
        List<MatchSubject> counterparts = assets.stream()
                .filter(asset -> !asset.productIds().isEmpty())
                .map(MatchSubject::ofAsset)
                .collect(Collectors.toList());
        return match(videos, counterparts, CounterpartType.ASSET);
    }

    /**
     * Scores every indexed pair and returns the candidates at or above the
     * minimum score, best first.
     */
    public List<MatchCandidate> match(List<MatchSubject> videos, List<MatchSubject> counterparts,
                                      CounterpartType counterpartType) {
        try (LogContext logCtx = LogContext.forMatch(
                LogContext.generateCorrelationId(), videos.size(), counterparts.size())) {

            CounterpartIndex index = new CounterpartIndex(counterparts);
            boolean substringAllowed = policy.allowsSubstringScan(videos.size(), counterparts.size());
            if (!substringAllowed) {
                log.info("match.substringSkipped videos={} counterparts={} limit={}",
                        videos.size(), counterparts.size(), policy.substringScanLimit());
            }

            List<MatchCandidate> candidates = new ArrayList<>();
            for (MatchSubject video : videos) {
                String titleKey = normalizer.normalize(video.title());
                List<MatchSubject> exact = index.byTitle(titleKey);

                Set<MatchSubject> pool = new LinkedHashSet<>(exact);
                pool.addAll(index.byDuration(DescriptorComparators.toSeconds(video.duration())));
                if (policy.dateWeight() >= policy.minimumScore()) {
                    pool.addAll(index.byDate(DescriptorComparators.parseDate(video.date())));
                }
                boolean useSubstring = substringAllowed && exact.isEmpty() && !titleKey.isEmpty();
                if (useSubstring) {
                    pool.addAll(index.containing(titleKey));
                }

                for (MatchSubject counterpart : pool) {
                    MatchCandidate candidate = score(video, titleKey, counterpart, counterpartType, useSubstring);
                    if (candidate != null) {
                        candidates.add(candidate);
                        metricsService.recordCandidateScore(candidate.score());
                    }
                }
            }

            candidates.sort(RANKING);
            metricsService.recordCandidatesProposed(candidates.size());
            log.info("match.completed candidates={} autoApprovable={}", candidates.size(),
                    candidates.stream().filter(MatchCandidate::autoApprovable).count());
            return candidates;
        }
    }

    private MatchCandidate score(MatchSubject video, String videoKey, MatchSubject counterpart,
                                 CounterpartType counterpartType, boolean useSubstring) {
        String counterpartKey = normalizer.normalize(counterpart.title());
        boolean exactTitle = !videoKey.isEmpty() && videoKey.equals(counterpartKey);
        boolean partialTitle = !exactTitle && useSubstring && !counterpartKey.isEmpty()
                && (videoKey.contains(counterpartKey) || counterpartKey.contains(videoKey));
        boolean duration = DescriptorComparators.durationsEqual(
                video.duration(), counterpart.duration(), policy.durationToleranceSeconds());
        boolean date = DescriptorComparators.datesClose(
                video.date(), counterpart.date(), policy.dateToleranceDays());

        int score = 0;
        List<String> reasons = new ArrayList<>();
        if (exactTitle) {
            score += policy.titleWeight();
            reasons.add("title match");
        } else if (partialTitle) {
            score += policy.partialTitleWeight();
            reasons.add("partial title match");
        }
        if (duration) {
            score += policy.durationWeight();
            reasons.add("duration match");
        }
        if (date) {
            score += policy.dateWeight();
            reasons.add("date within " + policy.dateToleranceDays() + " days");
        }

        MatchBasis basis = MatchBasis.of(exactTitle || partialTitle, duration, date);
        if (basis == null || score < policy.minimumScore()) {
            return null;
        }

        return new MatchCandidate(
                video.id() + "->" + counterpart.id(),
                video.id(),
                counterpart.id(),
                counterpartType,
                video.title(),
                counterpart.title(),
                counterpart.productIds(),
                basis,
                score,
                score >= policy.autoApproveScore(),
                String.join(", ", reasons)
        );
    }

    /**
     * Lookup structures over the counterpart side.
     */
    private final class CounterpartIndex {
        private final List<MatchSubject> all;
        private final List<String> keys = new ArrayList<>();
        private final Map<String, List<MatchSubject>> titleIndex = new HashMap<>();
        private final NavigableMap<Long, List<MatchSubject>> durationIndex = new TreeMap<>();
        private final NavigableMap<Long, List<MatchSubject>> dateIndex = new TreeMap<>();

        CounterpartIndex(List<MatchSubject> counterparts) {
            this.all = counterparts;
            for (MatchSubject subject : counterparts) {
                String key = normalizer.normalize(subject.title());
                keys.add(key);
                if (!key.isEmpty()) {
                    titleIndex.computeIfAbsent(key, k -> new ArrayList<>()).add(subject);
                }
                Long seconds = DescriptorComparators.toSeconds(subject.duration());
                if (seconds != null) {
                    durationIndex.computeIfAbsent(seconds, k -> new ArrayList<>()).add(subject);
                }
                LocalDate date = DescriptorComparators.parseDate(subject.date());
                if (date != null) {
                    dateIndex.computeIfAbsent(date.toEpochDay(), k -> new ArrayList<>()).add(subject);
                }
            }
        }

        List<MatchSubject> byTitle(String key) {
            if (key.isEmpty()) {
                return List.of();
            }
            return titleIndex.getOrDefault(key, List.of());
        }

        List<MatchSubject> byDuration(Long seconds) {
            if (seconds == null) {
                return List.of();
            }
            return within(durationIndex, seconds, policy.durationToleranceSeconds());
        }

        List<MatchSubject> byDate(LocalDate date) {
            if (date == null) {
                return List.of();
            }
            return within(dateIndex, date.toEpochDay(), policy.dateToleranceDays());
        }

        private List<MatchSubject> within(NavigableMap<Long, List<MatchSubject>> sorted, long center, int tolerance) {
            List<MatchSubject> result = new ArrayList<>();
            for (List<MatchSubject> bucket : sorted.subMap(center - tolerance, true, center + tolerance, true).values()) {
                result.addAll(bucket);
            }
            return result;
        }

        List<MatchSubject> containing(String key) {
            List<MatchSubject> result = new ArrayList<>();
            for (int i = 0; i < all.size(); i++) {
                String other = keys.get(i);
                if (!other.isEmpty() && (key.contains(other) || other.contains(key))) {
                    result.add(all.get(i));
                }
            }
            return result;
        }
    }
}
