package com.content.reconciliation.matching;

import com.content.reconciliation.cache.CacheConfig;
import com.content.reconciliation.core.model.CanonicalEntity;
import com.content.reconciliation.core.model.CounterpartType;
import com.content.reconciliation.core.model.MatchBasis;
import com.content.reconciliation.core.model.MatchCandidate;
import com.content.reconciliation.core.model.ProductVideoAsset;
import com.content.reconciliation.metrics.MetricsService;
import com.content.reconciliation.rules.DefaultNormalizationRules;
import com.content.reconciliation.rules.TitleNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CandidateMatcherTest {

    private TitleNormalizer normalizer;
    private CandidateMatcher matcher;

    @BeforeEach
    void setUp() {
        normalizer = DefaultNormalizationRules.createDefaultNormalizer(CacheConfig.disabled());
        matcher = new CandidateMatcher(normalizer, MatchingPolicy.defaults());
    }

    private static MatchSubject subject(String id, String title, String duration, String date) {
        return new MatchSubject(id, title, duration, date, List.of());
    }

    private List<MatchCandidate> matchOne(MatchSubject video, MatchSubject counterpart) {
        return matcher.match(List.of(video), List.of(counterpart), CounterpartType.ENTITY);
    }

    @Nested
    @DisplayName("Scoring")
    class ScoringTests {

        @Test
        @DisplayName("Title and duration should score at least 90 and be auto-approvable")
        void titleAndDuration() {
            List<MatchCandidate> candidates = matchOne(
                    subject("video:v1", "Unboxing Widget", "5:00", null),
                    subject("title:unboxing widget", "unboxing widget!", "5:01", null));

            assertEquals(1, candidates.size());
            MatchCandidate candidate = candidates.get(0);
            assertEquals(90, candidate.score());
            assertTrue(candidate.autoApprovable());
            assertEquals(MatchBasis.COMBINED, candidate.basis());
        }

        @Test
        @DisplayName("Title, duration and close dates should score 100")
        void allSignals() {
            List<MatchCandidate> candidates = matchOne(
                    subject("video:v1", "Unboxing Widget", "5:00", "2024-01-01"),
                    subject("title:unboxing widget", "Unboxing Widget", "5:00", "2024-01-02"));

            assertEquals(100, candidates.get(0).score());
            assertTrue(candidates.get(0).autoApprovable());
            assertEquals("title match, duration match, date within 2 days", candidates.get(0).reasoning());
        }

        @Test
        @DisplayName("Date proximity alone should not be proposed")
        void dateOnly() {
            assertTrue(matchOne(
                    subject("video:v1", "Alpha", null, "2024-01-01"),
                    subject("product:B1", "Beta", null, "2024-01-02")).isEmpty());
        }

        @Test
        @DisplayName("Duration alone should stay below the minimum score")
        void durationOnly() {
            assertTrue(matchOne(
                    subject("video:v1", "Alpha", "5:00", null),
                    subject("product:B1", "Beta", "5:00", null)).isEmpty());
        }

        @Test
        @DisplayName("Duration and date together should reach the minimum but not auto-approve")
        void durationAndDate() {
            List<MatchCandidate> candidates = matchOne(
                    subject("video:v1", "Alpha", "5:00", "2024-01-01"),
                    subject("product:B1", "Beta", "5:01", "2024-01-01"));

            assertEquals(1, candidates.size());
            assertEquals(40, candidates.get(0).score());
            assertFalse(candidates.get(0).autoApprovable());
            assertEquals(MatchBasis.COMBINED, candidates.get(0).basis());
        }

        @Test
        @DisplayName("Exact title alone should be proposed with title basis")
        void titleOnly() {
            List<MatchCandidate> candidates = matchOne(
                    subject("video:v1", "Unboxing Widget", null, null),
                    subject("product:B1", "UNBOXING widget", null, null));

            assertEquals(60, candidates.get(0).score());
            assertEquals(MatchBasis.TITLE, candidates.get(0).basis());
            assertFalse(candidates.get(0).autoApprovable());
        }

        @Test
        @DisplayName("Empty titles should never match")
        void emptyTitles() {
            assertTrue(matchOne(subject("video:v1", "!!!", null, null),
                    subject("product:B1", "", null, null)).isEmpty());
        }
    }

    @Nested
    @DisplayName("Substring fallback")
    class SubstringTests {

        @Test
        @DisplayName("Should propose a partial title match when no exact title exists")
        void partialMatch() {
            List<MatchCandidate> candidates = matchOne(
                    subject("video:v1", "Unboxing Widget Pro Review", null, null),
                    subject("product:B1", "Widget Pro", null, null));

            assertEquals(1, candidates.size());
            assertEquals(40, candidates.get(0).score());
            assertEquals(MatchBasis.TITLE, candidates.get(0).basis());
        }

        @Test
        @DisplayName("Should skip the fallback when an exact title exists")
        void skippedWhenExactExists() {
            List<MatchCandidate> candidates = matcher.match(
                    List.of(subject("video:v1", "Widget", null, null)),
                    List.of(subject("product:B1", "Widget", null, null),
                            subject("product:B2", "Widget Pro", null, null)),
                    CounterpartType.ENTITY);

            assertEquals(1, candidates.size());
            assertEquals("product:B1", candidates.get(0).counterpartId());
        }

        @Test
        @DisplayName("Should skip the fallback above the size guard")
        void skippedAboveGuard() {
            MatchingPolicy guarded = new MatchingPolicy(60, 40, 30, 10, 40, 90, 2, 2, 1);
            CandidateMatcher guardedMatcher = new CandidateMatcher(normalizer, guarded);

            assertTrue(guardedMatcher.match(
                    List.of(subject("video:v1", "Unboxing Widget Pro Review", null, null)),
                    List.of(subject("product:B1", "Widget Pro", null, null)),
                    CounterpartType.ENTITY).isEmpty());
        }
    }

    @Nested
    @DisplayName("Tuned policies")
    class TunedPolicyTests {

        @Test
        @DisplayName("Date proximity alone should be proposed when its weight reaches the minimum")
        void dateOnlyAboveMinimum() {
            MatchingPolicy dateHeavy = new MatchingPolicy(60, 40, 30, 50, 40, 90, 2, 2, 1000);
            CandidateMatcher dateMatcher = new CandidateMatcher(normalizer, dateHeavy);

            List<MatchCandidate> candidates = dateMatcher.match(
                    List.of(subject("video:v1", "Alpha", null, "2024-01-01")),
                    List.of(subject("product:B1", "Beta", null, "2024-01-02"),
                            subject("product:B2", "Gamma", null, "2024-01-09")),
                    CounterpartType.ENTITY);

            assertEquals(1, candidates.size());
            assertEquals("product:B1", candidates.get(0).counterpartId());
            assertEquals(50, candidates.get(0).score());
            assertEquals(MatchBasis.DATE, candidates.get(0).basis());
        }

        @Test
        @DisplayName("Very large duration tolerance should not slow lookups")
        void hugeDurationTolerance() {
            MatchingPolicy loose = new MatchingPolicy(60, 40, 30, 10, 40, 90, Integer.MAX_VALUE, 2, 1000);
            CandidateMatcher looseMatcher = new CandidateMatcher(normalizer, loose);

            List<MatchCandidate> candidates = assertTimeout(Duration.ofSeconds(5), () -> looseMatcher.match(
                    List.of(subject("video:v1", "Widget", "5:00", null)),
                    List.of(subject("product:B1", "Widget", "2:00:00", null),
                            subject("product:B2", "Gizmo", "0", null)),
                    CounterpartType.ENTITY));

            assertEquals(1, candidates.size());
            assertEquals("product:B1", candidates.get(0).counterpartId());
            assertEquals(90, candidates.get(0).score());
        }
    }

    @Test
    @DisplayName("Should keep every candidate for ambiguous titles, best first")
    void ambiguousTitlesAreAllProposed() {
        List<MatchCandidate> candidates = matcher.match(
                List.of(subject("video:v1", "Unboxing", "5:00", null)),
                List.of(subject("product:B2", "Unboxing", null, null),
                        subject("product:B1", "Unboxing", "5:00", null)),
                CounterpartType.ENTITY);

        assertEquals(2, candidates.size());
        assertEquals("product:B1", candidates.get(0).counterpartId());
        assertEquals(90, candidates.get(0).score());
        assertEquals("product:B2", candidates.get(1).counterpartId());
        assertEquals(60, candidates.get(1).score());
    }

    @Test
    @DisplayName("matchEntities should pair video orphans with product orphans only")
    void matchEntities() {
        CanonicalEntity video = CanonicalEntity.builder()
                .id("video:v1").videoId("v1").videoTitle("Unboxing Widget").duration("5:00").build();
        CanonicalEntity product = CanonicalEntity.builder()
                .id("title:unboxing widget").productTitle("Unboxing Widget").duration("5:00").build();
        CanonicalEntity otherVideo = CanonicalEntity.builder()
                .id("video:v2").videoId("v2").videoTitle("Unboxing Widget").duration("5:00").build();

        List<MatchCandidate> candidates = matcher.matchEntities(List.of(video, product, otherVideo));

        assertEquals(2, candidates.size());
        assertTrue(candidates.stream().allMatch(c -> c.counterpartId().equals("title:unboxing widget")));
        assertTrue(candidates.stream().allMatch(c -> c.counterpartType() == CounterpartType.ENTITY));
    }

    @Test
    @DisplayName("matchAssets should ignore assets without product ids")
    void matchAssets() {
        CanonicalEntity video = CanonicalEntity.builder()
                .id("video:v1").videoId("v1").videoTitle("Widget Review").duration("5:00").build();
        ProductVideoAsset linked = new ProductVideoAsset("a1", "Widget Review", "5:00", null, List.of("B01"));
        ProductVideoAsset unlinked = new ProductVideoAsset("a2", "Widget Review", "5:00", null, List.of());

        List<MatchCandidate> candidates = matcher.matchAssets(List.of(video), List.of(linked, unlinked));

        assertEquals(1, candidates.size());
        assertEquals("a1", candidates.get(0).counterpartId());
        assertEquals(CounterpartType.ASSET, candidates.get(0).counterpartType());
        assertEquals(List.of("B01"), candidates.get(0).productIds());
    }

    @Test
    @DisplayName("Should record candidate metrics")
    void recordsMetrics() {
        MetricsService metrics = mock(MetricsService.class);
        CandidateMatcher instrumented = new CandidateMatcher(normalizer, MatchingPolicy.defaults(), metrics);

        instrumented.match(List.of(subject("video:v1", "Widget", "5:00", null)),
                List.of(subject("product:B1", "Widget", "5:00", null)), CounterpartType.ENTITY);

        verify(metrics).recordCandidateScore(90);
        verify(metrics).recordCandidatesProposed(1);
    }
}
