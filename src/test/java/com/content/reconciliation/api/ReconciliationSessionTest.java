package com.content.reconciliation.api;

import com.content.reconciliation.aggregate.FoldResult;
import com.content.reconciliation.audit.AuditAction;
import com.content.reconciliation.audit.AuditService;
import com.content.reconciliation.core.model.CanonicalEntity;
import com.content.reconciliation.core.model.ChannelKind;
import com.content.reconciliation.core.model.ContentLink;
import com.content.reconciliation.core.model.CounterpartType;
import com.content.reconciliation.core.model.EntitySnapshot;
import com.content.reconciliation.core.model.MatchCandidate;
import com.content.reconciliation.core.model.NameSuggestion;
import com.content.reconciliation.core.model.ProductVideoAsset;
import com.content.reconciliation.core.model.RawChannelRecord;
import com.content.reconciliation.core.model.VideoProductMapping;
import com.content.reconciliation.verification.CommitResult;
import com.content.reconciliation.verification.VerificationWorkflow;
import com.content.reconciliation.verification.WorkflowStage;
import com.content.reconciliation.verification.WorkflowState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end reconciliation runs through the public session API.
 */
class ReconciliationSessionTest {

    private AuditService auditService;
    private ReconciliationSession session;

    @BeforeEach
    void setUp() {
        auditService = new AuditService();
        session = ReconciliationEngine.builder()
                .auditService(auditService)
                .build()
                .openSession();
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), "expected " + expected + " but was " + actual);
    }

    private static RawChannelRecord sponsored(String title, String amount, String duration, String date) {
        return RawChannelRecord.builder(ChannelKind.SPONSORED_ONSITE)
                .title(title).amount(amount).duration(duration).date(date).build();
    }

    @Nested
    @DisplayName("Entity matching")
    class EntityMatchingTests {

        @Test
        @DisplayName("A strong title, duration and date match should be pre-selected and consolidated on commit")
        void strongMatchCommitted() {
            session.ingest(ReconciliationInput.builder()
                    .videoRecord(RawChannelRecord.video("v1", "Unboxing Widget", "10.00", 1200, "5:00", "2024-01-01"))
                    .sponsoredRecords(List.of(sponsored("unboxing widget!", "5.00", "5:01", "2024-01-02")))
                    .build());
            assertEquals(2, session.registry().size());

            List<MatchCandidate> candidates = session.proposeMatches();

            assertEquals(1, candidates.size());
            MatchCandidate candidate = candidates.get(0);
            assertEquals("video:v1", candidate.videoEntityId());
            assertEquals("title:unboxing widget", candidate.counterpartId());
            assertEquals(CounterpartType.ENTITY, candidate.counterpartType());
            assertEquals(100, candidate.score());
            assertTrue(candidate.autoApprovable());
            assertEquals("title match, duration match, date within 2 days", candidate.reasoning());

            VerificationWorkflow workflow = session.workflow();
            workflow.beginReview();
            assertEquals(1, workflow.getSelectedCount());
            CommitResult result = workflow.commit();

            assertEquals(1, result.appliedCount());
            assertEquals(1, session.registry().size());
            CanonicalEntity entity = session.registry().require("video:v1");
            assertAmount("15.00", entity.getTotal());
            assertAmount("5.00", entity.getRevenue(ChannelKind.SPONSORED_ONSITE));
            assertEquals(List.of("title:unboxing widget"), entity.getConsolidatedIds());
        }

        @Test
        @DisplayName("A title-only product record should merge into the video it matches")
        void titleOnlyProductRecordCommitted() {
            session.ingest(ReconciliationInput.builder()
                    .videoRecord(RawChannelRecord.video("v1", "Unboxing Widget", "10.00", 0, "5:00", "2024-01-01"))
                    .productRecord(RawChannelRecord.builder(ChannelKind.PRODUCT_ONSITE)
                            .title("Unboxing Widget").amount("5.00").duration("5:00").date("2024-01-02").build())
                    .build());

            List<MatchCandidate> candidates = session.proposeMatches();

            assertEquals(1, candidates.size());
            assertEquals(100, candidates.get(0).score());
            assertTrue(candidates.get(0).autoApprovable());

            session.workflow().beginReview();
            session.workflow().commit();

            assertEquals(1, session.registry().size());
            CanonicalEntity entity = session.registry().all().iterator().next();
            assertEquals("v1", entity.getVideoId());
            assertAmount("15.00", entity.getTotal());
            assertAmount("5.00", entity.getOnsiteRevenue());
            assertAmount("10.00", entity.getVideoEstimatedRevenue());
        }

        @Test
        @DisplayName("A title-only match should be proposed but not pre-selected")
        void weakMatchNotSelected() {
            session.ingest(ReconciliationInput.builder()
                    .videoRecord(RawChannelRecord.video("v1", "Widget", "1.00", 0, "5:00", null))
                    .productRecord(RawChannelRecord.product(ChannelKind.PRODUCT_ONSITE, "P1", "Widget", "2.00", 3, 1))
                    .build());

            List<MatchCandidate> candidates = session.proposeMatches();

            assertEquals(1, candidates.size());
            assertEquals(60, candidates.get(0).score());
            assertFalse(candidates.get(0).autoApprovable());
            assertEquals(List.of("P1"), candidates.get(0).productIds());
        }

        @Test
        @DisplayName("Deselecting everything should leave the registry unchanged")
        void deselectAllLeavesRegistryUnchanged() {
            session.ingest(ReconciliationInput.builder()
                    .videoRecord(RawChannelRecord.video("v1", "Unboxing Widget", "10.00", 1200, "5:00", "2024-01-01"))
                    .sponsoredRecords(List.of(sponsored("Unboxing Widget", "5.00", "5:00", "2024-01-01")))
                    .build());
            List<EntitySnapshot> before = session.registry().snapshot();
            session.proposeMatches();

            session.workflow().beginReview();
            session.workflow().deselectAll();
            CommitResult result = session.workflow().commit();

            assertEquals(0, result.appliedCount());
            assertEquals(before, session.registry().snapshot());
            assertTrue(session.links().isEmpty());
        }

        @Test
        @DisplayName("A proposal made stale by an earlier commit should be skipped")
        void staleProposalSkipped() {
            session.ingest(ReconciliationInput.builder()
                    .videoRecord(RawChannelRecord.video("v1", "Widget", "1.00", 0, null, null))
                    .videoRecord(RawChannelRecord.video("v2", "Widget", "2.00", 0, null, null))
                    .productRecord(RawChannelRecord.product(ChannelKind.PRODUCT_ONSITE, "P1", "Widget", "3.00", 0, 0))
                    .build());

            List<MatchCandidate> candidates = session.proposeMatches();
            assertEquals(List.of("video:v1", "video:v2"),
                    candidates.stream().map(MatchCandidate::videoEntityId).toList());

            session.workflow().beginReview();
            session.workflow().selectAll();
            CommitResult result = session.workflow().commit();

            assertEquals(List.of("video:v1->product:P1"), result.applied());
            assertEquals(1, result.skipped().size());
            assertEquals("video:v2->product:P1", result.skipped().get(0).proposalId());
            assertEquals("video:v1", session.registry().findByProductId("P1").orElseThrow().getId());
            assertTrue(session.registry().require("video:v2").isVideoOrphan());
            assertEquals(1, session.links().size());
        }
    }

    @Test
    @DisplayName("Asset matching, naming and finish should run the full pipeline")
    void assetPipelineWithNaming() {
        session.ingest(ReconciliationInput.builder()
                .videoRecord(RawChannelRecord.video("v2", "How To Use Gizmo", "8.00", 500, "10:00", "2024-03-01"))
                .build());
        ProductVideoAsset asset = new ProductVideoAsset("A1", "How to use gizmo!", "10:01", "2024-03-02", List.of());
        VideoProductMapping mapping = new VideoProductMapping("How To Use Gizmo", List.of("P9"));

        List<MatchCandidate> candidates = session.proposeMatches(List.of(asset), List.of(mapping));

        assertEquals(1, candidates.size());
        assertEquals(CounterpartType.ASSET, candidates.get(0).counterpartType());
        assertEquals(List.of("P9"), candidates.get(0).productIds());
        session.workflow().beginReview();
        session.workflow().commit();

        ContentLink link = session.links().get(0);
        assertEquals("v2", link.videoId());
        assertEquals(List.of("P9"), link.productIds());
        assertFalse(link.manuallyLinked());

        session.fold(List.of(RawChannelRecord.product(ChannelKind.PRODUCT_OFFSITE, "P9", "Gizmo", "4.00", 2, 1)));
        assertEquals(1, session.registry().size());
        assertAmount("12.00", session.registry().require("video:v2").getTotal());

        List<NameSuggestion> names = session.proposeNames();
        assertEquals(1, names.size());
        assertEquals("How to use gizmo!", names.get(0).originalName());
        assertEquals(WorkflowStage.NAMING, session.workflow().getStage());

        session.workflow().beginReview();
        session.workflow().updateProposedName("P9", "Gizmo Guide");
        session.workflow().commit();
        session.workflow().finish();

        assertEquals(WorkflowState.IDLE, session.workflow().getState());
        assertEquals("Gizmo Guide", session.links().get(0).displayNameOverride());
        assertEquals("Gizmo Guide", session.registry().require("video:v2").getDisplayTitle());
    }

    @Test
    @DisplayName("Persisted links should fold product revenue into the linked video")
    void ingestAppliesPriorLinks() {
        ContentLink prior = ContentLink.of("v1", List.of("P1"), "Unboxing", true).withDisplayNameOverride("Widget Set");

        FoldResult result = session.ingest(ReconciliationInput.builder()
                .videoRecord(RawChannelRecord.video("v1", "Unboxing", "10.00", 0, null, null))
                .productRecord(RawChannelRecord.product(ChannelKind.PRODUCT_ONSITE, "P1", "Widget", "5.00", 0, 0))
                .links(List.of(prior))
                .build());

        assertEquals(2, result.recordsFolded());
        assertEquals(1, session.registry().size());
        CanonicalEntity entity = session.registry().require("video:v1");
        assertAmount("15.00", entity.getTotal());
        assertEquals("Widget Set", entity.getDisplayTitle());
        assertTrue(session.proposeMatches().isEmpty());
        assertEquals(List.of(prior), session.links());
    }

    @Test
    @DisplayName("Persisted links with blank product ids should still apply")
    void ingestToleratesBlankLinkProductIds() {
        ContentLink prior = ContentLink.of("v1", List.of("", "B1"), "Unboxing", true);

        FoldResult result = session.ingest(ReconciliationInput.builder()
                .videoRecord(RawChannelRecord.video("v1", "Unboxing", "10.00", 0, null, null))
                .productRecord(RawChannelRecord.product(ChannelKind.PRODUCT_ONSITE, "B1", "Widget", "5.00", 0, 0))
                .links(List.of(prior))
                .build());

        assertEquals(2, result.recordsFolded());
        assertEquals(1, session.registry().size());
        assertAmount("15.00", session.registry().require("video:v1").getTotal());
        assertEquals(List.of("B1"), session.links().get(0).productIds());
    }

    @Test
    @DisplayName("Manual consolidation should record a manual link")
    void manualConsolidationRecordsLink() {
        session.ingest(ReconciliationInput.builder()
                .videoRecord(RawChannelRecord.video("v1", "Clip", "1.00", 0, null, null))
                .productRecord(RawChannelRecord.product(ChannelKind.PRODUCT_ONSITE, "P1", "Widget", "2.00", 0, 0))
                .build());

        CanonicalEntity kept = session.consolidate("video:v1", "product:P1", "analyst");

        assertAmount("3.00", kept.getTotal());
        ContentLink link = session.links().get(0);
        assertTrue(link.manuallyLinked());
        assertEquals(List.of("P1"), link.productIds());
        assertEquals("analyst",
                auditService.getEntriesByAction(AuditAction.ENTITY_CONSOLIDATED).get(0).actorId());
    }

    @Test
    @DisplayName("Ingest should report rejected records and rank what was folded")
    void ingestReportsRejectionsAndRanks() {
        FoldResult result = session.ingest(ReconciliationInput.builder()
                .videoRecord(RawChannelRecord.video("v1", "Small", "1.00", 0, null, null))
                .videoRecord(RawChannelRecord.video("v2", "Large", "9.00", 0, null, null))
                .sponsoredRecords(List.of(sponsored("???", "1.00", null, null)))
                .build());

        assertEquals(2, result.recordsFolded());
        assertEquals(1, result.recordsRejected());
        assertEquals(List.of("video:v2", "video:v1"),
                session.rankedEntities().stream().map(CanonicalEntity::getId).toList());
    }

    @Test
    @DisplayName("Sessions from one engine should not share state")
    void sessionsIndependent() {
        ReconciliationEngine engine = ReconciliationEngine.createDefault();
        ReconciliationSession first = engine.openSession();
        ReconciliationSession second = engine.openSession();

        first.fold(List.of(RawChannelRecord.video("v1", "Clip", "1.00", 0, null, null)));

        assertEquals(1, first.registry().size());
        assertTrue(second.registry().isEmpty());
        assertEquals(WorkflowState.IDLE, second.workflow().getState());
    }
}
