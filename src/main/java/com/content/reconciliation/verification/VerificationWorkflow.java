package com.content.reconciliation.verification;

import com.content.reconciliation.audit.AuditAction;
import com.content.reconciliation.audit.AuditService;
import com.content.reconciliation.core.model.MatchCandidate;
import com.content.reconciliation.core.model.NameSuggestion;
import com.content.reconciliation.core.model.UnknownEntityException;
import com.content.reconciliation.logging.LogContext;
import com.content.reconciliation.metrics.MetricsService;
import com.content.reconciliation.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Staged, human-verified application of match and naming proposals.
 *
 * <p>State changes go through {@link WorkflowTransitions}. Staging replaces any
 * proposals that were not committed. Only selected proposals are applied on
 * commit; a selected proposal that has gone stale is skipped and reported while
 * the rest of the batch still commits.</p>
 */
public class VerificationWorkflow {
    private static final Logger log = LoggerFactory.getLogger(VerificationWorkflow.class);

    private static final String REVIEWER = "REVIEWER";

    private final ProposalApplier<MatchCandidate> matchApplier;
    private final ProposalApplier<NameSuggestion> nameApplier;
    private final AuditService auditService;
    private final MetricsService metricsService;

    private WorkflowState state = WorkflowState.IDLE;
    private WorkflowStage stage;
    private final List<StagedProposal<MatchCandidate>> matchProposals = new ArrayList<>();
    private final List<StagedProposal<NameSuggestion>> nameProposals = new ArrayList<>();
    private final List<MatchCandidate> committedMatches = new ArrayList<>();

    public VerificationWorkflow(ProposalApplier<MatchCandidate> matchApplier,
                                ProposalApplier<NameSuggestion> nameApplier,
                                AuditService auditService) {
        this(matchApplier, nameApplier, auditService, new NoOpMetricsService());
    }

    public VerificationWorkflow(ProposalApplier<MatchCandidate> matchApplier,
                                ProposalApplier<NameSuggestion> nameApplier,
                                AuditService auditService,
                                MetricsService metricsService) {
        this.matchApplier = matchApplier;
        this.nameApplier = nameApplier;
        this.auditService = auditService;
        this.metricsService = metricsService;
    }

    public WorkflowState getState() {
        return state;
    }

    /**
     * Current pipeline stage, or null when idle.
     */
    public WorkflowStage getStage() {
        return stage;
    }

    /**
     * Stages match candidates for review. Each proposal is pre-selected when the
     * candidate is auto-approvable.
     */
    public void stageMatches(List<MatchCandidate> candidates) {
        transition(WorkflowEvent.STAGE);
        discardStaged();
        committedMatches.clear();
        stage = WorkflowStage.MATCHING;
        for (MatchCandidate candidate : candidates) {
            matchProposals.add(new StagedProposal<>(candidate.id(), candidate, candidate.autoApprovable()));
        }
        recordStaged(candidates.size());
    }

    /**
     * Stages name suggestions, all pre-selected. From COMMITTED this advances the
     * pipeline to the naming stage.
     */
    public void stageNaming(List<NameSuggestion> suggestions) {
        transition(WorkflowEvent.STAGE);
        discardStaged();
        stage = WorkflowStage.NAMING;
        for (NameSuggestion suggestion : suggestions) {
            nameProposals.add(new StagedProposal<>(suggestion.productId(), suggestion, true));
        }
        recordStaged(suggestions.size());
    }

    public void beginReview() {
        transition(WorkflowEvent.REVIEW);
        log.info("workflow.reviewing stage={} proposals={}", stage, activeProposals().size());
    }

    public List<StagedProposal<MatchCandidate>> getMatchProposals() {
        return Collections.unmodifiableList(matchProposals);
    }

    public List<StagedProposal<NameSuggestion>> getNameProposals() {
        return Collections.unmodifiableList(nameProposals);
    }

    /**
     * Match candidates applied by the last matching commit.
     */
    public List<MatchCandidate> getCommittedMatches() {
        return List.copyOf(committedMatches);
    }

    public void toggle(String proposalId) {
        StagedProposal<?> proposal = findForEdit(proposalId);
        proposal.setSelected(!proposal.isSelected());
    }

    public void select(String proposalId, boolean selected) {
        findForEdit(proposalId).setSelected(selected);
    }

    public void selectAll() {
        setAll(true);
    }

    public void deselectAll() {
        setAll(false);
    }

    /**
     * Replaces the proposed display name of a naming proposal.
     */
    public void updateProposedName(String productId, String proposedName) {
        requireReviewing();
        if (stage != WorkflowStage.NAMING) {
            throw new IllegalStateException("Names can only be edited in the naming stage, current stage " + stage);
        }
        StagedProposal<NameSuggestion> proposal = nameProposals.stream()
                .filter(p -> p.getId().equals(productId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Proposal not found: " + productId));
        proposal.setPayload(proposal.getPayload().withProposedName(proposedName));
    }

    public int getSelectedCount() {
        return (int) activeProposals().stream().filter(StagedProposal::isSelected).count();
    }

    /**
     * Applies the selected proposals of the current stage and moves to COMMITTED.
     */
    public CommitResult commit() {
        transition(WorkflowEvent.COMMIT);
        try (LogContext logCtx = LogContext.forCommit(LogContext.generateCorrelationId(), stage.name())) {
            CommitResult result = stage == WorkflowStage.MATCHING
                    ? applySelected(matchProposals, matchApplier)
                    : applySelected(nameProposals, nameApplier);

            if (stage == WorkflowStage.MATCHING) {
                for (StagedProposal<MatchCandidate> proposal : matchProposals) {
                    if (result.applied().contains(proposal.getId())) {
                        committedMatches.add(proposal.getPayload());
                    }
                }
            }
            matchProposals.clear();
            nameProposals.clear();

            log.info("workflow.committed stage={} applied={} skipped={} discarded={}",
                    stage, result.appliedCount(), result.skipped().size(), result.discarded());
            return result;
        }
    }

    /**
     * Ends the pipeline after a commit.
     */
    public void finish() {
        transition(WorkflowEvent.FINISH);
        stage = null;
        committedMatches.clear();
    }

    /**
     * Aborts from any state, dropping everything staged.
     */
    public void clear() {
        WorkflowState previous = state;
        transition(WorkflowEvent.CLEAR);
        int dropped = activeProposals().size();
        discardStaged();
        committedMatches.clear();
        stage = null;
        auditService.record(AuditAction.WORKFLOW_CLEARED, null, REVIEWER,
                Map.of("previousState", previous.name(), "dropped", dropped));
        log.info("workflow.cleared previousState={} dropped={}", previous, dropped);
    }

    private <T> CommitResult applySelected(List<StagedProposal<T>> proposals, ProposalApplier<T> applier) {
        List<String> applied = new ArrayList<>();
        List<CommitResult.SkippedProposal> skipped = new ArrayList<>();
        int discarded = 0;

        for (StagedProposal<T> proposal : proposals) {
            if (!proposal.isSelected()) {
                discarded++;
                continue;
            }
            try {
                applier.apply(proposal.getPayload());
                applied.add(proposal.getId());
                metricsService.incrementProposalCommitted();
                auditService.record(AuditAction.PROPOSAL_COMMITTED, proposal.getId(), REVIEWER,
                        Map.of("stage", stage.name()));
            } catch (UnknownEntityException | IllegalArgumentException | IllegalStateException e) {
                skipped.add(new CommitResult.SkippedProposal(proposal.getId(), e.getMessage()));
                metricsService.incrementProposalSkipped();
                auditService.record(AuditAction.PROPOSAL_SKIPPED, proposal.getId(), REVIEWER,
                        Map.of("stage", stage.name(), "reason", String.valueOf(e.getMessage())));
                log.warn("workflow.proposalSkipped proposalId={} reason={}", proposal.getId(), e.getMessage());
            }
        }
        return new CommitResult(stage, applied, skipped, discarded);
    }

    private void transition(WorkflowEvent event) {
        WorkflowState next = WorkflowTransitions.next(state, event);
        log.debug("workflow.transition from={} event={} to={}", state, event, next);
        state = next;
    }

    private void discardStaged() {
        if (!matchProposals.isEmpty() || !nameProposals.isEmpty()) {
            log.info("workflow.discarding matchProposals={} nameProposals={}",
                    matchProposals.size(), nameProposals.size());
        }
        matchProposals.clear();
        nameProposals.clear();
    }

    private void recordStaged(int count) {
        auditService.record(AuditAction.PROPOSALS_STAGED, null, AuditService.SYSTEM_ACTOR,
                Map.of("stage", stage.name(), "count", count));
        log.info("workflow.staged stage={} proposals={}", stage, count);
    }

    private List<? extends StagedProposal<?>> activeProposals() {
        return stage == WorkflowStage.NAMING ? nameProposals : matchProposals;
    }

    private StagedProposal<?> findForEdit(String proposalId) {
        requireReviewing();
        return activeProposals().stream()
                .filter(p -> p.getId().equals(proposalId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Proposal not found: " + proposalId));
    }

    private void setAll(boolean selected) {
        requireReviewing();
        for (StagedProposal<?> proposal : activeProposals()) {
            proposal.setSelected(selected);
        }
    }

    private void requireReviewing() {
        if (state != WorkflowState.REVIEWING) {
            throw new IllegalStateException("Selection can only change while reviewing, current state " + state);
        }
    }
}
