package com.content.reconciliation.verification;

import java.util.List;

/**
 * Outcome of a workflow commit.
 *
 * @param stage     stage that was committed
 * @param applied   ids of proposals that were applied
 * @param skipped   selected proposals that could not be applied
 * @param discarded number of unselected proposals dropped without side effects
 */
public record CommitResult(
        WorkflowStage stage,
        List<String> applied,
        List<SkippedProposal> skipped,
        int discarded
) {
    public CommitResult {
        applied = applied != null ? List.copyOf(applied) : List.of();
        skipped = skipped != null ? List.copyOf(skipped) : List.of();
    }

    public int appliedCount() {
        return applied.size();
    }

    public boolean hasSkipped() {
        return !skipped.isEmpty();
    }

    /**
     * A selected proposal that was stale at commit time.
     */
    public record SkippedProposal(String proposalId, String reason) {
    }
}
