package com.content.reconciliation.metrics;

import com.content.reconciliation.core.model.ChannelKind;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordFoldDuration(Duration duration) {
    }

    @Override
    public void incrementRecordFolded(ChannelKind kind) {
    }

    @Override
    public void incrementRecordRejected() {
    }

    @Override
    public void incrementEntityCreated() {
    }

    @Override
    public void incrementEntityConsolidated() {
    }

    @Override
    public void recordCandidateScore(int score) {
    }

    @Override
    public void recordCandidatesProposed(int count) {
    }

    @Override
    public void incrementProposalCommitted() {
    }

    @Override
    public void incrementProposalSkipped() {
    }
}
