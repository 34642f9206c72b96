package com.content.reconciliation.metrics;

import com.content.reconciliation.core.model.ChannelKind;

import java.time.Duration;

/**
 * Interface for recording reconciliation metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine works
 * without a metrics backend.
 */
public interface MetricsService {

    void recordFoldDuration(Duration duration);

    void incrementRecordFolded(ChannelKind kind);

    void incrementRecordRejected();

    void incrementEntityCreated();

    void incrementEntityConsolidated();

    void recordCandidateScore(int score);

    void recordCandidatesProposed(int count);

    void incrementProposalCommitted();

    void incrementProposalSkipped();
}
