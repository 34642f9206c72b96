package com.content.reconciliation.metrics;

import com.content.reconciliation.core.model.ChannelKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code reconciliation.fold.duration} Timer</li>
 *   <li>{@code reconciliation.record.folded} Counter (tag: channel)</li>
 *   <li>{@code reconciliation.record.rejected} Counter</li>
 *   <li>{@code reconciliation.entity.created} Counter</li>
 *   <li>{@code reconciliation.entity.consolidated} Counter</li>
 *   <li>{@code reconciliation.candidate.score} DistributionSummary</li>
 *   <li>{@code reconciliation.candidate.proposed} DistributionSummary</li>
 *   <li>{@code reconciliation.proposal.committed} Counter</li>
 *   <li>{@code reconciliation.proposal.skipped} Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final Timer foldTimer;
    private final Map<ChannelKind, Counter> foldedCounters = new EnumMap<>(ChannelKind.class);
    private final Counter rejectedCounter;
    private final Counter createdCounter;
    private final Counter consolidatedCounter;
    private final DistributionSummary scoreSummary;
    private final DistributionSummary proposedSummary;
    private final Counter committedCounter;
    private final Counter skippedCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.foldTimer = Timer.builder("reconciliation.fold.duration")
                .description("Duration of raw record folds")
                .register(registry);
        for (ChannelKind kind : ChannelKind.values()) {
            foldedCounters.put(kind, Counter.builder("reconciliation.record.folded")
                    .description("Number of raw records folded into the registry")
                    .tag("channel", kind.name())
                    .register(registry));
        }
        this.rejectedCounter = Counter.builder("reconciliation.record.rejected")
                .description("Number of malformed raw records rejected")
                .register(registry);
        this.createdCounter = Counter.builder("reconciliation.entity.created")
                .description("Number of canonical entities created")
                .register(registry);
        this.consolidatedCounter = Counter.builder("reconciliation.entity.consolidated")
                .description("Number of entity consolidations")
                .register(registry);
        this.scoreSummary = DistributionSummary.builder("reconciliation.candidate.score")
                .description("Distribution of proposed candidate scores")
                .register(registry);
        this.proposedSummary = DistributionSummary.builder("reconciliation.candidate.proposed")
                .description("Number of candidates proposed per matching run")
                .register(registry);
        this.committedCounter = Counter.builder("reconciliation.proposal.committed")
                .description("Number of proposals applied on commit")
                .register(registry);
        this.skippedCounter = Counter.builder("reconciliation.proposal.skipped")
                .description("Number of stale proposals skipped on commit")
                .register(registry);
    }

    @Override
    public void recordFoldDuration(Duration duration) {
        foldTimer.record(duration);
    }

    @Override
    public void incrementRecordFolded(ChannelKind kind) {
        foldedCounters.get(kind).increment();
    }

    @Override
    public void incrementRecordRejected() {
        rejectedCounter.increment();
    }

    @Override
    public void incrementEntityCreated() {
        createdCounter.increment();
    }

    @Override
    public void incrementEntityConsolidated() {
        consolidatedCounter.increment();
    }

    @Override
    public void recordCandidateScore(int score) {
        scoreSummary.record(score);
    }

    @Override
    public void recordCandidatesProposed(int count) {
        proposedSummary.record(count);
    }

    @Override
    public void incrementProposalCommitted() {
        committedCounter.increment();
    }

    @Override
    public void incrementProposalSkipped() {
        skippedCounter.increment();
    }
}
