package com.content.reconciliation.aggregate;

import com.content.reconciliation.core.model.RawChannelRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of folding a batch of raw records.
 *
 * @param recordsFolded   records applied to the registry
 * @param entitiesCreated new entities created by the fold
 * @param consolidations  entities merged because one record bridged two of them
 * @param rejections      malformed records that were skipped
 */
public record FoldResult(
        int recordsFolded,
        int entitiesCreated,
        int consolidations,
        List<Rejection> rejections
) {
    public FoldResult {
        rejections = rejections != null ? List.copyOf(rejections) : List.of();
    }

    public int recordsRejected() {
        return rejections.size();
    }

    public boolean hasRejections() {
        return !rejections.isEmpty();
    }

    public static FoldResult empty() {
        return new FoldResult(0, 0, 0, List.of());
    }

    /**
     * Sums two results, e.g. the folds of several channel collections.
     */
    public FoldResult plus(FoldResult other) {
        List<Rejection> combined = new ArrayList<>(rejections);
        combined.addAll(other.rejections);
        return new FoldResult(recordsFolded + other.recordsFolded,
                entitiesCreated + other.entitiesCreated,
                consolidations + other.consolidations,
                combined);
    }

    /**
     * A skipped record.
     *
     * @param position zero-based position of the record in its batch
     * @param record   the record
     * @param reason   why it was rejected
     */
    public record Rejection(int position, RawChannelRecord record, String reason) {
    }
}
