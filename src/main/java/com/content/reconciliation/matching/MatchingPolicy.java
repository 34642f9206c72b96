package com.content.reconciliation.matching;

/**
 * Additive scoring policy for candidate matching.
 *
 * @param titleWeight              points for exact normalized-title equality
 * @param partialTitleWeight       points for substring containment when no exact title matched
 * @param durationWeight           points for durations within tolerance
 * @param dateWeight               points for dates within tolerance
 * @param minimumScore             candidates below this score are not proposed
 * @param autoApproveScore         candidates at or above this score are pre-selected
 * @param durationToleranceSeconds duration tolerance
 * @param dateToleranceDays        date tolerance
 * @param substringScanLimit       substring fallback runs only when both sides are smaller than this
 */
public record MatchingPolicy(
        int titleWeight,
        int partialTitleWeight,
        int durationWeight,
        int dateWeight,
        int minimumScore,
        int autoApproveScore,
        int durationToleranceSeconds,
        int dateToleranceDays,
        int substringScanLimit
) {
    public MatchingPolicy {
        if (titleWeight < 0 || partialTitleWeight < 0 || durationWeight < 0 || dateWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        if (minimumScore < 0 || autoApproveScore < minimumScore) {
            throw new IllegalArgumentException(
                    "Thresholds must satisfy 0 <= minimumScore <= autoApproveScore, got "
                            + minimumScore + " and " + autoApproveScore);
        }
        if (durationToleranceSeconds < 0 || dateToleranceDays < 0) {
            throw new IllegalArgumentException("Tolerances must be non-negative");
        }
        if (substringScanLimit < 0) {
            throw new IllegalArgumentException("substringScanLimit must be non-negative");
        }
    }

    public static MatchingPolicy defaults() {
        return new MatchingPolicy(60, 40, 30, 10, 40, 90,
                DescriptorComparators.DEFAULT_DURATION_TOLERANCE_SECONDS,
                DescriptorComparators.DEFAULT_DATE_TOLERANCE_DAYS,
                1000);
    }

    /**
     * Whether the substring fallback may scan collections of the given sizes.
     */
    public boolean allowsSubstringScan(int videoCount, int counterpartCount) {
        return videoCount < substringScanLimit && counterpartCount < substringScanLimit;
    }
}
