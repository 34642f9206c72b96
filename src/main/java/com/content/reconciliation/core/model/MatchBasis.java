package com.content.reconciliation.core.model;

/**
 * Which signal(s) produced a match candidate.
 */
public enum MatchBasis {
    TITLE,
    DURATION,
    DATE,
    /**
     * More than one signal contributed.
     */
    COMBINED;

    /**
     * Derives the basis from the contributing signals, or null when none contributed.
     */
    public static MatchBasis of(boolean title, boolean duration, boolean date) {
        int signals = (title ? 1 : 0) + (duration ? 1 : 0) + (date ? 1 : 0);
        if (signals == 0) {
            return null;
        }
        if (signals > 1) {
            return COMBINED;
        }
        if (title) {
            return TITLE;
        }
        return duration ? DURATION : DATE;
    }
}
