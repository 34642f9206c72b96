package com.content.reconciliation.core.model;

/**
 * Chooses a display title from the candidates an entity carries.
 *
 * <p>Precedence, first non-blank wins:</p>
 * <ol>
 *   <li>display-name override recorded on a content link</li>
 *   <li>video title</li>
 *   <li>product title</li>
 *   <li>platform identifier (video id, else primary product id)</li>
 *   <li>entity id</li>
 * </ol>
 */
public final class TitleSelector {

    private TitleSelector() {
        // Utility class
    }

    public static String select(String override, String videoTitle, String productTitle,
                                String platformId, String entityId) {
        return firstNonBlank(override, videoTitle, productTitle, platformId, entityId);
    }

    /**
     * Returns the first candidate that is neither null nor blank, or the empty string.
     */
    public static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate;
            }
        }
        return "";
    }
}
