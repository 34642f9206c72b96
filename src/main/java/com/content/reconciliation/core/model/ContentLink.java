package com.content.reconciliation.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Confirmed association of one video id with one or more product ids, persisted by
 * the host so later reconciliation runs do not need to re-match the pair.
 *
 * @param id                  link id
 * @param videoId             linked video id
 * @param productIds          linked product ids, the first one is primary
 * @param title               video title at the time the link was recorded
 * @param manuallyLinked      true when a user linked the pair by hand
 * @param videoCreationDate   publish date of the video, if known
 * @param videoDuration       duration of the video, if known
 * @param displayNameOverride user-chosen display name, or null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContentLink(
        String id,
        String videoId,
        List<String> productIds,
        String title,
        boolean manuallyLinked,
        String videoCreationDate,
        String videoDuration,
        String displayNameOverride
) {
    public ContentLink {
        Objects.requireNonNull(videoId, "videoId is required");
        if (videoId.isBlank()) {
            throw new IllegalArgumentException("videoId must not be blank");
        }
        videoId = videoId.trim();
        id = id != null ? id : UUID.randomUUID().toString();
        productIds = normalizeProductIds(productIds);
    }

    // Trimmed, blanks dropped, first occurrence wins
    private static List<String> normalizeProductIds(List<String> productIds) {
        if (productIds == null) {
            return List.of();
        }
        Set<String> cleaned = new LinkedHashSet<>();
        for (String productId : productIds) {
            if (productId != null && !productId.isBlank()) {
                cleaned.add(productId.trim());
            }
        }
        return List.copyOf(cleaned);
    }

    public static ContentLink of(String videoId, List<String> productIds, String title, boolean manuallyLinked) {
        return new ContentLink(null, videoId, productIds, title, manuallyLinked, null, null, null);
    }

    public String primaryProductId() {
        return productIds.isEmpty() ? "" : productIds.get(0);
    }

    public ContentLink withDisplayNameOverride(String name) {
        return new ContentLink(id, videoId, productIds, title, manuallyLinked,
                videoCreationDate, videoDuration, name);
    }
}
