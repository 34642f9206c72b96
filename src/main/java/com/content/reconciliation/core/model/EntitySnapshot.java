package com.content.reconciliation.core.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Immutable value copy of a {@link CanonicalEntity}, suitable for comparison
 * and for handing to presentation layers.
 */
public record EntitySnapshot(
        String id,
        String videoId,
        List<String> productIds,
        String displayTitle,
        String originalTitle,
        Map<ChannelKind, BigDecimal> revenue,
        BigDecimal total,
        long views,
        long clicks,
        long orderedItems,
        long shippedItems,
        String duration,
        String publishDate
) {
}
