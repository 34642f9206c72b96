package com.content.reconciliation.api;

import com.content.reconciliation.core.model.ChannelKind;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Totals over a set of entities.
 *
 * @param entityCount       number of entities summarized
 * @param revenue           sum of entity totals
 * @param revenueByChannel  sum per channel kind
 * @param views             total views
 * @param clicks            total clicks
 * @param orderedItems      total ordered items
 * @param shippedItems      total shipped items
 * @param conversionRate    ordered items per click, 0 when there were no clicks
 */
public record PortfolioSummary(
        int entityCount,
        BigDecimal revenue,
        Map<ChannelKind, BigDecimal> revenueByChannel,
        long views,
        long clicks,
        long orderedItems,
        long shippedItems,
        double conversionRate
) {
    public PortfolioSummary {
        revenueByChannel = Map.copyOf(revenueByChannel);
    }
}
