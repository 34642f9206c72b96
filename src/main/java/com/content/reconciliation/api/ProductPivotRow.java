package com.content.reconciliation.api;

import com.content.reconciliation.core.model.ChannelKind;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Presentation row summing every entity whose primary product id is {@code productId}.
 */
public record ProductPivotRow(
        String productId,
        String title,
        List<String> entityIds,
        Map<ChannelKind, BigDecimal> revenueByChannel,
        BigDecimal total,
        long views,
        long clicks,
        long orderedItems,
        long shippedItems
) {
    public ProductPivotRow {
        entityIds = List.copyOf(entityIds);
        revenueByChannel = Map.copyOf(revenueByChannel);
    }
}
