package com.content.reconciliation.aggregate;

import com.content.reconciliation.core.model.CanonicalEntity;
import com.content.reconciliation.core.model.ChannelKind;
import com.content.reconciliation.core.model.RawChannelRecord;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Set;
import java.util.TreeSet;

/**
 * What the fold knows about one product id: the video ids it was seen with, and
 * the revenue and counters of records that carried only the product id.
 *
 * <p>The product-only contribution always sits in the entity that owns the
 * product id, so it can be moved as a unit when ownership changes.</p>
 */
final class ProductShare {
    private final String productId;
    private final Set<String> videoIds = new TreeSet<>();
    private final EnumMap<ChannelKind, BigDecimal> revenue = new EnumMap<>(ChannelKind.class);
    private long views;
    private long clicks;
    private long orderedItems;
    private long shippedItems;

    ProductShare(String productId) {
        this.productId = productId;
    }

    String productId() {
        return productId;
    }

    /**
     * @return true when the video id was not seen with this product before
     */
    boolean addVideoId(String videoId) {
        return videoIds.add(videoId);
    }

    /**
     * A product seen with more than one video id belongs to none of them.
     */
    boolean isContested() {
        return videoIds.size() > 1;
    }

    void add(RawChannelRecord record) {
        revenue.merge(record.kind(), record.amount(), BigDecimal::add);
        views += record.views();
        clicks += record.clicks();
        orderedItems += record.orderedItems();
        shippedItems += record.shippedItems();
    }

    void withdrawFrom(CanonicalEntity entity) {
        revenue.forEach(entity::withdrawRevenue);
        entity.withdrawEngagement(views, clicks, orderedItems, shippedItems);
    }

    void depositInto(CanonicalEntity entity) {
        revenue.forEach(entity::addRevenue);
        entity.addEngagement(views, clicks, orderedItems, shippedItems);
    }
}
