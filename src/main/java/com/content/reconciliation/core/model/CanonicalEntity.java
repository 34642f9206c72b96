package com.content.reconciliation.core.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * De-duplicated, cross-platform record representing one real-world content asset.
 *
 * <p>Holds one accumulator per {@link ChannelKind}; {@link #getTotal()} is always
 * derived from them and never stored. Platform identifiers are claimed through the
 * registry, which keeps them unique across live entities.</p>
 */
public class CanonicalEntity {
    private final String id;
    private String videoId;
    private final Set<String> productIds = new LinkedHashSet<>();
    private final Map<String, String> productTitles = new LinkedHashMap<>();
    private String videoTitle;
    private String productTitle;
    private String displayNameOverride;
    private final EnumMap<ChannelKind, BigDecimal> revenue = new EnumMap<>(ChannelKind.class);
    private long views;
    private long clicks;
    private long orderedItems;
    private long shippedItems;
    private String duration;
    private String publishDate;
    private final List<String> consolidatedIds = new ArrayList<>();

    private CanonicalEntity(Builder builder) {
        this.id = builder.id;
        this.videoId = builder.videoId != null ? builder.videoId : "";
        this.videoTitle = builder.videoTitle;
        this.productTitle = builder.productTitle;
        this.duration = builder.duration;
        this.publishDate = builder.publishDate;
        for (ChannelKind kind : ChannelKind.values()) {
            revenue.put(kind, BigDecimal.ZERO);
        }
    }

    public String getId() {
        return id;
    }

    public String getVideoId() {
        return videoId;
    }

    public boolean hasVideoId() {
        return !videoId.isEmpty();
    }

    /**
     * Sets the video identifier. Callers outside the registry must go through
     * {@code EntityRegistry.claimVideoId} so the identifier index stays consistent.
     */
    public void setVideoId(String videoId) {
        this.videoId = videoId != null ? videoId : "";
    }

    /**
     * Primary product identifier (the first one claimed), or empty.
     */
    public String getProductId() {
        return productIds.isEmpty() ? "" : productIds.iterator().next();
    }

    public Set<String> getProductIds() {
        return Collections.unmodifiableSet(productIds);
    }

    public boolean hasProductIds() {
        return !productIds.isEmpty();
    }

    public void addProductId(String productId, String title) {
        if (productId == null || productId.isEmpty()) {
            return;
        }
        productIds.add(productId);
        if (title != null && !title.isBlank()) {
            productTitles.putIfAbsent(productId, title);
        }
    }

    /**
     * Drops a product identifier and its title. Callers outside the registry must go
     * through {@code EntityRegistry.releaseProductId}.
     */
    public void removeProductId(String productId) {
        productIds.remove(productId);
        productTitles.remove(productId);
    }

    /**
     * Product title as first seen for the given product identifier.
     */
    public String getProductTitle(String productId) {
        return productTitles.get(productId);
    }

    public Map<String, String> getProductTitles() {
        return Collections.unmodifiableMap(productTitles);
    }

    public String getVideoTitle() {
        return videoTitle;
    }

    public void offerVideoTitle(String title) {
        if (isBlank(videoTitle) && !isBlank(title)) {
            this.videoTitle = title;
        }
    }

    public String getProductTitle() {
        return productTitle;
    }

    public void offerProductTitle(String title) {
        if (isBlank(productTitle) && !isBlank(title)) {
            this.productTitle = title;
        }
    }

    public String getDisplayNameOverride() {
        return displayNameOverride;
    }

    public void setDisplayNameOverride(String displayNameOverride) {
        this.displayNameOverride = displayNameOverride;
    }

    /**
     * Title shown to users, chosen by {@link TitleSelector}.
     */
    public String getDisplayTitle() {
        return TitleSelector.select(displayNameOverride, videoTitle, productTitle,
                hasVideoId() ? videoId : getProductId(), id);
    }

    /**
     * Title as exported by the platforms, ignoring any display-name override.
     */
    public String getOriginalTitle() {
        return TitleSelector.select(null, videoTitle, productTitle,
                hasVideoId() ? videoId : getProductId(), id);
    }

    public BigDecimal getRevenue(ChannelKind kind) {
        return revenue.get(kind);
    }

    public Map<ChannelKind, BigDecimal> getRevenueByChannel() {
        return Collections.unmodifiableMap(revenue);
    }

    public void addRevenue(ChannelKind kind, BigDecimal amount) {
        Objects.requireNonNull(kind, "kind is required");
        if (amount == null) {
            return;
        }
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Revenue amounts must be non-negative: " + amount);
        }
        revenue.merge(kind, amount, BigDecimal::add);
    }

    /**
     * Takes back revenue previously added to this entity, when it moves elsewhere.
     *
     * @throws IllegalStateException if the accumulator would go negative
     */
    public void withdrawRevenue(ChannelKind kind, BigDecimal amount) {
        Objects.requireNonNull(kind, "kind is required");
        if (amount == null || amount.signum() == 0) {
            return;
        }
        BigDecimal remaining = revenue.get(kind).subtract(amount);
        if (remaining.signum() < 0 || amount.signum() < 0) {
            throw new IllegalStateException("Cannot withdraw " + amount + " of " + kind + " from " + id);
        }
        revenue.put(kind, remaining);
    }

    /**
     * Sum of all channel accumulators.
     */
    public BigDecimal getTotal() {
        BigDecimal total = BigDecimal.ZERO;
        for (BigDecimal value : revenue.values()) {
            total = total.add(value);
        }
        return total;
    }

    public BigDecimal getVideoEstimatedRevenue() {
        return revenue.get(ChannelKind.VIDEO_AD_REVENUE);
    }

    public BigDecimal getOnsiteRevenue() {
        return revenue.get(ChannelKind.PRODUCT_ONSITE);
    }

    public BigDecimal getOffsiteRevenue() {
        return revenue.get(ChannelKind.PRODUCT_OFFSITE);
    }

    public long getViews() {
        return views;
    }

    public long getClicks() {
        return clicks;
    }

    public long getOrderedItems() {
        return orderedItems;
    }

    public long getShippedItems() {
        return shippedItems;
    }

    public void addEngagement(long views, long clicks, long orderedItems, long shippedItems) {
        if (views < 0 || clicks < 0 || orderedItems < 0 || shippedItems < 0) {
            throw new IllegalArgumentException("Engagement counters must be non-negative");
        }
        this.views += views;
        this.clicks += clicks;
        this.orderedItems += orderedItems;
        this.shippedItems += shippedItems;
    }

    public void withdrawEngagement(long views, long clicks, long orderedItems, long shippedItems) {
        if (views > this.views || clicks > this.clicks
                || orderedItems > this.orderedItems || shippedItems > this.shippedItems) {
            throw new IllegalStateException("Cannot withdraw more engagement than " + id + " holds");
        }
        this.views -= views;
        this.clicks -= clicks;
        this.orderedItems -= orderedItems;
        this.shippedItems -= shippedItems;
    }

    public String getDuration() {
        return duration;
    }

    public void setDuration(String duration) {
        this.duration = duration;
    }

    public String getPublishDate() {
        return publishDate;
    }

    public void setPublishDate(String publishDate) {
        this.publishDate = publishDate;
    }

    /**
     * Ids of entities that were consolidated into this one, oldest first.
     */
    public List<String> getConsolidatedIds() {
        return Collections.unmodifiableList(consolidatedIds);
    }

    public void recordConsolidated(String entityId) {
        consolidatedIds.add(entityId);
    }

    /**
     * An orphan has exactly one platform side: a video id without product ids,
     * or product-side data without a video id.
     */
    public boolean isOrphan() {
        return !(hasVideoId() && hasProductIds());
    }

    public boolean isVideoOrphan() {
        return hasVideoId() && !hasProductIds();
    }

    public boolean isProductOrphan() {
        return !hasVideoId();
    }

    /**
     * Immutable value copy of this entity.
     */
    public EntitySnapshot snapshot() {
        return new EntitySnapshot(id, videoId, List.copyOf(productIds), getDisplayTitle(), getOriginalTitle(),
                Map.copyOf(revenue), getTotal(), views, clicks, orderedItems, shippedItems,
                duration, publishDate);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CanonicalEntity that = (CanonicalEntity) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "CanonicalEntity{" +
                "id='" + id + '\'' +
                ", videoId='" + videoId + '\'' +
                ", productIds=" + productIds +
                ", title='" + getDisplayTitle() + '\'' +
                ", total=" + getTotal() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String videoId;
        private String videoTitle;
        private String productTitle;
        private String duration;
        private String publishDate;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder videoId(String videoId) {
            this.videoId = videoId;
            return this;
        }

        public Builder videoTitle(String videoTitle) {
            this.videoTitle = videoTitle;
            return this;
        }

        public Builder productTitle(String productTitle) {
            this.productTitle = productTitle;
            return this;
        }

        public Builder duration(String duration) {
            this.duration = duration;
            return this;
        }

        public Builder publishDate(String publishDate) {
            this.publishDate = publishDate;
            return this;
        }

        public CanonicalEntity build() {
            Objects.requireNonNull(id, "id is required");
            return new CanonicalEntity(this);
        }
    }
}
