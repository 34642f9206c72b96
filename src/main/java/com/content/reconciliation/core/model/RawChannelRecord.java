package com.content.reconciliation.core.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Immutable fact supplied by an import collaborator.
 * Many raw records may describe the same real-world asset; the aggregator folds
 * them into one {@link CanonicalEntity}.
 *
 * @param kind         channel the amount was earned on
 * @param videoId      video-platform identifier, empty when absent
 * @param productId    product-platform identifier (e.g. ASIN), empty when absent
 * @param title        display title as exported by the platform
 * @param amount       monetary amount, never null
 * @param views        view count
 * @param clicks       click count
 * @param orderedItems ordered item count
 * @param shippedItems shipped item count
 * @param duration     optional elapsed-time descriptor ("H:M:S", "M:S" or seconds)
 * @param date         optional publish or sale date
 */
public record RawChannelRecord(
        ChannelKind kind,
        String videoId,
        String productId,
        String title,
        BigDecimal amount,
        long views,
        long clicks,
        long orderedItems,
        long shippedItems,
        String duration,
        String date
) {
    public RawChannelRecord {
        Objects.requireNonNull(kind, "kind is required");
        videoId = videoId != null ? videoId.trim() : "";
        productId = productId != null ? productId.trim() : "";
        title = title != null ? title : "";
        amount = amount != null ? amount : BigDecimal.ZERO;
    }

    public boolean hasVideoId() {
        return !videoId.isEmpty();
    }

    public boolean hasProductId() {
        return !productId.isEmpty();
    }

    public static Builder builder(ChannelKind kind) {
        return new Builder(kind);
    }

    /**
     * Creates a video-platform ad revenue record.
     */
    public static RawChannelRecord video(String videoId, String title, String amount, long views,
                                         String duration, String publishDate) {
        return builder(ChannelKind.VIDEO_AD_REVENUE)
                .videoId(videoId)
                .title(title)
                .amount(new BigDecimal(amount))
                .views(views)
                .duration(duration)
                .date(publishDate)
                .build();
    }

    /**
     * Creates a product-platform record of the given kind.
     */
    public static RawChannelRecord product(ChannelKind kind, String productId, String title, String amount,
                                           long clicks, long orderedItems) {
        return builder(kind)
                .productId(productId)
                .title(title)
                .amount(new BigDecimal(amount))
                .clicks(clicks)
                .orderedItems(orderedItems)
                .build();
    }

    public static class Builder {
        private final ChannelKind kind;
        private String videoId;
        private String productId;
        private String title;
        private BigDecimal amount = BigDecimal.ZERO;
        private long views;
        private long clicks;
        private long orderedItems;
        private long shippedItems;
        private String duration;
        private String date;

        private Builder(ChannelKind kind) {
            this.kind = kind;
        }

        public Builder videoId(String videoId) {
            this.videoId = videoId;
            return this;
        }

        public Builder productId(String productId) {
            this.productId = productId;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder amount(BigDecimal amount) {
            this.amount = amount;
            return this;
        }

        public Builder amount(String amount) {
            this.amount = new BigDecimal(amount);
            return this;
        }

        public Builder views(long views) {
            this.views = views;
            return this;
        }

        public Builder clicks(long clicks) {
            this.clicks = clicks;
            return this;
        }

        public Builder orderedItems(long orderedItems) {
            this.orderedItems = orderedItems;
            return this;
        }

        public Builder shippedItems(long shippedItems) {
            this.shippedItems = shippedItems;
            return this;
        }

        public Builder duration(String duration) {
            this.duration = duration;
            return this;
        }

        public Builder date(String date) {
            this.date = date;
            return this;
        }

        public RawChannelRecord build() {
            return new RawChannelRecord(kind, videoId, productId, title, amount,
                    views, clicks, orderedItems, shippedItems, duration, date);
        }
    }
}
