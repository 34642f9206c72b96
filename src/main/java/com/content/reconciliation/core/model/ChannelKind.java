package com.content.reconciliation.core.model;

/**
 * Monetization stream a raw record belongs to.
 * Each kind owns exactly one accumulator on a {@link CanonicalEntity}.
 */
public enum ChannelKind {
    /**
     * Ad revenue reported by the video platform.
     */
    VIDEO_AD_REVENUE(Platform.VIDEO),

    /**
     * Affiliate earnings for purchases made on the product platform.
     */
    PRODUCT_ONSITE(Platform.PRODUCT),

    /**
     * Affiliate earnings for purchases attributed to off-platform traffic.
     */
    PRODUCT_OFFSITE(Platform.PRODUCT),

    /**
     * Sponsored-content earnings paid on the product platform.
     */
    SPONSORED_ONSITE(Platform.PRODUCT),

    /**
     * Sponsored-content earnings paid for off-platform placements.
     */
    SPONSORED_OFFSITE(Platform.PRODUCT);

    /**
     * Platform family that issues the native identifier of a record.
     */
    public enum Platform {
        VIDEO,
        PRODUCT
    }

    private final Platform platform;

    ChannelKind(Platform platform) {
        this.platform = platform;
    }

    public Platform getPlatform() {
        return platform;
    }

    public boolean isVideo() {
        return platform == Platform.VIDEO;
    }

    public boolean isProduct() {
        return platform == Platform.PRODUCT;
    }

    public boolean isSponsored() {
        return this == SPONSORED_ONSITE || this == SPONSORED_OFFSITE;
    }
}
