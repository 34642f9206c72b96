package com.content.reconciliation.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Video descriptor exported by the product platform (storefront video listing).
 * Carries no revenue; it only bridges a video title to product identifiers.
 */
public record ProductVideoAsset(
        String assetId,
        String title,
        String duration,
        String uploadDate,
        List<String> productIds
) {
    public ProductVideoAsset {
        Objects.requireNonNull(assetId, "assetId is required");
        title = title != null ? title : "";
        productIds = productIds != null ? List.copyOf(productIds) : List.of();
    }

    public ProductVideoAsset withProductIds(List<String> ids) {
        return new ProductVideoAsset(assetId, title, duration, uploadDate, ids);
    }
}
