package com.content.reconciliation.matching;

import com.content.reconciliation.core.model.CanonicalEntity;
import com.content.reconciliation.core.model.ProductVideoAsset;
import com.content.reconciliation.core.model.TitleSelector;

import java.util.List;
import java.util.Objects;

/**
 * Uniform view of one side of a match: a registry entity or a product-platform asset.
 */
public record MatchSubject(
        String id,
        String title,
        String duration,
        String date,
        List<String> productIds
) {
    public MatchSubject {
        Objects.requireNonNull(id, "id is required");
        title = title != null ? title : "";
        productIds = productIds != null ? List.copyOf(productIds) : List.of();
    }

    public static MatchSubject ofEntity(CanonicalEntity entity) {
        // Platform ids are a display fallback only, never a comparison title
        String title = TitleSelector.firstNonBlank(entity.getVideoTitle(), entity.getProductTitle());
        return new MatchSubject(entity.getId(), title, entity.getDuration(),
                entity.getPublishDate(), List.copyOf(entity.getProductIds()));
    }

    public static MatchSubject ofAsset(ProductVideoAsset asset) {
        return new MatchSubject(asset.assetId(), asset.title(), asset.duration(),
                asset.uploadDate(), asset.productIds());
    }
}
