package com.content.reconciliation.matching;

import com.content.reconciliation.core.model.ProductVideoAsset;
import com.content.reconciliation.core.model.VideoProductMapping;
import com.content.reconciliation.rules.TitleNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Joins product-platform video assets with title-to-product mapping rows by
 * normalized title, so each asset carries every product id listed for its title.
 */
public class AssetCatalog {
    private static final Logger log = LoggerFactory.getLogger(AssetCatalog.class);

    private final TitleNormalizer normalizer;

    public AssetCatalog(TitleNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public List<ProductVideoAsset> join(Collection<ProductVideoAsset> assets,
                                        Collection<VideoProductMapping> mappings) {
        Map<String, Set<String>> productIdsByTitle = new HashMap<>();
        for (VideoProductMapping mapping : mappings) {
            String key = normalizer.normalize(mapping.videoTitle());
            if (key.isEmpty()) {
                continue;
            }
            Set<String> ids = productIdsByTitle.computeIfAbsent(key, k -> new LinkedHashSet<>());
            for (String productId : mapping.productIds()) {
                if (productId != null && !productId.isBlank()) {
                    ids.add(productId.trim());
                }
            }
        }

        List<ProductVideoAsset> joined = new ArrayList<>(assets.size());
        int enriched = 0;
        for (ProductVideoAsset asset : assets) {
            Set<String> mapped = productIdsByTitle.get(normalizer.normalize(asset.title()));
            if (mapped == null || mapped.isEmpty()) {
                joined.add(asset);
                continue;
            }
            Set<String> ids = new LinkedHashSet<>(asset.productIds());
            ids.addAll(mapped);
            joined.add(asset.withProductIds(new ArrayList<>(ids)));
            enriched++;
        }

        log.debug("catalog.joined assets={} mappings={} enriched={}", assets.size(), mappings.size(), enriched);
        return joined;
    }
}
