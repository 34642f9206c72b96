package com.content.reconciliation.matching;

import com.content.reconciliation.cache.CacheConfig;
import com.content.reconciliation.core.model.ProductVideoAsset;
import com.content.reconciliation.core.model.VideoProductMapping;
import com.content.reconciliation.rules.DefaultNormalizationRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AssetCatalogTest {

    private AssetCatalog catalog;

    @BeforeEach
    void setUp() {
        catalog = new AssetCatalog(DefaultNormalizationRules.createDefaultNormalizer(CacheConfig.disabled()));
    }

    @Test
    @DisplayName("Should attach mapped product ids by normalized title")
    void joinsByNormalizedTitle() {
        ProductVideoAsset asset = new ProductVideoAsset("a1", "Unboxing Widget", "5:00", null, List.of("B00"));
        List<VideoProductMapping> mappings = List.of(
                new VideoProductMapping("unboxing widget!", List.of("B01", "B00")),
                new VideoProductMapping("Unboxing  Widget", List.of("B02")));

        List<ProductVideoAsset> joined = catalog.join(List.of(asset), mappings);

        assertEquals(List.of("B00", "B01", "B02"), joined.get(0).productIds());
        assertEquals("a1", joined.get(0).assetId());
    }

    @Test
    @DisplayName("Should leave unmapped assets untouched")
    void unmappedAsset() {
        ProductVideoAsset asset = new ProductVideoAsset("a1", "Gadget Teardown", null, null, List.of());

        List<ProductVideoAsset> joined = catalog.join(List.of(asset),
                List.of(new VideoProductMapping("Unboxing Widget", List.of("B01"))));

        assertSame(asset, joined.get(0));
    }

    @Test
    @DisplayName("Empty title keys should never join")
    void emptyKeysNeverJoin() {
        ProductVideoAsset asset = new ProductVideoAsset("a1", "!!!", null, null, List.of());

        List<ProductVideoAsset> joined = catalog.join(List.of(asset),
                List.of(new VideoProductMapping("???", List.of("B09"))));

        assertTrue(joined.get(0).productIds().isEmpty());
    }
}
