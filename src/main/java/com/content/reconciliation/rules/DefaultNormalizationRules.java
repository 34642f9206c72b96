package com.content.reconciliation.rules;

import com.content.reconciliation.cache.CacheConfig;

import java.util.List;

/**
 * Built-in title normalization rules.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a TitleNormalizer with the default rules and a default-sized key cache.
     */
    public static TitleNormalizer createDefaultNormalizer() {
        return createDefaultNormalizer(CacheConfig.defaults());
    }

    public static TitleNormalizer createDefaultNormalizer(CacheConfig cacheConfig) {
        return new TitleNormalizer(getTitleRules(), cacheConfig);
    }

    public static List<NormalizationRule> getTitleRules() {
        return List.of(
                // Anything outside [a-z0-9] becomes a separator
                NormalizationRule.builder()
                        .name("title-non-alphanumeric")
                        .pattern("[^a-z0-9]")
                        .replacement(" ")
                        .priority(100)
                        .build(),

                NormalizationRule.builder()
                        .name("title-collapse-spaces")
                        .pattern("\\s+")
                        .replacement(" ")
                        .priority(200)
                        .build()
        );
    }
}
