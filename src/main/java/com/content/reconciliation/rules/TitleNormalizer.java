package com.content.reconciliation.rules;

import com.content.reconciliation.cache.CacheConfig;
import com.content.reconciliation.cache.CacheStats;
import com.content.reconciliation.cache.KeyCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Turns display titles into canonical comparison keys.
 *
 * <p>The input is lower-cased first, then rules are applied in priority order
 * (lower priority number = higher precedence), then whitespace is collapsed and
 * trimmed. With the default rules the result contains only {@code [a-z0-9]} and
 * single spaces, so normalization is idempotent. The empty key never matches.</p>
 */
public class TitleNormalizer {
    private static final Logger log = LoggerFactory.getLogger(TitleNormalizer.class);

    private final List<NormalizationRule> rules;
    private final KeyCache cache;

    public TitleNormalizer() {
        this(List.of(), CacheConfig.disabled());
    }

    public TitleNormalizer(List<NormalizationRule> rules, CacheConfig cacheConfig) {
        this.rules = new ArrayList<>(rules);
        this.rules.sort(Comparator.comparingInt(NormalizationRule::getPriority));
        this.cache = KeyCache.create(cacheConfig);
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Normalizes a title. Total: null and blank input give the empty string.
     */
    public String normalize(String title) {
        if (title == null || title.isBlank()) {
            return "";
        }
        return cache.get(title, this::applyRules);
    }

    /**
     * Returns true when both titles normalize to the same non-empty key.
     */
    public boolean sameKey(String title1, String title2) {
        String key = normalize(title1);
        return !key.isEmpty() && key.equals(normalize(title2));
    }

    /**
     * Returns true when one non-empty key contains the other.
     */
    public boolean containsEitherWay(String title1, String title2) {
        String key1 = normalize(title1);
        String key2 = normalize(title2);
        if (key1.isEmpty() || key2.isEmpty()) {
            return false;
        }
        return key1.contains(key2) || key2.contains(key1);
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    private String applyRules(String title) {
        String result = title.toLowerCase(Locale.ROOT);

        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (log.isTraceEnabled() && !before.equals(result)) {
                log.trace("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
            }
        }

        return result.replaceAll("\\s+", " ").trim();
    }
}
