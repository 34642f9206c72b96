package com.content.reconciliation.verification;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default provider: names longer than the limit are cut and suffixed with "...".
 */
public class TruncatingNameSuggestionProvider implements NameSuggestionProvider {

    public static final int DEFAULT_MAX_LENGTH = 30;

    private final int maxLength;

    public TruncatingNameSuggestionProvider() {
        this(DEFAULT_MAX_LENGTH);
    }

    public TruncatingNameSuggestionProvider(int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be > 0");
        }
        this.maxLength = maxLength;
    }

    @Override
    public Map<String, String> simplify(Map<String, String> originalNames) {
        Map<String, String> result = new LinkedHashMap<>();
        originalNames.forEach((productId, name) -> result.put(productId, truncate(name)));
        return result;
    }

    public String truncate(String name) {
        if (name == null || name.length() <= maxLength) {
            return name;
        }
        return name.substring(0, maxLength) + "...";
    }
}
