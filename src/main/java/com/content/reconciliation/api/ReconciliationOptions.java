package com.content.reconciliation.api;

import com.content.reconciliation.cache.CacheConfig;
import com.content.reconciliation.matching.MatchingPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Optional;
import java.util.Properties;

/**
 * Options for a reconciliation engine: matching policy, fold chunking and key caching.
 *
 * <p>Can be built in code or read from properties with the {@code reconciliation.}
 * prefix; keys that are absent keep their defaults.</p>
 */
public class ReconciliationOptions {

    public static final String DEFAULT_RESOURCE = "reconciliation.properties";

    private static final String PREFIX = "reconciliation.";
    private static final int DEFAULT_FOLD_CHUNK_SIZE = 500;
    private static final int DEFAULT_KEY_CACHE_SIZE = 10_000;

    private final MatchingPolicy matchingPolicy;
    private final int foldChunkSize;
    private final CacheConfig keyCacheConfig;

    private ReconciliationOptions(Builder builder) {
        this.matchingPolicy = new MatchingPolicy(
                builder.titleWeight,
                builder.partialTitleWeight,
                builder.durationWeight,
                builder.dateWeight,
                builder.minimumScore,
                builder.autoApproveScore,
                builder.durationToleranceSeconds,
                builder.dateToleranceDays,
                builder.substringScanLimit);
        this.foldChunkSize = builder.foldChunkSize;
        this.keyCacheConfig = builder.keyCacheEnabled
                ? CacheConfig.ofSize(builder.keyCacheSize)
                : CacheConfig.disabled();
    }

    public MatchingPolicy getMatchingPolicy() {
        return matchingPolicy;
    }

    public int getFoldChunkSize() {
        return foldChunkSize;
    }

    public CacheConfig getKeyCacheConfig() {
        return keyCacheConfig;
    }

    public static ReconciliationOptions defaults() {
        return builder().build();
    }

    /**
     * Reads {@value #DEFAULT_RESOURCE} from the classpath, or returns defaults when absent.
     */
    public static ReconciliationOptions load() {
        return load(DEFAULT_RESOURCE);
    }

    public static ReconciliationOptions load(String resource) {
        ClassLoader loader = ReconciliationOptions.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                return defaults();
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
    }

    /**
     * @throws IllegalArgumentException if a present key holds a malformed or out-of-range value
     */
    public static ReconciliationOptions fromProperties(Properties properties) {
        Builder builder = builder();
        PropertyReader reader = new PropertyReader(properties);
        reader.intValue("weight.title").ifPresent(builder::titleWeight);
        reader.intValue("weight.partialTitle").ifPresent(builder::partialTitleWeight);
        reader.intValue("weight.duration").ifPresent(builder::durationWeight);
        reader.intValue("weight.date").ifPresent(builder::dateWeight);
        reader.intValue("score.minimum").ifPresent(builder::minimumScore);
        reader.intValue("score.autoApprove").ifPresent(builder::autoApproveScore);
        reader.intValue("tolerance.durationSeconds").ifPresent(builder::durationToleranceSeconds);
        reader.intValue("tolerance.dateDays").ifPresent(builder::dateToleranceDays);
        reader.intValue("match.substringScanLimit").ifPresent(builder::substringScanLimit);
        reader.intValue("fold.chunkSize").ifPresent(builder::foldChunkSize);
        reader.intValue("cache.size").ifPresent(builder::keyCacheSize);
        reader.booleanValue("cache.enabled").ifPresent(builder::keyCacheEnabled);
        return builder.build();
    }

    @Override
    public String toString() {
        return "ReconciliationOptions{" +
                "matchingPolicy=" + matchingPolicy +
                ", foldChunkSize=" + foldChunkSize +
                ", keyCacheConfig=" + keyCacheConfig +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final MatchingPolicy defaults = MatchingPolicy.defaults();
        private int titleWeight = defaults.titleWeight();
        private int partialTitleWeight = defaults.partialTitleWeight();
        private int durationWeight = defaults.durationWeight();
        private int dateWeight = defaults.dateWeight();
        private int minimumScore = defaults.minimumScore();
        private int autoApproveScore = defaults.autoApproveScore();
        private int durationToleranceSeconds = defaults.durationToleranceSeconds();
        private int dateToleranceDays = defaults.dateToleranceDays();
        private int substringScanLimit = defaults.substringScanLimit();
        private int foldChunkSize = DEFAULT_FOLD_CHUNK_SIZE;
        private int keyCacheSize = DEFAULT_KEY_CACHE_SIZE;
        private boolean keyCacheEnabled = true;

        public Builder titleWeight(int weight) {
            this.titleWeight = weight;
            return this;
        }

        public Builder partialTitleWeight(int weight) {
            this.partialTitleWeight = weight;
            return this;
        }

        public Builder durationWeight(int weight) {
            this.durationWeight = weight;
            return this;
        }

        public Builder dateWeight(int weight) {
            this.dateWeight = weight;
            return this;
        }

        public Builder minimumScore(int score) {
            this.minimumScore = score;
            return this;
        }

        public Builder autoApproveScore(int score) {
            this.autoApproveScore = score;
            return this;
        }

        public Builder durationToleranceSeconds(int seconds) {
            this.durationToleranceSeconds = seconds;
            return this;
        }

        public Builder dateToleranceDays(int days) {
            this.dateToleranceDays = days;
            return this;
        }

        public Builder substringScanLimit(int limit) {
            this.substringScanLimit = limit;
            return this;
        }

        public Builder foldChunkSize(int size) {
            if (size <= 0) {
                throw new IllegalArgumentException("foldChunkSize must be > 0");
            }
            this.foldChunkSize = size;
            return this;
        }

        public Builder keyCacheSize(int size) {
            if (size <= 0) {
                throw new IllegalArgumentException("keyCacheSize must be > 0");
            }
            this.keyCacheSize = size;
            return this;
        }

        public Builder keyCacheEnabled(boolean enabled) {
            this.keyCacheEnabled = enabled;
            return this;
        }

        /**
         * @throws IllegalArgumentException if weights, thresholds or tolerances are invalid
         */
        public ReconciliationOptions build() {
            return new ReconciliationOptions(this);
        }
    }

    private static final class PropertyReader {
        private final Properties properties;

        PropertyReader(Properties properties) {
            this.properties = properties;
        }

        Optional<Integer> intValue(String key) {
            String raw = properties.getProperty(PREFIX + key);
            if (raw == null || raw.isBlank()) {
                return Optional.empty();
            }
            try {
                return Optional.of(Integer.parseInt(raw.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid integer for " + PREFIX + key + ": '" + raw + "'", e);
            }
        }

        Optional<Boolean> booleanValue(String key) {
            String raw = properties.getProperty(PREFIX + key);
            if (raw == null || raw.isBlank()) {
                return Optional.empty();
            }
            String value = raw.trim();
            if (value.equalsIgnoreCase("true") || value.equalsIgnoreCase("false")) {
                return Optional.of(Boolean.parseBoolean(value));
            }
            throw new IllegalArgumentException("Invalid boolean for " + PREFIX + key + ": '" + raw + "'");
        }
    }
}
