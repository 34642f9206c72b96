package com.content.reconciliation.api;

import com.content.reconciliation.audit.AuditService;
import com.content.reconciliation.metrics.MetricsService;
import com.content.reconciliation.metrics.NoOpMetricsService;
import com.content.reconciliation.rules.DefaultNormalizationRules;
import com.content.reconciliation.rules.TitleNormalizer;
import com.content.reconciliation.verification.NameSuggestionProvider;
import com.content.reconciliation.verification.TruncatingNameSuggestionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point of the reconciliation library. Holds shared configuration and
 * collaborators and opens independent {@link ReconciliationSession}s.
 *
 * <pre>
 * ReconciliationEngine engine = ReconciliationEngine.builder()
 *         .options(ReconciliationOptions.load())
 *         .build();
 * ReconciliationSession session = engine.openSession();
 * session.ingest(input);
 * session.proposeMatches();
 * </pre>
 */
public class ReconciliationEngine {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final ReconciliationOptions options;
    private final TitleNormalizer normalizer;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final NameSuggestionProvider nameSuggestionProvider;

    private ReconciliationEngine(Builder builder) {
        this.options = builder.options;
        this.normalizer = DefaultNormalizationRules.createDefaultNormalizer(options.getKeyCacheConfig());
        this.auditService = builder.auditService;
        this.metricsService = builder.metricsService;
        this.nameSuggestionProvider = builder.nameSuggestionProvider;
        log.info("ReconciliationEngine initialized: {}", options);
    }

    /**
     * Opens a session with an empty registry, no links and an idle workflow.
     */
    public ReconciliationSession openSession() {
        return new ReconciliationSession(options, normalizer, auditService, metricsService, nameSuggestionProvider);
    }

    public ReconciliationOptions getOptions() {
        return options;
    }

    public TitleNormalizer getNormalizer() {
        return normalizer;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public static ReconciliationEngine createDefault() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ReconciliationOptions options = ReconciliationOptions.defaults();
        private AuditService auditService = new AuditService();
        private MetricsService metricsService = new NoOpMetricsService();
        private NameSuggestionProvider nameSuggestionProvider = new TruncatingNameSuggestionProvider();

        public Builder options(ReconciliationOptions options) {
            this.options = options;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder nameSuggestionProvider(NameSuggestionProvider provider) {
            this.nameSuggestionProvider = provider;
            return this;
        }

        public ReconciliationEngine build() {
            Objects.requireNonNull(options, "options is required");
            Objects.requireNonNull(auditService, "auditService is required");
            Objects.requireNonNull(metricsService, "metricsService is required");
            Objects.requireNonNull(nameSuggestionProvider, "nameSuggestionProvider is required");
            return new ReconciliationEngine(this);
        }
    }
}
