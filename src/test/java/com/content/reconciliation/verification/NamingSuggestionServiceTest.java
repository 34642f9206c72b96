package com.content.reconciliation.verification;

import com.content.reconciliation.aggregate.EntityRegistry;
import com.content.reconciliation.core.model.CanonicalEntity;
import com.content.reconciliation.core.model.CounterpartType;
import com.content.reconciliation.core.model.MatchBasis;
import com.content.reconciliation.core.model.MatchCandidate;
import com.content.reconciliation.core.model.NameSuggestion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.*;

class NamingSuggestionServiceTest {

    private static final String LONG_NAME = "Super Long Product Name That Exceeds The Limit";

    private EntityRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new EntityRegistry();
        CanonicalEntity entity = registry.add(CanonicalEntity.builder().id("video:v1").videoId("v1").build());
        registry.claimProductId(entity, "P1", LONG_NAME);
    }

    private static MatchCandidate committed(String counterpartTitle, String... productIds) {
        return new MatchCandidate("m1", "video:v1", "asset-1", CounterpartType.ASSET, "Clip",
                counterpartTitle, List.of(productIds), MatchBasis.TITLE, 100, true, "title match");
    }

    @Test
    @DisplayName("Provider results should become proposed names")
    void providerResultsUsed() {
        NameSuggestionProvider provider = names -> Map.of("P1", "Widget");
        NamingSuggestionService service = new NamingSuggestionService(registry, provider);

        List<NameSuggestion> suggestions = service.suggest(List.of(committed("Asset title", "P1")));

        assertEquals(List.of(new NameSuggestion("P1", LONG_NAME, "Widget")), suggestions);
    }

    @Test
    @DisplayName("A failing provider should fall back to truncated drafts")
    void providerFailureFallsBack() {
        NameSuggestionProvider provider = mock(NameSuggestionProvider.class);
        when(provider.simplify(anyMap())).thenThrow(new IllegalStateException("service unavailable"));
        NamingSuggestionService service = new NamingSuggestionService(registry, provider);

        List<NameSuggestion> suggestions = service.suggest(List.of(committed("Asset title", "P1")));

        assertEquals(1, suggestions.size());
        assertEquals("Super Long Product Name That E...", suggestions.get(0).proposedName());
        assertEquals(LONG_NAME, suggestions.get(0).originalName());
    }

    @Test
    @DisplayName("Missing or blank provider entries should fall back per product")
    void missingEntriesFallBack() {
        NameSuggestionProvider provider = names -> Map.of("P1", " ");
        NamingSuggestionService service = new NamingSuggestionService(registry, provider);

        List<NameSuggestion> suggestions = service.suggest(List.of(committed("Gizmo", "P1", "P2")));

        assertEquals(2, suggestions.size());
        assertEquals("Super Long Product Name That E...", suggestions.get(0).proposedName());
        assertEquals("P2", suggestions.get(1).productId());
        assertEquals("Gizmo", suggestions.get(1).originalName());
        assertEquals("Gizmo", suggestions.get(1).proposedName());
    }

    @Test
    @DisplayName("Product ids shared by several matches should be suggested once")
    void uniqueProductIds() {
        NamingSuggestionService service = new NamingSuggestionService(registry, new TruncatingNameSuggestionProvider());

        List<NameSuggestion> suggestions = service.suggest(List.of(
                committed("A", "P1"), committed("B", "P1", "P3"), committed(null, "P4")));

        assertEquals(List.of("P1", "P3", "P4"), suggestions.stream().map(NameSuggestion::productId).toList());
        assertEquals("P4", suggestions.get(2).originalName());
    }

    @Test
    @DisplayName("No committed matches should yield no suggestions")
    void noMatches() {
        NameSuggestionProvider provider = mock(NameSuggestionProvider.class);
        NamingSuggestionService service = new NamingSuggestionService(registry, provider);

        assertTrue(service.suggest(List.of()).isEmpty());
        verifyNoInteractions(provider);
    }
}
