package com.content.reconciliation.aggregate;

import com.content.reconciliation.core.model.CanonicalEntity;
import com.content.reconciliation.core.model.ChannelKind;
import com.content.reconciliation.core.model.EntitySnapshot;
import com.content.reconciliation.core.model.UnknownEntityException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EntityRegistryTest {

    private EntityRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new EntityRegistry();
    }

    private CanonicalEntity add(String id) {
        return registry.add(CanonicalEntity.builder().id(id).build());
    }

    @Test
    @DisplayName("Should index identifiers on add")
    void addIndexesIdentifiers() {
        CanonicalEntity entity = registry.add(CanonicalEntity.builder().id("video:v1").videoId("v1").build());

        assertSame(entity, registry.findByVideoId("v1").orElseThrow());
        assertSame(entity, registry.require("video:v1"));
        assertEquals(1, registry.size());
    }

    @Test
    @DisplayName("Should reject duplicate entity ids")
    void duplicateId() {
        add("video:v1");
        assertThrows(IllegalStateException.class, () -> add("video:v1"));
    }

    @Test
    @DisplayName("Should refuse to let two entities own the same identifier")
    void identifierUniqueness() {
        CanonicalEntity first = add("a");
        CanonicalEntity second = add("b");
        registry.claimProductId(first, "B01", "Widget");
        registry.claimVideoId(first, "v1");

        assertThrows(IllegalStateException.class, () -> registry.claimProductId(second, "B01", null));
        assertThrows(IllegalStateException.class, () -> registry.claimVideoId(second, "v1"));
        assertThrows(IllegalStateException.class, () -> registry.claimVideoId(first, "v2"));
        assertThrows(IllegalArgumentException.class, () -> registry.claimProductId(second, "", null));
        assertEquals("Widget", first.getProductTitle("B01"));
    }

    @Test
    @DisplayName("Unknown ids should not resolve")
    void unknownIds() {
        assertTrue(registry.find("missing").isEmpty());
        assertTrue(registry.findByVideoId("").isEmpty());
        UnknownEntityException e = assertThrows(UnknownEntityException.class, () -> registry.require("missing"));
        assertEquals("missing", e.getEntityId());
    }

    @Test
    @DisplayName("Retiring should point every index entry at the survivor")
    void retireRepointsIndexes() {
        CanonicalEntity keep = add("video:v1");
        registry.claimVideoId(keep, "v1");
        CanonicalEntity retired = add("video:v2");
        registry.claimVideoId(retired, "v2");
        registry.claimProductId(retired, "B01", null);
        CanonicalEntity titled = add("title:widget");
        registry.claimTitleKey(titled, "widget");

        registry.retire(retired, keep);
        registry.retire(titled, keep);

        assertEquals(1, registry.size());
        assertFalse(registry.contains("video:v2"));
        assertSame(keep, registry.findByVideoId("v2").orElseThrow());
        assertSame(keep, registry.findByProductId("B01").orElseThrow());
        assertSame(keep, registry.findByTitleKey("widget").orElseThrow());
        assertThrows(UnknownEntityException.class, () -> registry.claimVideoId(retired, "v9"));
    }

    @Test
    @DisplayName("Snapshots should be equal values while nothing changes")
    void snapshotsCompareByValue() {
        CanonicalEntity entity = add("video:v1");
        entity.addRevenue(ChannelKind.VIDEO_AD_REVENUE, new BigDecimal("10.00"));

        List<EntitySnapshot> before = registry.snapshot();
        assertEquals(before, registry.snapshot());

        entity.addRevenue(ChannelKind.PRODUCT_ONSITE, new BigDecimal("1.00"));
        assertNotEquals(before, registry.snapshot());
    }

    @Test
    @DisplayName("Releasing a product id should leave it unowned and claimable")
    void releaseProductId() {
        CanonicalEntity holder = add("video:v1");
        CanonicalEntity other = add("product:B01");
        registry.claimProductId(holder, "B01", "Widget");

        assertThrows(IllegalStateException.class, () -> registry.releaseProductId(other, "B01"));
        registry.releaseProductId(holder, "B01");

        assertTrue(registry.findByProductId("B01").isEmpty());
        assertFalse(holder.hasProductIds());
        assertNull(holder.getProductTitle("B01"));
        registry.claimProductId(other, "B01", null);
        assertSame(other, registry.findByProductId("B01").orElseThrow());
    }
}
