package com.content.reconciliation.api;

import com.content.reconciliation.core.model.CanonicalEntity;
import com.content.reconciliation.core.model.ChannelKind;
import com.content.reconciliation.matching.DescriptorComparators;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Read-only presentation queries over registry entities. Filters return new views
 * and never touch the entities.
 */
public final class RegistryView {

    private static final Comparator<CanonicalEntity> BY_TOTAL_DESC =
            Comparator.comparing(CanonicalEntity::getTotal).reversed()
                    .thenComparing(CanonicalEntity::getId);

    private final List<CanonicalEntity> entities;

    private RegistryView(List<CanonicalEntity> entities) {
        this.entities = entities;
    }

    public static RegistryView of(Collection<CanonicalEntity> entities) {
        return new RegistryView(List.copyOf(entities));
    }

    /**
     * Entities by descending total, ties broken by id.
     */
    public List<CanonicalEntity> ranked() {
        List<CanonicalEntity> sorted = new ArrayList<>(entities);
        sorted.sort(BY_TOTAL_DESC);
        return sorted;
    }

    /**
     * Keeps entities with non-zero revenue on at least one of the given channels.
     */
    public RegistryView withRevenueIn(Set<ChannelKind> kinds) {
        return filter(entity -> kinds.stream().anyMatch(kind -> entity.getRevenue(kind).signum() != 0));
    }

    public RegistryView publishedIn(int year) {
        return filter(entity -> {
            LocalDate date = DescriptorComparators.parseDate(entity.getPublishDate());
            return date != null && date.getYear() == year;
        });
    }

    /**
     * Case-insensitive search over titles and platform identifiers. A blank query keeps everything.
     */
    public RegistryView search(String query) {
        if (query == null || query.isBlank()) {
            return this;
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);
        return filter(entity -> matches(entity, needle));
    }

    public RegistryView orphansOnly() {
        return filter(CanonicalEntity::isOrphan);
    }

    /**
     * Groups entities by primary product id and sums their additive fields.
     * Entities without a product id are left out. Rows are ordered by descending total.
     */
    public List<ProductPivotRow> pivotByProductId() {
        Map<String, List<CanonicalEntity>> groups = new LinkedHashMap<>();
        for (CanonicalEntity entity : entities) {
            if (entity.hasProductIds()) {
                groups.computeIfAbsent(entity.getProductId(), k -> new ArrayList<>()).add(entity);
            }
        }

        List<ProductPivotRow> rows = new ArrayList<>(groups.size());
        for (Map.Entry<String, List<CanonicalEntity>> group : groups.entrySet()) {
            List<CanonicalEntity> members = group.getValue();
            Map<ChannelKind, BigDecimal> revenue = sumRevenue(members);
            CanonicalEntity first = members.get(0);
            String title = first.getProductTitle(group.getKey()) != null
                    ? first.getProductTitle(group.getKey())
                    : first.getDisplayTitle();
            rows.add(new ProductPivotRow(
                    group.getKey(),
                    title,
                    members.stream().map(CanonicalEntity::getId).collect(Collectors.toList()),
                    revenue,
                    revenue.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add),
                    members.stream().mapToLong(CanonicalEntity::getViews).sum(),
                    members.stream().mapToLong(CanonicalEntity::getClicks).sum(),
                    members.stream().mapToLong(CanonicalEntity::getOrderedItems).sum(),
                    members.stream().mapToLong(CanonicalEntity::getShippedItems).sum()));
        }
        rows.sort(Comparator.comparing(ProductPivotRow::total).reversed()
                .thenComparing(ProductPivotRow::productId));
        return rows;
    }

    public PortfolioSummary summary() {
        Map<ChannelKind, BigDecimal> revenue = sumRevenue(entities);
        long clicks = entities.stream().mapToLong(CanonicalEntity::getClicks).sum();
        long ordered = entities.stream().mapToLong(CanonicalEntity::getOrderedItems).sum();
        return new PortfolioSummary(
                entities.size(),
                revenue.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add),
                revenue,
                entities.stream().mapToLong(CanonicalEntity::getViews).sum(),
                clicks,
                ordered,
                entities.stream().mapToLong(CanonicalEntity::getShippedItems).sum(),
                clicks == 0 ? 0.0 : (double) ordered / clicks);
    }

    public int size() {
        return entities.size();
    }

    private RegistryView filter(Predicate<CanonicalEntity> predicate) {
        return new RegistryView(entities.stream().filter(predicate).collect(Collectors.toList()));
    }

    private static boolean matches(CanonicalEntity entity, String needle) {
        if (contains(entity.getDisplayTitle(), needle)
                || contains(entity.getOriginalTitle(), needle)
                || contains(entity.getVideoId(), needle)) {
            return true;
        }
        for (String productId : entity.getProductIds()) {
            if (contains(productId, needle)) {
                return true;
            }
        }
        return false;
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static Map<ChannelKind, BigDecimal> sumRevenue(List<CanonicalEntity> members) {
        Map<ChannelKind, BigDecimal> revenue = new EnumMap<>(ChannelKind.class);
        for (ChannelKind kind : ChannelKind.values()) {
            revenue.put(kind, BigDecimal.ZERO);
        }
        for (CanonicalEntity entity : members) {
            for (ChannelKind kind : ChannelKind.values()) {
                revenue.merge(kind, entity.getRevenue(kind), BigDecimal::add);
            }
        }
        return revenue;
    }
}
