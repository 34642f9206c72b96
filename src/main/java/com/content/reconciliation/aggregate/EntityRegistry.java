package com.content.reconciliation.aggregate;

import com.content.reconciliation.core.model.CanonicalEntity;
import com.content.reconciliation.core.model.EntitySnapshot;
import com.content.reconciliation.core.model.UnknownEntityException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory canonical registry with hash indexes from platform identifiers and
 * title keys to the owning entity.
 *
 * <p>Every identifier is owned by at most one live entity. Claims that would
 * violate this fail with {@link IllegalStateException}; callers resolve conflicts
 * by consolidating first. Not thread-safe: the registry assumes a single writer.</p>
 */
public class EntityRegistry {

    private final Map<String, CanonicalEntity> entities = new LinkedHashMap<>();
    private final Map<String, String> videoIndex = new HashMap<>();
    private final Map<String, String> productIndex = new HashMap<>();
    private final Map<String, String> titleIndex = new HashMap<>();

    /**
     * Adds a new entity and indexes the identifiers it already carries.
     */
    public CanonicalEntity add(CanonicalEntity entity) {
        if (entities.containsKey(entity.getId())) {
            throw new IllegalStateException("Entity already registered: " + entity.getId());
        }
        if (entity.hasVideoId()) {
            ensureUnowned(videoIndex, entity.getVideoId(), entity.getId(), "video id");
        }
        for (String productId : entity.getProductIds()) {
            ensureUnowned(productIndex, productId, entity.getId(), "product id");
        }
        entities.put(entity.getId(), entity);
        if (entity.hasVideoId()) {
            videoIndex.put(entity.getVideoId(), entity.getId());
        }
        for (String productId : entity.getProductIds()) {
            productIndex.put(productId, entity.getId());
        }
        return entity;
    }

    public Optional<CanonicalEntity> find(String entityId) {
        return Optional.ofNullable(entities.get(entityId));
    }

    /**
     * Returns the live entity with the given id.
     *
     * @throws UnknownEntityException if no live entity has that id
     */
    public CanonicalEntity require(String entityId) {
        CanonicalEntity entity = entities.get(entityId);
        if (entity == null) {
            throw new UnknownEntityException(entityId);
        }
        return entity;
    }

    public boolean contains(String entityId) {
        return entities.containsKey(entityId);
    }

    public Optional<CanonicalEntity> findByVideoId(String videoId) {
        return lookup(videoIndex, videoId);
    }

    public Optional<CanonicalEntity> findByProductId(String productId) {
        return lookup(productIndex, productId);
    }

    public Optional<CanonicalEntity> findByTitleKey(String titleKey) {
        return lookup(titleIndex, titleKey);
    }

    /**
     * Assigns a video id to an entity that has none.
     */
    public void claimVideoId(CanonicalEntity entity, String videoId) {
        requireLive(entity);
        if (entity.hasVideoId()) {
            throw new IllegalStateException("Entity " + entity.getId() + " already has video id "
                    + entity.getVideoId());
        }
        ensureUnowned(videoIndex, videoId, entity.getId(), "video id");
        entity.setVideoId(videoId);
        videoIndex.put(videoId, entity.getId());
    }

    public void claimProductId(CanonicalEntity entity, String productId, String title) {
        requireLive(entity);
        ensureUnowned(productIndex, productId, entity.getId(), "product id");
        entity.addProductId(productId, title);
        productIndex.put(productId, entity.getId());
    }

    /**
     * Removes a product id from the entity that owns it, leaving it unowned.
     */
    public void releaseProductId(CanonicalEntity entity, String productId) {
        requireLive(entity);
        if (!entity.getId().equals(productIndex.get(productId))) {
            throw new IllegalStateException("product id '" + productId + "' is not owned by " + entity.getId());
        }
        productIndex.remove(productId);
        entity.removeProductId(productId);
    }

    /**
     * Routes a normalized title key to an entity. Used for records that carry no
     * platform identifier.
     */
    public void claimTitleKey(CanonicalEntity entity, String titleKey) {
        requireLive(entity);
        if (titleKey == null || titleKey.isEmpty()) {
            throw new IllegalArgumentException("Empty title key cannot be claimed");
        }
        ensureUnowned(titleIndex, titleKey, entity.getId(), "title key");
        titleIndex.put(titleKey, entity.getId());
    }

    /**
     * Removes {@code retired} and points every identifier and title key it owned at
     * {@code survivor}. A retired video id stays resolvable as an alias of the survivor.
     */
    public void retire(CanonicalEntity retired, CanonicalEntity survivor) {
        requireLive(retired);
        requireLive(survivor);
        if (retired.getId().equals(survivor.getId())) {
            throw new IllegalArgumentException("Cannot retire an entity into itself: " + retired.getId());
        }
        entities.remove(retired.getId());
        repoint(videoIndex, retired.getId(), survivor.getId());
        repoint(productIndex, retired.getId(), survivor.getId());
        repoint(titleIndex, retired.getId(), survivor.getId());
    }

    public int size() {
        return entities.size();
    }

    public boolean isEmpty() {
        return entities.isEmpty();
    }

    /**
     * Live entities in insertion order.
     */
    public Collection<CanonicalEntity> all() {
        return Collections.unmodifiableCollection(entities.values());
    }

    /**
     * Value copies of every live entity, in insertion order.
     */
    public List<EntitySnapshot> snapshot() {
        List<EntitySnapshot> snapshots = new ArrayList<>(entities.size());
        for (CanonicalEntity entity : entities.values()) {
            snapshots.add(entity.snapshot());
        }
        return snapshots;
    }

    private Optional<CanonicalEntity> lookup(Map<String, String> index, String key) {
        if (key == null || key.isEmpty()) {
            return Optional.empty();
        }
        String entityId = index.get(key);
        return entityId == null ? Optional.empty() : Optional.ofNullable(entities.get(entityId));
    }

    private void requireLive(CanonicalEntity entity) {
        if (entities.get(entity.getId()) != entity) {
            throw new UnknownEntityException(entity.getId());
        }
    }

    private static void ensureUnowned(Map<String, String> index, String key, String entityId, String kind) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Empty " + kind + " cannot be claimed");
        }
        String owner = index.get(key);
        if (owner != null && !owner.equals(entityId)) {
            throw new IllegalStateException(kind + " '" + key + "' is already owned by " + owner);
        }
    }

    private static void repoint(Map<String, String> index, String fromId, String toId) {
        index.replaceAll((key, owner) -> owner.equals(fromId) ? toId : owner);
    }
}
