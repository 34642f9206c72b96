package com.content.reconciliation.core.model;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Ephemeral proposal that a video entity and a product-side counterpart describe
 * the same content asset. Never persisted; the verification workflow decides
 * whether it is applied.
 *
 * @param id                unique proposal id
 * @param videoEntityId     id of the video-side entity
 * @param counterpartId     entity id or asset id, depending on {@code counterpartType}
 * @param counterpartType   whether the counterpart is a registry entity or an external asset
 * @param videoTitle        title of the video side
 * @param counterpartTitle  title of the counterpart
 * @param productIds        product identifiers carried by the counterpart
 * @param basis             signals that contributed to the score
 * @param score             additive confidence score
 * @param autoApprovable    whether the score reached the pre-selection threshold
 * @param reasoning         human-readable list of contributing signals
 */
public record MatchCandidate(
        String id,
        String videoEntityId,
        String counterpartId,
        CounterpartType counterpartType,
        String videoTitle,
        String counterpartTitle,
        List<String> productIds,
        MatchBasis basis,
        int score,
        boolean autoApprovable,
        String reasoning
) {
    public MatchCandidate {
        Objects.requireNonNull(videoEntityId, "videoEntityId is required");
        Objects.requireNonNull(counterpartId, "counterpartId is required");
        Objects.requireNonNull(counterpartType, "counterpartType is required");
        Objects.requireNonNull(basis, "basis is required");
        if (score < 0) {
            throw new IllegalArgumentException("Score must be non-negative");
        }
        id = id != null ? id : UUID.randomUUID().toString();
        productIds = productIds != null ? List.copyOf(productIds) : List.of();
    }
}
