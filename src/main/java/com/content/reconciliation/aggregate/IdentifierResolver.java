package com.content.reconciliation.aggregate;

import com.content.reconciliation.core.model.RawChannelRecord;
import com.content.reconciliation.rules.TitleNormalizer;

import java.util.Optional;

/**
 * Resolves a raw record to exactly one canonical key.
 * Precedence: video id, then product id, then normalized title.
 */
public class IdentifierResolver {

    private final TitleNormalizer normalizer;

    public IdentifierResolver(TitleNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    /**
     * @return the key, or empty when the record has no identifier and its title
     * normalizes to the empty string
     */
    public Optional<RecordKey> resolve(RawChannelRecord record) {
        if (record.hasVideoId()) {
            return Optional.of(new RecordKey(RecordKey.KeyType.VIDEO, record.videoId()));
        }
        if (record.hasProductId()) {
            return Optional.of(new RecordKey(RecordKey.KeyType.PRODUCT, record.productId()));
        }
        String titleKey = normalizer.normalize(record.title());
        if (titleKey.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new RecordKey(RecordKey.KeyType.TITLE, titleKey));
    }

    public TitleNormalizer getNormalizer() {
        return normalizer;
    }
}
