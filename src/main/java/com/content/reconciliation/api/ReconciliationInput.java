package com.content.reconciliation.api;

import com.content.reconciliation.core.model.ContentLink;
import com.content.reconciliation.core.model.RawChannelRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Collections handed to a session by the import collaborator: already-parsed
 * records per platform and the links persisted by earlier runs.
 */
public record ReconciliationInput(
        List<RawChannelRecord> videoRecords,
        List<RawChannelRecord> productRecords,
        List<RawChannelRecord> sponsoredRecords,
        List<ContentLink> links
) {
    public ReconciliationInput {
        videoRecords = videoRecords != null ? List.copyOf(videoRecords) : List.of();
        productRecords = productRecords != null ? List.copyOf(productRecords) : List.of();
        sponsoredRecords = sponsoredRecords != null ? List.copyOf(sponsoredRecords) : List.of();
        links = links != null ? List.copyOf(links) : List.of();
        for (RawChannelRecord record : videoRecords) {
            if (!record.kind().isVideo()) {
                throw new IllegalArgumentException("Video collection holds a " + record.kind() + " record");
            }
        }
        for (RawChannelRecord record : productRecords) {
            if (!record.kind().isProduct() || record.kind().isSponsored()) {
                throw new IllegalArgumentException("Product collection holds a " + record.kind() + " record");
            }
        }
        for (RawChannelRecord record : sponsoredRecords) {
            if (!record.kind().isSponsored()) {
                throw new IllegalArgumentException("Sponsored collection holds a " + record.kind() + " record");
            }
        }
    }

    public int recordCount() {
        return videoRecords.size() + productRecords.size() + sponsoredRecords.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<RawChannelRecord> videoRecords = new ArrayList<>();
        private final List<RawChannelRecord> productRecords = new ArrayList<>();
        private final List<RawChannelRecord> sponsoredRecords = new ArrayList<>();
        private final List<ContentLink> links = new ArrayList<>();

        public Builder videoRecords(Collection<RawChannelRecord> records) {
            this.videoRecords.addAll(records);
            return this;
        }

        public Builder videoRecord(RawChannelRecord record) {
            this.videoRecords.add(record);
            return this;
        }

        public Builder productRecords(Collection<RawChannelRecord> records) {
            this.productRecords.addAll(records);
            return this;
        }

        public Builder productRecord(RawChannelRecord record) {
            this.productRecords.add(record);
            return this;
        }

        public Builder sponsoredRecords(Collection<RawChannelRecord> records) {
            this.sponsoredRecords.addAll(records);
            return this;
        }

        public Builder links(Collection<ContentLink> links) {
            this.links.addAll(links);
            return this;
        }

        public ReconciliationInput build() {
            return new ReconciliationInput(videoRecords, productRecords, sponsoredRecords, links);
        }
    }
}
