package com.content.reconciliation.core.model;

import java.util.List;

/**
 * Row of a video-to-product mapping export: a video title and the products tagged in it.
 */
public record VideoProductMapping(String videoTitle, List<String> productIds) {
    public VideoProductMapping {
        videoTitle = videoTitle != null ? videoTitle : "";
        productIds = productIds != null ? List.copyOf(productIds) : List.of();
    }
}
