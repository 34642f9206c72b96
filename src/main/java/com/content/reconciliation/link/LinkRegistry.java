package com.content.reconciliation.link;

import com.content.reconciliation.audit.AuditAction;
import com.content.reconciliation.audit.AuditService;
import com.content.reconciliation.core.model.ContentLink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Confirmed video-to-product links, one per video id.
 */
public class LinkRegistry {
    private static final Logger log = LoggerFactory.getLogger(LinkRegistry.class);

    private final Map<String, ContentLink> linksByVideoId = new LinkedHashMap<>();
    private final AuditService auditService;

    public LinkRegistry(AuditService auditService) {
        this.auditService = auditService;
    }

    /**
     * Loads previously persisted links, replacing any held for the same video ids.
     */
    public void load(Collection<ContentLink> links) {
        for (ContentLink link : links) {
            linksByVideoId.put(link.videoId(), link);
        }
        log.info("links.loaded count={} total={}", links.size(), linksByVideoId.size());
    }

    /**
     * Records a link, replacing the existing one for the same video id. A display-name
     * override already chosen for the video is kept unless the new link carries its own.
     */
    public ContentLink record(ContentLink link) {
        ContentLink previous = linksByVideoId.get(link.videoId());
        ContentLink stored = link;
        if (previous != null && link.displayNameOverride() == null && previous.displayNameOverride() != null) {
            stored = link.withDisplayNameOverride(previous.displayNameOverride());
        }
        linksByVideoId.put(stored.videoId(), stored);

        auditService.record(AuditAction.LINK_RECORDED, stored.videoId(), AuditService.SYSTEM_ACTOR, Map.of(
                "productIds", String.join(",", stored.productIds()),
                "manuallyLinked", stored.manuallyLinked(),
                "replaced", previous != null
        ));
        log.info("link.recorded videoId={} productIds={} manual={} replaced={}",
                stored.videoId(), stored.productIds(), stored.manuallyLinked(), previous != null);
        return stored;
    }

    /**
     * Sets the display-name override on every link whose primary product id matches.
     *
     * @return number of links renamed
     */
    public int renameByPrimaryProductId(String productId, String displayName) {
        int renamed = 0;
        for (Map.Entry<String, ContentLink> entry : linksByVideoId.entrySet()) {
            ContentLink link = entry.getValue();
            if (productId.equals(link.primaryProductId())) {
                entry.setValue(link.withDisplayNameOverride(displayName));
                renamed++;
                auditService.record(AuditAction.LINK_RENAMED, link.videoId(), AuditService.SYSTEM_ACTOR,
                        Map.of("productId", productId, "displayName", displayName));
            }
        }
        log.debug("link.renamed productId={} links={}", productId, renamed);
        return renamed;
    }

    public Optional<ContentLink> find(String videoId) {
        return Optional.ofNullable(linksByVideoId.get(videoId));
    }

    public List<ContentLink> all() {
        return List.copyOf(new ArrayList<>(linksByVideoId.values()));
    }

    public int size() {
        return linksByVideoId.size();
    }
}
