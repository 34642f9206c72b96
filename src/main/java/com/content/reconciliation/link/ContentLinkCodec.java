package com.content.reconciliation.link;

import com.content.reconciliation.core.model.ContentLink;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.List;

/**
 * Reads and writes the content-link collection as a JSON array, for hosts that
 * persist links between reconciliation runs.
 */
public class ContentLinkCodec {
    private static final Logger log = LoggerFactory.getLogger(ContentLinkCodec.class);

    private static final TypeReference<List<ContentLink>> LINK_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ContentLinkCodec() {
        this(new ObjectMapper());
    }

    public ContentLinkCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(Collection<ContentLink> links) {
        try {
            return objectMapper.writeValueAsString(links);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize content links", e);
        }
    }

    public void write(Collection<ContentLink> links, OutputStream out) {
        try {
            objectMapper.writeValue(out, links);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write content links", e);
        }
    }

    /**
     * Parses a JSON array of links. Unknown properties are ignored.
     *
     * @throws IllegalArgumentException if the JSON is malformed
     */
    public List<ContentLink> read(String json) {
        try {
            List<ContentLink> links = objectMapper.readValue(json, LINK_LIST);
            log.debug("links.read count={}", links.size());
            return links;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed content link JSON: " + e.getOriginalMessage(), e);
        }
    }

    public List<ContentLink> read(InputStream in) {
        try {
            return objectMapper.readValue(in, LINK_LIST);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read content links", e);
        }
    }
}
