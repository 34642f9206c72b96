package com.content.reconciliation.aggregate;

import java.util.Objects;

/**
 * Canonical key a raw record resolves to.
 *
 * @param type  which identifier won the precedence
 * @param value the identifier or normalized title
 */
public record RecordKey(KeyType type, String value) {

    public enum KeyType {
        VIDEO("video"),
        PRODUCT("product"),
        TITLE("title");

        private final String prefix;

        KeyType(String prefix) {
            this.prefix = prefix;
        }

        public String getPrefix() {
            return prefix;
        }
    }

    public RecordKey {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(value, "value is required");
        if (value.isEmpty()) {
            throw new IllegalArgumentException("Key value must not be empty");
        }
    }

    /**
     * Entity id derived from this key, e.g. {@code video:abc123}.
     */
    public String entityId() {
        return type.getPrefix() + ":" + value;
    }
}
