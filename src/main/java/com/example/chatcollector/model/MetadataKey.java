package com.example.chatcollector.model;

import java.util.Arrays;

/**
 * Closed set of keys allowed in {@link SessionState#getMetadata()}.
 */
public enum MetadataKey {
    PENDING_FIELD_UPDATE("pending_field_update"),
    OUTPUT_MODIFICATIONS("output_modifications"),
    SKIPPED_FIELDS("skipped_fields");

    private final String key;

    MetadataKey(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static boolean isKnown(String key) {
        return Arrays.stream(values()).anyMatch(k -> k.key.equals(key));
    }
}
