package com.example.chatcollector.extraction;

/**
 * Where a candidate field value came from.
 */
public enum ExtractionSource {
    MARKER,
    LABELLED_SUMMARY,
    INTENT,
    DIRECT,
    SUGGESTION,
    PENDING_UPDATE,
    CONTENT
}
