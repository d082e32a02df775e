package com.example.chatcollector.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CollectionStatus {
    COLLECTING,
    CONFIRMING,
    ENHANCING,
    COMPLETED,
    CANCELLED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CollectionStatus from(String raw) {
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
