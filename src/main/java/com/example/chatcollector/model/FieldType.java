package com.example.chatcollector.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FieldType {
    TEXT("text"),
    NUMBER("number"),
    SELECT("select");

    private final String value;

    FieldType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Accepts the loose type names used in field definitions ("string", "textarea", "integer", "enum"...).
     */
    @JsonCreator
    public static FieldType from(String raw) {
        if (raw == null || raw.isBlank()) {
            return TEXT;
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "number":
            case "numeric":
            case "integer":
            case "int":
            case "float":
                return NUMBER;
            case "select":
            case "enum":
            case "choice":
                return SELECT;
            default:
                return TEXT;
        }
    }
}
