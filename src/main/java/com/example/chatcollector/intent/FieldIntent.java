package com.example.chatcollector.intent;

import java.util.Locale;

public enum FieldIntent {
    PROVIDE_VALUE,
    QUESTION,
    SUGGEST,
    SKIP,
    UNCLEAR;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static FieldIntent from(String raw) {
        if (raw == null) {
            return UNCLEAR;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (FieldIntent intent : values()) {
            if (intent.name().equals(normalized)) {
                return intent;
            }
        }
        return UNCLEAR;
    }
}
