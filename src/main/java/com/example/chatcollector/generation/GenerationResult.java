package com.example.chatcollector.generation;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of one text generation call. Failures are values, never exceptions.
 */
@Getter
@AllArgsConstructor
public class GenerationResult {
    private final boolean success;
    private final String content;
    private final String error;

    public static GenerationResult success(String content) {
        return new GenerationResult(true, content, null);
    }

    public static GenerationResult failure(String error) {
        return new GenerationResult(false, "", error);
    }

    public boolean hasContent() {
        return success && content != null && !content.isBlank();
    }
}
