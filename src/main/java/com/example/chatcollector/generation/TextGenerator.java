package com.example.chatcollector.generation;

/**
 * Prompt in, text out. Implementations must not throw; errors come back as
 * {@link GenerationResult#failure(String)}.
 */
public interface TextGenerator {
    GenerationResult generate(String systemPrompt, String userPrompt);
}
