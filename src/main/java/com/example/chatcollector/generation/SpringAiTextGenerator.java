package com.example.chatcollector.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * {@link TextGenerator} backed by the configured Spring AI chat model. Prompts are passed as
 * plain messages so braces in collected values are never treated as template variables.
 */
@Component
public class SpringAiTextGenerator implements TextGenerator {

    private static final Logger logger = LoggerFactory.getLogger(SpringAiTextGenerator.class);

    private final ChatModel chatModel;

    public SpringAiTextGenerator(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    public GenerationResult generate(String systemPrompt, String userPrompt) {
        try {
            Prompt prompt = new Prompt(List.of(new SystemMessage(systemPrompt), new UserMessage(userPrompt)));
            ChatResponse response = chatModel.call(prompt);
            String text = response == null || response.getResult() == null
                    ? null
                    : response.getResult().getOutput().getText();
            if (text == null || text.isBlank()) {
                logger.warn("Text generation returned no content");
                return GenerationResult.failure("empty response");
            }
            return GenerationResult.success(text);
        } catch (RuntimeException e) {
            logger.warn("Text generation failed: {}", e.getMessage());
            return GenerationResult.failure(e.getMessage());
        }
    }
}
