package com.example.chatcollector.service;

import com.example.chatcollector.generation.GenerationResult;
import com.example.chatcollector.generation.TextGenerator;
import com.example.chatcollector.locale.CollectorMessages;
import com.example.chatcollector.model.CollectionConfig;
import com.example.chatcollector.model.CollectorField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Data summaries and "what will happen" previews shown before a session completes.
 * Generated variants fall back to the static ones when the generator fails.
 */
@Component
public class SummaryService {

    private static final Logger logger = LoggerFactory.getLogger(SummaryService.class);

    public static final String SUMMARY_SYSTEM_PROMPT = "You are a helpful assistant generating a summary of collected data. "
            + "Format your response in a clear, readable way using markdown. Be concise but comprehensive.";
    public static final String ACTION_SYSTEM_PROMPT = "You are a helpful assistant generating a preview of what will be created "
            + "from user input. Format your response in a clear, readable way using markdown. Be specific and detailed.";

    private final TextGenerator textGenerator;
    private final CollectorMessages messages;
    private final CollectorPromptBuilder promptBuilder;

    public SummaryService(TextGenerator textGenerator, CollectorMessages messages, CollectorPromptBuilder promptBuilder) {
        this.textGenerator = textGenerator;
        this.messages = messages;
        this.promptBuilder = promptBuilder;
    }

    public String dataSummary(CollectionConfig config, Map<String, String> data, String locale) {
        if (hasText(config.getSummaryPrompt())) {
            String prompt = dataContext(data) + fillPlaceholders(config.getSummaryPrompt(), data);
            GenerationResult result = textGenerator.generate(SUMMARY_SYSTEM_PROMPT + promptBuilder.languageInstruction(locale), prompt);
            if (result.hasContent()) {
                return result.getContent().trim();
            }
            logger.warn("Summary generation failed for config {}: {}", config.getName(), result.getError());
        }
        return staticSummary(config, data, locale);
    }

    public String staticSummary(CollectionConfig config, Map<String, String> data, String locale) {
        StringBuilder s = new StringBuilder(messages.get(locale, "summary.title", CollectorPromptBuilder.title(config))).append("\n\n");
        for (CollectorField field : config.getFields()) {
            String value = data.get(field.getName());
            s.append("**").append(label(field.getName())).append("**");
            if (!field.mandatory()) {
                s.append(messages.get(locale, "summary.optional"));
            }
            s.append(": ").append(hasText(value) ? value : messages.get(locale, "summary.not_provided")).append("\n");
        }
        return s.toString();
    }

    public String actionSummary(CollectionConfig config, Map<String, String> data, List<String> modifications, String locale) {
        if (hasText(config.getActionSummaryPrompt())) {
            String prompt = dataContext(data) + fillPlaceholders(config.getActionSummaryPrompt(), data) + modificationContext(modifications);
            GenerationResult result = textGenerator.generate(ACTION_SYSTEM_PROMPT + promptBuilder.languageInstruction(locale), prompt);
            if (result.hasContent()) {
                return result.getContent().trim();
            }
            logger.warn("Action preview generation failed for config {}: {}", config.getName(), result.getError());
        }
        return staticActionSummary(config, data, locale);
    }

    public String staticActionSummary(CollectionConfig config, Map<String, String> data, String locale) {
        if (hasText(config.getActionSummary())) {
            return fillPlaceholders(config.getActionSummary(), data);
        }
        return messages.get(locale, "action.default", CollectorPromptBuilder.title(config));
    }

    /**
     * Bullet list of the values currently held, labelled by field description.
     */
    public String reviewList(CollectionConfig config, Map<String, String> data, String locale) {
        StringBuilder s = new StringBuilder();
        for (CollectorField field : config.getFields()) {
            String value = data.get(field.getName());
            if (hasText(value)) {
                s.append("• **").append(field.label()).append("**: ").append(value).append("\n");
            }
        }
        return s.length() == 0 ? messages.get(locale, "extract.no_data") : s.toString();
    }

    static String modificationContext(List<String> modifications) {
        if (modifications == null || modifications.isEmpty()) {
            return "";
        }
        StringBuilder s = new StringBuilder("\n\nUSER REQUESTED MODIFICATIONS:\n");
        modifications.forEach(m -> s.append("- ").append(m).append("\n"));
        return s.toString();
    }

    static String dataContext(Map<String, String> data) {
        StringBuilder s = new StringBuilder("Based on the following collected information:\n\n");
        data.forEach((k, v) -> s.append("- **").append(label(k)).append("**: ").append(v).append("\n"));
        return s.append("\n---\n\n").toString();
    }

    static String fillPlaceholders(String template, Map<String, String> data) {
        String out = template;
        for (Map.Entry<String, String> e : data.entrySet()) {
            if (e.getValue() != null) {
                out = out.replace("{" + e.getKey() + "}", e.getValue());
            }
        }
        return out;
    }

    static String label(String fieldName) {
        StringBuilder out = new StringBuilder();
        for (String word : fieldName.split("_")) {
            if (word.isEmpty()) {
                continue;
            }
            if (out.length() > 0) {
                out.append(' ');
            }
            out.append(word.substring(0, 1).toUpperCase(Locale.ROOT)).append(word.substring(1));
        }
        return out.toString();
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
