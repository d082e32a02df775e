package com.example.chatcollector.extraction;

import com.example.chatcollector.generation.GenerationResult;
import com.example.chatcollector.generation.TextGenerator;
import com.example.chatcollector.model.CollectionConfig;
import com.example.chatcollector.model.CollectorField;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls field values out of a pasted document in one generation call.
 */
@Component
public class ContentExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ContentExtractor.class);

    public static final String EXTRACTION_SYSTEM_PROMPT = "You are a data extraction assistant. Extract structured data "
            + "from the provided content and return it as valid JSON only. Do not include any text outside the JSON object.";

    private static final Pattern FENCED = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)\\s*```");

    private final TextGenerator textGenerator;
    private final ObjectMapper objectMapper;

    public ContentExtractor(TextGenerator textGenerator, ObjectMapper objectMapper) {
        this.textGenerator = textGenerator;
        this.objectMapper = objectMapper;
    }

    /**
     * Values found in {@code content}, keyed by field name. Only fields of the config with a
     * non-blank scalar value are returned; an unusable answer yields an empty map.
     */
    public Map<String, String> extract(CollectionConfig config, String content) {
        Map<String, String> out = new LinkedHashMap<>();
        if (content == null || content.isBlank()) {
            return out;
        }
        GenerationResult result = textGenerator.generate(EXTRACTION_SYSTEM_PROMPT, buildPrompt(config, content));
        if (!result.hasContent()) {
            logger.warn("Content extraction failed for config {}: {}", config.getName(), result.getError());
            return out;
        }
        String json = result.getContent().trim();
        Matcher fenced = FENCED.matcher(json);
        if (fenced.find()) {
            json = fenced.group(1).trim();
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            logger.warn("Failed to parse extracted content for config {}: {}", config.getName(), e.getOriginalMessage());
            return out;
        }
        if (node == null || !node.isObject()) {
            return out;
        }
        for (CollectorField field : config.getFields()) {
            JsonNode value = node.get(field.getName());
            if (value != null && value.isValueNode() && !value.isNull() && !value.asText().isBlank()) {
                out.put(field.getName(), value.asText().trim());
            }
        }
        logger.info("Extracted {} of {} fields from content for config {}", out.size(), config.getFields().size(), config.getName());
        return out;
    }

    private String buildPrompt(CollectionConfig config, String content) {
        Map<String, String> descriptions = new LinkedHashMap<>();
        for (CollectorField field : config.getFields()) {
            List<String> hints = new ArrayList<>();
            List<String> rules = field.rules();
            if (rules.contains("numeric")) {
                hints.add("must be a number only (no text)");
            }
            if (rules.contains("integer")) {
                hints.add("must be an integer");
            }
            for (String rule : rules) {
                if (rule.startsWith("min:")) {
                    hints.add("minimum: " + rule.substring(4));
                } else if (rule.startsWith("max:")) {
                    hints.add("maximum: " + rule.substring(4));
                }
            }
            if (!field.getOptions().isEmpty()) {
                hints.add("must be one of: " + String.join(", ", field.getOptions()));
            }
            descriptions.put(field.getName(), field.label() + (hints.isEmpty() ? "" : " (" + String.join(", ", hints) + ")"));
        }
        String fields;
        try {
            fields = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(descriptions);
        } catch (JsonProcessingException e) {
            fields = descriptions.toString();
        }
        return "Analyze the following content and extract the required information.\n\n"
                + "Content:\n" + content + "\n\n"
                + "Required fields:\n" + fields + "\n\n"
                + "Return the extracted data in JSON format only. If you cannot find a value for a field, leave it empty.\n"
                + "Example format:\n{\"field_name\": \"extracted_value\", \"another_field\": \"another_value\"}";
    }
}
