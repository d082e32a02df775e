package com.example.chatcollector.generation;

import com.example.chatcollector.model.CollectionConfig;
import com.example.chatcollector.model.MetadataKey;
import com.example.chatcollector.model.SessionState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Expands the flat collected values into the nested structure described by a config's
 * {@code outputSchema}. Returns {@code null} rather than failing when the generator's answer
 * is not usable JSON.
 */
@Component
public class StructuredOutputGenerator {

    private static final Logger logger = LoggerFactory.getLogger(StructuredOutputGenerator.class);

    private static final Pattern LEADING_FENCE = Pattern.compile("^```(?:json)?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_FENCE = Pattern.compile("\\s*```$");

    private final TextGenerator textGenerator;
    private final ObjectMapper objectMapper;

    public StructuredOutputGenerator(TextGenerator textGenerator, ObjectMapper objectMapper) {
        this.textGenerator = textGenerator;
        this.objectMapper = objectMapper;
    }

    public JsonNode generate(CollectionConfig config, SessionState state) {
        if (config.getOutputSchema() == null || config.getOutputSchema().isEmpty()) {
            return null;
        }
        Map<String, String> data = state.getCollectedData();

        StringBuilder system = new StringBuilder("You are a data generation assistant. Generate structured JSON output based on user input.\n\n");
        system.append("OUTPUT SCHEMA:\n").append(fill(describeSchema(config.getOutputSchema(), 0), data)).append("\n");
        system.append("RULES:\n");
        system.append("1. Return ONLY valid JSON, no markdown code blocks, no explanations\n");
        system.append("2. Follow the schema structure exactly\n");
        system.append("3. For arrays, generate the number of items specified or a reasonable default\n");

        StringBuilder user = new StringBuilder("Based on the following collected information:\n\n");
        data.forEach((k, v) -> user.append("- **").append(k).append("**: ").append(v).append("\n"));
        String prompt = config.getOutputPrompt() == null || config.getOutputPrompt().isBlank()
                ? "Generate the structured output based on the collected data."
                : config.getOutputPrompt();
        user.append("\n---\n\n").append(fill(prompt, data));

        if (state.getConfirmedActionSummary() != null && !state.getConfirmedActionSummary().isBlank()) {
            user.append("\n\nCONFIRMED STRUCTURE (USE THIS AS THE SOURCE):\n").append(state.getConfirmedActionSummary());
            user.append("\n\nIMPORTANT: Convert the confirmed structure above into JSON. Do NOT generate new content; ")
                    .append("use exactly the items, descriptions and details shown.\n");
        } else {
            List<String> modifications = state.metadataList(MetadataKey.OUTPUT_MODIFICATIONS);
            if (!modifications.isEmpty()) {
                user.append("\n\nIMPORTANT - USER REQUESTED MODIFICATIONS:\n");
                modifications.forEach(m -> user.append("- ").append(m).append("\n"));
                user.append("\nApply ALL of these modifications to the generated output.\n");
            }
        }

        GenerationResult result = textGenerator.generate(system.toString(), user.toString());
        if (!result.hasContent()) {
            logger.warn("Structured output generation failed for config {}: {}", config.getName(), result.getError());
            return null;
        }
        String content = stripFences(result.getContent());
        try {
            JsonNode node = objectMapper.readTree(content);
            if (node == null || !(node.isObject() || node.isArray())) {
                logger.warn("Structured output for config {} is not a JSON object or array", config.getName());
                return null;
            }
            return node;
        } catch (JsonProcessingException e) {
            logger.warn("Failed to parse structured output for config {}: {} (content: {})", config.getName(),
                    e.getOriginalMessage(), content.length() > 500 ? content.substring(0, 500) : content);
            return null;
        }
    }

    /**
     * Renders a schema map as indented text, e.g. {@code lessons: array of objects (generate 5 items)}.
     */
    public String describeSchema(Map<?, ?> schema, int indent) {
        StringBuilder out = new StringBuilder();
        String prefix = "  ".repeat(indent);
        for (Map.Entry<?, ?> entry : schema.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            if (!(value instanceof Map)) {
                out.append(prefix).append(key).append(": ").append(value).append("\n");
                continue;
            }
            Map<?, ?> spec = (Map<?, ?>) value;
            Object type = spec.get("type");
            if (type == null) {
                out.append(prefix).append(key).append(": object\n");
                out.append(describeSchema(spec, indent + 1));
                continue;
            }
            Object description = spec.get("description");
            if ("array".equals(type) && spec.get("items") instanceof Map) {
                Object count = spec.get("count");
                out.append(prefix).append(key).append(": array of objects");
                if (count != null) {
                    out.append(" (generate ").append(count).append(" items)");
                }
                out.append("\n");
                if (description != null) {
                    out.append(prefix).append("  // ").append(description).append("\n");
                }
                out.append(prefix).append("  Each item has:\n");
                out.append(describeSchema((Map<?, ?>) spec.get("items"), indent + 2));
            } else {
                out.append(prefix).append(key).append(": ").append(type);
                if (description != null) {
                    out.append(" // ").append(description);
                }
                out.append("\n");
            }
        }
        return out.toString();
    }

    static String stripFences(String content) {
        String trimmed = content.trim();
        trimmed = LEADING_FENCE.matcher(trimmed).replaceFirst("");
        trimmed = TRAILING_FENCE.matcher(trimmed).replaceFirst("");
        return trimmed.trim();
    }

    /**
     * Replaces {@code {field}} placeholders with collected values.
     */
    private static String fill(String template, Map<String, String> data) {
        String out = template;
        for (Map.Entry<String, String> e : data.entrySet()) {
            if (e.getValue() != null) {
                out = out.replace("{" + e.getKey() + "}", e.getValue());
            }
        }
        return out;
    }
}
