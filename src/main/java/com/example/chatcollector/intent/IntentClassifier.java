package com.example.chatcollector.intent;

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

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Works out what the user is trying to do on a turn. Field-level classification is delegated
 * to the text generator; rejection, completion and confirmation checks are deterministic.
 */
@Component
public class IntentClassifier {

    private static final Logger logger = LoggerFactory.getLogger(IntentClassifier.class);

    public static final String INTENT_SYSTEM_PROMPT =
            "You analyze one message of a conversational form and classify the user's intent. "
                    + "Respond with ONLY valid JSON.";
    public static final String TARGET_FIELD_SYSTEM_PROMPT =
            "You identify which field of a form the user wants to change. "
                    + "Answer with the exact field name only, or NONE if no field is meant.";

    private static final Pattern JSON_OBJECT = Pattern.compile("(\\{.*\\})", Pattern.DOTALL);

    private static final List<Pattern> REJECTION_PATTERNS = List.of(
            Pattern.compile("\\b(i|we)(\\s+(want|would like|need|wish)|'d like)\\s+to\\s+(change|modify|edit|update|correct|fix|replace)\\b"),
            Pattern.compile("\\b(can|could|may)\\s+(i|we|you)\\s+(change|modify|edit|update|correct|fix|replace)\\b"),
            Pattern.compile("^(please\\s+)?(change|modify|edit|update|correct|fix|replace)\\s+(the|my|that|this|it)\\b"),
            Pattern.compile("\\b(let\\s+me|let's)\\s+(change|modify|edit|update|correct|fix)\\b"),
            Pattern.compile("\\bthat('s|\\s+is)\\s+(wrong|incorrect|not right)\\b"));
    private static final List<String> REJECTION_TERMS_AR = List.of("أريد تغيير", "أريد تعديل", "اريد تغيير", "اريد تعديل", "أود تغيير", "أود تعديل");

    private static final Pattern COMPLETION = Pattern.compile(
            "\\b(done|finish|finished|that's all|that is all|nothing else|no more changes|all good|i'm good)\\b");
    private static final List<String> COMPLETION_TERMS_AR = List.of("تم", "انتهيت", "خلاص", "هذا كل شيء");

    private static final Set<String> CONFIRM_WORDS = Set.of("yes", "y", "yep", "yeah", "confirm", "correct", "ok", "okay",
            "looks good", "perfect", "submit", "proceed",
            "نعم", "تأكيد", "تاكيد", "صحيح", "موافق", "اكيد", "أكيد");
    private static final Set<String> REJECT_WORDS = Set.of("no", "n", "nope", "change", "modify", "edit", "wrong", "incorrect",
            "لا", "تغيير", "تعديل", "خطأ", "غلط");

    private final TextGenerator textGenerator;
    private final ObjectMapper objectMapper;

    public IntentClassifier(TextGenerator textGenerator, ObjectMapper objectMapper) {
        this.textGenerator = textGenerator;
        this.objectMapper = objectMapper;
    }

    public IntentAnalysis classify(String message, String currentField, CollectorField field, Map<String, String> collectedData) {
        if (field == null) {
            return new IntentAnalysis(FieldIntent.UNCLEAR, 0.0, null, "no field is being collected");
        }
        GenerationResult result = textGenerator.generate(INTENT_SYSTEM_PROMPT, buildIntentPrompt(message, currentField, field, collectedData));
        if (!result.hasContent()) {
            logger.warn("Field intent analysis failed: {}", result.getError());
            return IntentAnalysis.fallback(message, "analysis failed, using raw message");
        }
        IntentAnalysis parsed = parse(result.getContent());
        if (parsed == null) {
            logger.warn("Unparsable intent analysis: {}", abbreviate(result.getContent(), 200));
            return IntentAnalysis.fallback(message, "unparsable analysis, using raw message");
        }
        logger.info("Intent for field {}: {} ({})", currentField, parsed.getIntent().value(), parsed.getConfidence());
        return parsed;
    }

    IntentAnalysis parse(String content) {
        Matcher m = JSON_OBJECT.matcher(content);
        String json = m.find() ? m.group(1) : content;
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.hasNonNull("intent")) {
                return null;
            }
            JsonNode value = node.get("extracted_value");
            String extracted = value == null || value.isNull() ? null : value.asText();
            if (extracted != null && (extracted.isBlank() || extracted.equalsIgnoreCase("null"))) {
                extracted = null;
            }
            return new IntentAnalysis(
                    FieldIntent.from(node.get("intent").asText()),
                    node.path("confidence").asDouble(0.0),
                    extracted,
                    node.path("reasoning").asText(""));
        } catch (JsonProcessingException e) {
            logger.debug("Intent JSON did not parse: {}", e.getOriginalMessage());
            return null;
        }
    }

    /**
     * True when the message asks to change something, rather than being a value itself.
     */
    public boolean detectRejectionIntent(String message) {
        if (message == null || message.isBlank()) {
            return false;
        }
        String lower = message.trim().toLowerCase(Locale.ROOT).replace('’', '\'');
        for (Pattern p : REJECTION_PATTERNS) {
            if (p.matcher(lower).find()) {
                return true;
            }
        }
        return REJECTION_TERMS_AR.stream().anyMatch(lower::contains);
    }

    public boolean detectCompletionIntent(String message) {
        if (message == null || message.isBlank()) {
            return false;
        }
        String lower = message.trim().toLowerCase(Locale.ROOT).replace('’', '\'');
        if (COMPLETION.matcher(lower).find()) {
            return true;
        }
        return COMPLETION_TERMS_AR.stream().anyMatch(lower::equals);
    }

    public ConfirmationReply classifyConfirmation(String message) {
        String normalized = message == null ? "" : message.trim().toLowerCase(Locale.ROOT).replaceAll("[.!،]+$", "");
        if (CONFIRM_WORDS.contains(normalized)) {
            return ConfirmationReply.CONFIRM;
        }
        if (REJECT_WORDS.contains(normalized) || detectRejectionIntent(message)) {
            return ConfirmationReply.REJECT;
        }
        return ConfirmationReply.OTHER;
    }

    /**
     * Finds the field a modification request refers to. Asks the generator first, then falls
     * back to matching field names and descriptions in the message.
     */
    public String identifyTargetField(String message, CollectionConfig config, Map<String, String> collectedData) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Fields:\n");
        for (CollectorField f : config.getFields()) {
            String current = collectedData.get(f.getName());
            prompt.append("- ").append(f.getName()).append(": ").append(f.label());
            if (current != null && !current.isBlank()) {
                prompt.append(" (current value: ").append(current).append(")");
            }
            prompt.append("\n");
        }
        prompt.append("\nUser message: \"").append(message).append("\"\n");
        prompt.append("\nWhich field does the user want to change?");

        GenerationResult result = textGenerator.generate(TARGET_FIELD_SYSTEM_PROMPT, prompt.toString());
        if (result.hasContent()) {
            String answer = result.getContent().trim().replaceAll("^[\"'`]+|[\"'`.]+$", "");
            for (String name : config.fieldNames()) {
                if (name.equalsIgnoreCase(answer)) {
                    return name;
                }
            }
            logger.debug("Target field answer '{}' matched no field", abbreviate(answer, 80));
        }
        return matchFieldByText(message, config);
    }

    private String matchFieldByText(String message, CollectionConfig config) {
        String lower = message.toLowerCase(Locale.ROOT);
        for (CollectorField f : config.getFields()) {
            String name = f.getName().toLowerCase(Locale.ROOT);
            if (lower.contains(name) || lower.contains(name.replace('_', ' '))) {
                return f.getName();
            }
        }
        for (CollectorField f : config.getFields()) {
            String description = f.getDescription();
            if (description != null && !description.isBlank() && lower.contains(description.toLowerCase(Locale.ROOT))) {
                return f.getName();
            }
        }
        return null;
    }

    private String buildIntentPrompt(String message, String currentField, CollectorField field, Map<String, String> collectedData) {
        StringBuilder p = new StringBuilder();
        p.append("Analyze the user's message to extract a value for a specific field.\n\n");
        p.append("User Message: \"").append(message).append("\"\n\n");
        p.append("FIELD TO EXTRACT:\n");
        p.append("- Field Name: ").append(currentField).append("\n");
        p.append("- Description: ").append(field.getDescription()).append("\n");
        p.append("- Type: ").append(field.getType().value()).append("\n");
        p.append("- Required: ").append(field.mandatory() ? "YES" : "NO").append("\n");
        if (!field.getOptions().isEmpty()) {
            p.append("- Valid Options: ").append(String.join(", ", field.getOptions())).append("\n");
        }
        if (!field.getExamples().isEmpty()) {
            p.append("- Examples: ").append(String.join(", ", field.getExamples())).append("\n");
        }
        if (!field.getValidation().isBlank()) {
            p.append("- Validation: ").append(field.getValidation()).append("\n");
        }

        p.append("\nALREADY COLLECTED FIELDS (DO NOT extract these):\n");
        collectedData.forEach((name, value) -> {
            if (value != null && !value.isBlank()) {
                p.append("- ").append(name).append(": ").append(value).append("\n");
            }
        });

        p.append("\nDetermine the intent:\n");
        p.append("1. 'provide_value' - the user gives a value for '").append(currentField).append("'. Extract the exact value; ")
                .append("match select fields to the closest valid option; for numeric fields keep just the number.\n");
        p.append("2. 'question' - the user asks a question or needs clarification. Do NOT extract a value.\n");
        p.append("3. 'suggest' - the user wants suggestions or ideas. Do NOT extract a value.\n");
        p.append("4. 'skip' - the user wants to skip this field. Do NOT extract a value.\n");
        p.append("5. 'unclear' - the message is ambiguous. Do NOT extract a value.\n\n");
        p.append("RULES:\n");
        p.append("- ONLY extract a value for '").append(currentField).append("'\n");
        p.append("- NEVER extract values for other fields\n");
        p.append("- NEVER invent values; only use what the user said\n\n");

        p.append("EXAMPLES:\n");
        if (!field.getOptions().isEmpty()) {
            String first = field.getOptions().get(0);
            p.append("- User: '").append(first).append("' -> intent: 'provide_value', value: '").append(first).append("'\n");
            p.append("- User: 'what are the options?' -> intent: 'question', value: null\n");
        } else if (field.expectsNumber()) {
            p.append("- User: '10 hours' -> intent: 'provide_value', value: '10'\n");
            p.append("- User: 'not sure yet' -> intent: 'unclear', value: null\n");
        } else {
            p.append("- User: 'Learn Spring basics' -> intent: 'provide_value', value: 'Learn Spring basics'\n");
            p.append("- User: 'what should I write?' -> intent: 'question', value: null\n");
        }

        p.append("\nRespond with ONLY valid JSON in this exact format:\n");
        p.append("{\"intent\": \"provide_value|question|suggest|skip|unclear\", \"confidence\": 0.95, ")
                .append("\"extracted_value\": \"the value or null\", \"reasoning\": \"short explanation\"}\n");
        return p.toString();
    }

    private static String abbreviate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
