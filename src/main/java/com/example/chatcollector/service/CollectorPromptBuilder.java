package com.example.chatcollector.service;

import com.example.chatcollector.extraction.MarkerParser;
import com.example.chatcollector.locale.CollectorMessages;
import com.example.chatcollector.locale.LocaleDetector;
import com.example.chatcollector.model.CollectionConfig;
import com.example.chatcollector.model.CollectorField;
import com.example.chatcollector.model.SessionState;
import com.example.chatcollector.model.ValidationError;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the prompts sent to the text generator and the per-field questions shown to the user.
 */
@Component
public class CollectorPromptBuilder {

    public static final String SUGGESTION_SYSTEM_PROMPT =
            "You are a helpful assistant providing creative suggestions for data collection.";

    private static final String RULE = "=".repeat(60);

    private final CollectorMessages messages;
    private final LocaleDetector localeDetector;

    public CollectorPromptBuilder(CollectorMessages messages, LocaleDetector localeDetector) {
        this.messages = messages;
        this.localeDetector = localeDetector;
    }

    public String systemPrompt(CollectionConfig config, String locale) {
        if (config.getSystemPrompt() != null && !config.getSystemPrompt().isBlank()) {
            return config.getSystemPrompt() + languageInstruction(locale);
        }
        StringBuilder p = new StringBuilder();
        p.append("You are a helpful assistant collecting information from the user.\n\n");
        p.append("TASK: ").append(title(config)).append("\n");
        if (!config.getDescription().isBlank()) {
            p.append("DESCRIPTION: ").append(config.getDescription()).append("\n");
        }
        p.append("\nFIELDS TO COLLECT:\n");
        for (CollectorField f : config.getFields()) {
            p.append("- ").append(f.getName()).append(f.mandatory() ? " (required)" : " (optional)")
                    .append(": ").append(f.getDescription());
            if (!f.getExamples().isEmpty()) {
                p.append(" (e.g., ").append(String.join(", ", f.getExamples())).append(")");
            }
            p.append("\n");
        }
        p.append("\nINSTRUCTIONS:\n");
        p.append("1. Ask for ONE field at a time in a conversational manner\n");
        p.append("2. Validate user input and ask for corrections if needed\n");
        p.append("3. Be helpful and provide examples when the user seems unsure\n");
        if (config.isAllowSkipOptional()) {
            p.append("4. Allow skipping optional fields if the user wants to\n");
        }
        p.append("\nRESPONSE FORMAT:\n");
        p.append("When you take a field value from the user's message, add a marker at the END of your reply:\n");
        p.append("FIELD_COLLECTED:field_name=value\n");
        p.append("If the user wants to cancel, respond with ").append(MarkerParser.CANCEL_SIGNAL).append("\n");
        p.append(languageInstruction(locale));
        return p.toString();
    }

    /**
     * State summary sent with every collecting turn instead of the full message history.
     */
    public String contextPrompt(SessionState state, CollectionConfig config) {
        StringBuilder p = new StringBuilder("CURRENT COLLECTION STATUS:\n");
        Map<String, String> data = state.getCollectedData();

        List<String> collected = config.fieldNames().stream()
                .filter(state::hasValue)
                .collect(Collectors.toList());
        if (!collected.isEmpty()) {
            p.append("Already collected (DO NOT ask for these again):\n");
            collected.forEach(n -> p.append("  - ").append(n).append(": ").append(data.get(n)).append("\n"));
        }

        String current = state.getCurrentField();
        config.field(current).ifPresent(field -> {
            p.append("\n").append(RULE).append("\n");
            p.append("FOCUS: you are ONLY collecting this ONE field right now:\n");
            p.append("   Field name: ").append(current).append("\n");
            p.append("   Description: ").append(field.getDescription()).append("\n");
            p.append("   Required: ").append(field.mandatory() ? "YES" : "NO").append("\n");
            if (!field.getExamples().isEmpty()) {
                p.append("   Examples: ").append(String.join(", ", field.getExamples())).append("\n");
            }
            if (!field.getOptions().isEmpty()) {
                p.append("   Options: ").append(String.join(", ", field.getOptions())).append("\n");
            }
            if (!field.getValidation().isBlank()) {
                p.append("   Validation: ").append(field.getValidation()).append("\n");
            }
            p.append("\nRULES:\n");
            p.append("   1. ONLY ask for and acknowledge '").append(current).append("' (").append(field.label()).append(")\n");
            p.append("   2. NEVER mention other field names or descriptions in your response\n");
            p.append("   3. When acknowledging, say: 'I've recorded ").append(field.label()).append(": [value]'\n");
            p.append("   4. If the user gives information for other fields, ignore it for now\n");
            p.append(RULE).append("\n");
            p.append("\nWhen you extract the '").append(current).append("' value, you MUST add:\n");
            p.append("FIELD_COLLECTED:").append(current).append("=value\n");
        });

        List<String> later = config.uncollected(data).stream()
                .filter(n -> !n.equals(current))
                .collect(Collectors.toList());
        if (!later.isEmpty()) {
            p.append("\nStill to collect later (not now):\n");
            for (String n : later) {
                boolean required = config.field(n).map(CollectorField::mandatory).orElse(false);
                p.append("  - ").append(n).append(required ? " (required)" : " (optional)").append("\n");
            }
        }

        if (!state.getValidationErrors().isEmpty()) {
            p.append("\nValidation errors to address:\n");
            state.getValidationErrors().forEach((field, errors) -> p.append("  - ").append(field).append(": ")
                    .append(errors.stream().map(ValidationError::getMessage).collect(Collectors.joining(", ")))
                    .append("\n"));
        }
        return p.toString();
    }

    public String enhancementSystemPrompt(CollectionConfig config, String dataSummary, String locale) {
        StringBuilder p = new StringBuilder();
        p.append("You are helping the user modify their previously collected data.\n\n");
        p.append("Current data:\n").append(dataSummary).append("\n\n");
        p.append("Available fields: ").append(String.join(", ", config.fieldNames())).append("\n\n");
        p.append("INSTRUCTIONS:\n");
        p.append("1. For every field the user changes, add FIELD_COLLECTED:field_name=new value at the END of your reply\n");
        p.append("2. Only use the field names listed above\n");
        p.append("3. If the user is done with changes, ask them to confirm with 'yes'\n");
        p.append(languageInstruction(locale));
        return p.toString();
    }

    public String suggestionPrompt(CollectorField field, Map<String, String> data, String locale) {
        StringBuilder p = new StringBuilder("Generate helpful suggestions for the following field:\n\n");
        p.append("**Field**: ").append(field.getName()).append("\n");
        p.append("**Description**: ").append(field.getDescription()).append("\n");
        if (!field.getOptions().isEmpty()) {
            p.append("**Valid Options**: ").append(String.join(", ", field.getOptions())).append("\n");
        }
        if (!field.getExamples().isEmpty()) {
            p.append("**Examples**: ").append(String.join(", ", field.getExamples())).append("\n");
        }
        if (!field.getValidation().isBlank()) {
            p.append("**Requirements**: ").append(field.getValidation()).append("\n");
        }
        if (data.values().stream().anyMatch(v -> v != null && !v.isBlank())) {
            p.append("\n**Context from collected information**:\n");
            data.forEach((k, v) -> {
                if (v != null && !v.isBlank()) {
                    p.append("- ").append(k).append(": ").append(v).append("\n");
                }
            });
        }
        p.append("\n**Task**: Generate 3-5 relevant suggestions for the '").append(field.label()).append("' field.");
        p.append("\nFormat each suggestion on a new line with a number (1., 2., 3., etc.).");
        p.append(languageInstruction(locale));
        return p.toString();
    }

    /**
     * The question asked for a field, with examples, options and validation hints.
     */
    public String fieldPrompt(CollectorField field, String locale) {
        if (field.getPrompt() != null && !field.getPrompt().isBlank()) {
            return field.getPrompt();
        }
        StringBuilder p = new StringBuilder();
        if (field.getDescription().isBlank()) {
            p.append(messages.get(locale, "field.prompt", field.getName()));
        } else {
            p.append(messages.get(locale, "field.prompt_described", field.getName(), field.getDescription()));
        }
        if (!field.getExamples().isEmpty()) {
            p.append("\n\n").append(messages.get(locale, "field.examples", String.join(", ", field.getExamples())));
        }
        if (!field.getOptions().isEmpty()) {
            p.append("\n\n").append(messages.get(locale, "field.options", String.join(", ", field.getOptions())));
        }
        String hints = validationHints(field, locale);
        if (!hints.isEmpty()) {
            p.append("\n\n").append(messages.get(locale, "field.requirements", hints));
        }
        return p.toString();
    }

    public String validationHints(CollectorField field, String locale) {
        List<String> hints = new ArrayList<>();
        boolean numeric = field.expectsNumber();
        for (String rule : field.rules()) {
            int colon = rule.indexOf(':');
            String key = colon > 0 ? rule.substring(0, colon) : rule;
            String arg = colon > 0 ? rule.substring(colon + 1) : "";
            switch (key) {
                case "min":
                    hints.add(messages.get(locale, numeric ? "hint.min_number" : "hint.min", arg));
                    break;
                case "max":
                    hints.add(messages.get(locale, numeric ? "hint.max_number" : "hint.max", arg));
                    break;
                case "between": {
                    String[] bounds = arg.split(",");
                    hints.add(messages.get(locale, "hint.between", bounds[0].trim(), bounds.length > 1 ? bounds[1].trim() : ""));
                    break;
                }
                case "in":
                    hints.add(messages.get(locale, "hint.in", arg));
                    break;
                case "email":
                case "url":
                case "numeric":
                case "integer":
                    hints.add(messages.get(locale, "hint." + key));
                    break;
                default:
                    break;
            }
        }
        return String.join(", ", hints);
    }

    public String languageInstruction(String locale) {
        if (locale == null || locale.equals(localeDetector.defaultLocale())) {
            return "";
        }
        String name = LocaleDetector.displayName(locale);
        return "\nLANGUAGE:\nYou MUST respond in " + name + ". "
                + "FIELD_COLLECTED markers keep the field names in English, but values can be in " + name + ".\n";
    }

    static String title(CollectionConfig config) {
        return config.getTitle() == null || config.getTitle().isBlank() ? config.getName() : config.getTitle();
    }
}
