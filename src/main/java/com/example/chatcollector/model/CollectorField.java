package com.example.chatcollector.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * One named, typed and validated slot of a {@link CollectionConfig}.
 *
 * <p>Validation rules are a pipe separated string such as {@code required|numeric|min:1}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class CollectorField {

    String name;
    @Builder.Default
    FieldType type = FieldType.TEXT;
    @Builder.Default
    String description = "";
    @Builder.Default
    String validation = "";
    @Builder.Default
    boolean required = true;
    @Builder.Default
    List<String> options = List.of();
    @Builder.Default
    List<String> examples = List.of();
    String prompt;

    /**
     * Parses the compact form {@code "Course duration in hours | required | numeric | min:1"}.
     * The first segment is the description unless it looks like a rule.
     */
    public static CollectorField parse(String name, String definition) {
        String[] parts = definition.split("\\|");
        String description = "";
        FieldType type = FieldType.TEXT;
        boolean required = true;
        List<String> examples = List.of();
        List<String> options = List.of();
        List<String> rules = new ArrayList<>();

        for (int i = 0; i < parts.length; i++) {
            String part = parts[i].trim();
            if (part.isEmpty()) {
                continue;
            }
            if (i == 0 && !part.contains(":") && !isBareRule(part)) {
                description = part;
                continue;
            }
            int colon = part.indexOf(':');
            String key = colon > 0 ? part.substring(0, colon).trim().toLowerCase(Locale.ROOT) : part.toLowerCase(Locale.ROOT);
            String value = colon > 0 ? part.substring(colon + 1).trim() : "";
            switch (key) {
                case "type":
                    type = FieldType.from(value);
                    break;
                case "required":
                    required = value.isEmpty() || Boolean.parseBoolean(value);
                    if (required) {
                        rules.add("required");
                    }
                    break;
                case "optional":
                    required = false;
                    break;
                case "examples":
                    examples = splitList(value);
                    break;
                case "options":
                    options = splitList(value);
                    type = FieldType.SELECT;
                    break;
                case "validation":
                    rules.addAll(splitRules(value));
                    break;
                default:
                    rules.add(part);
            }
        }
        if (type == FieldType.TEXT && rules.contains("numeric")) {
            type = FieldType.NUMBER;
        }
        return CollectorField.builder()
                .name(name)
                .type(type)
                .description(description)
                .validation(String.join("|", rules))
                .required(required)
                .examples(examples)
                .options(options)
                .build();
    }

    private static boolean isBareRule(String part) {
        String lower = part.toLowerCase(Locale.ROOT);
        return lower.equals("required") || lower.equals("optional") || lower.equals("numeric")
                || lower.equals("integer") || lower.equals("email") || lower.equals("url");
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static List<String> splitRules(String validation) {
        if (validation == null || validation.isBlank()) {
            return List.of();
        }
        return Arrays.stream(validation.split("\\|"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    public List<String> rules() {
        return splitRules(validation);
    }

    /**
     * A field is mandatory when flagged as required or when its rules say so.
     */
    public boolean mandatory() {
        return required || rules().contains("required");
    }

    public boolean expectsNumber() {
        List<String> rules = rules();
        return type == FieldType.NUMBER || rules.contains("numeric") || rules.contains("integer");
    }

    public String label() {
        return description == null || description.isBlank() ? name : description;
    }
}
