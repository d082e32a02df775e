package com.example.chatcollector.model;

import com.example.chatcollector.service.CompletionCallback;
import com.example.chatcollector.service.InvalidCollectionConfigException;
import com.example.chatcollector.validation.FieldValidator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable schema of one conversational collection, identified by {@link #getName()}.
 *
 * <p>Field order defines the default collection order. The completion callback is an
 * in-process object and is never serialized; a config restored from a store falls back to
 * the callback bean named by {@link #getCompletionAction()}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class CollectionConfig {

    String name;
    @Builder.Default
    String title = "";
    @Builder.Default
    String description = "";
    @Builder.Default
    List<CollectorField> fields = List.of();
    @Builder.Default
    boolean confirmBeforeComplete = true;
    @Builder.Default
    boolean allowEnhancement = true;
    @Builder.Default
    boolean allowSkipOptional = true;
    String successMessage;
    String cancelMessage;
    String systemPrompt;
    String summaryPrompt;
    String actionSummary;
    String actionSummaryPrompt;
    String outputPrompt;
    Map<String, Object> outputSchema;
    String locale;
    boolean detectLocale;
    @Builder.Default
    Map<String, String> initialData = Map.of();
    String completionAction;

    @JsonIgnore
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    CompletionCallback completionCallback;

    /**
     * Checks the structural invariants: at least one field, unique non-blank names,
     * options on select fields and well-formed validation rules.
     */
    public CollectionConfig validate() {
        if (name == null || name.isBlank()) {
            throw new InvalidCollectionConfigException("Collection config must have a name");
        }
        if (fields == null || fields.isEmpty()) {
            throw new InvalidCollectionConfigException("Collection config '" + name + "' has no fields");
        }
        Set<String> seen = new HashSet<>();
        for (CollectorField field : fields) {
            if (field.getName() == null || field.getName().isBlank()) {
                throw new InvalidCollectionConfigException("Field without a name in config '" + name + "'");
            }
            if (!seen.add(field.getName())) {
                throw new InvalidCollectionConfigException("Duplicate field '" + field.getName() + "' in config '" + name + "'");
            }
            if (field.getType() == FieldType.SELECT && (field.getOptions() == null || field.getOptions().isEmpty())) {
                throw new InvalidCollectionConfigException("Select field '" + field.getName() + "' has no options");
            }
            for (String rule : field.rules()) {
                if (!FieldValidator.isWellFormed(rule)) {
                    throw new InvalidCollectionConfigException("Malformed rule '" + rule + "' on field '" + field.getName() + "'");
                }
            }
        }
        return this;
    }

    public Optional<CollectorField> field(String fieldName) {
        if (fieldName == null) {
            return Optional.empty();
        }
        return fields.stream().filter(f -> f.getName().equals(fieldName)).findFirst();
    }

    public List<String> fieldNames() {
        return fields.stream().map(CollectorField::getName).collect(Collectors.toList());
    }

    public Optional<CollectorField> firstField() {
        return fields.stream().findFirst();
    }

    public List<CollectorField> requiredFields() {
        return fields.stream().filter(CollectorField::mandatory).collect(Collectors.toList());
    }

    public List<CollectorField> optionalFields() {
        return fields.stream().filter(f -> !f.mandatory()).collect(Collectors.toList());
    }

    public boolean isComplete(Map<String, String> data) {
        return missingRequired(data).isEmpty();
    }

    public List<CollectorField> missingRequired(Map<String, String> data) {
        return requiredFields().stream()
                .filter(f -> !hasValue(data, f.getName()))
                .collect(Collectors.toList());
    }

    /**
     * Every field, required or optional, that has no value yet.
     */
    public List<String> uncollected(Map<String, String> data) {
        return fields.stream()
                .map(CollectorField::getName)
                .filter(n -> !hasValue(data, n))
                .collect(Collectors.toList());
    }

    public Map<String, String> seedData(Map<String, String> overrides) {
        Map<String, String> merged = new LinkedHashMap<>();
        if (initialData != null) {
            merged.putAll(initialData);
        }
        if (overrides != null) {
            merged.putAll(overrides);
        }
        merged.values().removeIf(v -> v == null || v.isBlank());
        return merged;
    }

    public static boolean hasValue(Map<String, String> data, String fieldName) {
        String value = data == null ? null : data.get(fieldName);
        return value != null && !value.isBlank();
    }
}
