package com.example.chatcollector.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one conversational turn.
 */
@Getter
@Builder(toBuilder = true)
public class CollectorResponse {
    private final boolean success;
    private final String message;
    private final SessionState state;
    private final String currentField;
    @Builder.Default
    private final List<String> collectedFields = List.of();
    @Builder.Default
    private final List<String> remainingFields = List.of();
    @Builder.Default
    private final Map<String, List<ValidationError>> validationErrors = Map.of();
    private final boolean complete;
    private final boolean cancelled;
    private final boolean requiresConfirmation;
    private final boolean allowsEnhancement;
    private final String summary;
    private final String actionSummary;
    private final Object result;
    private final JsonNode generatedOutput;

    public static CollectorResponse failure(String message, SessionState state) {
        return CollectorResponse.builder()
                .success(false)
                .message(message)
                .state(state)
                .currentField(state != null ? state.getCurrentField() : null)
                .build();
    }

    public CollectionStatus getStatus() {
        return state != null ? state.getStatus() : null;
    }

    public boolean isFinished() {
        return complete || cancelled;
    }

    public double getProgress() {
        int total = collectedFields.size() + remainingFields.size();
        if (total == 0) {
            return 100.0;
        }
        return Math.round(collectedFields.size() * 1000.0 / total) / 10.0;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", success);
        out.put("message", message);
        out.put("status", getStatus() != null ? getStatus().value() : null);
        out.put("currentField", currentField);
        out.put("collectedFields", collectedFields);
        out.put("remainingFields", remainingFields);
        out.put("validationErrors", validationErrors);
        out.put("complete", complete);
        out.put("cancelled", cancelled);
        out.put("requiresConfirmation", requiresConfirmation);
        out.put("allowsEnhancement", allowsEnhancement);
        out.put("progress", getProgress());
        out.put("data", state != null ? state.getCollectedData() : Map.of());
        if (summary != null) {
            out.put("summary", summary);
        }
        if (actionSummary != null) {
            out.put("actionSummary", actionSummary);
        }
        if (result != null) {
            out.put("result", result);
        }
        if (generatedOutput != null) {
            out.put("generatedOutput", generatedOutput);
        }
        return out;
    }
}
