package com.example.chatcollector.extraction;

import com.example.chatcollector.intent.IntentAnalysis;
import com.example.chatcollector.model.CollectionConfig;
import lombok.Builder;
import lombok.Getter;

import java.util.Map;

@Getter
@Builder
public class ExtractionRequest {
    private final String message;
    /** Text produced by the generator for this turn, may carry FIELD_COLLECTED markers. */
    private final String generatedResponse;
    private final String currentField;
    private final CollectionConfig config;
    private final Map<String, String> collectedData;
    private final IntentAnalysis intent;
}
