package com.example.chatcollector.extraction;

import com.example.chatcollector.intent.IntentClassifier;
import com.example.chatcollector.model.CollectionConfig;
import com.example.chatcollector.model.CollectorField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a user message into at most one candidate value for the field being asked.
 *
 * <p>Strategies run in a fixed order and the first one that yields a value for the current
 * field wins: generated markers, labelled summary lines (only when markers were present), the
 * intent classifier's value, then the raw message. Every candidate passes through
 * {@link #filterToCurrentField} so a value is never attributed to another field.
 */
@Component
public class FieldExtractionPipeline {

    private static final Logger logger = LoggerFactory.getLogger(FieldExtractionPipeline.class);

    private final MarkerParser markerParser;
    private final DirectValueExtractor directValueExtractor;
    private final IntentClassifier intentClassifier;

    public FieldExtractionPipeline(MarkerParser markerParser, DirectValueExtractor directValueExtractor,
                                   IntentClassifier intentClassifier) {
        this.markerParser = markerParser;
        this.directValueExtractor = directValueExtractor;
        this.intentClassifier = intentClassifier;
    }

    public Optional<ExtractionResult> extract(ExtractionRequest request) {
        String currentField = request.getCurrentField();
        if (currentField == null) {
            return Optional.empty();
        }
        if (intentClassifier.detectRejectionIntent(request.getMessage())) {
            logger.info("Message asks for a change, nothing extracted for {}", currentField);
            return Optional.empty();
        }
        Map<String, String> data = request.getCollectedData();

        Map<String, String> markers = markerParser.markers(request.getGeneratedResponse());
        Optional<ExtractionResult> found = first(filterToCurrentField(markers, currentField, data), currentField, ExtractionSource.MARKER);
        if (found.isPresent()) {
            return found;
        }

        if (!markers.isEmpty()) {
            Map<String, String> labelled = markerParser.labelledValues(request.getGeneratedResponse(), request.getConfig());
            found = first(filterToCurrentField(labelled, currentField, data), currentField, ExtractionSource.LABELLED_SUMMARY);
            if (found.isPresent()) {
                return found;
            }
        }

        if (request.getIntent() != null && request.getIntent().providesValue()) {
            Map<String, String> fromIntent = new LinkedHashMap<>();
            fromIntent.put(currentField, request.getIntent().getExtractedValue().trim());
            found = first(filterToCurrentField(fromIntent, currentField, data), currentField, ExtractionSource.INTENT);
            if (found.isPresent()) {
                return found;
            }
        }

        Optional<CollectorField> field = request.getConfig().field(currentField);
        if (field.isEmpty()) {
            return Optional.empty();
        }
        Map<String, String> direct = new LinkedHashMap<>();
        directValueExtractor.extract(request.getMessage(), field.get()).ifPresent(v -> direct.put(currentField, v));
        return first(filterToCurrentField(direct, currentField, data), currentField, ExtractionSource.DIRECT);
    }

    /**
     * Keeps only the candidate for {@code currentField}, and only while that field is still empty.
     */
    public Map<String, String> filterToCurrentField(Map<String, String> candidates, String currentField, Map<String, String> collectedData) {
        Map<String, String> filtered = new LinkedHashMap<>();
        candidates.forEach((name, value) -> {
            if (CollectionConfig.hasValue(collectedData, name)) {
                logger.warn("Ignoring value for already collected field {}", name);
            } else if (!name.equals(currentField)) {
                logger.warn("Ignoring value for field {} while collecting {}", name, currentField);
            } else {
                filtered.put(name, value);
            }
        });
        return filtered;
    }

    /**
     * Values for any known field found in generated markers. Used while enhancing, where
     * already collected fields may be overwritten.
     */
    public Map<String, String> extractAnyField(String generatedResponse, CollectionConfig config) {
        Map<String, String> out = new LinkedHashMap<>();
        markerParser.markers(generatedResponse).forEach((name, value) -> {
            if (config.field(name).isPresent()) {
                out.put(name, value);
            } else {
                logger.warn("Ignoring marker for unknown field {}", name);
            }
        });
        return out;
    }

    private static Optional<ExtractionResult> first(Map<String, String> values, String field, ExtractionSource source) {
        String value = values.get(field);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new ExtractionResult(field, value, source));
    }
}
