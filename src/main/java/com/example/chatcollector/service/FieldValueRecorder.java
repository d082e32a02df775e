package com.example.chatcollector.service;

import com.example.chatcollector.extraction.ExtractionSource;
import com.example.chatcollector.model.CollectorField;
import com.example.chatcollector.model.SessionState;
import com.example.chatcollector.model.ValidationError;
import com.example.chatcollector.validation.FieldValidator;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * The single place where a candidate value is validated and written into a session.
 */
@Component
public class FieldValueRecorder {

    private static final Logger logger = LoggerFactory.getLogger(FieldValueRecorder.class);

    private final FieldValidator validator;
    private final CollectionEventLog eventLog;

    public FieldValueRecorder(FieldValidator validator, CollectionEventLog eventLog) {
        this.validator = validator;
        this.eventLog = eventLog;
    }

    public Outcome validateAndStore(TurnContext ctx, String fieldName, String value, ExtractionSource source) {
        SessionState state = ctx.getState();
        CollectorField field = ctx.getConfig().field(fieldName).orElse(null);
        if (field == null) {
            logger.warn("Session {} tried to store unknown field {}", state.getSessionId(), fieldName);
            return Outcome.rejected(fieldName, value, List.of(), null);
        }

        List<ValidationError> errors = validator.validate(field, value);
        if (!errors.isEmpty()) {
            state.getValidationErrors().put(fieldName, errors);
            logger.info("Session {} rejected value for {} ({} errors, source={})", state.getSessionId(), fieldName, errors.size(), source);
            eventLog.record(state.getSessionId(), CollectionEventLog.VALIDATION_FAILED,
                    Map.of("field", fieldName, "source", source.name(), "errors", errors.size()));
            return Outcome.rejected(fieldName, value, errors, errorMessage(ctx, field, errors));
        }

        String stored = validator.normalize(field, value);
        state.putValue(fieldName, stored);
        logger.info("Session {} stored {} (source={})", state.getSessionId(), fieldName, source);
        eventLog.record(state.getSessionId(), CollectionEventLog.FIELD_COLLECTED,
                Map.of("field", fieldName, "source", source.name()));
        return Outcome.stored(fieldName, stored);
    }

    private String errorMessage(TurnContext ctx, CollectorField field, List<ValidationError> errors) {
        StringBuilder list = new StringBuilder();
        for (ValidationError error : errors) {
            list.append("- ").append(error.getMessage()).append("\n");
        }
        String message = ctx.text("validation.invalid_value", list.toString(), field.label());
        if (!field.getExamples().isEmpty()) {
            message += ctx.text("validation.examples_suffix", String.join(", ", field.getExamples()));
        }
        return message;
    }

    @Getter
    @AllArgsConstructor
    public static class Outcome {
        private final boolean stored;
        private final String field;
        private final String value;
        private final List<ValidationError> errors;
        private final String errorMessage;

        static Outcome stored(String field, String value) {
            return new Outcome(true, field, value, List.of(), null);
        }

        static Outcome rejected(String field, String value, List<ValidationError> errors, String errorMessage) {
            return new Outcome(false, field, value, errors, errorMessage);
        }
    }
}
