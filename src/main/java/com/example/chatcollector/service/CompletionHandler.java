package com.example.chatcollector.service;

import com.example.chatcollector.generation.StructuredOutputGenerator;
import com.example.chatcollector.model.CollectionConfig;
import com.example.chatcollector.model.CollectionStatus;
import com.example.chatcollector.model.CollectorResponse;
import com.example.chatcollector.model.SessionState;
import com.example.chatcollector.model.ValidationError;
import com.example.chatcollector.validation.FieldValidator;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Finishes a session: full re-validation, optional structured output, then the completion callback.
 */
@Component
public class CompletionHandler {

    private static final Logger logger = LoggerFactory.getLogger(CompletionHandler.class);

    private final FieldValidator validator;
    private final StructuredOutputGenerator outputGenerator;
    private final CompletionCallbackResolver callbackResolver;
    private final SummaryService summaryService;
    private final CollectionEventLog eventLog;

    public CompletionHandler(FieldValidator validator, StructuredOutputGenerator outputGenerator,
                             CompletionCallbackResolver callbackResolver, SummaryService summaryService,
                             CollectionEventLog eventLog) {
        this.validator = validator;
        this.outputGenerator = outputGenerator;
        this.callbackResolver = callbackResolver;
        this.summaryService = summaryService;
        this.eventLog = eventLog;
    }

    public CollectorResponse complete(TurnContext ctx) {
        SessionState state = ctx.getState();
        CollectionConfig config = ctx.getConfig();

        Map<String, List<ValidationError>> errors = validator.validateAll(config, state.getCollectedData());
        if (!errors.isEmpty()) {
            String firstInvalid = errors.keySet().iterator().next();
            logger.warn("Session {} failed final validation on {}", state.getSessionId(), errors.keySet());
            state.setValidationErrors(new LinkedHashMap<>(errors));
            errors.keySet().forEach(state.getCollectedData()::remove);
            state.changeStatus(CollectionStatus.COLLECTING);
            state.setCurrentField(firstInvalid);
            StringBuilder list = new StringBuilder();
            errors.forEach((field, fieldErrors) -> list.append("- ").append(field).append(": ")
                    .append(fieldErrors.stream().map(ValidationError::getMessage).collect(Collectors.joining(", ")))
                    .append("\n"));
            return ctx.response()
                    .success(false)
                    .message(ctx.text("validation.completion_failed", list.toString()))
                    .build();
        }

        JsonNode generated = outputGenerator.generate(config, state);

        Map<String, Object> callbackData = new LinkedHashMap<>(state.getCollectedData());
        if (generated != null) {
            callbackData.put(CompletionCallback.GENERATED_OUTPUT_KEY, generated);
        }
        Object result;
        try {
            result = callbackResolver.resolve(config).onComplete(callbackData);
        } catch (RuntimeException e) {
            logger.error("Completion callback failed for session {} (config {})", state.getSessionId(), config.getName(), e);
            return ctx.response()
                    .success(false)
                    .message(ctx.text("completion.error", e.getMessage()))
                    .generatedOutput(generated)
                    .build();
        }

        state.changeStatus(CollectionStatus.COMPLETED);
        state.setCurrentField(null);
        state.getValidationErrors().clear();
        logger.info("Session {} completed (config {})", state.getSessionId(), config.getName());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("config", config.getName());
        details.put("fields", state.getCollectedData().size());
        details.put("generatedOutput", generated != null);
        eventLog.record(state.getSessionId(), CollectionEventLog.COMPLETED, details);

        String message = config.getSuccessMessage() == null || config.getSuccessMessage().isBlank()
                ? ctx.text("success.default")
                : config.getSuccessMessage();
        return ctx.response()
                .message(message)
                .complete(true)
                .allowsEnhancement(false)
                .result(result)
                .generatedOutput(generated)
                .summary(summaryService.staticSummary(config, state.getCollectedData(), ctx.getLocale()))
                .build();
    }
}
