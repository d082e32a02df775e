package com.example.chatcollector.service;

import com.example.chatcollector.extraction.ExtractionRequest;
import com.example.chatcollector.extraction.ExtractionResult;
import com.example.chatcollector.extraction.ExtractionSource;
import com.example.chatcollector.extraction.FieldExtractionPipeline;
import com.example.chatcollector.extraction.MarkerParser;
import com.example.chatcollector.extraction.SuggestionSelector;
import com.example.chatcollector.generation.GenerationResult;
import com.example.chatcollector.generation.TextGenerator;
import com.example.chatcollector.intent.IntentAnalysis;
import com.example.chatcollector.intent.IntentClassifier;
import com.example.chatcollector.model.CollectionConfig;
import com.example.chatcollector.model.CollectionStatus;
import com.example.chatcollector.model.CollectorField;
import com.example.chatcollector.model.CollectorResponse;
import com.example.chatcollector.model.MetadataKey;
import com.example.chatcollector.model.SessionState;
import com.example.chatcollector.model.SuggestionCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Handles turns while fields are still being gathered, one field at a time.
 */
@Component
public class CollectingHandler {

    private static final Logger logger = LoggerFactory.getLogger(CollectingHandler.class);

    private static final int ACK_VALUE_LIMIT = 100;

    private final TextGenerator textGenerator;
    private final IntentClassifier intentClassifier;
    private final FieldExtractionPipeline extractionPipeline;
    private final MarkerParser markerParser;
    private final SuggestionSelector suggestionSelector;
    private final FieldValueRecorder recorder;
    private final CollectorPromptBuilder promptBuilder;
    private final ConfirmingHandler confirmingHandler;
    private final CompletionHandler completionHandler;
    private final CancellationHandler cancellationHandler;

    public CollectingHandler(TextGenerator textGenerator, IntentClassifier intentClassifier,
                             FieldExtractionPipeline extractionPipeline, MarkerParser markerParser,
                             SuggestionSelector suggestionSelector, FieldValueRecorder recorder,
                             CollectorPromptBuilder promptBuilder, ConfirmingHandler confirmingHandler,
                             CompletionHandler completionHandler, CancellationHandler cancellationHandler) {
        this.textGenerator = textGenerator;
        this.intentClassifier = intentClassifier;
        this.extractionPipeline = extractionPipeline;
        this.markerParser = markerParser;
        this.suggestionSelector = suggestionSelector;
        this.recorder = recorder;
        this.promptBuilder = promptBuilder;
        this.confirmingHandler = confirmingHandler;
        this.completionHandler = completionHandler;
        this.cancellationHandler = cancellationHandler;
    }

    public CollectorResponse handle(TurnContext ctx) {
        SessionState state = ctx.getState();
        CollectionConfig config = ctx.getConfig();
        CollectorField field = state.getCurrentField() == null ? null : config.field(state.getCurrentField()).orElse(null);
        // a filled current field is left over from a failed completion
        if (field == null || state.hasValue(field.getName())) {
            return advance(ctx, null);
        }

        Optional<String> picked = suggestionSelector.select(ctx.getMessage(), state.getLastSuggestions(), field.getName());
        if (picked.isPresent()) {
            state.setLastSuggestions(null);
            logger.info("Session {} picked suggestion for {}", state.getSessionId(), field.getName());
            FieldValueRecorder.Outcome outcome = recorder.validateAndStore(ctx, field.getName(), picked.get(), ExtractionSource.SUGGESTION);
            return afterRecording(ctx, outcome, "", ExtractionSource.SUGGESTION);
        }

        if (config.isAllowEnhancement() && !ctx.collectedFields().isEmpty()
                && intentClassifier.detectRejectionIntent(ctx.getMessage())) {
            String target = intentClassifier.identifyTargetField(ctx.getMessage(), config, state.getCollectedData());
            if (target != null && state.hasValue(target)) {
                state.changeStatus(CollectionStatus.ENHANCING);
                state.putMetadata(MetadataKey.PENDING_FIELD_UPDATE, target);
                logger.info("Session {} wants to change {} while collecting", state.getSessionId(), target);
                return ctx.response()
                        .message(ctx.text("enhance.ask_field", config.field(target).map(CollectorField::label).orElse(target)))
                        .allowsEnhancement(true)
                        .build();
            }
        }

        IntentAnalysis intent = intentClassifier.classify(ctx.getMessage(), field.getName(), field, state.getCollectedData());
        logger.debug("Session {} intent for {}: {}", state.getSessionId(), field.getName(), intent);
        switch (intent.getIntent()) {
            case SUGGEST:
                return suggest(ctx, field);
            case SKIP:
                return skip(ctx, field);
            case QUESTION:
                return answerQuestion(ctx, field);
            default:
                return collect(ctx, field, intent);
        }
    }

    private CollectorResponse collect(TurnContext ctx, CollectorField field, IntentAnalysis intent) {
        SessionState state = ctx.getState();
        CollectionConfig config = ctx.getConfig();
        GenerationResult generated = textGenerator.generate(promptBuilder.systemPrompt(config, ctx.getLocale()),
                promptBuilder.contextPrompt(state, config) + "\n\nUser: " + ctx.getMessage());
        String reply = generated.hasContent() ? generated.getContent() : "";

        if (markerParser.signalsCancellation(reply)) {
            logger.info("Session {} generator signalled cancellation", state.getSessionId());
            return cancellationHandler.cancel(ctx);
        }

        Optional<ExtractionResult> extracted = extractionPipeline.extract(ExtractionRequest.builder()
                .message(ctx.getMessage())
                .generatedResponse(reply)
                .currentField(field.getName())
                .config(config)
                .collectedData(state.getCollectedData())
                .intent(intent)
                .build());
        String cleaned = markerParser.clean(reply);
        if (extracted.isPresent()) {
            ExtractionResult result = extracted.get();
            FieldValueRecorder.Outcome outcome = recorder.validateAndStore(ctx, result.getField(), result.getValue(), result.getSource());
            return afterRecording(ctx, outcome, cleaned, result.getSource());
        }

        if (markerParser.signalsCompletion(reply)) {
            if (config.isComplete(state.getCollectedData())) {
                return advance(ctx, cleaned);
            }
            logger.warn("Session {} ignoring completion signal, required fields missing: {}", state.getSessionId(),
                    config.missingRequired(state.getCollectedData()).size());
        }
        return ctx.response()
                .message(cleaned.isBlank() ? promptBuilder.fieldPrompt(field, ctx.getLocale()) : cleaned)
                .build();
    }

    private CollectorResponse afterRecording(TurnContext ctx, FieldValueRecorder.Outcome outcome, String reply, ExtractionSource source) {
        if (!outcome.isStored()) {
            return ctx.response()
                    .success(false)
                    .message(outcome.getErrorMessage() != null ? outcome.getErrorMessage()
                            : promptBuilder.fieldPrompt(ctx.getConfig().field(ctx.getState().getCurrentField()).orElseThrow(), ctx.getLocale()))
                    .build();
        }
        String ack = reply;
        if (ack == null || ack.isBlank() || source == ExtractionSource.DIRECT || source == ExtractionSource.SUGGESTION
                || mentionsOtherField(ack, ctx.getConfig(), outcome.getField())) {
            String label = ctx.getConfig().field(outcome.getField()).map(CollectorField::label).orElse(outcome.getField());
            ack = ctx.text("ack.recorded", label, truncate(outcome.getValue()));
        }
        return advance(ctx, ack);
    }

    /**
     * Asks for the next field, or moves to review or completion once nothing required is missing.
     */
    CollectorResponse advance(TurnContext ctx, String lead) {
        SessionState state = ctx.getState();
        CollectionConfig config = ctx.getConfig();
        String next = nextField(state, config);
        if (next == null) {
            if (config.isConfirmBeforeComplete()) {
                return confirmingHandler.enter(ctx, lead);
            }
            CollectorResponse done = completionHandler.complete(ctx);
            if (lead == null || lead.isBlank()) {
                return done;
            }
            return done.toBuilder().message(lead.trim() + "\n\n" + done.getMessage()).build();
        }
        state.setCurrentField(next);
        String prompt = promptBuilder.fieldPrompt(config.field(next).orElseThrow(), ctx.getLocale());
        return ctx.response()
                .currentField(next)
                .message(lead == null || lead.isBlank() ? prompt : lead.trim() + "\n\n" + prompt)
                .build();
    }

    private CollectorResponse suggest(TurnContext ctx, CollectorField field) {
        SessionState state = ctx.getState();
        GenerationResult generated = textGenerator.generate(CollectorPromptBuilder.SUGGESTION_SYSTEM_PROMPT,
                promptBuilder.suggestionPrompt(field, state.getCollectedData(), ctx.getLocale()));
        if (generated.hasContent()) {
            String text = generated.getContent().trim();
            state.setLastSuggestions(new SuggestionCache(field.getName(), text, suggestionSelector.parseItems(text)));
            return ctx.response().message(ctx.text("suggest.intro", text)).build();
        }
        logger.warn("Session {} suggestion generation failed for {}: {}", state.getSessionId(), field.getName(), generated.getError());
        if (!field.getExamples().isEmpty()) {
            StringBuilder list = new StringBuilder();
            List<String> items = new ArrayList<>(field.getExamples());
            for (int i = 0; i < items.size(); i++) {
                list.append(i + 1).append(". ").append(items.get(i)).append("\n");
            }
            state.setLastSuggestions(new SuggestionCache(field.getName(), list.toString(), items));
            return ctx.response().message(ctx.text("suggest.examples", field.label(), list.toString().trim())).build();
        }
        return ctx.response()
                .success(false)
                .message(ctx.text("suggest.failed", field.label()))
                .build();
    }

    private CollectorResponse skip(TurnContext ctx, CollectorField field) {
        SessionState state = ctx.getState();
        if (field.mandatory() || !ctx.getConfig().isAllowSkipOptional()) {
            return ctx.response()
                    .message(ctx.text("skip.required", field.label()) + "\n\n" + promptBuilder.fieldPrompt(field, ctx.getLocale()))
                    .build();
        }
        state.appendMetadata(MetadataKey.SKIPPED_FIELDS, field.getName());
        logger.info("Session {} skipped optional field {}", state.getSessionId(), field.getName());
        return advance(ctx, ctx.text("skip.done", field.label()));
    }

    private CollectorResponse answerQuestion(TurnContext ctx, CollectorField field) {
        SessionState state = ctx.getState();
        GenerationResult generated = textGenerator.generate(promptBuilder.systemPrompt(ctx.getConfig(), ctx.getLocale()),
                promptBuilder.contextPrompt(state, ctx.getConfig()) + "\n\nUser: " + ctx.getMessage());
        String cleaned = generated.hasContent() ? markerParser.clean(generated.getContent()) : "";
        return ctx.response()
                .message(cleaned.isBlank() ? promptBuilder.fieldPrompt(field, ctx.getLocale()) : cleaned)
                .build();
    }

    /**
     * The next field to ask for: the first missing required field, then (unless optional fields
     * may be skipped) the first uncollected optional field the user has not skipped.
     */
    public static String nextField(SessionState state, CollectionConfig config) {
        List<CollectorField> missing = config.missingRequired(state.getCollectedData());
        if (!missing.isEmpty()) {
            return missing.get(0).getName();
        }
        if (config.isAllowSkipOptional()) {
            return null;
        }
        List<String> skipped = state.metadataList(MetadataKey.SKIPPED_FIELDS);
        for (CollectorField optional : config.optionalFields()) {
            if (!state.hasValue(optional.getName()) && !skipped.contains(optional.getName())) {
                return optional.getName();
            }
        }
        return null;
    }

    private static boolean mentionsOtherField(String reply, CollectionConfig config, String recorded) {
        String lower = reply.toLowerCase(Locale.ROOT);
        for (CollectorField f : config.getFields()) {
            if (f.getName().equals(recorded)) {
                continue;
            }
            String name = f.getName().toLowerCase(Locale.ROOT);
            if (lower.contains(name) || lower.contains(name.replace('_', ' '))) {
                return true;
            }
            String description = f.getDescription().trim().toLowerCase(Locale.ROOT);
            if (!description.isEmpty() && lower.contains(description)) {
                return true;
            }
        }
        return false;
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= ACK_VALUE_LIMIT) {
            return value;
        }
        return value.substring(0, ACK_VALUE_LIMIT) + "...";
    }
}
