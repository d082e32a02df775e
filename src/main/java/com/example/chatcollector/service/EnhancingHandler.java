package com.example.chatcollector.service;

import com.example.chatcollector.extraction.ExtractionSource;
import com.example.chatcollector.extraction.FieldExtractionPipeline;
import com.example.chatcollector.extraction.MarkerParser;
import com.example.chatcollector.generation.GenerationResult;
import com.example.chatcollector.generation.TextGenerator;
import com.example.chatcollector.intent.ConfirmationReply;
import com.example.chatcollector.intent.IntentClassifier;
import com.example.chatcollector.model.CollectionConfig;
import com.example.chatcollector.model.CollectionStatus;
import com.example.chatcollector.model.CollectorField;
import com.example.chatcollector.model.CollectorResponse;
import com.example.chatcollector.model.MetadataKey;
import com.example.chatcollector.model.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Handles turns after the user asked to change something that was already collected.
 *
 * <p>Checks run in order: "done", a new change request, a value for the field named earlier, a
 * change to the generated output, and finally a free form change interpreted by the generator.
 */
@Component
public class EnhancingHandler {

    private static final Logger logger = LoggerFactory.getLogger(EnhancingHandler.class);

    private static final List<String> OUTPUT_KEYWORDS = List.of("structure", "content", "outline", "curriculum", "syllabus");

    private final TextGenerator textGenerator;
    private final IntentClassifier intentClassifier;
    private final FieldExtractionPipeline extractionPipeline;
    private final MarkerParser markerParser;
    private final FieldValueRecorder recorder;
    private final SummaryService summaryService;
    private final CollectorPromptBuilder promptBuilder;
    private final ConfirmingHandler confirmingHandler;

    public EnhancingHandler(TextGenerator textGenerator, IntentClassifier intentClassifier,
                            FieldExtractionPipeline extractionPipeline, MarkerParser markerParser,
                            FieldValueRecorder recorder, SummaryService summaryService,
                            CollectorPromptBuilder promptBuilder, ConfirmingHandler confirmingHandler) {
        this.textGenerator = textGenerator;
        this.intentClassifier = intentClassifier;
        this.extractionPipeline = extractionPipeline;
        this.markerParser = markerParser;
        this.recorder = recorder;
        this.summaryService = summaryService;
        this.promptBuilder = promptBuilder;
        this.confirmingHandler = confirmingHandler;
    }

    public CollectorResponse handle(TurnContext ctx) {
        SessionState state = ctx.getState();
        CollectionConfig config = ctx.getConfig();
        String message = ctx.getMessage();

        if (intentClassifier.detectCompletionIntent(message)
                || intentClassifier.classifyConfirmation(message) == ConfirmationReply.CONFIRM) {
            state.putMetadata(MetadataKey.PENDING_FIELD_UPDATE, null);
            if (config.isComplete(state.getCollectedData())) {
                return confirmingHandler.enter(ctx, ctx.text("confirm.updated_intro"));
            }
            String next = CollectingHandler.nextField(state, config);
            state.changeStatus(CollectionStatus.COLLECTING);
            state.setCurrentField(next);
            logger.info("Session {} left enhancing with required fields missing, asking {}", state.getSessionId(), next);
            return ctx.response()
                    .currentField(next)
                    .message(promptBuilder.fieldPrompt(config.field(next).orElseThrow(), ctx.getLocale()))
                    .build();
        }

        if (intentClassifier.detectRejectionIntent(message)) {
            String target = intentClassifier.identifyTargetField(message, config, state.getCollectedData());
            if (target == null && isOutputModification(message, config)) {
                return recordOutputModification(ctx);
            }
            state.putMetadata(MetadataKey.PENDING_FIELD_UPDATE, target);
            return ctx.response()
                    .message(target == null ? ctx.text("enhance.prompt")
                            : ctx.text("enhance.ask_field", config.field(target).map(CollectorField::label).orElse(target)))
                    .allowsEnhancement(true)
                    .build();
        }

        String pending = state.pendingFieldUpdate();
        if (pending != null && config.field(pending).isPresent()) {
            return applyPending(ctx, pending);
        }
        if (isOutputModification(message, config)) {
            return recordOutputModification(ctx);
        }
        return applyFreeForm(ctx);
    }

    private CollectorResponse recordOutputModification(TurnContext ctx) {
        SessionState state = ctx.getState();
        CollectionConfig config = ctx.getConfig();
        state.appendMetadata(MetadataKey.OUTPUT_MODIFICATIONS, ctx.getMessage().trim());
        List<String> modifications = state.metadataList(MetadataKey.OUTPUT_MODIFICATIONS);
        String actionSummary = summaryService.actionSummary(config, state.getCollectedData(), modifications, ctx.getLocale());
        logger.info("Session {} recorded output modification #{}", state.getSessionId(), modifications.size());
        return ctx.response()
                .message(ctx.text("enhance.output_updated", actionSummary.trim()))
                .actionSummary(actionSummary)
                .allowsEnhancement(true)
                .build();
    }

    private CollectorResponse applyPending(TurnContext ctx, String pending) {
        SessionState state = ctx.getState();
        CollectionConfig config = ctx.getConfig();
        FieldValueRecorder.Outcome outcome = recorder.validateAndStore(ctx, pending, ctx.getMessage().trim(), ExtractionSource.PENDING_UPDATE);
        if (!outcome.isStored()) {
            return ctx.response()
                    .success(false)
                    .message(outcome.getErrorMessage())
                    .allowsEnhancement(true)
                    .build();
        }
        state.putMetadata(MetadataKey.PENDING_FIELD_UPDATE, null);
        String label = config.field(pending).map(CollectorField::label).orElse(pending);
        String summary = summaryService.staticSummary(config, state.getCollectedData(), ctx.getLocale());
        String action = summaryService.staticActionSummary(config, state.getCollectedData(), ctx.getLocale());
        String message = ctx.text("enhance.updated", label, outcome.getValue())
                + "\n\n" + summary.trim()
                + "\n\n" + ctx.text("enhance.what_happens", action.trim())
                + "\n\n" + ctx.text("enhance.more_changes");
        return ctx.response()
                .message(message)
                .summary(summary)
                .actionSummary(action)
                .allowsEnhancement(true)
                .build();
    }

    private CollectorResponse applyFreeForm(TurnContext ctx) {
        SessionState state = ctx.getState();
        CollectionConfig config = ctx.getConfig();
        String dataSummary = summaryService.staticSummary(config, state.getCollectedData(), ctx.getLocale());
        GenerationResult generated = textGenerator.generate(
                promptBuilder.enhancementSystemPrompt(config, dataSummary, ctx.getLocale()),
                "User wants to modify: " + ctx.getMessage());
        String reply = generated.hasContent() ? generated.getContent() : "";

        int applied = 0;
        for (Map.Entry<String, String> entry : extractionPipeline.extractAnyField(reply, config).entrySet()) {
            if (recorder.validateAndStore(ctx, entry.getKey(), entry.getValue(), ExtractionSource.MARKER).isStored()) {
                applied++;
            }
        }
        logger.info("Session {} applied {} change(s) from free form request", state.getSessionId(), applied);

        String cleaned = markerParser.clean(reply);
        String summary = summaryService.staticSummary(config, state.getCollectedData(), ctx.getLocale());
        String message = (cleaned.isBlank() ? ctx.text("enhance.prompt") : cleaned)
                + "\n\n" + summary.trim()
                + "\n\n" + ctx.text("enhance.more_changes");
        return ctx.response()
                .message(message)
                .summary(summary)
                .allowsEnhancement(true)
                .build();
    }

    private static boolean isOutputModification(String message, CollectionConfig config) {
        boolean hasOutput = (config.getActionSummaryPrompt() != null && !config.getActionSummaryPrompt().isBlank())
                || (config.getOutputSchema() != null && !config.getOutputSchema().isEmpty());
        if (!hasOutput || message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        if (config.getOutputSchema() != null) {
            for (String key : config.getOutputSchema().keySet()) {
                if (lower.contains(key.toLowerCase(Locale.ROOT))) {
                    return true;
                }
            }
        }
        return OUTPUT_KEYWORDS.stream().anyMatch(lower::contains);
    }
}
