package com.example.chatcollector.service;

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
import java.util.Map;

/**
 * The review step: shows the collected data with a preview and waits for yes / no.
 */
@Component
public class ConfirmingHandler {

    private static final Logger logger = LoggerFactory.getLogger(ConfirmingHandler.class);

    private final IntentClassifier intentClassifier;
    private final SummaryService summaryService;
    private final CompletionHandler completionHandler;
    private final CollectorPromptBuilder promptBuilder;
    private final CollectionEventLog eventLog;

    public ConfirmingHandler(IntentClassifier intentClassifier, SummaryService summaryService,
                             CompletionHandler completionHandler, CollectorPromptBuilder promptBuilder,
                             CollectionEventLog eventLog) {
        this.intentClassifier = intentClassifier;
        this.summaryService = summaryService;
        this.completionHandler = completionHandler;
        this.promptBuilder = promptBuilder;
        this.eventLog = eventLog;
    }

    /**
     * Moves the session to {@code confirming} and builds the review message, prefixed by {@code lead}.
     */
    public CollectorResponse enter(TurnContext ctx, String lead) {
        SessionState state = ctx.getState();
        CollectionConfig config = ctx.getConfig();
        state.changeStatus(CollectionStatus.CONFIRMING);
        state.setCurrentField(null);

        String summary = summaryService.dataSummary(config, state.getCollectedData(), ctx.getLocale());
        String actionSummary = summaryService.actionSummary(config, state.getCollectedData(),
                state.metadataList(MetadataKey.OUTPUT_MODIFICATIONS), ctx.getLocale());

        StringBuilder message = new StringBuilder();
        if (lead != null && !lead.isBlank()) {
            message.append(lead.trim()).append("\n\n");
        }
        message.append(summary.trim()).append("\n\n---\n\n");
        message.append(ctx.text("confirm.what_happens")).append("\n\n").append(actionSummary.trim());
        message.append("\n\n---\n\n").append(ctx.text("confirm.instructions"));

        logger.info("Session {} awaiting confirmation", state.getSessionId());
        eventLog.record(state.getSessionId(), CollectionEventLog.CONFIRMING, Map.of("fields", state.getCollectedData().size()));
        return ctx.response()
                .message(message.toString())
                .requiresConfirmation(true)
                .summary(summary)
                .actionSummary(actionSummary)
                .build();
    }

    public CollectorResponse handle(TurnContext ctx) {
        SessionState state = ctx.getState();
        CollectionConfig config = ctx.getConfig();
        ConfirmationReply reply = intentClassifier.classifyConfirmation(ctx.getMessage());

        switch (reply) {
            case CONFIRM:
                if (config.getActionSummaryPrompt() != null && !config.getActionSummaryPrompt().isBlank()) {
                    List<String> modifications = state.metadataList(MetadataKey.OUTPUT_MODIFICATIONS);
                    state.setConfirmedActionSummary(summaryService.actionSummary(config, state.getCollectedData(),
                            modifications, ctx.getLocale()));
                }
                return completionHandler.complete(ctx);
            case REJECT:
                return config.isAllowEnhancement() ? startEnhancing(ctx) : restart(ctx);
            default:
                return ctx.response()
                        .message(ctx.text("confirm.reask"))
                        .requiresConfirmation(true)
                        .build();
        }
    }

    private CollectorResponse startEnhancing(TurnContext ctx) {
        SessionState state = ctx.getState();
        state.changeStatus(CollectionStatus.ENHANCING);
        String target = intentClassifier.identifyTargetField(ctx.getMessage(), ctx.getConfig(), state.getCollectedData());
        state.putMetadata(MetadataKey.PENDING_FIELD_UPDATE, target);
        logger.info("Session {} enhancing (target={})", state.getSessionId(), target);
        String message = target == null
                ? ctx.text("enhance.prompt")
                : ctx.text("enhance.ask_field", ctx.getConfig().field(target).map(CollectorField::label).orElse(target));
        return ctx.response()
                .message(message)
                .allowsEnhancement(true)
                .build();
    }

    private CollectorResponse restart(TurnContext ctx) {
        SessionState state = ctx.getState();
        CollectionConfig config = ctx.getConfig();
        state.getCollectedData().clear();
        state.getValidationErrors().clear();
        state.setLastSuggestions(null);
        state.putMetadata(MetadataKey.PENDING_FIELD_UPDATE, null);
        state.putMetadata(MetadataKey.SKIPPED_FIELDS, null);
        state.changeStatus(CollectionStatus.COLLECTING);
        CollectorField first = config.firstField().orElseThrow();
        state.setCurrentField(first.getName());
        logger.info("Session {} restarted collection", state.getSessionId());
        return ctx.response()
                .message(ctx.text("restart", promptBuilder.fieldPrompt(first, ctx.getLocale())))
                .build();
    }
}
