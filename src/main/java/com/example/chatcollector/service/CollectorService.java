package com.example.chatcollector.service;

import com.example.chatcollector.extraction.ContentExtractor;
import com.example.chatcollector.extraction.ExtractionSource;
import com.example.chatcollector.locale.CollectorMessages;
import com.example.chatcollector.locale.LocaleDetector;
import com.example.chatcollector.model.CollectionConfig;
import com.example.chatcollector.model.CollectionStatus;
import com.example.chatcollector.model.CollectorField;
import com.example.chatcollector.model.CollectorResponse;
import com.example.chatcollector.model.SessionState;
import com.example.chatcollector.store.ConfigStore;
import com.example.chatcollector.store.SessionStateStore;
import com.example.chatcollector.validation.FieldValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Entry point of the collector: starts sessions and runs one conversational turn at a time.
 *
 * <p>Each turn loads the session, resolves its config, dispatches on the session status and
 * saves the result. Persistence failures propagate as
 * {@link com.example.chatcollector.store.SessionStoreException}; everything else is reported
 * in the returned {@link CollectorResponse}.
 */
@Service
public class CollectorService {

    private static final Logger logger = LoggerFactory.getLogger(CollectorService.class);

    private final CollectionConfigRegistry registry;
    private final ConfigStore configStore;
    private final SessionStateStore stateStore;
    private final LocaleDetector localeDetector;
    private final CollectorMessages messages;
    private final FieldValidator validator;
    private final FieldValueRecorder recorder;
    private final ContentExtractor contentExtractor;
    private final SummaryService summaryService;
    private final CollectorPromptBuilder promptBuilder;
    private final CollectingHandler collectingHandler;
    private final ConfirmingHandler confirmingHandler;
    private final EnhancingHandler enhancingHandler;
    private final CancellationHandler cancellationHandler;
    private final CollectionEventLog eventLog;

    @Value("${app.collector.events-limit:100}")
    private int eventsLimit = 100;

    @Value("${app.collector.config-scan-limit:500}")
    private int configScanLimit = 500;

    public CollectorService(CollectionConfigRegistry registry, ConfigStore configStore, SessionStateStore stateStore,
                            LocaleDetector localeDetector, CollectorMessages messages, FieldValidator validator,
                            FieldValueRecorder recorder, ContentExtractor contentExtractor, SummaryService summaryService,
                            CollectorPromptBuilder promptBuilder, CollectingHandler collectingHandler,
                            ConfirmingHandler confirmingHandler, EnhancingHandler enhancingHandler,
                            CancellationHandler cancellationHandler, CollectionEventLog eventLog) {
        this.registry = registry;
        this.configStore = configStore;
        this.stateStore = stateStore;
        this.localeDetector = localeDetector;
        this.messages = messages;
        this.validator = validator;
        this.recorder = recorder;
        this.contentExtractor = contentExtractor;
        this.summaryService = summaryService;
        this.promptBuilder = promptBuilder;
        this.collectingHandler = collectingHandler;
        this.confirmingHandler = confirmingHandler;
        this.enhancingHandler = enhancingHandler;
        this.cancellationHandler = cancellationHandler;
        this.eventLog = eventLog;
    }

    public CollectorResponse startSession(String sessionId, String configName, Map<String, String> initialData) {
        Optional<CollectionConfig> config = resolveConfig(configName, null);
        if (config.isEmpty()) {
            logger.warn("Cannot start session: config '{}' not found", configName);
            return CollectorResponse.failure(text(null, "session.config_not_found"), null);
        }
        return start(sessionId, config.get(), initialData);
    }

    /**
     * Starts a session for a config supplied by the caller. The config is validated and registered,
     * so its completion callback stays in process, and kept in the config store so other
     * instances can resolve it by name.
     */
    public CollectorResponse startSession(String sessionId, CollectionConfig inlineConfig, Map<String, String> initialData) {
        registry.register(inlineConfig);
        configStore.save(inlineConfig);
        return start(sessionId, inlineConfig, initialData);
    }

    private CollectorResponse start(String requestedId, CollectionConfig config, Map<String, String> initialData) {
        String sessionId = requestedId == null || requestedId.isBlank() ? UUID.randomUUID().toString() : requestedId;
        if (stateStore.exists(sessionId)) {
            logger.warn("Session {} already exists", sessionId);
            return CollectorResponse.failure(text(config.getLocale(), "session.exists", sessionId), null);
        }

        SessionState state = SessionState.builder()
                .sessionId(sessionId)
                .configName(config.getName())
                .embeddedConfig(config)
                .startedAt(Instant.now())
                .detectedLocale(config.getLocale())
                .build();

        config.seedData(initialData).forEach((name, value) -> {
            Optional<CollectorField> field = config.field(name);
            if (field.isEmpty()) {
                logger.warn("Session {} ignoring initial value for unknown field {}", sessionId, name);
            } else if (!validator.validate(field.get(), value).isEmpty()) {
                logger.warn("Session {} ignoring invalid initial value for {}", sessionId, name);
            } else {
                state.putValue(name, validator.normalize(field.get(), value));
            }
        });
        state.setCurrentField(config.getFields().stream()
                .map(CollectorField::getName)
                .filter(name -> !state.hasValue(name))
                .findFirst()
                .orElse(null));

        String locale = localeDetector.effective(state, config);
        String greeting = getGreeting(config, state, locale);
        state.addMessage("assistant", greeting);
        stateStore.save(state);

        logger.info("Started session {} for config '{}' ({} pre-filled)", sessionId, config.getName(), state.getCollectedData().size());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("config", config.getName());
        details.put("prefilled", state.getCollectedData().size());
        eventLog.record(sessionId, CollectionEventLog.SESSION_STARTED, details);

        return new TurnContext(state, config, locale, null, messages).response()
                .message(greeting)
                .build();
    }

    /**
     * Runs one turn of the conversation.
     */
    public CollectorResponse processMessage(String sessionId, String message) {
        Optional<SessionState> loaded = stateStore.load(sessionId);
        if (loaded.isEmpty()) {
            return CollectorResponse.failure(text(null, "session.not_found"), null);
        }
        SessionState state = loaded.get();
        Optional<CollectionConfig> resolved = resolveConfig(state.getConfigName(), state);
        if (resolved.isEmpty()) {
            logger.warn("Session {} references unknown config '{}'", sessionId, state.getConfigName());
            return CollectorResponse.failure(text(state.getDetectedLocale(), "session.config_not_found"), state);
        }
        CollectionConfig config = resolved.get();
        if (state.getStatus().isTerminal()) {
            return CollectorResponse.failure(
                    text(localeDetector.effective(state, config), "session.inactive", state.getStatus().value()), state);
        }
        String text = message == null ? "" : message;

        if (cancellationHandler.isCancellationRequest(text)) {
            TurnContext ctx = new TurnContext(state, config, localeDetector.effective(state, config), text, messages);
            CollectorResponse response = cancellationHandler.cancel(ctx);
            stateStore.save(state);
            return response;
        }

        String locale = localeDetector.refresh(state, config, text);
        state.addMessage("user", text);
        TurnContext ctx = new TurnContext(state, config, locale, text, messages);

        CollectorResponse response;
        switch (state.getStatus()) {
            case CONFIRMING:
                response = confirmingHandler.handle(ctx);
                break;
            case ENHANCING:
                response = enhancingHandler.handle(ctx);
                break;
            default:
                response = collectingHandler.handle(ctx);
        }

        if (response.getMessage() != null) {
            state.addMessage("assistant", response.getMessage());
        }
        stateStore.save(state);
        logger.debug("Session {} turn done: status={}, currentField={}", sessionId, state.getStatus().value(), state.getCurrentField());
        return response;
    }

    public CollectorResponse cancel(String sessionId) {
        Optional<SessionState> loaded = stateStore.load(sessionId);
        if (loaded.isEmpty()) {
            return CollectorResponse.failure(text(null, "session.not_found"), null);
        }
        SessionState state = loaded.get();
        CollectionConfig config = resolveConfig(state.getConfigName(), state).orElse(null);
        if (config == null) {
            return CollectorResponse.failure(text(state.getDetectedLocale(), "session.config_not_found"), state);
        }
        String locale = localeDetector.effective(state, config);
        if (state.getStatus().isTerminal()) {
            return CollectorResponse.failure(text(locale, "session.inactive", state.getStatus().value()), state);
        }
        CollectorResponse response = cancellationHandler.cancel(new TurnContext(state, config, locale, null, messages));
        state.addMessage("assistant", response.getMessage());
        stateStore.save(state);
        return response;
    }

    public Optional<SessionState> getState(String sessionId) {
        return stateStore.load(sessionId);
    }

    public boolean hasSession(String sessionId) {
        return stateStore.exists(sessionId);
    }

    public boolean deleteSession(String sessionId) {
        if (!stateStore.exists(sessionId)) {
            return false;
        }
        stateStore.delete(sessionId);
        logger.info("Deleted session {}", sessionId);
        return true;
    }

    public List<Map<String, Object>> events(String sessionId) {
        return eventLog.events(sessionId, eventsLimit);
    }

    /**
     * Names of registered configs plus those kept in the config store.
     */
    public List<String> configNames() {
        TreeSet<String> names = new TreeSet<>(registry.names());
        names.addAll(configStore.names(configScanLimit));
        return new ArrayList<>(names);
    }

    public String getGreeting(CollectionConfig config, SessionState state, String locale) {
        StringBuilder g = new StringBuilder(text(locale, "greeting.hello"));
        if (!state.getCollectedData().isEmpty()) {
            g.append("\n\n").append(text(locale, "greeting.already_have")).append("\n");
            for (CollectorField field : config.getFields()) {
                if (state.hasValue(field.getName())) {
                    g.append("✓ ").append(field.label()).append(": ").append(state.getCollectedData().get(field.getName())).append("\n");
                }
            }
        }
        if (state.getCurrentField() != null) {
            CollectorField field = config.field(state.getCurrentField()).orElseThrow();
            g.append("\n\n").append(text(locale, "greeting.provide", field.label()));
            String hints = promptBuilder.validationHints(field, locale);
            if (!hints.isEmpty()) {
                g.append("\n").append(text(locale, "field.requirements", hints));
            }
        }
        return g.toString().trim();
    }

    /**
     * Asks the generator to pull field values out of {@code content}. Nothing is stored.
     */
    public Map<String, String> extractFromContent(String sessionId, String content) {
        Optional<SessionState> state = stateStore.load(sessionId);
        if (state.isEmpty()) {
            logger.warn("Content extraction for unknown session {}", sessionId);
            return Map.of();
        }
        return resolveConfig(state.get().getConfigName(), state.get())
                .map(config -> contentExtractor.extract(config, content))
                .orElse(Map.of());
    }

    /**
     * Stores extracted values that pass validation. A complete result moves the session to
     * review, otherwise collection resumes at the next missing field.
     */
    public CollectorResponse applyExtractedData(String sessionId, Map<String, String> data) {
        Optional<SessionState> loaded = stateStore.load(sessionId);
        if (loaded.isEmpty()) {
            return CollectorResponse.failure(text(null, "session.not_found"), null);
        }
        SessionState state = loaded.get();
        Optional<CollectionConfig> resolved = resolveConfig(state.getConfigName(), state);
        if (resolved.isEmpty()) {
            return CollectorResponse.failure(text(state.getDetectedLocale(), "session.config_not_found"), state);
        }
        CollectionConfig config = resolved.get();
        String locale = localeDetector.effective(state, config);
        if (state.getStatus().isTerminal()) {
            return CollectorResponse.failure(text(locale, "session.inactive", state.getStatus().value()), state);
        }
        if (data == null || data.isEmpty()) {
            return CollectorResponse.failure(text(locale, "extract.none"), state);
        }

        TurnContext ctx = new TurnContext(state, config, locale, null, messages);
        data.forEach((name, value) -> recorder.validateAndStore(ctx, name, value, ExtractionSource.CONTENT));
        String review = summaryService.reviewList(config, state.getCollectedData(), locale).trim();

        CollectorResponse response;
        if (config.isComplete(state.getCollectedData()) && validator.validateAll(config, state.getCollectedData()).isEmpty()) {
            CollectorResponse confirming = confirmingHandler.enter(ctx, null);
            response = confirming.toBuilder().message(text(locale, "extract.applied", review)).build();
        } else {
            String next = CollectingHandler.nextField(state, config);
            state.changeStatus(CollectionStatus.COLLECTING);
            state.setCurrentField(next);
            String prompt = next == null ? "" : promptBuilder.fieldPrompt(config.field(next).orElseThrow(), locale);
            response = ctx.response()
                    .currentField(next)
                    .message(text(locale, "extract.partial", review, prompt))
                    .build();
        }
        state.addMessage("assistant", response.getMessage());
        stateStore.save(state);
        logger.info("Session {} applied {} extracted value(s), status={}", sessionId, data.size(), state.getStatus().value());
        return response;
    }

    /**
     * Registry first, then the config store, then the copy embedded in the session.
     */
    private Optional<CollectionConfig> resolveConfig(String name, SessionState state) {
        if (name != null) {
            Optional<CollectionConfig> config = registry.get(name);
            if (config.isPresent()) {
                return config;
            }
            config = configStore.load(name);
            if (config.isPresent()) {
                return config;
            }
        }
        if (state != null && state.getEmbeddedConfig() != null) {
            logger.debug("Session {} falling back to embedded config", state.getSessionId());
            return Optional.of(state.getEmbeddedConfig());
        }
        return Optional.empty();
    }

    private String text(String locale, String key, Object... args) {
        return messages.get(locale == null ? localeDetector.defaultLocale() : locale, key, args);
    }
}
