package com.example.chatcollector.service;

import com.example.chatcollector.locale.CollectorMessages;
import com.example.chatcollector.model.CollectionConfig;
import com.example.chatcollector.model.CollectorResponse;
import com.example.chatcollector.model.SessionState;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Everything a handler needs for one turn: the loaded state, its resolved config, the locale
 * in effect and the user's message.
 */
@Getter
public class TurnContext {

    private final SessionState state;
    private final CollectionConfig config;
    private final String locale;
    private final String message;
    private final CollectorMessages messages;

    public TurnContext(SessionState state, CollectionConfig config, String locale, String message, CollectorMessages messages) {
        this.state = state;
        this.config = config;
        this.locale = locale;
        this.message = message;
        this.messages = messages;
    }

    public String text(String key, Object... args) {
        return messages.get(locale, key, args);
    }

    public List<String> collectedFields() {
        return config.fieldNames().stream().filter(state::hasValue).collect(Collectors.toList());
    }

    /**
     * A successful response pre-filled from the current state; handlers override what differs.
     */
    public CollectorResponse.CollectorResponseBuilder response() {
        return CollectorResponse.builder()
                .success(true)
                .state(state)
                .currentField(state.getCurrentField())
                .collectedFields(collectedFields())
                .remainingFields(config.uncollected(state.getCollectedData()))
                .validationErrors(new LinkedHashMap<>(state.getValidationErrors()))
                .allowsEnhancement(config.isAllowEnhancement());
    }
}
