package com.example.chatcollector.service;

import com.example.chatcollector.model.CollectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Picks the callback for a completed session: the config's own callback, then the bean named
 * by {@link CollectionConfig#getCompletionAction()}, then one that echoes the data back.
 */
@Component
public class CompletionCallbackResolver {

    private static final Logger logger = LoggerFactory.getLogger(CompletionCallbackResolver.class);

    static final CompletionCallback ECHO = data -> data;

    private final Map<String, CompletionCallback> callbacks;

    public CompletionCallbackResolver(Map<String, CompletionCallback> callbacks) {
        this.callbacks = callbacks;
    }

    public CompletionCallback resolve(CollectionConfig config) {
        if (config.getCompletionCallback() != null) {
            return config.getCompletionCallback();
        }
        String action = config.getCompletionAction();
        if (action != null && !action.isBlank()) {
            CompletionCallback named = callbacks.get(action);
            if (named != null) {
                return named;
            }
            logger.warn("No completion callback bean named '{}' for config '{}', echoing data", action, config.getName());
        }
        return ECHO;
    }
}
