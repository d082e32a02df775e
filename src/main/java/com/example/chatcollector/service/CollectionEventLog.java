package com.example.chatcollector.service;

import com.example.chatcollector.store.StoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only history of session lifecycle events. Writing an event never fails a turn.
 */
@Component
public class CollectionEventLog {

    private static final Logger logger = LoggerFactory.getLogger(CollectionEventLog.class);

    public static final String SESSION_STARTED = "session_started";
    public static final String FIELD_COLLECTED = "field_collected";
    public static final String VALIDATION_FAILED = "validation_failed";
    public static final String CONFIRMING = "confirming";
    public static final String COMPLETED = "completed";
    public static final String CANCELLED = "cancelled";

    private final StoreClient storeClient;

    public CollectionEventLog(StoreClient storeClient) {
        this.storeClient = storeClient;
    }

    public void record(String sessionId, String type, Map<String, Object> details) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("type", type);
        if (details != null) {
            event.putAll(details);
        }
        try {
            storeClient.appendEvent(sessionId, event);
        } catch (RuntimeException e) {
            logger.warn("Could not record {} event for session {}: {}", type, sessionId, e.getMessage());
        }
    }

    public List<Map<String, Object>> events(String sessionId, int limit) {
        return storeClient.find(StoreClient.EVENTS, Map.of("sessionId", sessionId), Map.of("ts", 1), limit);
    }
}
