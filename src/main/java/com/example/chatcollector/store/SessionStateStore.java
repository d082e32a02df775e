package com.example.chatcollector.store;

import com.example.chatcollector.kv.KvClient;
import com.example.chatcollector.model.MetadataKey;
import com.example.chatcollector.model.SessionState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Durable home of {@link SessionState} records. Each save refreshes the expiry, so an idle
 * session disappears after the configured TTL.
 */
@Component
public class SessionStateStore {

    private static final Logger logger = LoggerFactory.getLogger(SessionStateStore.class);

    private final KvClient kvClient;
    private final ObjectMapper objectMapper;

    @Value("${app.collector.key-prefix:data_collector_state_}")
    private String keyPrefix;

    @Value("${app.collector.ttl-seconds:3600}")
    private long ttlSeconds;

    public SessionStateStore(KvClient kvClient, ObjectMapper objectMapper) {
        this.kvClient = kvClient;
        this.objectMapper = objectMapper;
    }

    public Optional<SessionState> load(String sessionId) {
        Optional<String> raw;
        try {
            raw = kvClient.get(key(sessionId));
        } catch (RuntimeException e) {
            throw new SessionStoreException("Failed to read session " + sessionId, e);
        }
        if (raw.isEmpty()) {
            logger.debug("No stored state for session {}", sessionId);
            return Optional.empty();
        }
        try {
            SessionState state = objectMapper.readValue(raw.get(), SessionState.class);
            dropUnknownMetadata(state);
            return Optional.of(state);
        } catch (JsonProcessingException e) {
            throw new SessionStoreException("Corrupt state record for session " + sessionId, e);
        }
    }

    public void save(SessionState state) {
        String json;
        try {
            json = objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new SessionStoreException("Failed to encode session " + state.getSessionId(), e);
        }
        try {
            kvClient.set(key(state.getSessionId()), json, Duration.ofSeconds(ttlSeconds));
        } catch (RuntimeException e) {
            throw new SessionStoreException("Failed to write session " + state.getSessionId(), e);
        }
        logger.debug("Saved session {} (status={})", state.getSessionId(), state.getStatus());
    }

    public void delete(String sessionId) {
        try {
            kvClient.del(key(sessionId));
        } catch (RuntimeException e) {
            throw new SessionStoreException("Failed to delete session " + sessionId, e);
        }
    }

    public boolean exists(String sessionId) {
        try {
            return kvClient.exists(key(sessionId));
        } catch (RuntimeException e) {
            throw new SessionStoreException("Failed to look up session " + sessionId, e);
        }
    }

    private void dropUnknownMetadata(SessionState state) {
        state.getMetadata().keySet().removeIf(k -> {
            if (MetadataKey.isKnown(k)) {
                return false;
            }
            logger.warn("Dropping unknown metadata key '{}' from session {}", k, state.getSessionId());
            return true;
        });
    }

    private String key(String sessionId) {
        return keyPrefix + sessionId;
    }
}
