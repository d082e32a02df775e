package com.example.chatcollector.store;

import com.example.chatcollector.kv.KvClient;
import com.example.chatcollector.model.CollectionConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Keeps inline configs alive across restarts so sessions started with them can still be resolved.
 */
@Component
public class ConfigStore {

    private static final Logger logger = LoggerFactory.getLogger(ConfigStore.class);
    private static final String CONFIG_SEGMENT = "config_";

    private final KvClient kvClient;
    private final ObjectMapper objectMapper;

    @Value("${app.collector.key-prefix:data_collector_state_}")
    private String keyPrefix;

    @Value("${app.collector.ttl-seconds:3600}")
    private long ttlSeconds;

    public ConfigStore(KvClient kvClient, ObjectMapper objectMapper) {
        this.kvClient = kvClient;
        this.objectMapper = objectMapper;
    }

    public void save(CollectionConfig config) {
        try {
            kvClient.set(key(config.getName()), objectMapper.writeValueAsString(config), Duration.ofSeconds(ttlSeconds));
        } catch (JsonProcessingException e) {
            throw new SessionStoreException("Failed to encode config " + config.getName(), e);
        } catch (RuntimeException e) {
            throw new SessionStoreException("Failed to write config " + config.getName(), e);
        }
        logger.debug("Saved config {}", config.getName());
    }

    public Optional<CollectionConfig> load(String name) {
        try {
            Optional<String> raw = kvClient.get(key(name));
            if (raw.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(raw.get(), CollectionConfig.class));
        } catch (JsonProcessingException e) {
            throw new SessionStoreException("Corrupt config record " + name, e);
        } catch (RuntimeException e) {
            throw new SessionStoreException("Failed to read config " + name, e);
        }
    }

    public List<String> names(int limit) {
        String prefix = keyPrefix + CONFIG_SEGMENT;
        try {
            return kvClient.scan(prefix, limit).stream()
                    .map(k -> k.substring(prefix.length()))
                    .collect(Collectors.toList());
        } catch (RuntimeException e) {
            throw new SessionStoreException("Failed to list stored configs", e);
        }
    }

    private String key(String name) {
        return keyPrefix + CONFIG_SEGMENT + name;
    }
}
