package com.example.chatcollector.service;

import com.example.chatcollector.model.CollectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory lookup of named collection configs. Every {@link CollectionConfig} bean is
 * registered when the context starts; more can be added at runtime.
 */
@Component
public class CollectionConfigRegistry {

    private static final Logger logger = LoggerFactory.getLogger(CollectionConfigRegistry.class);

    private final Map<String, CollectionConfig> configs = new ConcurrentHashMap<>();

    public CollectionConfigRegistry(List<CollectionConfig> declared) {
        declared.forEach(this::register);
    }

    public CollectionConfig register(CollectionConfig config) {
        config.validate();
        CollectionConfig previous = configs.put(config.getName(), config);
        logger.info("{} collection config '{}' ({} fields)", previous == null ? "Registered" : "Replaced",
                config.getName(), config.getFields().size());
        return config;
    }

    public Optional<CollectionConfig> get(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(configs.get(name));
    }

    public List<String> names() {
        List<String> names = new ArrayList<>(configs.keySet());
        names.sort(String::compareTo);
        return names;
    }
}
