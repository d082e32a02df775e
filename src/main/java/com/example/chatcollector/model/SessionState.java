package com.example.chatcollector.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The mutable record of one conversation, keyed by {@link #sessionId}.
 * Only the collector flow writes {@link #collectedData} and {@link #status}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionState {
    private String sessionId;
    private String configName;
    @Builder.Default
    private CollectionStatus status = CollectionStatus.COLLECTING;
    @Builder.Default
    private Map<String, String> collectedData = new LinkedHashMap<>();
    private String currentField;
    @Builder.Default
    private Map<String, List<ValidationError>> validationErrors = new LinkedHashMap<>();
    @Builder.Default
    private List<ChatTurn> messageHistory = new ArrayList<>();
    private String detectedLocale;
    private SuggestionCache lastSuggestions;
    private String confirmedActionSummary;
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();
    private CollectionConfig embeddedConfig;
    private String lastAssistantMessage;
    private Instant startedAt;
    private Instant completedAt;

    public boolean hasValue(String field) {
        return CollectionConfig.hasValue(collectedData, field);
    }

    public void putValue(String field, String value) {
        collectedData.put(field, value);
        validationErrors.remove(field);
    }

    public void addMessage(String role, String content) {
        messageHistory.add(new ChatTurn(role, content, Instant.now()));
        if ("assistant".equals(role)) {
            lastAssistantMessage = content;
        }
    }

    public void changeStatus(CollectionStatus next) {
        this.status = next;
        if (next.isTerminal()) {
            this.completedAt = Instant.now();
        }
    }

    public void putMetadata(MetadataKey key, Object value) {
        if (value == null) {
            metadata.remove(key.key());
        } else {
            metadata.put(key.key(), value);
        }
    }

    public Object metadataValue(MetadataKey key) {
        return metadata.get(key.key());
    }

    public String pendingFieldUpdate() {
        Object value = metadataValue(MetadataKey.PENDING_FIELD_UPDATE);
        return value == null ? null : value.toString();
    }

    public List<String> metadataList(MetadataKey key) {
        Object value = metadataValue(key);
        List<String> out = new ArrayList<>();
        if (value instanceof List<?>) {
            for (Object item : (List<?>) value) {
                out.add(String.valueOf(item));
            }
        }
        return out;
    }

    public void appendMetadata(MetadataKey key, String item) {
        List<String> items = metadataList(key);
        items.add(item);
        putMetadata(key, items);
    }
}
