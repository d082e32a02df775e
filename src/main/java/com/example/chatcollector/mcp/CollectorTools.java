package com.example.chatcollector.mcp;

import com.example.chatcollector.model.CollectorResponse;
import com.example.chatcollector.model.SessionState;
import com.example.chatcollector.service.CollectorService;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class CollectorTools {

    private final CollectorService collectorService;

    public CollectorTools(CollectorService collectorService) {
        this.collectorService = collectorService;
    }

    @Tool(description = "Start a data collection session for a registered config; returns the greeting and session id")
    public Map<String, Object> collector_start(String configName, String sessionId, Map<String, String> initialData) {
        return withSessionId(collectorService.startSession(sessionId, configName, initialData));
    }

    @Tool(description = "Send the user's message to a collection session and get the assistant's reply")
    public Map<String, Object> collector_message(String sessionId, String message) {
        return withSessionId(collectorService.processMessage(sessionId, message));
    }

    @Tool(description = "Get the collected data, status and current field of a session")
    public Map<String, Object> collector_state(String sessionId) {
        Optional<SessionState> state = collectorService.getState(sessionId);
        if (state.isEmpty()) {
            return Map.of("sessionId", sessionId, "found", false);
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("sessionId", sessionId);
        out.put("found", true);
        out.put("status", state.get().getStatus().value());
        out.put("configName", state.get().getConfigName());
        out.put("currentField", state.get().getCurrentField());
        out.put("data", state.get().getCollectedData());
        return out;
    }

    @Tool(description = "Cancel a collection session")
    public Map<String, Object> collector_cancel(String sessionId) {
        return withSessionId(collectorService.cancel(sessionId));
    }

    @Tool(description = "List the names of available collection configs")
    public Map<String, Object> collector_configs() {
        List<String> names = collectorService.configNames();
        return Map.of("configs", names, "count", names.size());
    }

    private static Map<String, Object> withSessionId(CollectorResponse response) {
        Map<String, Object> out = response.toMap();
        if (response.getState() != null) {
            out.put("sessionId", response.getState().getSessionId());
        }
        return out;
    }
}
