package com.example.chatcollector.mcp;

import com.example.chatcollector.model.CollectionStatus;
import com.example.chatcollector.model.CollectorResponse;
import com.example.chatcollector.model.SessionState;
import com.example.chatcollector.service.CollectorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CollectorToolsTest {

    @Mock
    private CollectorService collectorService;

    private CollectorTools tools;

    @BeforeEach
    void setUp() {
        tools = new CollectorTools(collectorService);
    }

    @Test
    void testCollectorMessage_AddsSessionId() {
        // Given
        SessionState state = SessionState.builder().sessionId("s-1").configName("course").currentField("duration").build();
        CollectorResponse response = CollectorResponse.builder()
                .success(true)
                .message("Please provide the duration")
                .state(state)
                .currentField("duration")
                .build();
        when(collectorService.processMessage("s-1", "Java 101")).thenReturn(response);

        // When
        Map<String, Object> result = tools.collector_message("s-1", "Java 101");

        // Then
        assertEquals("s-1", result.get("sessionId"));
        assertEquals("collecting", result.get("status"));
        assertEquals("duration", result.get("currentField"));
    }

    @Test
    void testCollectorStart_FailureHasNoSessionId() {
        when(collectorService.startSession(null, "nope", null))
                .thenReturn(CollectorResponse.failure("Configuration not found.", null));

        Map<String, Object> result = tools.collector_start("nope", null, null);

        assertEquals(false, result.get("success"));
        assertFalse(result.containsKey("sessionId"));
    }

    @Test
    void testCollectorState() {
        SessionState state = SessionState.builder().sessionId("s-2").configName("course").status(CollectionStatus.CONFIRMING).build();
        state.putValue("name", "Java 101");
        when(collectorService.getState("s-2")).thenReturn(Optional.of(state));
        when(collectorService.getState("missing")).thenReturn(Optional.empty());

        Map<String, Object> found = tools.collector_state("s-2");
        Map<String, Object> missing = tools.collector_state("missing");

        assertEquals("confirming", found.get("status"));
        assertEquals(Map.of("name", "Java 101"), found.get("data"));
        assertEquals(false, missing.get("found"));
    }

    @Test
    void testCollectorConfigs() {
        when(collectorService.configNames()).thenReturn(List.of("course_creator", "customer_feedback"));

        Map<String, Object> result = tools.collector_configs();

        assertEquals(2, result.get("count"));
    }
}
