package com.example.chatcollector.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ToolRegistrationConfig {

    private final CollectorTools collectorTools;

    public ToolRegistrationConfig(CollectorTools collectorTools) {
        this.collectorTools = collectorTools;
    }

    @Bean
    public ToolCallbackProvider collectorToolCallbacks() {
        return MethodToolCallbackProvider.builder()
                .toolObjects(collectorTools)
                .build();
    }
}
