package com.example.chatcollector.controller;

import com.example.chatcollector.kv.KvClient;
import com.example.chatcollector.store.StoreClient;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final KvClient kvClient;
    private final StoreClient storeClient;

    public HealthController(KvClient kvClient, StoreClient storeClient) {
        this.kvClient = kvClient;
        this.storeClient = storeClient;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "UP");
        health.put("service", "chat-collector");

        // session store
        try {
            kvClient.exists("health-check");
            health.put("redis", "UP");
        } catch (RuntimeException e) {
            health.put("redis", "DOWN");
            health.put("redisError", e.getMessage());
        }

        // event log
        try {
            storeClient.find(StoreClient.EVENTS, Map.of(), null, 1);
            health.put("mongodb", "UP");
        } catch (RuntimeException e) {
            health.put("mongodb", "DOWN");
            health.put("mongodbError", e.getMessage());
        }

        return ResponseEntity.ok(health);
    }
}
