package com.example.chatcollector.controller;

import com.example.chatcollector.model.CollectionConfig;
import com.example.chatcollector.model.CollectorResponse;
import com.example.chatcollector.service.CollectorService;
import lombok.Data;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP surface of the collector. Every call blocks on Redis and the generator, so work runs on
 * the bounded elastic scheduler.
 */
@RestController
@RequestMapping("/api/collector")
public class CollectorController {

    private final CollectorService collectorService;

    public CollectorController(CollectorService collectorService) {
        this.collectorService = collectorService;
    }

    @GetMapping("/configs")
    public Mono<List<String>> configs() {
        return Mono.fromCallable(collectorService::configNames)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/sessions")
    public Mono<ResponseEntity<Map<String, Object>>> start(@RequestBody StartSessionRequest request) {
        return Mono.fromCallable(() -> {
            CollectorResponse response = request.getConfig() != null
                    ? collectorService.startSession(request.getSessionId(), request.getConfig(), request.getInitialData())
                    : collectorService.startSession(request.getSessionId(), request.getConfigName(), request.getInitialData());
            return toEntity(response, HttpStatus.CREATED, HttpStatus.BAD_REQUEST);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/sessions/{sessionId}/messages")
    public Mono<ResponseEntity<Map<String, Object>>> message(@PathVariable String sessionId, @RequestBody MessageRequest request) {
        return Mono.fromCallable(() -> toEntity(collectorService.processMessage(sessionId, request.getMessage()), HttpStatus.OK, HttpStatus.NOT_FOUND))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/sessions/{sessionId}")
    public Mono<ResponseEntity<Object>> state(@PathVariable String sessionId) {
        return Mono.fromCallable(() -> collectorService.getState(sessionId)
                        .<ResponseEntity<Object>>map(ResponseEntity::ok)
                        .orElseGet(() -> ResponseEntity.notFound().build()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/sessions/{sessionId}")
    public Mono<ResponseEntity<Map<String, Object>>> delete(@PathVariable String sessionId) {
        return Mono.fromCallable(() -> {
            boolean deleted = collectorService.deleteSession(sessionId);
            Map<String, Object> body = Map.of("sessionId", sessionId, "deleted", deleted);
            return deleted ? ResponseEntity.ok(body) : ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/sessions/{sessionId}/cancel")
    public Mono<ResponseEntity<Map<String, Object>>> cancel(@PathVariable String sessionId) {
        return Mono.fromCallable(() -> toEntity(collectorService.cancel(sessionId), HttpStatus.OK, HttpStatus.NOT_FOUND))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/sessions/{sessionId}/events")
    public Mono<List<Map<String, Object>>> events(@PathVariable String sessionId) {
        return Mono.fromCallable(() -> collectorService.events(sessionId))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Extracts field values from pasted content and applies the valid ones to the session.
     */
    @PostMapping("/sessions/{sessionId}/extract")
    public Mono<ResponseEntity<Map<String, Object>>> extract(@PathVariable String sessionId, @RequestBody ExtractRequest request) {
        return Mono.fromCallable(() -> {
            Map<String, String> extracted = collectorService.extractFromContent(sessionId, request.getContent());
            Map<String, Object> body = new LinkedHashMap<>(collectorService.applyExtractedData(sessionId, extracted).toMap());
            body.put("extracted", extracted);
            return ResponseEntity.ok(body);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private static ResponseEntity<Map<String, Object>> toEntity(CollectorResponse response, HttpStatus okStatus, HttpStatus noSessionStatus) {
        Map<String, Object> body = response.toMap();
        if (response.getState() != null) {
            body.put("sessionId", response.getState().getSessionId());
        }
        if (response.isSuccess()) {
            return ResponseEntity.status(okStatus).body(body);
        }
        // a rejected value is still a normal turn
        return ResponseEntity.status(response.getState() == null ? noSessionStatus : HttpStatus.OK).body(body);
    }

    @Data
    public static class StartSessionRequest {
        private String sessionId;
        private String configName;
        private CollectionConfig config;
        private Map<String, String> initialData;
    }

    @Data
    public static class MessageRequest {
        private String message;
    }

    @Data
    public static class ExtractRequest {
        private String content;
    }
}
