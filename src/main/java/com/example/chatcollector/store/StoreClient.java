package com.example.chatcollector.store;

import java.util.List;
import java.util.Map;

/**
 * Document store holding the append-only session event history.
 */
public interface StoreClient {
    String EVENTS = "events";

    List<Map<String,Object>> find(String collection, Map<String,Object> filter, Map<String,Integer> sort, Integer limit);
    void appendEvent(String sessionId, Map<String,Object> event);
}
