package com.example.chatcollector.kv;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Key-value access used for session and config records. Values are opaque strings.
 */
public interface KvClient {
    Optional<String> get(String key);
    void set(String key, String value, Duration ttl);
    void del(String key);
    boolean exists(String key);
    List<String> scan(String prefix, int limit);
}
