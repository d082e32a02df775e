package com.example.chatcollector.service;

import java.util.Map;

/**
 * Invoked once when a session completes successfully. The returned value is handed back to
 * the caller untouched.
 */
@FunctionalInterface
public interface CompletionCallback {

    String GENERATED_OUTPUT_KEY = "_generated_output";

    Object onComplete(Map<String, Object> data);
}
