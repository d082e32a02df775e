package com.example.chatcollector.store;

/**
 * Raised when a session or config record cannot be read or written. Not recoverable within a turn.
 */
public class SessionStoreException extends RuntimeException {

    public SessionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
