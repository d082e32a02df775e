package com.example.chatcollector.service;

public class InvalidCollectionConfigException extends RuntimeException {

    public InvalidCollectionConfigException(String message) {
        super(message);
    }
}
