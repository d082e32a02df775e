package com.example.chatcollector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChatCollectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatCollectorApplication.class, args);
    }
}
