package com.example.chatcollector.model;

import lombok.*;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatTurn {
    private String role; // user | assistant
    private String content;
    private Instant timestamp;
}
