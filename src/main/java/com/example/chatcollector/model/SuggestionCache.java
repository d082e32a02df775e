package com.example.chatcollector.model;

import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Suggestions offered for one field, kept so a later "2" can pick one of them.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SuggestionCache {
    private String field;
    private String text;
    @Builder.Default
    private List<String> items = new ArrayList<>();
}
