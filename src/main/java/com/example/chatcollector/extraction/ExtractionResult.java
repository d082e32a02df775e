package com.example.chatcollector.extraction;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class ExtractionResult {
    private final String field;
    private final String value;
    private final ExtractionSource source;
}
