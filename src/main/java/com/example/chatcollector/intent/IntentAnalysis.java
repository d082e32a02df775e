package com.example.chatcollector.intent;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class IntentAnalysis {
    private final FieldIntent intent;
    private final double confidence;
    private final String extractedValue;
    private final String reasoning;

    /**
     * Used whenever classification is unavailable: assume the whole message is the answer.
     */
    public static IntentAnalysis fallback(String message, String reasoning) {
        return new IntentAnalysis(FieldIntent.PROVIDE_VALUE, 0.5, message == null ? null : message.trim(), reasoning);
    }

    public boolean providesValue() {
        return intent == FieldIntent.PROVIDE_VALUE && extractedValue != null && !extractedValue.isBlank();
    }
}
