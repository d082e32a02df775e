package com.example.chatcollector.service;

import com.example.chatcollector.model.CollectionStatus;
import com.example.chatcollector.model.CollectorResponse;
import com.example.chatcollector.model.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class CancellationHandler {

    private static final Logger logger = LoggerFactory.getLogger(CancellationHandler.class);

    private static final List<String> CANCEL_PHRASES = List.of("cancel", "stop", "quit", "exit", "abort", "nevermind", "never mind",
            "إلغاء", "الغاء", "توقف");

    private final CollectionEventLog eventLog;

    public CancellationHandler(CollectionEventLog eventLog) {
        this.eventLog = eventLog;
    }

    /**
     * Exact phrase, or phrase followed by more words ("cancel this please").
     */
    public boolean isCancellationRequest(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.trim().toLowerCase(Locale.ROOT);
        for (String phrase : CANCEL_PHRASES) {
            if (lower.equals(phrase) || lower.startsWith(phrase + " ")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Marks the session cancelled. Collected values are left as they are.
     */
    public CollectorResponse cancel(TurnContext ctx) {
        SessionState state = ctx.getState();
        CollectionStatus previous = state.getStatus();
        state.changeStatus(CollectionStatus.CANCELLED);
        logger.info("Session {} cancelled while {}", state.getSessionId(), previous.value());
        eventLog.record(state.getSessionId(), CollectionEventLog.CANCELLED, Map.of("from", previous.value()));

        String cancelMessage = ctx.getConfig().getCancelMessage();
        return ctx.response()
                .message(cancelMessage == null || cancelMessage.isBlank() ? ctx.text("cancel.default") : cancelMessage)
                .cancelled(true)
                .allowsEnhancement(false)
                .build();
    }
}
