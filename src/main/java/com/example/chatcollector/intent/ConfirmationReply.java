package com.example.chatcollector.intent;

public enum ConfirmationReply {
    CONFIRM,
    REJECT,
    OTHER
}
