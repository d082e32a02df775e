package com.example.chatcollector.locale;

import org.springframework.context.MessageSource;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * User-facing texts from {@code messages*.properties}. Locales without a bundle fall back to English.
 */
@Component
public class CollectorMessages {

    private final MessageSource messageSource;

    public CollectorMessages(MessageSource messageSource) {
        this.messageSource = messageSource;
    }

    public String get(String locale, String key, Object... args) {
        Locale target = locale == null || locale.isBlank() ? Locale.ENGLISH : Locale.forLanguageTag(locale);
        return messageSource.getMessage(key, args, target);
    }
}
