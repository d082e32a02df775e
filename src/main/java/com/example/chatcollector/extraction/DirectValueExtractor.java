package com.example.chatcollector.extraction;

import com.example.chatcollector.model.CollectorField;
import com.example.chatcollector.model.FieldType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last-resort extraction: treat the user's own message as the answer, with type-aware heuristics.
 */
@Component
public class DirectValueExtractor {

    private static final Logger logger = LoggerFactory.getLogger(DirectValueExtractor.class);
    private static final Pattern FIRST_NUMBER = Pattern.compile("(\\d+(?:\\.\\d+)?)");

    public Optional<String> extract(String message, CollectorField field) {
        if (message == null || field == null) {
            return Optional.empty();
        }
        String value = message.trim();

        if (field.getType() == FieldType.SELECT && !field.getOptions().isEmpty()) {
            String lower = value.toLowerCase(Locale.ROOT);
            for (String option : field.getOptions()) {
                if (lower.contains(option.toLowerCase(Locale.ROOT))) {
                    logger.debug("Direct extraction matched option '{}' for {}", option, field.getName());
                    return Optional.of(option);
                }
            }
        }

        if (field.expectsNumber()) {
            Matcher m = FIRST_NUMBER.matcher(value);
            if (m.find()) {
                return Optional.of(m.group(1));
            }
        }

        if (value.codePointCount(0, value.length()) >= 2 && !value.endsWith("?")) {
            return Optional.of(value);
        }
        logger.debug("Direct extraction rejected message for {} ({})", field.getName(),
                value.endsWith("?") ? "looks like a question" : "too short");
        return Optional.empty();
    }
}
