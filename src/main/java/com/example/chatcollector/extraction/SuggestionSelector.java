package com.example.chatcollector.extraction;

import com.example.chatcollector.model.SuggestionCache;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a bare number reply ("2" or "2.") into the matching entry of the last suggestion list.
 */
@Component
public class SuggestionSelector {

    private static final Pattern BARE_NUMBER = Pattern.compile("^(\\d+)\\.?$");
    private static final Pattern NUMBERED_LINE = Pattern.compile("^\\s*(?:[-*]\\s*)?(?:\\*\\*)?(\\d+)[.:)\\-]\\s*(.+)$");

    public Optional<String> select(String message, SuggestionCache cache, String currentField) {
        if (cache == null || currentField == null || !currentField.equals(cache.getField()) || message == null) {
            return Optional.empty();
        }
        Matcher m = BARE_NUMBER.matcher(message.trim());
        if (!m.matches()) {
            return Optional.empty();
        }
        int index = Integer.parseInt(m.group(1)) - 1;
        List<String> items = cache.getItems().isEmpty() ? parseItems(cache.getText()) : cache.getItems();
        if (index < 0 || index >= items.size()) {
            return Optional.empty();
        }
        return Optional.of(items.get(index));
    }

    /**
     * Numbered entries of a suggestion text, in order, with any markdown bold markers removed.
     */
    public List<String> parseItems(String text) {
        List<String> items = new ArrayList<>();
        if (text == null) {
            return items;
        }
        for (String line : text.split("\\R")) {
            Matcher m = NUMBERED_LINE.matcher(line);
            if (m.matches()) {
                String item = m.group(2).replace("**", "").trim();
                if (!item.isEmpty()) {
                    items.add(item);
                }
            }
        }
        return items;
    }
}
