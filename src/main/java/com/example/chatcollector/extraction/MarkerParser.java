package com.example.chatcollector.extraction;

import com.example.chatcollector.model.CollectionConfig;
import com.example.chatcollector.model.CollectorField;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the machine markers a generated reply may carry: {@code FIELD_COLLECTED:name=value},
 * {@code **Label**: value} summary lines and the completion / cancellation signals.
 */
@Component
public class MarkerParser {

    public static final String COMPLETE_SIGNAL = "DATA_COLLECTION_COMPLETE";
    public static final String CANCEL_SIGNAL = "DATA_COLLECTION_CANCELLED";

    private static final Pattern MARKER = Pattern.compile("FIELD_COLLECTED:(\\w+)=(.+?)(?=\\n|FIELD_COLLECTED:|$)", Pattern.DOTALL);
    private static final Pattern LABELLED = Pattern.compile("\\*\\*([^*:]+):?\\*\\*:?\\s*(.+?)(?=\\n|$)");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");

    private static final Map<String, String> SYNONYMS = Map.of(
            "title", "name",
            "course name", "name",
            "difficulty", "level",
            "difficulty level", "level",
            "lessons", "lessons_count",
            "number of lessons", "lessons_count",
            "lesson count", "lessons_count");

    public Map<String, String> markers(String response) {
        Map<String, String> out = new LinkedHashMap<>();
        if (response == null) {
            return out;
        }
        Matcher m = MARKER.matcher(response);
        while (m.find()) {
            String value = m.group(2).trim();
            if (!value.isEmpty()) {
                out.put(m.group(1), value);
            }
        }
        return out;
    }

    /**
     * Maps {@code **Label**: value} lines to field names using field names, descriptions and a
     * few common synonyms. Unknown labels are ignored.
     */
    public Map<String, String> labelledValues(String response, CollectionConfig config) {
        Map<String, String> out = new LinkedHashMap<>();
        if (response == null) {
            return out;
        }
        Matcher m = LABELLED.matcher(response);
        while (m.find()) {
            String field = fieldForLabel(m.group(1), config);
            String value = m.group(2).trim();
            if (field != null && !value.isEmpty()) {
                out.put(field, value);
            }
        }
        return out;
    }

    public String clean(String response) {
        if (response == null) {
            return "";
        }
        String clean = MARKER.matcher(response).replaceAll("");
        clean = clean.replace(COMPLETE_SIGNAL, "").replace(CANCEL_SIGNAL, "");
        clean = BLANK_LINES.matcher(clean).replaceAll("\n\n");
        return clean.trim();
    }

    public boolean signalsCompletion(String response) {
        return response != null && response.contains(COMPLETE_SIGNAL);
    }

    public boolean signalsCancellation(String response) {
        return response != null && response.contains(CANCEL_SIGNAL);
    }

    private String fieldForLabel(String rawLabel, CollectionConfig config) {
        String label = rawLabel.trim().toLowerCase(Locale.ROOT);
        for (CollectorField f : config.getFields()) {
            String name = f.getName().toLowerCase(Locale.ROOT);
            if (label.equals(name) || label.equals(name.replace('_', ' '))
                    || label.equals(f.getDescription().trim().toLowerCase(Locale.ROOT))) {
                return f.getName();
            }
        }
        String synonym = SYNONYMS.get(label);
        if (synonym != null && config.field(synonym).isPresent()) {
            return synonym;
        }
        return null;
    }
}
