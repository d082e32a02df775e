package com.example.chatcollector.locale;

import com.example.chatcollector.model.CollectionConfig;
import com.example.chatcollector.model.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.lang.Character.UnicodeScript;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Guesses a message's language from the Unicode scripts it contains.
 */
@Component
public class LocaleDetector {

    private static final Logger logger = LoggerFactory.getLogger(LocaleDetector.class);

    // checked in this order, first hit wins
    private static final Map<UnicodeScript, String> SCRIPTS = new LinkedHashMap<>();

    static {
        SCRIPTS.put(UnicodeScript.ARABIC, "ar");
        SCRIPTS.put(UnicodeScript.HAN, "zh");
        SCRIPTS.put(UnicodeScript.HIRAGANA, "ja");
        SCRIPTS.put(UnicodeScript.KATAKANA, "ja");
        SCRIPTS.put(UnicodeScript.HANGUL, "ko");
        SCRIPTS.put(UnicodeScript.CYRILLIC, "ru");
        SCRIPTS.put(UnicodeScript.GREEK, "el");
        SCRIPTS.put(UnicodeScript.HEBREW, "he");
        SCRIPTS.put(UnicodeScript.THAI, "th");
        SCRIPTS.put(UnicodeScript.DEVANAGARI, "hi");
    }

    @Value("${app.collector.default-locale:en}")
    private String defaultLocale = "en";

    public String detect(String message) {
        if (message == null || message.isEmpty()) {
            return defaultLocale;
        }
        for (Map.Entry<UnicodeScript, String> entry : SCRIPTS.entrySet()) {
            if (containsScript(message, entry.getKey())) {
                return entry.getValue();
            }
        }
        return defaultLocale;
    }

    /**
     * Records the language of a new user message on the session and returns the locale the
     * turn should use. A fixed config locale always wins; otherwise the first non-default
     * detection sticks unless the config asks for detection on every message.
     */
    public String refresh(SessionState state, CollectionConfig config, String message) {
        if (hasText(config.getLocale())) {
            state.setDetectedLocale(config.getLocale());
            return config.getLocale();
        }
        String detected = detect(message);
        if (config.isDetectLocale()) {
            if (!detected.equals(state.getDetectedLocale())) {
                logger.info("Session {} switched locale {} -> {}", state.getSessionId(), state.getDetectedLocale(), detected);
            }
            state.setDetectedLocale(detected);
        } else if (state.getDetectedLocale() == null && !detected.equals(defaultLocale)) {
            logger.info("Session {} detected locale {}", state.getSessionId(), detected);
            state.setDetectedLocale(detected);
        }
        return effective(state, config);
    }

    public String effective(SessionState state, CollectionConfig config) {
        if (config != null && hasText(config.getLocale())) {
            return config.getLocale();
        }
        if (state != null && hasText(state.getDetectedLocale())) {
            return state.getDetectedLocale();
        }
        return defaultLocale;
    }

    public String defaultLocale() {
        return defaultLocale;
    }

    public static String displayName(String tag) {
        String name = Locale.forLanguageTag(tag).getDisplayLanguage(Locale.ENGLISH);
        return name.isEmpty() ? tag : name;
    }

    private static boolean containsScript(String message, UnicodeScript script) {
        return message.codePoints().anyMatch(cp -> UnicodeScript.of(cp) == script);
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
