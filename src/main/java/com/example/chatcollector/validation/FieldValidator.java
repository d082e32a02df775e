package com.example.chatcollector.validation;

import com.example.chatcollector.model.CollectionConfig;
import com.example.chatcollector.model.CollectorField;
import com.example.chatcollector.model.FieldType;
import com.example.chatcollector.model.ValidationError;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Applies the pipe separated rules of a {@link CollectorField} to a candidate value.
 * Every violated rule is reported; an empty list means the value is acceptable.
 */
@Component
public class FieldValidator {

    private static final Pattern NUMBER = Pattern.compile("^\\d+(\\.\\d+)?$");
    private static final Pattern WELL_FORMED = Pattern.compile(
            "^(required|optional|numeric|integer|email|url|string"
                    + "|(min|max):-?\\d+(\\.\\d+)?"
                    + "|between:-?\\d+(\\.\\d+)?,-?\\d+(\\.\\d+)?"
                    + "|in:[^,]+(,[^,]+)*)$");
    private static final Pattern INTEGER = Pattern.compile("^[+-]?\\d+$");
    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    public static boolean isWellFormed(String rule) {
        return rule != null && WELL_FORMED.matcher(rule.trim()).matches();
    }

    public List<ValidationError> validate(CollectorField field, String value) {
        List<ValidationError> errors = new ArrayList<>();
        String name = field.getName();
        boolean empty = value == null || value.isBlank();

        if (empty) {
            if (field.mandatory()) {
                errors.add(error(name, "required", "The " + name + " field is required."));
            }
            return errors;
        }

        String trimmed = value.trim();
        for (String rule : field.rules()) {
            String message = checkRule(field, trimmed, rule);
            if (message != null) {
                errors.add(error(name, ruleName(rule), message));
            }
        }

        if (field.getType() == FieldType.SELECT && !field.getOptions().isEmpty()
                && canonicalOption(field, trimmed) == null) {
            errors.add(error(name, "options", "The " + name + " must be one of: " + String.join(", ", field.getOptions())));
        }
        return errors;
    }

    /**
     * Validates every field of the config against the data, keyed by field name. Only fields
     * with at least one error appear in the result.
     */
    public Map<String, List<ValidationError>> validateAll(CollectionConfig config, Map<String, String> data) {
        Map<String, List<ValidationError>> out = new LinkedHashMap<>();
        for (CollectorField field : config.getFields()) {
            List<ValidationError> errors = validate(field, data.get(field.getName()));
            if (!errors.isEmpty()) {
                out.put(field.getName(), errors);
            }
        }
        return out;
    }

    /**
     * The stored form of a value: trimmed, and spelled like the declared option for select fields.
     */
    public String normalize(CollectorField field, String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (field.getType() == FieldType.SELECT) {
            String option = canonicalOption(field, trimmed);
            return option != null ? option : trimmed;
        }
        return trimmed;
    }

    private String canonicalOption(CollectorField field, String value) {
        for (String option : field.getOptions()) {
            if (option.equalsIgnoreCase(value)) {
                return option;
            }
        }
        return null;
    }

    private String checkRule(CollectorField field, String value, String rule) {
        String name = field.getName();
        String key = ruleName(rule);
        String arg = rule.contains(":") ? rule.substring(rule.indexOf(':') + 1).trim() : "";

        switch (key) {
            case "numeric":
                return parseNumber(value) == null ? "The " + name + " must be a number." : null;
            case "integer":
                return INTEGER.matcher(value).matches() ? null : "The " + name + " must be a whole number.";
            case "email":
                return EMAIL.matcher(value).matches() ? null : "The " + name + " must be a valid email address.";
            case "url":
                return isUrl(value) ? null : "The " + name + " must be a valid URL.";
            case "min":
                return checkMin(field, value, new BigDecimal(arg));
            case "max":
                return checkMax(field, value, new BigDecimal(arg));
            case "between": {
                String[] bounds = arg.split(",");
                String low = checkMin(field, value, new BigDecimal(bounds[0].trim()));
                String high = checkMax(field, value, new BigDecimal(bounds[1].trim()));
                if (low != null || high != null) {
                    return "The " + name + " must be between " + bounds[0].trim() + " and " + bounds[1].trim()
                            + (measuredByLength(field, value) ? " characters." : ".");
                }
                return null;
            }
            case "in": {
                List<String> allowed = Arrays.stream(arg.split(",")).map(String::trim).collect(Collectors.toList());
                boolean ok = allowed.stream().anyMatch(a -> a.equalsIgnoreCase(value));
                return ok ? null : "The " + name + " must be one of: " + String.join(", ", allowed);
            }
            default:
                return null;
        }
    }

    private String checkMin(CollectorField field, String value, BigDecimal min) {
        if (measuredByLength(field, value)) {
            return length(value) < min.doubleValue()
                    ? "The " + field.getName() + " must be at least " + min.toPlainString() + " characters." : null;
        }
        BigDecimal number = parseNumber(value);
        return number.compareTo(min) < 0 ? "The " + field.getName() + " must be at least " + min.toPlainString() + "." : null;
    }

    private String checkMax(CollectorField field, String value, BigDecimal max) {
        if (measuredByLength(field, value)) {
            return length(value) > max.doubleValue()
                    ? "The " + field.getName() + " must not exceed " + max.toPlainString() + " characters." : null;
        }
        BigDecimal number = parseNumber(value);
        return number.compareTo(max) > 0 ? "The " + field.getName() + " must not exceed " + max.toPlainString() + "." : null;
    }

    // numbers are compared by magnitude, everything else by length
    private boolean measuredByLength(CollectorField field, String value) {
        return !field.expectsNumber() || parseNumber(value) == null;
    }

    private static int length(String value) {
        return value.codePointCount(0, value.length());
    }

    private static BigDecimal parseNumber(String value) {
        String candidate = value.startsWith("-") || value.startsWith("+") ? value.substring(1) : value;
        if (!NUMBER.matcher(candidate).matches()) {
            return null;
        }
        return new BigDecimal(value);
    }

    private static boolean isUrl(String value) {
        try {
            URI uri = new URI(value);
            String scheme = uri.getScheme();
            return scheme != null
                    && (scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https") || scheme.equalsIgnoreCase("ftp"))
                    && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static String ruleName(String rule) {
        int colon = rule.indexOf(':');
        return (colon > 0 ? rule.substring(0, colon) : rule).trim().toLowerCase(Locale.ROOT);
    }

    private static ValidationError error(String field, String rule, String message) {
        return new ValidationError(field, rule, message);
    }
}
