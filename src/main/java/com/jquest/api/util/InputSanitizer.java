package com.jquest.api.util;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Cleans query input before it reaches the filter builder and masks secrets before logging.
 */
@Component
public class InputSanitizer {

    private static final Pattern CONTROL_CHARACTERS = Pattern.compile("[\\x00-\\x1F\\x7F]");

    private static final Pattern SECRET_PARAMETER = Pattern.compile(
            "(?i)(password|token|secret|key)=[^&\\s]+");

    private static final Pattern SECRET_JSON_FIELD = Pattern.compile(
            "(?i)\"(password|token|secret)\"\\s*:\\s*\"[^\"]*\"");

    private static final int MAX_LOGGED_LENGTH = 1000;

    /**
     * Trims a value and strips control characters.
     * @param input the raw value
     * @return the cleaned value, or the input itself when it has no text
     */
    public String sanitizeString(String input) {
        if (!StringUtils.hasText(input)) {
            return input;
        }
        return CONTROL_CHARACTERS.matcher(input.trim()).replaceAll("");
    }

    /**
     * Returns a copy of the filters with every value sanitized. Keys are kept as given.
     */
    public Map<String, String> sanitizeFilters(Map<String, String> filters) {
        Map<String, String> sanitized = new LinkedHashMap<>();
        if (filters != null) {
            filters.forEach((key, value) -> sanitized.put(key, sanitizeString(value)));
        }
        return sanitized;
    }

    /**
     * Truncates a value for logging and masks passwords, tokens, secrets and keys.
     */
    public String sanitizeForLogging(String input) {
        if (!StringUtils.hasText(input)) {
            return input;
        }
        String sanitized = input;
        if (sanitized.length() > MAX_LOGGED_LENGTH) {
            sanitized = sanitized.substring(0, MAX_LOGGED_LENGTH) + "...";
        }
        sanitized = SECRET_PARAMETER.matcher(sanitized).replaceAll("$1=***");
        sanitized = SECRET_JSON_FIELD.matcher(sanitized).replaceAll("\"$1\":\"***\"");
        return sanitized;
    }
}
