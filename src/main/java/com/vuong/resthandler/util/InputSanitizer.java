package com.vuong.resthandler.util;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Component for sanitizing user input before it reaches a query.
 * Removes control characters and masks sensitive values for logging.
 */
@Component
public class InputSanitizer {

    private static final int MAX_LOG_LENGTH = 1000;

    // Whole parameter names only, so sortkey= or monkey= stay readable
    private static final Pattern SENSITIVE_PARAMETER = Pattern.compile(
            "(?i)(^|[?&])(password|token|access_token|secret|client_secret|key|api_?key|access_?key)=[^&\\s]+");

    /**
     * Sanitizes a string by trimming, removing null bytes, and control characters.
     * @param input the input string to sanitize
     * @return the sanitized string, or null if input is null
     */
    public String sanitizeString(String input) {
        if (!StringUtils.hasText(input)) {
            return input;
        }

        String sanitized = input.trim();

        // Remove null bytes
        sanitized = sanitized.replace("\0", "");

        // Remove control characters
        sanitized = sanitized.replaceAll("[\\x00-\\x1F\\x7F]", "");

        return sanitized;
    }

    /**
     * Returns a copy of the filters with sanitized keys and values.
     * @param filters the map of filters to sanitize
     * @return the sanitized filters, or null if input is null
     */
    public Map<String, String> sanitizeFilters(Map<String, String> filters) {
        if (filters == null) {
            return null;
        }

        Map<String, String> sanitized = new LinkedHashMap<>();
        filters.forEach((key, value) -> sanitized.put(sanitizeString(key), sanitizeString(value)));
        return sanitized;
    }

    /**
     * Sanitizes a string for safe logging by limiting length and masking sensitive information.
     * @param input the string to sanitize for logging
     * @return the sanitized string for logging, or null if input is null
     */
    public String sanitizeForLogging(String input) {
        if (!StringUtils.hasText(input)) {
            return input;
        }

        String sanitized = input;
        if (sanitized.length() > MAX_LOG_LENGTH) {
            sanitized = sanitized.substring(0, MAX_LOG_LENGTH) + "...";
        }

        sanitized = SENSITIVE_PARAMETER.matcher(sanitized).replaceAll("$1$2=***");

        return sanitized;
    }
}
