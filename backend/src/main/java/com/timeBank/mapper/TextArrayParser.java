package com.timeBank.mapper;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Decodes the textual array form some clients and older rows store list fields in:
 * {@code {skill one,"skill two"}}. Braces are optional, elements are comma separated,
 * and each element is trimmed and unwrapped from double quotes.
 */
public final class TextArrayParser {

    private TextArrayParser() {
        // Utility class - prevent instantiation
    }

    /**
     * Parses the brace-delimited form.
     *
     * @param text raw value, may be null
     * @return decoded elements in input order, never null
     */
    public static List<String> parse(String text) {
        List<String> result = new ArrayList<>();
        if (text == null) {
            return result;
        }
        String body = stripChars(text.trim(), '{', '}');
        if (body.isBlank()) {
            return result;
        }
        for (String part : body.split(",")) {
            String element = stripChars(part.trim(), '"', '"');
            if (!element.isBlank()) {
                result.add(element);
            }
        }
        return result;
    }

    /**
     * Accepts either a native list or the textual form.
     *
     * @throws IllegalArgumentException for any other value type
     */
    public static List<String> decode(Object raw) {
        if (raw == null) {
            return new ArrayList<>();
        }
        if (raw instanceof String text) {
            return parse(text);
        }
        if (raw instanceof Collection<?> items) {
            List<String> result = new ArrayList<>();
            for (Object item : items) {
                if (item != null) {
                    result.add(item.toString().trim());
                }
            }
            return result;
        }
        throw new IllegalArgumentException("Unsupported list value: " + raw.getClass().getSimpleName());
    }

    private static String stripChars(String value, char leading, char trailing) {
        int start = 0;
        int end = value.length();
        while (start < end && (value.charAt(start) == leading || value.charAt(start) == trailing)) {
            start++;
        }
        while (end > start && (value.charAt(end - 1) == leading || value.charAt(end - 1) == trailing)) {
            end--;
        }
        return value.substring(start, end);
    }
}
