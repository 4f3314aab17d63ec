package com.timeBank.mapper;

import com.google.cloud.Timestamp;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.Map;

/** Lenient readers for raw Firestore field values. */
final class DocumentValues {

    private DocumentValues() {
    }

    static String getString(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value == null ? null : value.toString();
    }

    static int getInt(Map<String, Object> data, String key, int fallback) {
        Object value = data.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            return Integer.parseInt(text.trim());
        }
        return fallback;
    }

    static boolean getBoolean(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value instanceof Boolean flag) {
            return flag;
        }
        return value instanceof String text && Boolean.parseBoolean(text);
    }

    static Instant getInstant(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Timestamp timestamp) {
            return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof String text) {
            // Accepts both "2024-05-01T10:00:00Z" and "2024-05-01T10:00:00+00:00"
            return OffsetDateTime.parse(text).toInstant();
        }
        throw new IllegalArgumentException("Unsupported timestamp value for " + key + ": " + value);
    }

    static Timestamp toTimestamp(Instant instant) {
        if (instant == null) {
            return null;
        }
        return Timestamp.ofTimeSecondsAndNanos(instant.getEpochSecond(), instant.getNano());
    }
}
