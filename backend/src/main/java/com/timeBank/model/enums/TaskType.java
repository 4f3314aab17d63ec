package com.timeBank.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * OFFER: the creator performs the task for others.
 * REQUEST: the creator pays credits for the task to be performed.
 */
public enum TaskType {
    OFFER,
    REQUEST;

    @JsonValue
    public String toValue() {
        return this.name().toLowerCase();
    }

    @JsonCreator
    public static TaskType fromValue(String value) {
        if (value == null)
            return null;
        return lookup(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown task type: " + value));
    }

    public static Optional<TaskType> lookup(String value) {
        if (value == null)
            return Optional.empty();
        return switch (value) {
            case "offer" -> Optional.of(OFFER);
            case "request" -> Optional.of(REQUEST);
            default -> Optional.empty();
        };
    }
}
