package com.timeBank.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum TaskStatus {
    OPEN,
    ASSIGNED,
    VALIDATED,
    NEEDS_REVIEW;

    /** Value stored in Firestore and sent on the wire ("open", "needs_review", ...) */
    @JsonValue
    public String toValue() {
        return this.name().toLowerCase();
    }

    @JsonCreator
    public static TaskStatus fromValue(String value) {
        if (value == null)
            return null;
        return lookup(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown task status: " + value));
    }

    /** Empty for values no task can have, e.g. a query filter like "cancelled" */
    public static Optional<TaskStatus> lookup(String value) {
        if (value == null)
            return Optional.empty();
        return switch (value) {
            case "open" -> Optional.of(OPEN);
            case "assigned" -> Optional.of(ASSIGNED);
            case "validated" -> Optional.of(VALIDATED);
            case "needs_review" -> Optional.of(NEEDS_REVIEW);
            default -> Optional.empty();
        };
    }

    /** A task carries an assignee exactly when its status allows one */
    public boolean allowsAssignee() {
        return this != OPEN;
    }

    /** No lifecycle transition leaves these states */
    public boolean isTerminal() {
        return this == VALIDATED || this == NEEDS_REVIEW;
    }
}
