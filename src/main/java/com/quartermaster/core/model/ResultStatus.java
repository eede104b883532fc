package com.quartermaster.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome an agent reports in its {@code result.yaml}. Anything but {@code completed}
 * leaves the task Blocked.
 *
 * <p>Only a missing status or {@code completed} counts as success; an unrecognised value
 * is read as {@link #BLOCKED} so a typo never marks a task Done.
 */
public enum ResultStatus {
    COMPLETED,
    BLOCKED,
    FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ResultStatus parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return COMPLETED;
        }
        return switch (raw.trim().toLowerCase()) {
            case "completed" -> COMPLETED;
            case "failed", "error" -> FAILED;
            default -> BLOCKED;
        };
    }

    public boolean isSuccess() {
        return this == COMPLETED;
    }
}
