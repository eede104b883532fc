package com.quartermaster.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a task branch is integrated into its parent branch.
 */
public enum MergeStrategy {
    MERGE,
    SQUASH,
    REBASE;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static MergeStrategy parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return MERGE;
        }
        return MergeStrategy.valueOf(raw.trim().toUpperCase());
    }
}
