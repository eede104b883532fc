package com.quartermaster.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How many ancestor branches sit between a task branch and the main branch.
 *
 * <ul>
 *   <li>{@link #FLAT}: main → task</li>
 *   <li>{@link #EPIC}: main → epic → task</li>
 *   <li>{@link #PRD}: main → prd → epic → task</li>
 * </ul>
 */
public enum BranchingStrategy {
    FLAT,
    EPIC,
    PRD;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static BranchingStrategy parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return FLAT;
        }
        return switch (raw.trim().toLowerCase()) {
            case "epic" -> EPIC;
            case "prd" -> PRD;
            case "flat" -> FLAT;
            default -> throw new IllegalArgumentException("Unknown branching strategy: " + raw);
        };
    }
}
