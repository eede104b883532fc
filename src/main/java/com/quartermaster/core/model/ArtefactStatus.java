package com.quartermaster.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Map;

/**
 * Status of a backlog artefact (task, epic or PRD).
 *
 * <p>Parsing is lenient: case, spaces, dashes and underscores are ignored and common
 * aliases ("todo", "wip", "complete", "canceled") map onto the canonical value.
 * Anything unrecognised becomes {@link #UNKNOWN}.
 */
public enum ArtefactStatus {
    NOT_STARTED("Not Started"),
    IN_PROGRESS("In Progress"),
    BLOCKED("Blocked"),
    DONE("Done"),
    CANCELLED("Cancelled"),
    AUTO_DONE("Auto-Done"),   // all known children finished, awaiting human confirmation
    DRAFT("Draft"),
    IN_REVIEW("In Review"),
    APPROVED("Approved"),
    UNKNOWN("Unknown");

    private static final Map<String, ArtefactStatus> ALIASES = Map.ofEntries(
            Map.entry("notstarted", NOT_STARTED),
            Map.entry("todo", NOT_STARTED),
            Map.entry("pending", NOT_STARTED),
            Map.entry("new", NOT_STARTED),
            Map.entry("inprogress", IN_PROGRESS),
            Map.entry("wip", IN_PROGRESS),
            Map.entry("started", IN_PROGRESS),
            Map.entry("working", IN_PROGRESS),
            Map.entry("blocked", BLOCKED),
            Map.entry("stuck", BLOCKED),
            Map.entry("autodone", AUTO_DONE),
            Map.entry("done", DONE),
            Map.entry("complete", DONE),
            Map.entry("completed", DONE),
            Map.entry("finished", DONE),
            Map.entry("cancelled", CANCELLED),
            Map.entry("canceled", CANCELLED),
            Map.entry("cancel", CANCELLED),
            Map.entry("dropped", CANCELLED),
            Map.entry("abandoned", CANCELLED),
            Map.entry("draft", DRAFT),
            Map.entry("inreview", IN_REVIEW),
            Map.entry("review", IN_REVIEW),
            Map.entry("reviewing", IN_REVIEW),
            Map.entry("approved", APPROVED)
    );

    private final String label;

    ArtefactStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static ArtefactStatus parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String key = raw.toLowerCase().replaceAll("[\\s_-]+", "");
        return ALIASES.getOrDefault(key, UNKNOWN);
    }

    /** Done or Cancelled: the task no longer blocks anything. */
    public boolean isFinished() {
        return this == DONE || this == CANCELLED;
    }

    /** Done, Cancelled or Auto-Done: counts as finished when rolling epics up into a PRD. */
    public boolean isFinishedOrAutoDone() {
        return isFinished() || this == AUTO_DONE;
    }

    /** Statuses a task may legitimately carry; epic and PRD statuses are not valid on tasks. */
    public boolean isTaskStatus() {
        return this == NOT_STARTED || this == IN_PROGRESS || this == BLOCKED || isFinished();
    }

    @Override
    public String toString() {
        return label;
    }
}
