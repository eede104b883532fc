package com.quartermaster.core.graph;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * A single problem found by {@link DependencyValidator}.
 *
 * @param type     kind of problem
 * @param severity whether the backlog is unusable ({@code ERROR}) or just untidy ({@code WARNING})
 * @param taskId   task the issue is reported on, null for cycles
 * @param related  other ids involved (the offending blocker, or the cycle path)
 * @param message  human-readable description
 */
public record ValidationIssue(
    IssueType type,
    Severity severity,
    String taskId,
    List<String> related,
    String message
) {

    public ValidationIssue {
        related = related == null ? List.of() : List.copyOf(related);
    }

    public enum Severity { ERROR, WARNING }

    public enum IssueType {
        MISSING_REF("missing_ref"),
        SELF_REF("self_ref"),
        DUPLICATE("duplicate"),
        CANCELLED_BLOCKER("cancelled_blocker"),
        INVALID_STATUS("invalid_status"),
        MISSING_EPIC("missing_epic"),
        CYCLE("cycle");

        private final String code;

        IssueType(String code) {
            this.code = code;
        }

        @JsonValue
        public String code() {
            return code;
        }
    }
}
