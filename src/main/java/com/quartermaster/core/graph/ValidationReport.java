package com.quartermaster.core.graph;

import java.util.List;

/**
 * Result of a dependency validation run.
 *
 * @param issues       everything found, errors before warnings
 * @param tasksChecked number of tasks examined
 */
public record ValidationReport(List<ValidationIssue> issues, int tasksChecked) {

    public ValidationReport {
        issues = List.copyOf(issues);
    }

    public List<ValidationIssue> errors() {
        return issues.stream().filter(i -> i.severity() == ValidationIssue.Severity.ERROR).toList();
    }

    public List<ValidationIssue> warnings() {
        return issues.stream().filter(i -> i.severity() == ValidationIssue.Severity.WARNING).toList();
    }

    /** True when there are no errors; warnings do not invalidate a backlog. */
    public boolean isValid() {
        return errors().isEmpty();
    }
}
