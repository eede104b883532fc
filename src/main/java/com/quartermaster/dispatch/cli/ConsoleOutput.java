package com.quartermaster.dispatch.cli;

import com.quartermaster.agent.ConflictMatrix;
import com.quartermaster.agent.SyncReport;
import com.quartermaster.core.graph.ValidationIssue;
import com.quartermaster.core.model.AgentRecord;
import com.quartermaster.core.model.Escalation;
import com.quartermaster.core.scheduler.ReadyTask;
import picocli.CommandLine;

import java.time.Duration;
import java.time.Instant;

/**
 * ANSI-colored terminal output utilities for the Quartermaster CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) QUARTERMASTER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [QM]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warning(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    /**
     * Prints an escalation as {@code BLOCKED: reason} followed by numbered next steps.
     */
    public static void escalation(Escalation escalation) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red),bold BLOCKED:|@ " + escalation.reason()));
        if (!escalation.nextSteps().isEmpty()) {
            System.out.println("  Next steps:");
            int i = 1;
            for (String step : escalation.nextSteps()) {
                System.out.println(CommandLine.Help.Ansi.AUTO.string(
                        "    @|fg(yellow) " + i++ + ".|@ " + step));
            }
        }
    }

    public static void readyTask(ReadyTask ready) {
        System.out.printf("  %-8s %-7s %-7s %-13s %s%n",
                ready.task().id(),
                ready.impact(),
                ready.criticalPathLength(),
                ready.task().status().label(),
                truncate(ready.task().title(), 40));
    }

    public static void readyHeader() {
        System.out.printf("  %-8s %-7s %-7s %-13s %s%n", "TASK", "IMPACT", "PATH", "STATUS", "TITLE");
        System.out.println("  " + "-".repeat(64));
    }

    public static void issue(ValidationIssue issue) {
        String prefix = issue.severity() == ValidationIssue.Severity.ERROR
                ? "@|fg(red) [ERROR]|@"
                : "@|fg(yellow) [WARN]|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + prefix + " " + issue.type().code() + " " + issue.message()));
    }

    public static void agentRecord(AgentRecord record) {
        String color = switch (record.status()) {
            case SPAWNED, RUNNING -> "fg(cyan)";
            case COMPLETED, REAPED -> "fg(green)";
            case ERROR, KILLED, REJECTED -> "fg(red)";
        };
        String runtime = record.spawnedAt() == null ? "-"
                : formatDuration(Duration.between(record.spawnedAt(),
                        record.endedAt() != null ? record.endedAt() : Instant.now()).toMillis());
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  %-8s @|" + color + " %-10s|@ %-8s %-8s %s",
                record.taskId(),
                record.status(),
                record.pid() == null ? "-" : record.pid(),
                runtime,
                record.hasWorktree() ? record.worktree().branch() : "-")));
    }

    public static void agentHeader() {
        System.out.printf("  %-8s %-10s %-8s %-8s %s%n", "TASK", "STATUS", "PID", "RUNTIME", "BRANCH");
        System.out.println("  " + "-".repeat(56));
    }

    public static void syncReport(SyncReport report) {
        String prefix = report.dryRun() ? "[dry run] " : "";
        if (report.inSync()) {
            success(prefix + "Agent records match the worktrees on disk");
            return;
        }
        if (!report.recovered().isEmpty()) {
            info(prefix + "Recovered " + report.recovered().size() + " orphaned worktree(s):");
            report.recovered().forEach(c -> System.out.println(
                    "  + " + c.taskId() + ": " + c.to() + " (" + c.detail() + ")"));
        }
        if (!report.updated().isEmpty()) {
            info(prefix + "Updated " + report.updated().size() + " agent(s):");
            report.updated().forEach(c -> System.out.println(
                    "  ~ " + c.taskId() + ": " + c.from() + " -> " + c.to() + " (" + c.detail() + ")"));
        }
        if (!report.missingWorktrees().isEmpty()) {
            warning(prefix + "Worktree missing for " + report.missingWorktrees().size() + " agent(s):");
            report.missingWorktrees().forEach(c -> System.out.println(
                    "  ? " + c.taskId() + ": " + c.to() + " " + c.detail() + "  (agent clear " + c.taskId() + ")"));
        }
    }

    public static void conflictMatrix(ConflictMatrix matrix) {
        info("Agents with unmerged work: " + matrix.agents().size());
        matrix.filesByAgent().forEach((taskId, files) -> {
            System.out.println("  " + taskId + ":");
            if (files.isEmpty()) {
                System.out.println("    (no changes)");
            }
            files.stream().limit(5).forEach(f -> System.out.println("    " + f));
            if (files.size() > 5) {
                System.out.println("    ... and " + (files.size() - 5) + " more");
            }
        });
        if (!matrix.hasConflicts()) {
            success("No overlapping files; the agents can be reaped in any order");
            return;
        }
        warning("Overlapping files: " + matrix.overlaps().size() + " pair(s)");
        for (ConflictMatrix.Overlap overlap : matrix.overlaps()) {
            System.out.println("  " + overlap.first() + " <-> " + overlap.second()
                    + " (" + overlap.files().size() + " file(s))");
            overlap.files().stream().limit(3).forEach(f -> System.out.println("    - " + f));
            if (overlap.files().size() > 3) {
                System.out.println("    ... and " + (overlap.files().size() - 3) + " more");
            }
        }
        System.out.println("  Suggested order (reap one at a time):");
        int i = 1;
        for (String taskId : matrix.suggestedMergeOrder()) {
            System.out.println("    " + i++ + ". agent reap " + taskId);
        }
    }

    private static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
