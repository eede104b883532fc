package com.quartermaster.agent;

import com.quartermaster.core.model.AgentStatus;

import java.util.List;

/**
 * What {@link AgentLifecycleManager#sync(boolean)} found, and changed unless it was a dry run.
 *
 * @param dryRun           whether the store was left untouched
 * @param recovered        worktrees on disk that had no record
 * @param updated          active records whose process was gone
 * @param missingWorktrees records pointing at a worktree directory that no longer exists
 */
public record SyncReport(boolean dryRun, List<Change> recovered, List<Change> updated,
                         List<Change> missingWorktrees) {

    public SyncReport {
        recovered = List.copyOf(recovered);
        updated = List.copyOf(updated);
        missingWorktrees = List.copyOf(missingWorktrees);
    }

    /**
     * @param from   status before the sync, null for a recovered worktree
     * @param to     status after the sync
     * @param detail short note for the operator
     */
    public record Change(String taskId, AgentStatus from, AgentStatus to, String detail) {}

    public boolean inSync() {
        return recovered.isEmpty() && updated.isEmpty() && missingWorktrees.isEmpty();
    }
}
