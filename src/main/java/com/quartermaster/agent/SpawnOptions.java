package com.quartermaster.agent;

import com.quartermaster.core.model.MergeStrategy;

/**
 * Per-spawn overrides; null fields fall back to configuration.
 *
 * @param timeoutSeconds run timeout recorded for the agent
 * @param instruction    instruction text, instead of one derived from the task
 * @param useWorktrees   run in an isolated worktree
 * @param mergeStrategy  strategy the agent's work is reaped with
 */
public record SpawnOptions(
    Integer timeoutSeconds,
    String instruction,
    Boolean useWorktrees,
    MergeStrategy mergeStrategy
) {

    public static SpawnOptions defaults() {
        return new SpawnOptions(null, null, null, null);
    }
}
