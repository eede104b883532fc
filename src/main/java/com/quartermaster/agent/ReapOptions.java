package com.quartermaster.agent;

import com.quartermaster.core.model.MergeStrategy;

/**
 * Options for reaping; null fields fall back to configuration or the spawn-time choice.
 *
 * @param waitForCompletion block until the agent finishes instead of escalating
 * @param timeoutSeconds    how long to block when waiting
 * @param cleanupWorktree   remove worktree and branch after a successful merge
 * @param mergeStrategy     overrides the strategy recorded at spawn
 */
public record ReapOptions(
    boolean waitForCompletion,
    int timeoutSeconds,
    Boolean cleanupWorktree,
    MergeStrategy mergeStrategy
) {

    public static final int DEFAULT_TIMEOUT_SECONDS = 300;

    public static ReapOptions defaults() {
        return new ReapOptions(true, DEFAULT_TIMEOUT_SECONDS, null, null);
    }

    public static ReapOptions nonBlocking() {
        return new ReapOptions(false, 0, null, null);
    }
}
