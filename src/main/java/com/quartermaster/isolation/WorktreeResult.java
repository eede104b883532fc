package com.quartermaster.isolation;

import com.quartermaster.core.model.WorktreeInfo;

/**
 * Result of a worktree operation.
 */
public record WorktreeResult(boolean success, WorktreeInfo worktree, String error) {

    public static WorktreeResult success(WorktreeInfo worktree) {
        return new WorktreeResult(true, worktree, null);
    }

    public static WorktreeResult failure(String error) {
        return new WorktreeResult(false, null, error);
    }
}
