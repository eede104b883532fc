package com.quartermaster.core.model;

import java.io.Serializable;

/**
 * Worktree bound to an agent record.
 *
 * @param path       absolute path of the worktree directory
 * @param branch     task branch checked out in the worktree
 * @param baseBranch branch the task branch was created from and merges back into
 * @param branching  hierarchy the branch belongs to
 */
public record WorktreeInfo(
    String path,
    String branch,
    String baseBranch,
    BranchingStrategy branching
) implements Serializable {}
