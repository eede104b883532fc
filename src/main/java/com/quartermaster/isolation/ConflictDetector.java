package com.quartermaster.isolation;

/**
 * Predicts whether merging one branch into another would conflict, without touching the
 * index, the work tree or any ref.
 */
public interface ConflictDetector {

    /**
     * @param targetBranch branch that would receive the merge
     * @param sourceBranch branch that would be merged
     */
    ConflictReport detectConflicts(String targetBranch, String sourceBranch);
}
