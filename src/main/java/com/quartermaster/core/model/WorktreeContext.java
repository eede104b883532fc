package com.quartermaster.core.model;

/**
 * Position of a task in the branch hierarchy.
 *
 * @param prdId     owning PRD, may be null in flat mode
 * @param epicId    owning epic, may be null in flat mode
 * @param branching branch hierarchy to use
 */
public record WorktreeContext(String prdId, String epicId, BranchingStrategy branching) {

    public WorktreeContext {
        branching = branching == null ? BranchingStrategy.FLAT : branching;
    }

    public static WorktreeContext flat() {
        return new WorktreeContext(null, null, BranchingStrategy.FLAT);
    }
}
