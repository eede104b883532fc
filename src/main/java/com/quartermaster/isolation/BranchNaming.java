package com.quartermaster.isolation;

/**
 * Branch names are pure functions of artefact ids.
 */
public final class BranchNaming {

    private BranchNaming() {}

    public static String taskBranch(String taskId) {
        return "task/" + taskId;
    }

    public static String epicBranch(String epicId) {
        return "epic/" + epicId;
    }

    public static String prdBranch(String prdId) {
        return "prd/" + prdId;
    }

    /** Scratch branch suggested for resolving conflicts by hand. */
    public static String mergeBranch(String sourceId, String targetBranch) {
        return "merge/" + sourceId + "-to-" + targetBranch;
    }
}
