package com.quartermaster.isolation;

/**
 * Hierarchy level that has just been completed, driving which upward merges happen.
 */
public enum SyncLevel {
    /** An epic completed: merge the epic branch into its PRD branch. */
    EPIC,
    /** A PRD completed: merge epic into PRD, then PRD into main. */
    PRD
}
