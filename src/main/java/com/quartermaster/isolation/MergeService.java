package com.quartermaster.isolation;

import com.quartermaster.core.model.MergeStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Moves an agent's work from its worktree into the target branch.
 *
 * <p>Callers must serialise merges into the same target branch; this class takes no locks.
 */
public class MergeService {

    private static final Logger log = LoggerFactory.getLogger(MergeService.class);

    private final GitCommandRunner git;
    private final ConflictDetector conflictDetector;

    public MergeService(GitCommandRunner git, ConflictDetector conflictDetector) {
        this.git = git;
        this.conflictDetector = conflictDetector;
    }

    /**
     * Result of committing leftover worktree changes.
     *
     * @param committed whether a commit was created
     * @param files     number of changed paths that went into it
     */
    public record AutoCommitResult(boolean committed, int files) {
        public static AutoCommitResult nothing() {
            return new AutoCommitResult(false, 0);
        }
    }

    /**
     * Commits everything the agent left uncommitted in its worktree, tagged with the task id.
     */
    public AutoCommitResult autoCommit(Path worktreePath, String taskId) {
        if (worktreePath == null || !Files.isDirectory(worktreePath)) {
            return AutoCommitResult.nothing();
        }
        List<String> changes = git.status(worktreePath);
        if (changes.isEmpty()) {
            return AutoCommitResult.nothing();
        }
        if (!git.addAll(worktreePath)
                || !git.commit(worktreePath, "chore(" + taskId + "): auto-commit agent changes")) {
            log.warn("Auto-commit failed in {} for {}", worktreePath, taskId);
            return AutoCommitResult.nothing();
        }
        log.info("Auto-committed {} changed path(s) for {}", changes.size(), taskId);
        return new AutoCommitResult(true, changes.size());
    }

    /**
     * Probes for conflicts, then integrates {@code branch} into {@code targetBranch}.
     * No merge is attempted when the probe reports conflicts. A merge that still fails is
     * aborted and the previously checked-out branch is restored.
     */
    public MergeOutcome mergeWork(String taskId, String branch, String targetBranch, MergeStrategy strategy) {
        ConflictReport conflicts = conflictDetector.detectConflicts(targetBranch, branch);
        if (conflicts.hasConflicts()) {
            return MergeOutcome.conflicted(strategy, conflicts.files());
        }

        String original = git.currentBranch();
        if (!original.equals(targetBranch) && !git.checkout(targetBranch)) {
            return MergeOutcome.failed(strategy, "could not check out " + targetBranch);
        }

        try {
            boolean ok = switch (strategy) {
                case SQUASH -> git.mergeSquash(branch)
                        && (git.isClean(git.repoRoot())
                            || git.commit(git.repoRoot(), "feat(" + taskId + "): " + branch));
                case REBASE -> git.rebase(branch);
                case MERGE -> git.merge(branch);
            };
            if (!ok) {
                if (strategy == MergeStrategy.REBASE) {
                    git.abortRebase();
                } else {
                    git.abortMerge();
                }
                return MergeOutcome.failed(strategy,
                        "git " + strategy.value() + " of " + branch + " into " + targetBranch + " failed");
            }
            log.info("Merged {} into {} ({})", branch, targetBranch, strategy.value());
            return MergeOutcome.merged(strategy);
        } finally {
            if (!original.isEmpty() && !original.equals(targetBranch)) {
                git.checkout(original);
            }
        }
    }
}
