package com.quartermaster.isolation;

import com.quartermaster.core.model.BranchingStrategy;
import com.quartermaster.core.model.WorktreeContext;
import com.quartermaster.core.model.WorktreeInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Gives every task its own git worktree on its own branch, and keeps the epic and PRD
 * branches above it in place and up to date.
 *
 * <p>Branch hierarchy per strategy:
 * <ul>
 *   <li>{@code FLAT}: main → task/T</li>
 *   <li>{@code EPIC}: main → epic/E → task/T</li>
 *   <li>{@code PRD}: main → prd/P → epic/E → task/T</li>
 * </ul>
 *
 * <p>Worktrees live under {@code <haven>/worktrees/<taskId>}.
 */
public class WorktreeManager {

    private static final Logger log = LoggerFactory.getLogger(WorktreeManager.class);

    private final GitCommandRunner git;
    private final Path worktreesRoot;
    private final String mainBranch;
    private final boolean pushRemoteOnCleanup;

    public WorktreeManager(GitCommandRunner git, Path worktreesRoot, String mainBranch,
                           boolean pushRemoteOnCleanup) {
        this.git = git;
        this.worktreesRoot = worktreesRoot.toAbsolutePath().normalize();
        this.mainBranch = mainBranch;
        this.pushRemoteOnCleanup = pushRemoteOnCleanup;
    }

    public String mainBranch() {
        return mainBranch;
    }

    public Path worktreePath(String taskId) {
        return worktreesRoot.resolve(taskId);
    }

    // ── Branch hierarchy ────────────────────────────────────────────────

    /**
     * Ancestor chain for a context, from the main branch down to the task's parent branch.
     * Levels whose id is missing are left out.
     */
    public List<String> getBranchHierarchy(WorktreeContext ctx) {
        List<String> chain = new ArrayList<>();
        chain.add(mainBranch);
        if (ctx.branching() == BranchingStrategy.PRD && ctx.prdId() != null) {
            chain.add(BranchNaming.prdBranch(ctx.prdId()));
        }
        if (ctx.branching() != BranchingStrategy.FLAT && ctx.epicId() != null) {
            chain.add(BranchNaming.epicBranch(ctx.epicId()));
        }
        return chain;
    }

    /** The branch a task branches off and merges back into. */
    public String getParentBranch(String taskId, WorktreeContext ctx) {
        List<String> chain = getBranchHierarchy(ctx);
        String parent = chain.get(chain.size() - 1);
        log.debug("Parent branch for {} ({}): {}", taskId, ctx.branching(), parent);
        return parent;
    }

    /**
     * Creates any missing ancestor branches, each from the one above it. Idempotent.
     *
     * @return branches created by this call
     */
    public List<String> ensureBranchHierarchy(WorktreeContext ctx) {
        List<String> chain = getBranchHierarchy(ctx);
        List<String> created = new ArrayList<>();
        for (int i = 1; i < chain.size(); i++) {
            String branch = chain.get(i);
            if (git.branchExists(branch)) {
                continue;
            }
            String from = chain.get(i - 1);
            if (!git.createBranch(branch, from)) {
                throw new IllegalStateException("Failed to create branch " + branch + " from " + from);
            }
            log.info("Created branch {} from {}", branch, from);
            created.add(branch);
        }
        return created;
    }

    /**
     * Brings the task's immediate parent branch up to date with its own upstream
     * (epic from PRD, or PRD/epic from main). Skipped in flat mode.
     */
    public SyncResult syncParentBranch(WorktreeContext ctx) {
        List<String> chain = getBranchHierarchy(ctx);
        if (ctx.branching() == BranchingStrategy.FLAT || chain.size() < 2) {
            return SyncResult.skipped(mainBranch, null, "flat mode");
        }
        String parent = chain.get(chain.size() - 1);
        String upstream = chain.get(chain.size() - 2);
        return syncBranch(parent, upstream, false);
    }

    /**
     * Merges (or rebases) {@code upstream} into {@code branch} in the repository root, then
     * restores the previously checked-out branch. A failed merge or rebase is aborted.
     */
    public SyncResult syncBranch(String branch, String upstream, boolean useRebase) {
        if (!git.branchExists(branch)) {
            return SyncResult.skipped(branch, upstream, "branch " + branch + " does not exist");
        }
        if (!git.branchExists(upstream)) {
            return SyncResult.skipped(branch, upstream, "upstream " + upstream + " does not exist");
        }
        AheadBehind counts = git.aheadBehind(upstream, branch);
        if (counts.behind() == 0) {
            return SyncResult.skipped(branch, upstream, branch + " is up to date with " + upstream);
        }

        String original = git.currentBranch();
        if (!git.checkout(branch)) {
            return SyncResult.failed(branch, upstream, "could not check out " + branch);
        }
        try {
            boolean ok = useRebase ? git.rebase(upstream) : git.merge(upstream);
            if (!ok) {
                if (useRebase) {
                    git.abortRebase();
                } else {
                    git.abortMerge();
                }
                log.warn("Sync of {} from {} failed, aborted", branch, upstream);
                return SyncResult.failed(branch, upstream,
                        "conflicts while syncing " + branch + " from " + upstream);
            }
            log.info("Synced {} from {} ({} commit(s))", branch, upstream, counts.behind());
            return SyncResult.synced(branch, upstream, counts.behind() + " commit(s) from " + upstream);
        } finally {
            if (!original.isEmpty() && !original.equals(branch)) {
                git.checkout(original);
            }
        }
    }

    /**
     * Propagates a completed level upward into the branch above it.
     * <ul>
     *   <li>PRD strategy: epic → prd at either level, then prd → main at PRD level.</li>
     *   <li>EPIC strategy: epic → main at either level, since main is the epic's parent.</li>
     *   <li>FLAT: nothing; tasks merge straight into main.</li>
     * </ul>
     */
    public List<SyncResult> syncUpwardHierarchy(SyncLevel level, WorktreeContext ctx) {
        List<SyncResult> results = new ArrayList<>();
        if (ctx.branching() == BranchingStrategy.PRD && ctx.prdId() != null) {
            String prdBranch = BranchNaming.prdBranch(ctx.prdId());
            if (ctx.epicId() != null) {
                results.add(syncBranch(prdBranch, BranchNaming.epicBranch(ctx.epicId()), false));
            }
            if (level == SyncLevel.PRD) {
                results.add(syncBranch(mainBranch, prdBranch, false));
            }
        } else if (ctx.branching() == BranchingStrategy.EPIC && ctx.epicId() != null) {
            results.add(syncBranch(mainBranch, BranchNaming.epicBranch(ctx.epicId()), false));
        }
        return results;
    }

    // ── Worktrees ───────────────────────────────────────────────────────

    /**
     * Creates {@code <haven>/worktrees/<taskId>} on a fresh {@code task/<taskId>} branch.
     *
     * <p>A leftover task branch with commits not on {@code baseBranch} is refused unless
     * {@code force} is set, so unmerged work is never silently thrown away.
     */
    public WorktreeResult createWorktree(String taskId, String baseBranch, BranchingStrategy branching,
                                         boolean force) {
        Path path = worktreePath(taskId);
        String branch = BranchNaming.taskBranch(taskId);

        if (Files.exists(path)) {
            if (!force) {
                return WorktreeResult.failure("Worktree already exists: " + path);
            }
            log.info("Removing existing worktree for {} (force)", taskId);
            removeWorktree(taskId, true, true);
        }

        if (git.branchExists(branch)) {
            int unmerged = git.aheadBehind(baseBranch, branch).ahead();
            if (unmerged > 0 && !force) {
                return WorktreeResult.failure("Branch " + branch + " has " + unmerged
                        + " commit(s) not in " + baseBranch + "; merge or delete it first");
            }
            log.info("Deleting stale branch {}", branch);
            git.deleteBranch(branch, true);
        }

        git.worktreePrune();
        try {
            Files.createDirectories(worktreesRoot);
        } catch (IOException e) {
            return WorktreeResult.failure("Cannot create " + worktreesRoot + ": " + e.getMessage());
        }

        log.info("Adding worktree for {} at {} (branch: {}, base: {})", taskId, path, branch, baseBranch);
        if (!git.worktreeAdd(path, branch, baseBranch)) {
            return WorktreeResult.failure("Failed to create worktree for " + taskId + " from " + baseBranch);
        }
        return WorktreeResult.success(new WorktreeInfo(path.toString(), branch, baseBranch, branching));
    }

    /**
     * Removes the task's worktree and, unless {@code keepBranch}, its branch.
     *
     * @return true if the worktree is gone (or never existed) afterwards
     */
    public boolean removeWorktree(String taskId, boolean force, boolean keepBranch) {
        Path path = worktreePath(taskId);
        boolean removed = true;
        if (Files.exists(path)) {
            log.info("Removing worktree for {} at {}", taskId, path);
            if (!git.worktreeRemove(path, force)) {
                if (force) {
                    log.warn("git worktree remove failed for {}, deleting directory", taskId);
                    GitCommandRunner.deleteDirectory(path);
                    git.worktreePrune();
                } else {
                    removed = false;
                }
            }
        }
        if (removed && !keepBranch) {
            String branch = BranchNaming.taskBranch(taskId);
            if (git.branchExists(branch) && !git.deleteBranch(branch, force)) {
                log.warn("Could not delete branch {} (unmerged?)", branch);
            }
        }
        return removed && !Files.exists(path);
    }

    /**
     * Removes worktree and branch, including the remote branch when configured.
     */
    public boolean cleanupWorktree(String taskId, boolean force) {
        boolean removed = removeWorktree(taskId, force, false);
        if (removed && pushRemoteOnCleanup && git.hasRemote("origin")) {
            String branch = BranchNaming.taskBranch(taskId);
            if (!git.pushDelete("origin", branch)) {
                log.debug("Remote branch {} not deleted (probably never pushed)", branch);
            }
        }
        return removed;
    }

    /** Task ids that currently have a worktree under the haven. */
    public List<String> listTaskWorktrees() {
        List<String> ids = new ArrayList<>();
        for (Path path : git.worktreeList()) {
            Path normalized = path.toAbsolutePath().normalize();
            if (normalized.getParent() != null && normalized.getParent().equals(worktreesRoot)) {
                ids.add(normalized.getFileName().toString());
            }
        }
        return ids;
    }
}
