package com.quartermaster.agent;

import com.quartermaster.core.cascade.CascadeResult;
import com.quartermaster.core.cascade.StatusCascadeService;
import com.quartermaster.core.events.EventBus;
import com.quartermaster.core.events.OrchestrationEvent;
import com.quartermaster.core.logging.MdcContext;
import com.quartermaster.core.metrics.OrchestratorMetrics;
import com.quartermaster.core.model.AgentRecord;
import com.quartermaster.core.model.AgentStatus;
import com.quartermaster.core.model.ArtefactStatus;
import com.quartermaster.core.model.BranchingStrategy;
import com.quartermaster.core.model.Escalation;
import com.quartermaster.core.model.IdNormalizer;
import com.quartermaster.core.model.MergeStrategy;
import com.quartermaster.core.model.PrdNode;
import com.quartermaster.core.model.TaskNode;
import com.quartermaster.core.model.WorktreeContext;
import com.quartermaster.core.model.WorktreeInfo;
import com.quartermaster.core.repository.ArtefactRepository;
import com.quartermaster.isolation.BranchNaming;
import com.quartermaster.isolation.GitCommandRunner;
import com.quartermaster.isolation.MergeOutcome;
import com.quartermaster.isolation.MergeService;
import com.quartermaster.isolation.SyncLevel;
import com.quartermaster.isolation.SyncResult;
import com.quartermaster.isolation.WorktreeManager;
import com.quartermaster.isolation.WorktreeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchService;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;

/**
 * Drives an agent through its lifecycle: spawn, wait, reap, kill, reject, clear. Also
 * reconciles records with the worktrees on disk and reports overlapping work between agents.
 *
 * <p>Conditions the orchestrator cannot resolve (a live agent in the way, conflicts, timeouts,
 * missing worktrees) are returned as {@link LifecycleResult}s carrying an {@link Escalation};
 * they are never thrown.
 *
 * <p>Every transition is persisted in the {@link AgentRecordStore} before the matching event is
 * published. Reaps into the same target branch must be serialised by the caller.
 */
@Service
public class AgentLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(AgentLifecycleManager.class);

    private static final long KILL_POLL_MS = 100;

    private final QuartermasterProperties properties;
    private final AgentRecordStore store;
    private final AgentProcessProvider provider;
    private final GitCommandRunner git;
    private final WorktreeManager worktreeManager;
    private final MergeService mergeService;
    private final ArtefactRepository repository;
    private final StatusCascadeService cascade;
    private final MissionBuilder missionBuilder;
    private final CompletionSentinel sentinel;
    private final HavenLayout layout;
    private final EventBus eventBus;
    private final OrchestratorMetrics metrics;

    /** Guards record updates shared between callers and process-exit callbacks. */
    private final Object recordLock = new Object();

    public AgentLifecycleManager(QuartermasterProperties properties,
                                 AgentRecordStore store,
                                 AgentProcessProvider provider,
                                 GitCommandRunner git,
                                 WorktreeManager worktreeManager,
                                 MergeService mergeService,
                                 ArtefactRepository repository,
                                 StatusCascadeService cascade,
                                 MissionBuilder missionBuilder,
                                 CompletionSentinel sentinel,
                                 HavenLayout layout,
                                 EventBus eventBus,
                                 OrchestratorMetrics metrics) {
        this.properties = properties;
        this.store = store;
        this.provider = provider;
        this.git = git;
        this.worktreeManager = worktreeManager;
        this.mergeService = mergeService;
        this.repository = repository;
        this.cascade = cascade;
        this.missionBuilder = missionBuilder;
        this.sentinel = sentinel;
        this.layout = layout;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    // ══════════════════════════════════════════════════════════════════════════
    // SPAWN
    // ══════════════════════════════════════════════════════════════════════════

    /**
     * Launches an agent for a task.
     *
     * <p>Refuses when a live agent already holds the task or the previous agent left work that
     * has not been reaped. With worktrees enabled the project must be a git repository with at
     * least one commit and no uncommitted changes to tracked files.
     */
    public LifecycleResult spawn(String rawTaskId, SpawnOptions options) {
        String taskId = IdNormalizer.normalize(rawTaskId);
        Optional<TaskNode> taskOpt = repository.getTask(taskId);
        if (taskOpt.isEmpty()) {
            return escalate("spawn", taskId, null, Escalation.of("Task not found: " + taskId,
                    "Check the task id against the backlog (" + properties.getBacklogFile() + ")"));
        }
        TaskNode task = taskOpt.get();
        MdcContext.setTask(taskId, task.epicId(), task.prdId());
        try {
            Optional<LifecycleResult> blocked = resolveExistingRecord(taskId);
            if (blocked.isPresent()) {
                return blocked.get();
            }

            boolean useWorktrees = options.useWorktrees() != null
                    ? options.useWorktrees()
                    : properties.getAgent().isUseWorktrees();
            int timeout = options.timeoutSeconds() != null
                    ? options.timeoutSeconds()
                    : properties.getAgent().getTimeoutSeconds();
            MergeStrategy strategy = options.mergeStrategy() != null
                    ? options.mergeStrategy()
                    : properties.getAgent().getMergeStrategy();

            WorktreeInfo worktree = null;
            Path workdir = git.repoRoot();
            if (useWorktrees) {
                Optional<Escalation> precondition = checkRepository();
                if (precondition.isPresent()) {
                    return escalate("spawn", taskId, null, precondition.get());
                }
                WorktreeContext ctx = contextFor(task);
                try {
                    worktreeManager.ensureBranchHierarchy(ctx);
                } catch (IllegalStateException e) {
                    return escalate("spawn", taskId, null, Escalation.of(e.getMessage(),
                            "git branch -a", "Create the missing branch by hand and retry"));
                }
                if (properties.getGit().isSyncBeforeSpawn()) {
                    SyncResult sync = worktreeManager.syncParentBranch(ctx);
                    if (sync.isFailed()) {
                        return escalate("spawn", taskId, null, Escalation.of("Sync error: " + sync.message(),
                                "git checkout " + sync.branch() + " && git merge " + sync.upstream(),
                                "Resolve the conflicts, commit, then retry the spawn"));
                    }
                }
                String base = worktreeManager.getParentBranch(taskId, ctx);
                WorktreeResult created = worktreeManager.createWorktree(taskId, base, ctx.branching(), false);
                metrics.recordWorktreeOperation("create", created.success());
                if (!created.success()) {
                    return escalate("spawn", taskId, null, Escalation.of(created.error(),
                            "git log " + base + ".." + BranchNaming.taskBranch(taskId),
                            "Merge the branch, or delete it: git branch -D " + BranchNaming.taskBranch(taskId)));
                }
                worktree = created.worktree();
                workdir = Path.of(worktree.path());
            }

            clearSentinels(taskId);
            Mission mission = missionBuilder.build(task, options.instruction(), timeout, useWorktrees, workdir);
            Path missionFile = missionBuilder.write(mission);
            Path logFile = layout.logFile(taskId);

            List<String> command = new ArrayList<>(properties.getAgent().getCommand());
            command.add(missionFile.toString());
            Map<String, String> env = new HashMap<>();
            env.put("QUARTERMASTER_TASK_ID", taskId);
            env.put("QUARTERMASTER_AGENT_DIR", layout.agentDir(taskId).toString());
            env.put("QUARTERMASTER_MISSION", missionFile.toString());

            AgentRecord record;
            synchronized (recordLock) {
                Optional<AgentRecord> raced = store.get(taskId).filter(r -> r.status().isActive());
                if (raced.isPresent()) {
                    return escalate("spawn", taskId, raced.get(), Escalation.of(
                            "Agent " + taskId + " is already running (PID " + raced.get().pid() + ")",
                            "agent wait " + taskId,
                            "agent kill " + taskId));
                }
                long pid;
                try {
                    pid = provider.launch(command, workdir, env, logFile, this::onAgentExit);
                } catch (ProcessLaunchException e) {
                    if (worktree != null) {
                        worktreeManager.removeWorktree(taskId, true, false);
                    }
                    throw e;
                }
                record = AgentRecord.spawned(taskId, pid, worktree, missionFile.toString(),
                        logFile.toString(), timeout, strategy);
                store.save(record);
            }

            cascade.updateTaskStatus(task, ArtefactStatus.IN_PROGRESS);
            cascade.escalateOnTaskStart(task);

            metrics.recordSpawn();
            Map<String, Object> payload = new HashMap<>();
            payload.put("pid", record.pid());
            if (worktree != null) {
                payload.put("worktree", worktree.path());
                payload.put("branch", worktree.branch());
            }
            eventBus.publish(OrchestrationEvent.of(OrchestrationEvent.AGENT_SPAWNED, taskId, payload));
            log.info("Spawned agent for {} (pid {}) in {}", taskId, record.pid(), workdir);
            return LifecycleResult.ok(taskId, record, "Spawned agent for " + taskId + " (PID " + record.pid() + ")");
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Decides what to do with a record left over from an earlier agent. Returns an escalation
     * when the task is occupied, or when the record points at a worktree that is gone;
     * otherwise tidies up and returns empty.
     */
    private Optional<LifecycleResult> resolveExistingRecord(String taskId) {
        Optional<AgentRecord> existingOpt = store.get(taskId).map(this::refresh);
        if (existingOpt.isEmpty()) {
            return Optional.empty();
        }
        AgentRecord existing = existingOpt.get();

        if (existing.status().isActive()) {
            return Optional.of(escalate("spawn", taskId, existing, Escalation.of(
                    "Agent " + taskId + " is already running (PID " + existing.pid() + ")",
                    "agent wait " + taskId,
                    "agent kill " + taskId)));
        }

        if (existing.hasWorktree() && !Files.isDirectory(Path.of(existing.worktree().path()))) {
            return Optional.of(escalate("spawn", taskId, existing, Escalation.of(
                    "Worktree not found: " + existing.worktree().path()
                            + " (branch " + existing.worktree().branch() + " may still hold work)",
                    "git log " + existing.worktree().baseBranch() + ".." + existing.worktree().branch(),
                    "agent clear " + taskId)));
        }

        if (existing.hasWorktree()) {
            if (hasUnmergedWork(existing.worktree())) {
                return Optional.of(escalate("spawn", taskId, existing, Escalation.of(
                        "Agent " + taskId + " has unreaped work in " + existing.worktree().path(),
                        "agent reap " + taskId,
                        "agent reject " + taskId + " (discards the work)")));
            }
            log.info("Removing clean, merged worktree left by previous agent for {}", taskId);
            boolean removed = worktreeManager.removeWorktree(taskId, true, false);
            metrics.recordWorktreeOperation("remove", removed);
        }

        log.info("Clearing stale {} record for {}", existing.status(), taskId);
        store.delete(taskId);
        return Optional.empty();
    }

    private boolean hasUnmergedWork(WorktreeInfo worktree) {
        Path path = Path.of(worktree.path());
        if (!git.status(path).isEmpty()) {
            return true;
        }
        return git.aheadBehind(worktree.baseBranch(), worktree.branch()).ahead() > 0;
    }

    private Optional<Escalation> checkRepository() {
        Path root = git.repoRoot();
        if (!git.isRepository()) {
            return Optional.of(Escalation.of("Not a git repository: " + root,
                    "git init", "git add -A && git commit -m \"initial commit\"",
                    "Or spawn without worktrees"));
        }
        if (!git.hasCommits()) {
            return Optional.of(Escalation.of("Repository has no commits: " + root,
                    "git add -A && git commit -m \"initial commit\""));
        }
        if (!git.isClean(root)) {
            return Optional.of(Escalation.of("Working tree has uncommitted changes: " + root,
                    "git status", "Commit or stash the changes, then retry"));
        }
        return Optional.empty();
    }

    private void onAgentExit(long pid, int exitCode) {
        AgentRecord updated = null;
        synchronized (recordLock) {
            for (AgentRecord record : store.list()) {
                if (record.status().isActive() && record.pid() != null && record.pid() == pid) {
                    updated = record.exited(exitCode);
                    store.save(updated);
                    break;
                }
            }
        }
        if (updated != null) {
            if (updated.spawnedAt() != null) {
                metrics.recordAgentRunDuration(Duration.between(updated.spawnedAt(), updated.endedAt()));
            }
            eventBus.publish(OrchestrationEvent.of(OrchestrationEvent.AGENT_COMPLETED, updated.taskId(),
                    Map.of("exitCode", exitCode, "status", updated.status().name())));
        }
    }

    // ══════════════════════════════════════════════════════════════════════════
    // WAIT
    // ══════════════════════════════════════════════════════════════════════════

    /**
     * Blocks until the agent signals completion, its process ends, or the timeout passes.
     * Timing out never kills the agent.
     */
    public WaitResult waitFor(String rawTaskId, Duration timeout) {
        String taskId = IdNormalizer.normalize(rawTaskId);
        Optional<AgentRecord> initial = store.get(taskId);
        if (initial.isEmpty()) {
            return WaitResult.noAgent(taskId);
        }

        Instant deadline = Instant.now().plus(timeout);
        long interval = Math.max(1, properties.getAgent().getPollIntervalMs());
        WatchService watcher = openWatcher(layout.agentDir(taskId));
        try {
            while (true) {
                AgentRecord record = store.get(taskId).map(this::refresh).orElse(initial.get());
                if (sentinel.isComplete(taskId, record)) {
                    return WaitResult.completed(record);
                }
                if (!record.status().isActive()) {
                    return WaitResult.ended(record, "Agent " + taskId + " ended (" + record.status()
                            + (record.exitCode() != null ? ", exit code " + record.exitCode() : "")
                            + ") without signalling completion");
                }
                long remaining = Duration.between(Instant.now(), deadline).toMillis();
                if (remaining <= 0) {
                    return WaitResult.timedOut(record);
                }
                if (!pause(watcher, Math.min(interval, remaining))) {
                    return WaitResult.timedOut(record);
                }
            }
        } finally {
            closeQuietly(watcher);
        }
    }

    /** Sleeps up to {@code millis}, waking early on a change in the agent directory. */
    private boolean pause(WatchService watcher, long millis) {
        try {
            if (watcher == null) {
                Thread.sleep(millis);
                return true;
            }
            var key = watcher.poll(millis, TimeUnit.MILLISECONDS);
            if (key != null) {
                key.pollEvents();
                key.reset();
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ClosedWatchServiceException e) {
            return true;
        }
    }

    private WatchService openWatcher(Path dir) {
        try {
            Files.createDirectories(dir);
            WatchService watcher = FileSystems.getDefault().newWatchService();
            dir.register(watcher, StandardWatchEventKinds.ENTRY_CREATE, StandardWatchEventKinds.ENTRY_MODIFY);
            return watcher;
        } catch (IOException | UnsupportedOperationException e) {
            log.debug("Falling back to plain polling for {}: {}", dir, e.getMessage());
            return null;
        }
    }

    private static void closeQuietly(WatchService watcher) {
        if (watcher == null) {
            return;
        }
        try {
            watcher.close();
        } catch (IOException e) {
            log.debug("Error closing watch service: {}", e.getMessage());
        }
    }

    // ══════════════════════════════════════════════════════════════════════════
    // REAP
    // ══════════════════════════════════════════════════════════════════════════

    /**
     * Integrates a finished agent's work: auto-commit, conflict probe, merge, optional
     * teardown, task status update and cascade. Reaping an already reaped agent is a no-op.
     *
     * <p>The branch is merged whatever the agent reported, so partial work never stays
     * stranded in its worktree; only a {@code completed} result marks the task Done.
     */
    public LifecycleResult reap(String rawTaskId, ReapOptions options) {
        String taskId = IdNormalizer.normalize(rawTaskId);
        Optional<AgentRecord> recordOpt = store.get(taskId).map(this::refresh);
        if (recordOpt.isEmpty()) {
            return escalate("reap", taskId, null, Escalation.of("No agent found for task " + taskId,
                    "agent spawn " + taskId));
        }
        AgentRecord record = recordOpt.get();
        if (record.status() == AgentStatus.REAPED) {
            return LifecycleResult.ok(taskId, record, "Agent " + taskId + " already reaped");
        }
        if (record.status() == AgentStatus.KILLED || record.status() == AgentStatus.REJECTED) {
            return escalate("reap", taskId, record, Escalation.of(
                    "Agent " + taskId + " was " + record.status().name().toLowerCase() + "; nothing to reap",
                    "agent reject " + taskId, "agent clear " + taskId));
        }

        Optional<TaskNode> taskOpt = repository.getTask(taskId);
        MdcContext.setTask(taskId, taskOpt.map(TaskNode::epicId).orElse(null), taskOpt.map(TaskNode::prdId).orElse(null));
        try {
            if (record.status().isActive() && !sentinel.isComplete(taskId, record)) {
                if (!options.waitForCompletion()) {
                    return escalate("reap", taskId, record, Escalation.of(
                            "Agent " + taskId + " is still running (PID " + record.pid() + ")",
                            "agent wait " + taskId,
                            "agent kill " + taskId));
                }
                WaitResult waited = waitFor(taskId, Duration.ofSeconds(options.timeoutSeconds()));
                if (waited.timedOut()) {
                    return escalate("reap", taskId, waited.record(), Escalation.of(
                            "Timeout waiting for agent " + taskId,
                            "agent wait " + taskId + " --timeout " + (options.timeoutSeconds() * 2),
                            "agent kill " + taskId));
                }
                record = store.get(taskId).map(this::refresh).orElse(record);
            }

            if (!sentinel.isComplete(taskId, record)) {
                return escalate("reap", taskId, record, Escalation.of(
                        "Agent " + taskId + " did not complete",
                        "agent log " + taskId,
                        "agent reject " + taskId,
                        "agent spawn " + taskId + " (after reject and clear)"));
            }

            AgentResult result = sentinel.read(taskId).orElse(AgentResult.completedWithoutReport());
            WorktreeInfo remaining = record.worktree();
            boolean merged = false;

            if (record.hasWorktree()) {
                WorktreeInfo worktree = record.worktree();
                Path path = Path.of(worktree.path());
                if (!Files.isDirectory(path)) {
                    return escalate("reap", taskId, record, Escalation.of(
                            "Worktree not found: " + path,
                            "agent clear " + taskId));
                }

                mergeService.autoCommit(path, taskId);

                MergeStrategy strategy = options.mergeStrategy() != null ? options.mergeStrategy()
                        : record.mergeStrategy() != null ? record.mergeStrategy()
                        : properties.getAgent().getMergeStrategy();
                MergeOutcome outcome = mergeService.mergeWork(taskId, worktree.branch(), worktree.baseBranch(), strategy);
                if (outcome.conflicted()) {
                    taskOpt.ifPresent(t -> cascade.updateTaskStatus(t, ArtefactStatus.BLOCKED));
                    metrics.recordMergeConflict(outcome.conflicts().size());
                    return escalate("reap", taskId, record, new Escalation("Merge conflicts detected",
                            manualMergeSteps(taskId, worktree, outcome.conflicts())));
                }
                if (!outcome.success()) {
                    return escalate("reap", taskId, record, Escalation.of(
                            "Merge failed: " + outcome.error(),
                            "git status",
                            "git merge " + worktree.branch() + " (on " + worktree.baseBranch() + ")",
                            "agent reap " + taskId));
                }
                merged = true;

                boolean cleanup = options.cleanupWorktree() != null
                        ? options.cleanupWorktree()
                        : properties.getAgent().isCleanupWorktreeOnReap();
                if (cleanup) {
                    boolean removed = worktreeManager.cleanupWorktree(taskId, true);
                    metrics.recordWorktreeOperation("cleanup", removed);
                    if (removed) {
                        remaining = null;
                    }
                }
            }

            if (taskOpt.isPresent()) {
                TaskNode task = taskOpt.get();
                if (result.status().isSuccess()) {
                    cascade.updateTaskStatus(task, ArtefactStatus.DONE);
                    CascadeResult cascaded = cascade.cascadeTaskCompletion(task);
                    if (record.hasWorktree()) {
                        syncUpward(task, cascaded);
                    }
                } else {
                    cascade.updateTaskStatus(task, ArtefactStatus.BLOCKED);
                }
            }

            AgentRecord reaped = record.reaped(result.status(), remaining);
            store.save(reaped);
            metrics.recordReap(result.status().value());
            eventBus.publish(OrchestrationEvent.of(OrchestrationEvent.AGENT_REAPED, taskId, Map.of(
                    "result", result.status().value(),
                    "merged", merged)));
            log.info("Reaped agent for {} (result: {}, merged: {})", taskId, result.status().value(), merged);
            return LifecycleResult.ok(taskId, reaped, "Reaped " + taskId + " (" + result.status().value() + ")");
        } finally {
            MdcContext.clear();
        }
    }

    private List<String> manualMergeSteps(String taskId, WorktreeInfo worktree, List<String> files) {
        String target = worktree.baseBranch();
        String scratch = BranchNaming.mergeBranch(taskId, target);
        List<String> steps = new ArrayList<>();
        steps.add("git checkout -b " + scratch + " " + target);
        steps.add("git merge " + worktree.branch() + " --no-commit");
        steps.add("Resolve the conflicts");
        steps.add("git commit -m \"merge(" + taskId + "): resolved conflicts\"");
        steps.add("git checkout " + target + " && git merge " + scratch + " --ff-only");
        steps.add("agent clear " + taskId);
        for (String file : files) {
            steps.add("conflict: " + file);
        }
        return steps;
    }

    private void syncUpward(TaskNode task, CascadeResult cascaded) {
        if (!properties.getGit().isSyncUpwardOnComplete()) {
            return;
        }
        SyncLevel level = cascaded.prdAutoDone() ? SyncLevel.PRD
                : cascaded.epicAutoDone() ? SyncLevel.EPIC
                : null;
        if (level == null) {
            return;
        }
        for (SyncResult sync : worktreeManager.syncUpwardHierarchy(level, contextFor(task))) {
            if (sync.isFailed()) {
                log.warn("Upward sync {} <- {} failed: {}", sync.branch(), sync.upstream(), sync.message());
            }
        }
    }

    // ══════════════════════════════════════════════════════════════════════════
    // KILL / REJECT / CLEAR
    // ══════════════════════════════════════════════════════════════════════════

    /**
     * Stops the agent: SIGTERM, a grace period, then SIGKILL if it is still alive. A process
     * that has already exited counts as killed.
     */
    public LifecycleResult kill(String rawTaskId) {
        String taskId = IdNormalizer.normalize(rawTaskId);
        Optional<AgentRecord> recordOpt = store.get(taskId);
        if (recordOpt.isEmpty()) {
            return escalate("kill", taskId, null, Escalation.of("No agent found for task " + taskId));
        }
        AgentRecord record = recordOpt.get();
        if (!record.status().canTransitionTo(AgentStatus.KILLED)) {
            return LifecycleResult.ok(taskId, record, "Agent " + taskId + " is not running (" + record.status() + ")");
        }

        if (record.pid() != null) {
            terminate(record.pid());
        }

        AgentRecord killed;
        synchronized (recordLock) {
            killed = store.get(taskId).orElse(record).killed();
            store.save(killed);
        }
        metrics.recordKill();
        eventBus.publish(OrchestrationEvent.of(OrchestrationEvent.AGENT_KILLED, taskId,
                Map.of("pid", record.pid() == null ? -1L : record.pid())));
        log.info("Killed agent for {} (pid {})", taskId, record.pid());
        return LifecycleResult.ok(taskId, killed, "Killed agent " + taskId);
    }

    private void terminate(long pid) {
        if (!provider.isAlive(pid)) {
            log.debug("pid {} already exited", pid);
            return;
        }
        provider.terminate(pid);
        long deadline = System.currentTimeMillis() + properties.getAgent().getKillGraceMs();
        while (provider.isAlive(pid) && System.currentTimeMillis() < deadline) {
            try {
                Thread.sleep(KILL_POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        if (provider.isAlive(pid)) {
            log.warn("pid {} ignored SIGTERM, sending SIGKILL", pid);
            provider.forceKill(pid);
        }
    }

    /**
     * Discards the agent's work: stops it if running, removes worktree and branch, and marks
     * the record rejected. Allowed from every state, including after a reap that kept its
     * worktree. The task's status is left alone.
     */
    public LifecycleResult reject(String rawTaskId, String reason) {
        String taskId = IdNormalizer.normalize(rawTaskId);
        Optional<AgentRecord> recordOpt = store.get(taskId);
        if (recordOpt.isEmpty()) {
            return escalate("reject", taskId, null, Escalation.of("No agent found for task " + taskId));
        }
        AgentRecord record = recordOpt.get();
        if (record.status() == AgentStatus.REJECTED) {
            return LifecycleResult.ok(taskId, record, "Agent " + taskId + " already rejected");
        }
        if (!record.status().canTransitionTo(AgentStatus.REJECTED)) {
            return escalate("reject", taskId, record, Escalation.of(
                    "Agent " + taskId + " is " + record.status() + " and cannot be rejected",
                    "agent clear " + taskId));
        }
        if (record.status().isActive() && record.pid() != null) {
            terminate(record.pid());
        }
        if (record.hasWorktree()) {
            boolean removed = worktreeManager.cleanupWorktree(taskId, true);
            metrics.recordWorktreeOperation("cleanup", removed);
        }

        AgentRecord rejected;
        synchronized (recordLock) {
            rejected = store.get(taskId).orElse(record).rejected(reason);
            store.save(rejected);
        }
        metrics.recordRejection();
        log.info("Rejected agent for {}: {}", taskId, reason);
        return LifecycleResult.ok(taskId, rejected, "Rejected " + taskId);
    }

    /**
     * Forgets the agent. Refused while its process is alive. Worktrees are not touched.
     */
    public LifecycleResult clear(String rawTaskId) {
        String taskId = IdNormalizer.normalize(rawTaskId);
        Optional<AgentRecord> recordOpt = store.get(taskId).map(this::refresh);
        if (recordOpt.isEmpty()) {
            return escalate("clear", taskId, null, Escalation.of("No agent found for task " + taskId));
        }
        AgentRecord record = recordOpt.get();
        if (record.status().isActive()) {
            return escalate("clear", taskId, record, Escalation.of(
                    "Agent " + taskId + " is still running (PID " + record.pid() + ")",
                    "agent kill " + taskId));
        }
        store.delete(taskId);
        clearSentinels(taskId);
        log.info("Cleared agent record for {}", taskId);
        return LifecycleResult.ok(taskId, null, "Cleared " + taskId);
    }

    // ══════════════════════════════════════════════════════════════════════════
    // SYNC / CONFLICTS
    // ══════════════════════════════════════════════════════════════════════════

    /**
     * Reconciles the record store with the worktrees on disk and the process table.
     *
     * <p>A task worktree with no record gets a recovered record (completed when a sentinel
     * exists, error otherwise) so it can be reaped or rejected. An active record whose process
     * is gone is settled the way {@link #status} would. A record whose worktree directory has
     * vanished is only reported; {@code agent clear} is the way out. With {@code dryRun} the
     * store is not written.
     */
    public SyncReport sync(boolean dryRun) {
        List<SyncReport.Change> recovered = new ArrayList<>();
        List<SyncReport.Change> updated = new ArrayList<>();
        List<SyncReport.Change> missing = new ArrayList<>();

        for (String taskId : worktreeManager.listTaskWorktrees()) {
            if (store.get(taskId).isPresent()) {
                continue;
            }
            WorktreeInfo worktree = recoveredWorktree(taskId);
            AgentRecord record = AgentRecord.recovered(taskId, worktree, sentinel.isComplete(taskId, null),
                    layout.missionFile(taskId).toString(), layout.logFile(taskId).toString(),
                    properties.getAgent().getMergeStrategy());
            int dirty = git.status(Path.of(worktree.path())).size();
            if (!dryRun) {
                synchronized (recordLock) {
                    if (store.get(taskId).isEmpty()) {
                        store.save(record);
                    }
                }
                log.info("Recovered {} record for orphaned worktree {}", record.status(), worktree.path());
            }
            recovered.add(new SyncReport.Change(taskId, null, record.status(),
                    dirty > 0 ? dirty + " uncommitted file(s)" : "clean"));
        }

        for (AgentRecord record : store.list()) {
            if (record.status().isActive() && record.pid() != null && !provider.isAlive(record.pid())) {
                AgentStatus to = dryRun
                        ? record.lost(sentinel.isComplete(record.taskId(), null)).status()
                        : refresh(record).status();
                updated.add(new SyncReport.Change(record.taskId(), record.status(), to,
                        "process " + record.pid() + " is gone"));
            }
            if (record.hasWorktree() && !Files.isDirectory(Path.of(record.worktree().path()))) {
                missing.add(new SyncReport.Change(record.taskId(), record.status(), record.status(),
                        record.worktree().path()));
            }
        }

        SyncReport report = new SyncReport(dryRun, recovered, updated, missing);
        log.info("Agent sync{}: {} recovered, {} updated, {} missing worktree(s)", dryRun ? " (dry run)" : "",
                recovered.size(), updated.size(), missing.size());
        return report;
    }

    private WorktreeInfo recoveredWorktree(String taskId) {
        Optional<TaskNode> task = repository.getTask(taskId);
        WorktreeContext ctx = task.map(this::contextFor).orElse(null);
        String base = ctx != null ? worktreeManager.getParentBranch(taskId, ctx) : worktreeManager.mainBranch();
        return new WorktreeInfo(worktreeManager.worktreePath(taskId).toString(), BranchNaming.taskBranch(taskId),
                base, ctx != null ? ctx.branching() : BranchingStrategy.FLAT);
    }

    /**
     * Files changed by every agent whose work is still waiting to be merged, committed or not,
     * and which of those agents touched the same files.
     */
    public ConflictMatrix conflicts() {
        Map<String, List<String>> filesByAgent = new TreeMap<>();
        for (AgentRecord record : list()) {
            if (record.status().isTerminal() || !record.hasWorktree()) {
                continue;
            }
            WorktreeInfo worktree = record.worktree();
            Path path = Path.of(worktree.path());
            if (!Files.isDirectory(path)) {
                continue;
            }
            Set<String> files = new TreeSet<>(git.changedFiles(worktree.baseBranch(), worktree.branch()));
            git.status(path).stream().map(GitCommandRunner::porcelainPath).forEach(files::add);
            filesByAgent.put(record.taskId(), List.copyOf(files));
        }
        ConflictMatrix matrix = ConflictMatrix.of(filesByAgent);
        log.debug("Conflict matrix over {} agent(s): {} overlapping pair(s)",
                filesByAgent.size(), matrix.overlaps().size());
        return matrix;
    }

    // ══════════════════════════════════════════════════════════════════════════
    // QUERIES
    // ══════════════════════════════════════════════════════════════════════════

    public Optional<AgentRecord> status(String rawTaskId) {
        return store.get(IdNormalizer.normalize(rawTaskId)).map(this::refresh);
    }

    public List<AgentRecord> list() {
        return store.list().stream().map(this::refresh).toList();
    }

    /**
     * Re-verifies liveness of an active record by signalling its pid; a dead process is
     * recorded as completed or errored depending on its completion sentinel.
     */
    private AgentRecord refresh(AgentRecord record) {
        if (!record.status().isActive() || record.pid() == null) {
            return record;
        }
        if (provider.isAlive(record.pid())) {
            if (record.status() != AgentStatus.SPAWNED) {
                return record;
            }
            synchronized (recordLock) {
                AgentRecord current = store.get(record.taskId()).orElse(record);
                if (current.status() != AgentStatus.SPAWNED) {
                    return current;
                }
                AgentRecord running = current.running();
                store.save(running);
                return running;
            }
        }
        synchronized (recordLock) {
            AgentRecord current = store.get(record.taskId()).orElse(record);
            if (!current.status().isActive()) {
                return current;
            }
            AgentRecord lost = current.lost(sentinel.isComplete(current.taskId(), null));
            store.save(lost);
            log.info("Agent {} (pid {}) is no longer alive, marked {}", current.taskId(), current.pid(), lost.status());
            return lost;
        }
    }

    // ══════════════════════════════════════════════════════════════════════════
    // UTILITY METHODS
    // ══════════════════════════════════════════════════════════════════════════

    private WorktreeContext contextFor(TaskNode task) {
        BranchingStrategy branching = task.prdId() == null
                ? BranchingStrategy.FLAT
                : repository.getPrd(task.prdId()).map(PrdNode::branching).orElse(BranchingStrategy.FLAT);
        return new WorktreeContext(task.prdId(), task.epicId(), branching);
    }

    private void clearSentinels(String taskId) {
        try {
            Files.deleteIfExists(layout.resultFile(taskId));
            Files.deleteIfExists(layout.doneFile(taskId));
        } catch (IOException e) {
            throw new AgentRecordStoreException("Failed to remove completion files for " + taskId, e);
        }
    }

    private LifecycleResult escalate(String operation, String taskId, AgentRecord record, Escalation escalation) {
        log.warn("Escalation on {} {}: {}", operation, taskId, escalation.reason());
        metrics.incrementEscalations(operation);
        return LifecycleResult.escalate(taskId, record, escalation);
    }
}
