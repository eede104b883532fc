package com.quartermaster.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;

/**
 * Persisted state of the agent assigned to a task. One record per task id.
 *
 * <p>{@code pid} is present exactly while the status is {@link AgentStatus#isActive() active}.
 *
 * @param taskId         task the agent works on
 * @param status         lifecycle state
 * @param pid            operating-system pid while active, otherwise null
 * @param worktree       worktree the agent runs in, null when worktrees are disabled or torn down
 * @param spawnedAt      when the process was launched
 * @param endedAt        when the process exited
 * @param exitCode       process exit code once known
 * @param resultStatus   status the agent reported in its result file
 * @param missionFile    path of the mission descriptor handed to the agent
 * @param logFile        path of the combined stdout/stderr log
 * @param timeoutSeconds run timeout the agent was spawned with
 * @param mergeStrategy  strategy used when reaping
 * @param rejectReason   reason given on rejection
 * @param killedAt       when the agent was killed
 * @param reapedAt       when the agent was reaped
 * @param rejectedAt     when the agent was rejected
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentRecord(
    String taskId,
    AgentStatus status,
    Long pid,
    WorktreeInfo worktree,
    Instant spawnedAt,
    Instant endedAt,
    Integer exitCode,
    ResultStatus resultStatus,
    String missionFile,
    String logFile,
    int timeoutSeconds,
    MergeStrategy mergeStrategy,
    String rejectReason,
    Instant killedAt,
    Instant reapedAt,
    Instant rejectedAt
) implements Serializable {

    public static AgentRecord spawned(String taskId, long pid, WorktreeInfo worktree,
                                      String missionFile, String logFile, int timeoutSeconds,
                                      MergeStrategy mergeStrategy) {
        return new AgentRecord(taskId, AgentStatus.SPAWNED, pid, worktree, Instant.now(),
                null, null, null, missionFile, logFile, timeoutSeconds, mergeStrategy,
                null, null, null, null);
    }

    /**
     * Record rebuilt for a worktree found on disk with no record behind it. Without a pid
     * nothing is known about the process; the completion sentinel decides the status.
     */
    public static AgentRecord recovered(String taskId, WorktreeInfo worktree, boolean completed,
                                        String missionFile, String logFile, MergeStrategy mergeStrategy) {
        return new AgentRecord(taskId, completed ? AgentStatus.COMPLETED : AgentStatus.ERROR, null,
                worktree, null, Instant.now(), null, null, missionFile, logFile, 0, mergeStrategy,
                null, null, null, null);
    }

    /** Process exited on its own. Drops the pid. */
    public AgentRecord exited(int code) {
        AgentStatus next = code == 0 ? AgentStatus.COMPLETED : AgentStatus.ERROR;
        return new AgentRecord(taskId, next, null, worktree, spawnedAt, Instant.now(), code,
                resultStatus, missionFile, logFile, timeoutSeconds, mergeStrategy,
                rejectReason, killedAt, reapedAt, rejectedAt);
    }

    /**
     * Process is gone but its exit was not observed (it was launched by an earlier run).
     *
     * @param completed whether a completion sentinel was found
     */
    public AgentRecord lost(boolean completed) {
        AgentStatus next = completed ? AgentStatus.COMPLETED : AgentStatus.ERROR;
        return new AgentRecord(taskId, next, null, worktree, spawnedAt, Instant.now(), exitCode,
                resultStatus, missionFile, logFile, timeoutSeconds, mergeStrategy,
                rejectReason, killedAt, reapedAt, rejectedAt);
    }

    public AgentRecord running() {
        return new AgentRecord(taskId, AgentStatus.RUNNING, pid, worktree, spawnedAt, endedAt, exitCode,
                resultStatus, missionFile, logFile, timeoutSeconds, mergeStrategy,
                rejectReason, killedAt, reapedAt, rejectedAt);
    }

    public AgentRecord killed() {
        Instant now = Instant.now();
        return new AgentRecord(taskId, AgentStatus.KILLED, null, worktree, spawnedAt,
                endedAt == null ? now : endedAt, exitCode, resultStatus, missionFile, logFile,
                timeoutSeconds, mergeStrategy, rejectReason, now, reapedAt, rejectedAt);
    }

    public AgentRecord reaped(ResultStatus result, WorktreeInfo remainingWorktree) {
        return new AgentRecord(taskId, AgentStatus.REAPED, null, remainingWorktree, spawnedAt, endedAt,
                exitCode, result, missionFile, logFile, timeoutSeconds, mergeStrategy,
                rejectReason, killedAt, Instant.now(), rejectedAt);
    }

    public AgentRecord rejected(String reason) {
        return new AgentRecord(taskId, AgentStatus.REJECTED, null, null, spawnedAt, endedAt,
                exitCode, resultStatus, missionFile, logFile, timeoutSeconds, mergeStrategy,
                reason, killedAt, reapedAt, Instant.now());
    }

    public boolean hasWorktree() {
        return worktree != null;
    }
}
