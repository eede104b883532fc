package com.quartermaster.agent;

import java.nio.file.Path;

/**
 * On-disk layout under the haven directory.
 *
 * <pre>
 * &lt;haven&gt;/agents/&lt;taskId&gt;/record.json    agent record
 * &lt;haven&gt;/agents/&lt;taskId&gt;/mission.yaml   mission handed to the agent
 * &lt;haven&gt;/agents/&lt;taskId&gt;/run.log        combined stdout/stderr
 * &lt;haven&gt;/agents/&lt;taskId&gt;/result.yaml    written by the agent when it finishes
 * &lt;haven&gt;/agents/&lt;taskId&gt;/done          bare completion marker
 * &lt;haven&gt;/worktrees/&lt;taskId&gt;            task worktree
 * </pre>
 */
public record HavenLayout(Path root) {

    public HavenLayout {
        root = root.toAbsolutePath().normalize();
    }

    public Path agentsDir() {
        return root.resolve("agents");
    }

    public Path agentDir(String taskId) {
        return agentsDir().resolve(taskId);
    }

    public Path recordFile(String taskId) {
        return agentDir(taskId).resolve("record.json");
    }

    public Path missionFile(String taskId) {
        return agentDir(taskId).resolve("mission.yaml");
    }

    public Path logFile(String taskId) {
        return agentDir(taskId).resolve("run.log");
    }

    public Path resultFile(String taskId) {
        return agentDir(taskId).resolve("result.yaml");
    }

    public Path doneFile(String taskId) {
        return agentDir(taskId).resolve("done");
    }

    public Path worktreesDir() {
        return root.resolve("worktrees");
    }
}
