package com.quartermaster.agent;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The mission descriptor handed to an agent as {@code mission.yaml}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Mission(
    String version,
    @JsonProperty("task_id") String taskId,
    @JsonProperty("epic_id") String epicId,
    @JsonProperty("prd_id") String prdId,
    String instruction,
    Context context,
    Constraints constraints,
    int timeout,
    @JsonProperty("agent_dir") String agentDir,
    String workdir
) {

    /**
     * Files the agent should read before starting.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Context(
        @JsonProperty("backlog_file") String backlogFile,
        @JsonProperty("dev_md") String devMd,
        String memory,
        String toolset
    ) {}

    /**
     * @param noGitCommit the orchestrator commits on the agent's behalf when reaping
     */
    public record Constraints(@JsonProperty("no_git_commit") boolean noGitCommit) {}
}
