package com.quartermaster.agent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.quartermaster.core.model.ResultStatus;

import java.util.List;

/**
 * Contents of the {@code result.yaml} an agent writes when it finishes.
 *
 * @param status        reported outcome
 * @param filesModified files the agent says it changed
 * @param issues        problems the agent ran into
 * @param summary       free-text summary
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentResult(
    ResultStatus status,
    @JsonProperty("files_modified") List<String> filesModified,
    List<String> issues,
    String summary
) {

    public AgentResult {
        status = status == null ? ResultStatus.COMPLETED : status;
        filesModified = filesModified == null ? List.of() : List.copyOf(filesModified);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    /** Result assumed when only the bare {@code done} marker exists. */
    public static AgentResult completedWithoutReport() {
        return new AgentResult(ResultStatus.COMPLETED, List.of(), List.of(), null);
    }
}
