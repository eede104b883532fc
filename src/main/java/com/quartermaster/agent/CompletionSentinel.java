package com.quartermaster.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.quartermaster.core.model.AgentRecord;
import com.quartermaster.core.model.AgentStatus;
import com.quartermaster.core.model.ResultStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Detects that an agent has finished and reads what it reported.
 *
 * <p>An agent counts as complete when any of these hold: {@code result.yaml} exists, the bare
 * {@code done} marker exists, or its record shows the process exited cleanly.
 */
public class CompletionSentinel {

    private static final Logger log = LoggerFactory.getLogger(CompletionSentinel.class);

    private final HavenLayout layout;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public CompletionSentinel(HavenLayout layout) {
        this.layout = layout;
    }

    public boolean isComplete(String taskId, AgentRecord record) {
        if (Files.exists(layout.resultFile(taskId)) || Files.exists(layout.doneFile(taskId))) {
            return true;
        }
        return record != null && record.status() == AgentStatus.COMPLETED
                && record.exitCode() != null && record.exitCode() == 0;
    }

    /**
     * Reads {@code result.yaml}. Falls back to a bare "completed" when only the marker exists
     * and to "failed" when the file is unreadable.
     *
     * @return empty when the agent left neither file behind
     */
    public Optional<AgentResult> read(String taskId) {
        Path file = layout.resultFile(taskId);
        if (Files.isRegularFile(file)) {
            try {
                AgentResult result = yamlMapper.readValue(file.toFile(), AgentResult.class);
                return Optional.of(result == null ? AgentResult.completedWithoutReport() : result);
            } catch (IOException e) {
                log.warn("Unreadable result file {}: {}", file, e.getMessage());
                return Optional.of(new AgentResult(ResultStatus.FAILED, List.of(),
                        List.of("unreadable result.yaml: " + e.getMessage()), null));
            }
        }
        if (Files.exists(layout.doneFile(taskId))) {
            return Optional.of(AgentResult.completedWithoutReport());
        }
        return Optional.empty();
    }
}
