package com.quartermaster.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.quartermaster.core.model.TaskNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Builds the mission descriptor for a task and writes it to {@code mission.yaml}.
 */
public class MissionBuilder {

    private static final Logger log = LoggerFactory.getLogger(MissionBuilder.class);

    static final String VERSION = "1";

    private static final List<String> DEV_DOC_CANDIDATES = List.of("DEV.md", "CONTRIBUTING.md", "CLAUDE.md");
    private static final List<String> TOOLSET_CANDIDATES = List.of("TOOLSET.md", ".quartermaster/toolset.md");

    private final HavenLayout layout;
    private final Path projectRoot;
    private final Path backlogFile;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public MissionBuilder(HavenLayout layout, Path projectRoot, Path backlogFile) {
        this.layout = layout;
        this.projectRoot = projectRoot;
        this.backlogFile = backlogFile;
    }

    /**
     * @param instruction explicit instruction, or null to derive one from the task
     * @param workdir     directory the agent runs in
     */
    public Mission build(TaskNode task, String instruction, int timeoutSeconds, boolean usesWorktree, Path workdir) {
        String text = instruction != null && !instruction.isBlank()
                ? instruction
                : defaultInstruction(task);
        return new Mission(
                VERSION,
                task.id(),
                task.epicId(),
                task.prdId(),
                text,
                new Mission.Context(
                        backlogFile == null ? null : backlogFile.toString(),
                        firstExisting(DEV_DOC_CANDIDATES),
                        null,
                        firstExisting(TOOLSET_CANDIDATES)),
                new Mission.Constraints(usesWorktree),
                timeoutSeconds,
                layout.agentDir(task.id()).toString(),
                workdir.toString());
    }

    public Path write(Mission mission) {
        Path file = layout.missionFile(mission.taskId());
        try {
            Files.createDirectories(file.getParent());
            yamlMapper.writeValue(file.toFile(), mission);
            log.debug("Wrote mission for {} to {}", mission.taskId(), file);
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write mission file " + file, e);
        }
    }

    private static String defaultInstruction(TaskNode task) {
        return "Implement task " + task.id() + ": " + (task.title() == null ? "" : task.title()) + "\n"
                + "When finished, write result.yaml (status: completed | blocked) and a 'done' file "
                + "in the agent directory.";
    }

    private String firstExisting(List<String> candidates) {
        for (String name : candidates) {
            Path p = projectRoot.resolve(name);
            if (Files.isRegularFile(p)) {
                return p.toString();
            }
        }
        return null;
    }
}
