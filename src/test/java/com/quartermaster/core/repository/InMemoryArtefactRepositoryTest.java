package com.quartermaster.core.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quartermaster.core.model.ArtefactStatus;
import com.quartermaster.core.model.BranchingStrategy;
import com.quartermaster.core.model.EpicNode;
import com.quartermaster.core.model.PrdNode;
import com.quartermaster.core.model.TaskNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryArtefactRepositoryTest {

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private Path backlogFile;
    private InMemoryArtefactRepository repository;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules();
        backlogFile = tempDir.resolve("backlog.json");
        repository = new InMemoryArtefactRepository(objectMapper, backlogFile);
        repository.load(new BacklogSnapshot(
                List.of(new PrdNode("prd1", "Auth", ArtefactStatus.APPROVED, BranchingStrategy.EPIC)),
                List.of(new EpicNode("e1", "PRD-001", "Login", ArtefactStatus.NOT_STARTED),
                        new EpicNode("E2", "PRD-002", "Other", ArtefactStatus.NOT_STARTED)),
                List.of(),
                List.of(new TaskNode("T2", "Second", ArtefactStatus.NOT_STARTED, List.of("T1"), "PRD-001 / E001", null, null, List.of()),
                        new TaskNode("t1", "First", ArtefactStatus.NOT_STARTED, List.of(), "PRD-001 / E001", null, null, List.of("api")))));
    }

    @Test
    @DisplayName("lookups accept loosely written ids")
    void lookupsNormaliseIds() {
        assertEquals("First", repository.getTask("t01").orElseThrow().title());
        assertEquals("Login", repository.getEpic("E001").orElseThrow().title());
        assertEquals(BranchingStrategy.EPIC, repository.getPrd("PRD-1").orElseThrow().branching());
        assertTrue(repository.getTask("T404").isEmpty());
    }

    @Test
    @DisplayName("listings are ordered by id and filtered by parent")
    void listings() {
        assertEquals(List.of("T001", "T002"), repository.allTasks().stream().map(TaskNode::id).toList());
        assertEquals(List.of("T001", "T002"), repository.tasksForEpic("e1").stream().map(TaskNode::id).toList());
        assertEquals(List.of("E001"), repository.epicsForPrd("PRD-001").stream().map(EpicNode::id).toList());
    }

    @Test
    @DisplayName("status updates are written to the backlog file and survive a reload")
    void persistsAndReloads() {
        repository.updateTaskStatus("T1", ArtefactStatus.DONE);
        repository.updateEpicStatus("E1", ArtefactStatus.AUTO_DONE);

        assertTrue(Files.isRegularFile(backlogFile));
        var reloaded = new InMemoryArtefactRepository(objectMapper, backlogFile);

        assertEquals(ArtefactStatus.DONE, reloaded.getTask("T001").orElseThrow().status());
        assertEquals(ArtefactStatus.AUTO_DONE, reloaded.getEpic("E001").orElseThrow().status());
        assertEquals(List.of("T001"), reloaded.getTask("T002").orElseThrow().blockedBy());
        assertEquals(List.of("api"), reloaded.getTask("T001").orElseThrow().tags());
    }

    @Test
    @DisplayName("invalidate picks up edits made behind the repository's back")
    void invalidateReloads() {
        repository.updateTaskStatus("T1", ArtefactStatus.IN_PROGRESS);
        var other = new InMemoryArtefactRepository(objectMapper, backlogFile);
        other.updateTaskStatus("T1", ArtefactStatus.CANCELLED);

        repository.invalidate();

        assertEquals(ArtefactStatus.CANCELLED, repository.getTask("T1").orElseThrow().status());
    }

    @Test
    @DisplayName("updating an unknown artefact is an error")
    void unknownIds() {
        assertThrows(IllegalArgumentException.class,
                () -> repository.updateTaskStatus("T404", ArtefactStatus.DONE));
        assertThrows(IllegalArgumentException.class,
                () -> repository.updatePrdStatus("PRD-404", ArtefactStatus.DONE));
    }

    @Test
    @DisplayName("a missing backlog file means an empty repository")
    void missingFile() {
        var empty = new InMemoryArtefactRepository(objectMapper, tempDir.resolve("none.json"));
        assertTrue(empty.allTasks().isEmpty());
    }
}
