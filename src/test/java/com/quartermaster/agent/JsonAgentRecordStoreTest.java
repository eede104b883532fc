package com.quartermaster.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.quartermaster.core.model.AgentRecord;
import com.quartermaster.core.model.AgentStatus;
import com.quartermaster.core.model.BranchingStrategy;
import com.quartermaster.core.model.MergeStrategy;
import com.quartermaster.core.model.ResultStatus;
import com.quartermaster.core.model.WorktreeInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonAgentRecordStoreTest {

    @TempDir
    Path tempDir;

    private HavenLayout layout;
    private JsonAgentRecordStore store;

    @BeforeEach
    void setUp() {
        layout = new HavenLayout(tempDir.resolve(".haven"));
        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        store = new JsonAgentRecordStore(layout, mapper);
    }

    @Test
    @DisplayName("saved records read back with every field")
    void roundTripsFullRecord() {
        var worktree = new WorktreeInfo("/wt/T001", "task/T001", "epic/E001", BranchingStrategy.EPIC);
        AgentRecord record = AgentRecord.spawned("T001", 4242L, worktree, "m.yaml", "run.log", 600, MergeStrategy.SQUASH)
                .exited(0)
                .reaped(ResultStatus.COMPLETED, worktree);

        store.save(record);

        assertEquals(record, store.get("T001").orElseThrow());
        assertTrue(Files.isRegularFile(layout.recordFile("T001")));
    }

    @Test
    @DisplayName("one record per task: saving again replaces it")
    void replaces() {
        AgentRecord spawned = AgentRecord.spawned("T001", 1L, null, null, null, 60, null);
        store.save(spawned);
        store.save(spawned.killed());

        assertEquals(AgentStatus.KILLED, store.get("T001").orElseThrow().status());
        assertEquals(1, store.list().size());
    }

    @Test
    @DisplayName("missing records are empty, delete reports whether one existed")
    void missingAndDelete() {
        assertTrue(store.get("T404").isEmpty());
        assertFalse(store.delete("T404"));

        store.save(AgentRecord.spawned("T001", 1L, null, null, null, 60, null));
        assertTrue(store.delete("T001"));
        assertTrue(store.get("T001").isEmpty());
    }

    @Test
    @DisplayName("list returns records sorted by task and skips directories without a record")
    void list() throws Exception {
        store.save(AgentRecord.spawned("T002", 2L, null, null, null, 60, null));
        store.save(AgentRecord.spawned("T001", 1L, null, null, null, 60, null));
        Files.createDirectories(layout.agentDir("T003"));

        assertEquals(List.of("T001", "T002"), store.list().stream().map(AgentRecord::taskId).toList());
    }

    @Test
    @DisplayName("a corrupt record is an error, not an absent one")
    void corrupt() throws Exception {
        Files.createDirectories(layout.agentDir("T001"));
        Files.writeString(layout.recordFile("T001"), "{ not json");

        assertThrows(AgentRecordStoreException.class, () -> store.get("T001"));
    }
}
