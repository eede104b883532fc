package com.quartermaster.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quartermaster.core.model.AgentRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * {@link AgentRecordStore} writing one JSON file per task to
 * {@code <haven>/agents/<taskId>/record.json}. Writes go to a temp file first and are moved
 * into place atomically, so readers never see a half-written record.
 */
public class JsonAgentRecordStore implements AgentRecordStore {

    private static final Logger log = LoggerFactory.getLogger(JsonAgentRecordStore.class);

    private final HavenLayout layout;
    private final ObjectMapper objectMapper;

    public JsonAgentRecordStore(HavenLayout layout, ObjectMapper objectMapper) {
        this.layout = layout;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<AgentRecord> get(String taskId) {
        Path file = layout.recordFile(taskId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), AgentRecord.class));
        } catch (IOException e) {
            throw new AgentRecordStoreException("Corrupt or unreadable agent record " + file, e);
        }
    }

    @Override
    public synchronized void save(AgentRecord record) {
        Path file = layout.recordFile(record.taskId());
        try {
            Files.createDirectories(file.getParent());
            Path tmp = Files.createTempFile(file.getParent(), ".record-", ".json");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), record);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Saved agent record {} ({})", record.taskId(), record.status());
        } catch (IOException e) {
            throw new AgentRecordStoreException("Failed to write agent record " + file, e);
        }
    }

    @Override
    public synchronized boolean delete(String taskId) {
        Path file = layout.recordFile(taskId);
        try {
            boolean existed = Files.deleteIfExists(file);
            if (existed) {
                log.debug("Deleted agent record {}", taskId);
            }
            return existed;
        } catch (IOException e) {
            throw new AgentRecordStoreException("Failed to delete agent record " + file, e);
        }
    }

    @Override
    public List<AgentRecord> list() {
        Path dir = layout.agentsDir();
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<AgentRecord> records = new ArrayList<>();
        try (Stream<Path> entries = Files.list(dir)) {
            entries.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .sorted()
                    .forEach(id -> get(id).ifPresent(records::add));
        } catch (IOException e) {
            throw new AgentRecordStoreException("Failed to list agent records in " + dir, e);
        }
        records.sort(Comparator.comparing(AgentRecord::taskId));
        return records;
    }
}
