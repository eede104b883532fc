package com.quartermaster.core.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quartermaster.core.model.ArtefactStatus;
import com.quartermaster.core.model.EpicNode;
import com.quartermaster.core.model.IdNormalizer;
import com.quartermaster.core.model.PrdNode;
import com.quartermaster.core.model.StoryNode;
import com.quartermaster.core.model.TaskNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Default {@link ArtefactRepository}: keeps the backlog in memory and, when a backlog file is
 * configured, writes every status change straight back to it as a {@link BacklogSnapshot}.
 *
 * <p>{@link #invalidate()} reloads from the file, picking up edits made by other processes.
 */
public class InMemoryArtefactRepository implements ArtefactRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryArtefactRepository.class);

    private final ObjectMapper objectMapper;
    private final Path backlogFile;

    private final Map<String, PrdNode> prds = new ConcurrentHashMap<>();
    private final Map<String, EpicNode> epics = new ConcurrentHashMap<>();
    private final Map<String, StoryNode> stories = new ConcurrentHashMap<>();
    private final Map<String, TaskNode> tasks = new ConcurrentHashMap<>();

    /**
     * Creates a purely in-memory repository with no backing file.
     */
    public InMemoryArtefactRepository(ObjectMapper objectMapper) {
        this(objectMapper, null);
    }

    /**
     * @param objectMapper mapper used for the snapshot file
     * @param backlogFile  snapshot file, may be null or not yet exist
     */
    public InMemoryArtefactRepository(ObjectMapper objectMapper, Path backlogFile) {
        this.objectMapper = objectMapper;
        this.backlogFile = backlogFile;
        reload();
    }

    /** Replaces the whole backlog. Used by tests and by importers. */
    public synchronized void load(BacklogSnapshot snapshot) {
        prds.clear();
        epics.clear();
        stories.clear();
        tasks.clear();
        snapshot.prds().forEach(this::putPrd);
        snapshot.epics().forEach(this::putEpic);
        snapshot.stories().forEach(s -> stories.put(IdNormalizer.normalize(s.id()), s));
        snapshot.tasks().forEach(this::putTask);
    }

    public void putPrd(PrdNode prd) {
        prds.put(IdNormalizer.normalize(prd.id()), prd);
    }

    public void putEpic(EpicNode epic) {
        epics.put(IdNormalizer.normalize(epic.id()), epic);
    }

    public void putTask(TaskNode task) {
        tasks.put(IdNormalizer.normalize(task.id()), task);
    }

    public synchronized BacklogSnapshot snapshot() {
        return new BacklogSnapshot(
                sorted(prds.values(), PrdNode::id),
                sorted(epics.values(), EpicNode::id),
                sorted(stories.values(), StoryNode::id),
                sorted(tasks.values(), TaskNode::id));
    }

    @Override
    public Optional<TaskNode> getTask(String taskId) {
        return Optional.ofNullable(tasks.get(IdNormalizer.normalize(taskId)));
    }

    @Override
    public Optional<EpicNode> getEpic(String epicId) {
        return Optional.ofNullable(epics.get(IdNormalizer.normalize(epicId)));
    }

    @Override
    public Optional<PrdNode> getPrd(String prdId) {
        return Optional.ofNullable(prds.get(IdNormalizer.normalize(prdId)));
    }

    @Override
    public Optional<StoryNode> getStory(String storyId) {
        return Optional.ofNullable(stories.get(IdNormalizer.normalize(storyId)));
    }

    @Override
    public List<TaskNode> allTasks() {
        return sorted(tasks.values(), TaskNode::id);
    }

    @Override
    public List<TaskNode> tasksForEpic(String epicId) {
        String id = IdNormalizer.normalize(epicId);
        return allTasks().stream().filter(t -> id.equals(t.epicId())).toList();
    }

    @Override
    public List<EpicNode> epicsForPrd(String prdId) {
        String id = IdNormalizer.normalize(prdId);
        return allEpics().stream().filter(e -> id.equals(IdNormalizer.normalize(e.prdId()))).toList();
    }

    @Override
    public List<EpicNode> allEpics() {
        return sorted(epics.values(), EpicNode::id);
    }

    @Override
    public List<PrdNode> allPrds() {
        return sorted(prds.values(), PrdNode::id);
    }

    @Override
    public synchronized void updateTaskStatus(String taskId, ArtefactStatus status) {
        String id = IdNormalizer.normalize(taskId);
        TaskNode task = require(tasks, id, "task");
        tasks.put(id, task.withStatus(status));
        log.info("Task {} status: {} -> {}", id, task.status(), status);
        persist();
    }

    @Override
    public synchronized void updateEpicStatus(String epicId, ArtefactStatus status) {
        String id = IdNormalizer.normalize(epicId);
        EpicNode epic = require(epics, id, "epic");
        epics.put(id, epic.withStatus(status));
        log.info("Epic {} status: {} -> {}", id, epic.status(), status);
        persist();
    }

    @Override
    public synchronized void updatePrdStatus(String prdId, ArtefactStatus status) {
        String id = IdNormalizer.normalize(prdId);
        PrdNode prd = require(prds, id, "PRD");
        prds.put(id, prd.withStatus(status));
        log.info("PRD {} status: {} -> {}", id, prd.status(), status);
        persist();
    }

    @Override
    public void invalidate() {
        if (backlogFile != null) {
            reload();
        }
    }

    private synchronized void reload() {
        if (backlogFile == null || !Files.isRegularFile(backlogFile)) {
            return;
        }
        try {
            load(objectMapper.readValue(backlogFile.toFile(), BacklogSnapshot.class));
            log.debug("Loaded backlog from {} ({} tasks)", backlogFile, tasks.size());
        } catch (IOException e) {
            throw new ArtefactStoreException("Failed to read backlog " + backlogFile, e);
        }
    }

    private void persist() {
        if (backlogFile == null) {
            return;
        }
        try {
            Path parent = backlogFile.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path tmp = Files.createTempFile(parent, ".backlog-", ".json");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), snapshot());
            Files.move(tmp, backlogFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new ArtefactStoreException("Failed to write backlog " + backlogFile, e);
        }
    }

    private static <T> T require(Map<String, T> map, String id, String kind) {
        T value = map.get(id);
        if (value == null) {
            throw new IllegalArgumentException("Unknown " + kind + ": " + id);
        }
        return value;
    }

    private static <T> List<T> sorted(Collection<T> values, Function<T, String> key) {
        List<T> list = new ArrayList<>(values);
        list.sort(Comparator.comparing(key));
        return list;
    }
}
