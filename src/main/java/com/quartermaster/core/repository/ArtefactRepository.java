package com.quartermaster.core.repository;

import com.quartermaster.core.model.ArtefactStatus;
import com.quartermaster.core.model.EpicNode;
import com.quartermaster.core.model.PrdNode;
import com.quartermaster.core.model.StoryNode;
import com.quartermaster.core.model.TaskNode;

import java.util.List;
import java.util.Optional;

/**
 * Read/write access to the backlog. Ids passed in are normalised by the implementation,
 * so {@code getTask("t1")} and {@code getTask("T001")} find the same task.
 *
 * <p>Implementations may cache; callers invoke {@link #invalidate()} after writing behind
 * the repository's back.
 */
public interface ArtefactRepository {

    Optional<TaskNode> getTask(String taskId);

    Optional<EpicNode> getEpic(String epicId);

    Optional<PrdNode> getPrd(String prdId);

    Optional<StoryNode> getStory(String storyId);

    List<TaskNode> allTasks();

    List<TaskNode> tasksForEpic(String epicId);

    List<EpicNode> epicsForPrd(String prdId);

    List<EpicNode> allEpics();

    List<PrdNode> allPrds();

    void updateTaskStatus(String taskId, ArtefactStatus status);

    void updateEpicStatus(String epicId, ArtefactStatus status);

    void updatePrdStatus(String prdId, ArtefactStatus status);

    /** Drops any cached state so the next read reflects the backing store. */
    void invalidate();
}
