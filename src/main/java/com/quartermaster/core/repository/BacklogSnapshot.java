package com.quartermaster.core.repository;

import com.quartermaster.core.model.EpicNode;
import com.quartermaster.core.model.PrdNode;
import com.quartermaster.core.model.StoryNode;
import com.quartermaster.core.model.TaskNode;

import java.io.Serializable;
import java.util.List;

/**
 * On-disk JSON form of the whole backlog, read and written by {@link InMemoryArtefactRepository}.
 */
public record BacklogSnapshot(
    List<PrdNode> prds,
    List<EpicNode> epics,
    List<StoryNode> stories,
    List<TaskNode> tasks
) implements Serializable {

    public BacklogSnapshot {
        prds = prds == null ? List.of() : List.copyOf(prds);
        epics = epics == null ? List.of() : List.copyOf(epics);
        stories = stories == null ? List.of() : List.copyOf(stories);
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    public static BacklogSnapshot empty() {
        return new BacklogSnapshot(List.of(), List.of(), List.of(), List.of());
    }
}
