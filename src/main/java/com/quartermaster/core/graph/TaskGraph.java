package com.quartermaster.core.graph;

import com.quartermaster.core.model.TaskNode;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable dependency graph over a set of tasks.
 *
 * <p>{@code nodes} is keyed by normalised task id; each node's {@code blockedBy} has already
 * been resolved against those keys (ids that match no task are kept verbatim). {@code blocks}
 * is the reverse adjacency: blocker id → ids of the tasks it blocks.
 *
 * @param nodes  tasks keyed by id, in id order
 * @param blocks reverse edges, only for ids present in {@code nodes}
 */
public record TaskGraph(
    Map<String, TaskNode> nodes,
    Map<String, List<String>> blocks
) {

    public Optional<TaskNode> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    /** Tasks directly blocked by {@code id}. */
    public List<String> blockedTasks(String id) {
        return blocks.getOrDefault(id, List.of());
    }

    public int size() {
        return nodes.size();
    }
}
