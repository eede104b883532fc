package com.quartermaster.core.graph;

import com.quartermaster.core.model.IdNormalizer;
import com.quartermaster.core.model.TaskNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Builds a {@link TaskGraph} in a single pass over tasks and their blocker lists.
 */
public final class TaskGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(TaskGraphBuilder.class);

    private TaskGraphBuilder() {}

    /**
     * Builds the graph. When two tasks share a normalised id the first one wins.
     * Repeated blockers within one task collapse to a single edge.
     */
    public static TaskGraph build(Collection<TaskNode> tasks) {
        Map<String, TaskNode> byId = new TreeMap<>();
        for (TaskNode task : tasks) {
            String id = IdNormalizer.normalize(task.id());
            if (byId.putIfAbsent(id, task) != null) {
                log.warn("Duplicate task id {}, keeping first occurrence", id);
            }
        }

        Map<String, TaskNode> nodes = new LinkedHashMap<>();
        Map<String, List<String>> blocks = new LinkedHashMap<>();
        for (var entry : byId.entrySet()) {
            TaskNode task = entry.getValue();
            Set<String> resolved = new LinkedHashSet<>();
            for (String raw : task.blockedBy()) {
                resolved.add(resolve(raw, byId));
            }
            nodes.put(entry.getKey(), task.withBlockedBy(new ArrayList<>(resolved)));
            for (String blocker : resolved) {
                if (byId.containsKey(blocker)) {
                    blocks.computeIfAbsent(blocker, k -> new ArrayList<>()).add(entry.getKey());
                }
            }
        }

        blocks.replaceAll((k, v) -> List.copyOf(v));
        return new TaskGraph(Collections.unmodifiableMap(nodes), Collections.unmodifiableMap(blocks));
    }

    /**
     * Maps a raw blocker reference onto a known task id, or returns it trimmed when nothing matches.
     */
    static String resolve(String raw, Map<String, TaskNode> known) {
        String trimmed = raw == null ? "" : raw.trim();
        String normalized = IdNormalizer.normalize(trimmed);
        return known.containsKey(normalized) ? normalized : trimmed;
    }
}
