package com.quartermaster.core.graph;

import com.quartermaster.core.model.TaskNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Queries over a {@link TaskGraph}: cycle detection, readiness, critical path and impact.
 *
 * <p>An instance is meant to serve a single query; critical-path and impact results are
 * memoised for its lifetime. Build a fresh graph and a fresh instance for the next query.
 */
public class GraphAlgorithms {

    private final TaskGraph graph;
    private final Map<String, CriticalPath> longestPathMemo = new HashMap<>();
    private final Map<String, Integer> impactMemo = new HashMap<>();

    public GraphAlgorithms(TaskGraph graph) {
        this.graph = graph;
    }

    public TaskGraph graph() {
        return graph;
    }

    // ── Cycles ──────────────────────────────────────────────────────────

    /**
     * Finds dependency cycles. Each cycle is reported as an ordered id sequence whose first id
     * is repeated at the end, rotated so the smallest id comes first. Every task that lies on
     * some cycle appears in at least one reported cycle.
     *
     * @return distinct cycles, empty when the graph is acyclic
     */
    public List<List<String>> detectCycles() {
        Map<List<String>, Boolean> found = new LinkedHashMap<>();
        Set<String> done = new HashSet<>();

        for (String start : graph.nodes().keySet()) {
            if (!done.contains(start)) {
                depthFirst(start, done, found);
            }
        }

        if (found.isEmpty()) {
            return List.of();
        }

        // A back-edge walk can miss tasks reached only through cross edges; close those gaps.
        Set<String> covered = new HashSet<>();
        found.keySet().forEach(covered::addAll);
        for (String id : graph.nodes().keySet()) {
            if (!covered.contains(id)) {
                List<String> cycle = shortestCycleThrough(id);
                if (cycle != null) {
                    found.putIfAbsent(canonical(cycle), Boolean.TRUE);
                    covered.addAll(cycle);
                }
            }
        }
        return List.copyOf(found.keySet());
    }

    public boolean hasCycles() {
        return !detectCycles().isEmpty();
    }

    /** Iterative DFS over "blocks" edges with an explicit recursion stack. */
    private void depthFirst(String start, Set<String> done, Map<List<String>, Boolean> found) {
        Deque<Iterator<String>> iterators = new ArrayDeque<>();
        List<String> path = new ArrayList<>();
        Set<String> onPath = new HashSet<>();

        path.add(start);
        onPath.add(start);
        iterators.push(graph.blockedTasks(start).iterator());

        while (!iterators.isEmpty()) {
            Iterator<String> it = iterators.peek();
            if (it.hasNext()) {
                String next = it.next();
                if (onPath.contains(next)) {
                    List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                    found.putIfAbsent(canonical(cycle), Boolean.TRUE);
                } else if (!done.contains(next)) {
                    path.add(next);
                    onPath.add(next);
                    iterators.push(graph.blockedTasks(next).iterator());
                }
            } else {
                iterators.pop();
                String finished = path.remove(path.size() - 1);
                onPath.remove(finished);
                done.add(finished);
            }
        }
    }

    private List<String> shortestCycleThrough(String id) {
        Map<String, String> parent = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(id);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : graph.blockedTasks(current)) {
                if (next.equals(id)) {
                    List<String> cycle = new ArrayList<>();
                    for (String at = current; at != null; at = parent.get(at)) {
                        cycle.add(at);
                    }
                    Collections.reverse(cycle);
                    return cycle;
                }
                if (!parent.containsKey(next) && !next.equals(id)) {
                    parent.put(next, current);
                    queue.add(next);
                }
            }
        }
        return null;
    }

    /** Rotates an open cycle so its smallest id leads, then closes it. */
    private static List<String> canonical(List<String> open) {
        int min = 0;
        for (int i = 1; i < open.size(); i++) {
            if (open.get(i).compareTo(open.get(min)) < 0) {
                min = i;
            }
        }
        List<String> rotated = new ArrayList<>(open.size() + 1);
        for (int i = 0; i < open.size(); i++) {
            rotated.add(open.get((min + i) % open.size()));
        }
        rotated.add(rotated.get(0));
        return List.copyOf(rotated);
    }

    // ── Readiness ───────────────────────────────────────────────────────

    /**
     * True when every blocker of {@code task} is a known task that is Done or Cancelled.
     * A blocker id that matches no task counts as unresolved.
     */
    public boolean blockersResolved(TaskNode task) {
        TaskNode resolved = graph.nodes().getOrDefault(task.id(), task);
        for (String blocker : resolved.blockedBy()) {
            TaskNode node = graph.nodes().get(blocker);
            if (node == null || !node.status().isFinished()) {
                return false;
            }
        }
        return true;
    }

    /** Blockers of {@code task} that are unknown or not yet finished. */
    public List<String> unresolvedBlockers(TaskNode task) {
        TaskNode resolved = graph.nodes().getOrDefault(task.id(), task);
        List<String> pending = new ArrayList<>();
        for (String blocker : resolved.blockedBy()) {
            TaskNode node = graph.nodes().get(blocker);
            if (node == null || !node.status().isFinished()) {
                pending.add(blocker);
            }
        }
        return pending;
    }

    // ── Critical path & impact ──────────────────────────────────────────

    /**
     * Longest chain of tasks reachable from {@code id} over "blocks" edges.
     *
     * @throws DependencyCycleException if the chain runs into a cycle
     */
    public CriticalPath longestPath(String id) {
        return longestPath(id, new LinkedHashSet<>());
    }

    private CriticalPath longestPath(String id, Set<String> visiting) {
        CriticalPath cached = longestPathMemo.get(id);
        if (cached != null) {
            return cached;
        }
        if (!visiting.add(id)) {
            throw new DependencyCycleException(detectCycles());
        }

        CriticalPath best = null;
        for (String next : graph.blockedTasks(id)) {
            CriticalPath candidate = longestPath(next, visiting);
            if (best == null || candidate.length() > best.length()) {
                best = candidate;
            }
        }
        visiting.remove(id);

        List<String> path = new ArrayList<>();
        path.add(id);
        if (best != null) {
            path.addAll(best.path());
        }
        CriticalPath result = new CriticalPath(path.size(), List.copyOf(path));
        longestPathMemo.put(id, result);
        return result;
    }

    /**
     * Number of distinct tasks transitively blocked by {@code id}, excluding {@code id} itself.
     */
    public int impact(String id) {
        Integer cached = impactMemo.get(id);
        if (cached != null) {
            return cached;
        }
        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>(graph.blockedTasks(id));
        while (!queue.isEmpty()) {
            String next = queue.poll();
            if (seen.add(next)) {
                queue.addAll(graph.blockedTasks(next));
            }
        }
        seen.remove(id);
        impactMemo.put(id, seen.size());
        return seen.size();
    }
}
