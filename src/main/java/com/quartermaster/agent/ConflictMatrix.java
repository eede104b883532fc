package com.quartermaster.agent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Files touched by each pending agent, and the pairs of agents that touched the same file.
 *
 * @param filesByAgent changed files per task id, in task id order
 * @param overlaps     pairs sharing at least one file
 */
public record ConflictMatrix(Map<String, List<String>> filesByAgent, List<Overlap> overlaps) {

    public ConflictMatrix {
        filesByAgent = Collections.unmodifiableMap(new LinkedHashMap<>(filesByAgent));
        overlaps = List.copyOf(overlaps);
    }

    public record Overlap(String first, String second, List<String> files) {}

    /** Builds the pairwise overlaps of the given file sets, agents in task id order. */
    public static ConflictMatrix of(Map<String, List<String>> files) {
        Map<String, List<String>> filesByAgent = new TreeMap<>(files);
        List<String> agents = new ArrayList<>(filesByAgent.keySet());
        List<Overlap> overlaps = new ArrayList<>();
        for (int i = 0; i < agents.size(); i++) {
            Set<String> mine = new HashSet<>(filesByAgent.get(agents.get(i)));
            for (int j = i + 1; j < agents.size(); j++) {
                List<String> shared = filesByAgent.get(agents.get(j)).stream()
                        .filter(mine::contains)
                        .sorted()
                        .toList();
                if (!shared.isEmpty()) {
                    overlaps.add(new Overlap(agents.get(i), agents.get(j), shared));
                }
            }
        }
        return new ConflictMatrix(filesByAgent, overlaps);
    }

    public List<String> agents() {
        return List.copyOf(filesByAgent.keySet());
    }

    public boolean hasConflicts() {
        return !overlaps.isEmpty();
    }

    /** Number of files {@code a} and {@code b} both changed. */
    public int overlapCount(String a, String b) {
        return overlaps.stream()
                .filter(o -> (o.first().equals(a) && o.second().equals(b))
                        || (o.first().equals(b) && o.second().equals(a)))
                .mapToInt(o -> o.files().size())
                .sum();
    }

    /**
     * Order in which to merge one at a time: smallest change sets first, so the later,
     * larger merges absorb the conflicts. Task id order when nothing overlaps.
     */
    public List<String> suggestedMergeOrder() {
        if (!hasConflicts()) {
            return agents();
        }
        return filesByAgent.keySet().stream()
                .sorted(Comparator.<String>comparingInt(id -> filesByAgent.get(id).size())
                        .thenComparing(Comparator.naturalOrder()))
                .toList();
    }
}
