package com.quartermaster.isolation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * {@link ConflictDetector} backed by {@code git merge-base} and the in-memory three-way
 * {@code git merge-tree <base> <target> <source>}.
 *
 * <p>Conflict markers in the merge-tree output mean the merge would conflict. File names come
 * from the entries that follow each {@code changed in both} header, for example:
 * <pre>
 * changed in both
 *   base   100644 1a2b3c... src/App.java
 *   our    100644 4d5e6f... src/App.java
 *   their  100644 7a8b9c... src/App.java
 * </pre>
 */
public class GitMergeTreeConflictDetector implements ConflictDetector {

    private static final Logger log = LoggerFactory.getLogger(GitMergeTreeConflictDetector.class);

    private final GitCommandRunner git;

    public GitMergeTreeConflictDetector(GitCommandRunner git) {
        this.git = git;
    }

    @Override
    public ConflictReport detectConflicts(String targetBranch, String sourceBranch) {
        String base = git.mergeBase(targetBranch, sourceBranch);
        if (base.isBlank()) {
            log.warn("No merge base between {} and {}; cannot probe for conflicts", targetBranch, sourceBranch);
            return ConflictReport.none();
        }

        String tree = git.mergeTree(base, targetBranch, sourceBranch);
        if (!tree.contains("<<<<<<<") && !tree.contains(">>>>>>>")) {
            return ConflictReport.none();
        }

        List<String> files = parseConflictFiles(tree);
        log.info("Merging {} into {} would conflict in {}", sourceBranch, targetBranch, files);
        return ConflictReport.of(files);
    }

    static List<String> parseConflictFiles(String mergeTreeOutput) {
        Set<String> files = new LinkedHashSet<>();
        boolean inBoth = false;
        for (String line : mergeTreeOutput.split("\n")) {
            if (line.startsWith("changed in both")) {
                inBoth = true;
                String rest = line.substring("changed in both".length()).trim();
                if (!rest.isEmpty()) {
                    files.add(rest);
                }
                continue;
            }
            if (inBoth && line.startsWith("  ")) {
                // "  our    100644 <sha> <path>"
                String[] parts = line.trim().split("\\s+", 4);
                if (parts.length == 4) {
                    files.add(parts[3]);
                }
            } else {
                inBoth = false;
            }
        }
        return new ArrayList<>(files);
    }
}
