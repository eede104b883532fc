package com.quartermaster.isolation;

import java.util.List;

/**
 * Result of a dry-run merge probe.
 *
 * @param hasConflicts whether merging would conflict
 * @param files        paths that would conflict, possibly empty even when {@code hasConflicts}
 */
public record ConflictReport(boolean hasConflicts, List<String> files) {

    public ConflictReport {
        files = files == null ? List.of() : List.copyOf(files);
    }

    public static ConflictReport none() {
        return new ConflictReport(false, List.of());
    }

    public static ConflictReport of(List<String> files) {
        return new ConflictReport(true, files);
    }
}
