package com.quartermaster.core.scheduler;

import java.util.List;

/**
 * Filters for {@link ReadyTaskScheduler#findReady}.
 *
 * @param prdId             only tasks of this PRD, or null
 * @param epicId            only tasks of this epic, or null
 * @param tags              task must carry all of these tags
 * @param limit             maximum number of results, 0 for unlimited
 * @param includeInProgress also return In Progress tasks whose blockers are resolved
 */
public record ReadyQuery(
    String prdId,
    String epicId,
    List<String> tags,
    int limit,
    boolean includeInProgress
) {

    public ReadyQuery {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static ReadyQuery all() {
        return new ReadyQuery(null, null, List.of(), 0, false);
    }
}
