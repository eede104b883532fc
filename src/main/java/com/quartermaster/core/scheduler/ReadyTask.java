package com.quartermaster.core.scheduler;

import com.quartermaster.core.model.TaskNode;

import java.util.List;

/**
 * A task that can be started now, with the ranking data used to order it.
 *
 * @param task               the task
 * @param impact             number of tasks transitively waiting on it
 * @param criticalPathLength length of the longest chain it heads
 * @param criticalPath       ids along that chain
 */
public record ReadyTask(
    TaskNode task,
    int impact,
    int criticalPathLength,
    List<String> criticalPath
) {}
