package com.quartermaster.core.graph;

import java.util.List;

/**
 * Longest chain of tasks starting at a given task and following "blocks" edges.
 *
 * @param length number of tasks on the chain (a task that blocks nothing has length 1)
 * @param path   task ids along the chain, starting with the queried task
 */
public record CriticalPath(int length, List<String> path) {}
