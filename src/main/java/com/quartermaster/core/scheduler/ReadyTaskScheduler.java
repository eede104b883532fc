package com.quartermaster.core.scheduler;

import com.quartermaster.core.graph.DependencyCycleException;
import com.quartermaster.core.graph.GraphAlgorithms;
import com.quartermaster.core.graph.TaskGraph;
import com.quartermaster.core.graph.TaskGraphBuilder;
import com.quartermaster.core.model.ArtefactStatus;
import com.quartermaster.core.model.IdNormalizer;
import com.quartermaster.core.model.TaskNode;
import com.quartermaster.core.repository.ArtefactRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Computes the tasks an agent can pick up next.
 *
 * <p>A task is ready when it has not started (optionally: is in progress) and every blocker
 * is Done or Cancelled. Ready tasks are ranked so the ones unblocking the most work come first:
 * impact descending, then critical-path length descending, then id.
 *
 * <p>The graph is rebuilt from the repository on every call; no state is kept between queries.
 */
@Service
public class ReadyTaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(ReadyTaskScheduler.class);

    private static final Comparator<ReadyTask> RANKING = Comparator
            .comparingInt(ReadyTask::impact).reversed()
            .thenComparing(Comparator.comparingInt(ReadyTask::criticalPathLength).reversed())
            .thenComparing(r -> r.task().id());

    private final ArtefactRepository repository;

    public ReadyTaskScheduler(ArtefactRepository repository) {
        this.repository = repository;
    }

    /**
     * Ready tasks from the repository, filtered and ranked.
     *
     * @throws DependencyCycleException if the backlog contains a dependency cycle
     */
    public List<ReadyTask> findReady(ReadyQuery query) {
        return findReady(repository.allTasks(), query);
    }

    /**
     * Ready tasks from an explicit task list, filtered and ranked.
     *
     * @throws DependencyCycleException if the tasks contain a dependency cycle
     */
    public List<ReadyTask> findReady(Collection<TaskNode> tasks, ReadyQuery query) {
        TaskGraph graph = TaskGraphBuilder.build(tasks);
        GraphAlgorithms algorithms = new GraphAlgorithms(graph);

        List<List<String>> cycles = algorithms.detectCycles();
        if (!cycles.isEmpty()) {
            log.warn("Refusing ready query: {} dependency cycle(s) found", cycles.size());
            throw new DependencyCycleException(cycles);
        }

        String prd = IdNormalizer.normalize(query.prdId());
        String epic = IdNormalizer.normalize(query.epicId());

        var ready = new ArrayList<ReadyTask>();
        for (TaskNode task : graph.nodes().values()) {
            if (!isCandidateStatus(task.status(), query.includeInProgress())) {
                continue;
            }
            if (prd != null && !prd.equals(task.prdId())) continue;
            if (epic != null && !epic.equals(task.epicId())) continue;
            if (!task.tags().containsAll(query.tags())) continue;

            if (!algorithms.blockersResolved(task)) {
                log.debug("  {} waiting on {}", task.id(), algorithms.unresolvedBlockers(task));
                continue;
            }

            var path = algorithms.longestPath(task.id());
            ready.add(new ReadyTask(task, algorithms.impact(task.id()), path.length(), path.path()));
        }

        ready.sort(RANKING);
        List<ReadyTask> result = query.limit() > 0 && ready.size() > query.limit()
                ? List.copyOf(ready.subList(0, query.limit()))
                : List.copyOf(ready);

        log.info("findReady: {} tasks, {} ready (limit {})", graph.size(), result.size(), query.limit());
        return result;
    }

    private static boolean isCandidateStatus(ArtefactStatus status, boolean includeInProgress) {
        return status == ArtefactStatus.NOT_STARTED
                || (includeInProgress && status == ArtefactStatus.IN_PROGRESS);
    }
}
