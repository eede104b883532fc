package com.quartermaster.core.graph;

import com.quartermaster.core.graph.ValidationIssue.IssueType;
import com.quartermaster.core.graph.ValidationIssue.Severity;
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
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks the backlog's dependency data for problems that would stall or mislead scheduling.
 *
 * <p>Errors: references to unknown tasks, self references, statuses that are not task
 * statuses, tasks without an epic, cycles. Warnings: repeated blockers, cancelled blockers.
 */
@Service
public class DependencyValidator {

    private static final Logger log = LoggerFactory.getLogger(DependencyValidator.class);

    private final ArtefactRepository repository;

    public DependencyValidator(ArtefactRepository repository) {
        this.repository = repository;
    }

    /**
     * Validates the whole backlog, or only the tasks of one PRD.
     *
     * @param prdFilter PRD id to restrict the per-task checks to, or null for all tasks
     */
    public ValidationReport validate(String prdFilter) {
        Set<String> epicIds = new HashSet<>();
        repository.allEpics().forEach(e -> epicIds.add(e.id()));
        return validate(repository.allTasks(), epicIds, prdFilter);
    }

    /**
     * Validates an explicit set of tasks.
     *
     * @param tasks     tasks to check
     * @param epicIds   known epic ids; a task whose epic is not among them is reported.
     *                  Pass an empty set to only require that each task names an epic.
     * @param prdFilter PRD id to restrict per-task checks to, or null
     */
    public ValidationReport validate(Collection<TaskNode> tasks, Set<String> epicIds, String prdFilter) {
        TaskGraph graph = TaskGraphBuilder.build(tasks);
        String prd = IdNormalizer.normalize(prdFilter);
        List<ValidationIssue> issues = new ArrayList<>();

        for (TaskNode original : tasks) {
            if (prd != null && !prd.equals(original.prdId())) {
                continue;
            }
            String id = original.id();
            List<String> resolved = original.blockedBy().stream()
                    .map(raw -> TaskGraphBuilder.resolve(raw, graph.nodes()))
                    .toList();

            for (String blocker : new LinkedHashSet<>(resolved)) {
                if (!graph.contains(blocker)) {
                    issues.add(error(IssueType.MISSING_REF, id, List.of(blocker),
                            id + ": blocked_by references non-existent task " + blocker));
                } else if (graph.node(blocker).orElseThrow().status() == ArtefactStatus.CANCELLED) {
                    issues.add(warning(IssueType.CANCELLED_BLOCKER, id, List.of(blocker),
                            id + ": blocked by cancelled task " + blocker));
                }
            }

            if (resolved.contains(id)) {
                issues.add(error(IssueType.SELF_REF, id, List.of(id),
                        id + ": blocked_by contains self-reference"));
            }

            Set<String> seen = new HashSet<>();
            List<String> duplicates = resolved.stream().filter(b -> !seen.add(b)).distinct().toList();
            if (!duplicates.isEmpty()) {
                issues.add(warning(IssueType.DUPLICATE, id, duplicates,
                        id + ": blocked_by contains duplicates: " + String.join(", ", duplicates)));
            }

            if (!original.status().isTaskStatus()) {
                issues.add(error(IssueType.INVALID_STATUS, id, List.of(),
                        id + ": invalid status \"" + original.status() + "\""));
            }

            if (original.epicId() == null) {
                issues.add(error(IssueType.MISSING_EPIC, id, List.of(),
                        id + ": task has no epic parent (parent: " + (original.parent() == null ? "none" : original.parent()) + ")"));
            } else if (!epicIds.isEmpty() && !epicIds.contains(original.epicId())) {
                issues.add(error(IssueType.MISSING_EPIC, id, List.of(original.epicId()),
                        id + ": parent epic " + original.epicId() + " does not exist"));
            }
        }

        for (List<String> cycle : new GraphAlgorithms(graph).detectCycles()) {
            issues.add(error(IssueType.CYCLE, null, cycle, "Task cycle detected: " + String.join(" -> ", cycle)));
        }

        issues.sort(Comparator.comparing(ValidationIssue::severity));
        ValidationReport report = new ValidationReport(issues, tasks.size());
        log.info("Validated {} tasks: {} errors, {} warnings",
                report.tasksChecked(), report.errors().size(), report.warnings().size());
        return report;
    }

    private static ValidationIssue error(IssueType type, String taskId, List<String> related, String message) {
        return new ValidationIssue(type, Severity.ERROR, taskId, related, message);
    }

    private static ValidationIssue warning(IssueType type, String taskId, List<String> related, String message) {
        return new ValidationIssue(type, Severity.WARNING, taskId, related, message);
    }
}
