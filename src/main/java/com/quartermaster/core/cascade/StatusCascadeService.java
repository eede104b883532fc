package com.quartermaster.core.cascade;

import com.quartermaster.core.events.EventBus;
import com.quartermaster.core.events.OrchestrationEvent;
import com.quartermaster.core.model.ArtefactStatus;
import com.quartermaster.core.model.EpicNode;
import com.quartermaster.core.model.PrdNode;
import com.quartermaster.core.model.TaskNode;
import com.quartermaster.core.repository.ArtefactRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Keeps epic and PRD statuses consistent with the tasks beneath them.
 *
 * <p>Every method reads the current status before writing and writes only when the status
 * actually changes, so calling it twice is harmless. Epics and PRDs are only ever moved to
 * {@code Auto-Done}; confirming {@code Done} is left to a human.
 *
 * <p>An epic with no tasks, or a PRD with no epics, is never auto-completed.
 */
@Service
public class StatusCascadeService {

    private static final Logger log = LoggerFactory.getLogger(StatusCascadeService.class);

    private static final Set<ArtefactStatus> PRD_STARTABLE =
            EnumSet.of(ArtefactStatus.DRAFT, ArtefactStatus.APPROVED, ArtefactStatus.NOT_STARTED);

    private static final Set<ArtefactStatus> PRD_ACTIVATABLE =
            EnumSet.of(ArtefactStatus.DRAFT, ArtefactStatus.APPROVED);

    private static final Set<ArtefactStatus> CLOSED =
            EnumSet.of(ArtefactStatus.AUTO_DONE, ArtefactStatus.DONE, ArtefactStatus.CANCELLED);

    private final ArtefactRepository repository;
    private final EventBus eventBus;

    public StatusCascadeService(ArtefactRepository repository, EventBus eventBus) {
        this.repository = repository;
        this.eventBus = eventBus;
    }

    /**
     * Marks the task's epic and PRD as in progress when work on the task begins.
     * Epic: Not Started → In Progress. PRD: Draft, Approved or Not Started → In Progress.
     *
     * @return the writes performed, empty when everything was already in progress
     */
    public List<StatusChange> escalateOnTaskStart(TaskNode task) {
        var changes = new ArrayList<StatusChange>();

        epicOf(task).ifPresent(epic -> {
            if (epic.status() == ArtefactStatus.NOT_STARTED) {
                repository.updateEpicStatus(epic.id(), ArtefactStatus.IN_PROGRESS);
                changes.add(publish(task.id(), new StatusChange("epic", epic.id(), epic.status(), ArtefactStatus.IN_PROGRESS)));
            }
        });

        prdOf(task).ifPresent(prd -> {
            if (PRD_STARTABLE.contains(prd.status())) {
                repository.updatePrdStatus(prd.id(), ArtefactStatus.IN_PROGRESS);
                changes.add(publish(task.id(), new StatusChange("prd", prd.id(), prd.status(), ArtefactStatus.IN_PROGRESS)));
            }
        });

        if (!changes.isEmpty()) {
            log.info("Task {} started: {}", task.id(), changes);
        }
        return changes;
    }

    /**
     * Rolls a finished task up the hierarchy.
     * <ol>
     *   <li>Epic → Auto-Done when it has tasks and every one is Done or Cancelled.</li>
     *   <li>PRD → Auto-Done when it has epics and every one is Done, Cancelled or Auto-Done;
     *       otherwise a Draft or Approved PRD moves to In Progress.</li>
     * </ol>
     */
    public CascadeResult cascadeTaskCompletion(TaskNode task) {
        var changes = new ArrayList<StatusChange>();
        Optional<EpicNode> epic = epicOf(task);

        epic.ifPresent(e -> {
            List<TaskNode> tasks = repository.tasksForEpic(e.id());
            boolean allFinished = !tasks.isEmpty() && tasks.stream().allMatch(t -> t.status().isFinished());
            if (allFinished && !CLOSED.contains(e.status())) {
                repository.updateEpicStatus(e.id(), ArtefactStatus.AUTO_DONE);
                changes.add(publish(task.id(), new StatusChange("epic", e.id(), e.status(), ArtefactStatus.AUTO_DONE)));
            }
        });

        Optional<PrdNode> prd = prdOf(task);
        prd.ifPresent(p -> {
            List<EpicNode> epics = repository.epicsForPrd(p.id());
            boolean allFinished = !epics.isEmpty() && epics.stream().allMatch(e -> e.status().isFinishedOrAutoDone());
            if (allFinished && !CLOSED.contains(p.status())) {
                repository.updatePrdStatus(p.id(), ArtefactStatus.AUTO_DONE);
                changes.add(publish(task.id(), new StatusChange("prd", p.id(), p.status(), ArtefactStatus.AUTO_DONE)));
            } else if (!allFinished && PRD_ACTIVATABLE.contains(p.status())) {
                repository.updatePrdStatus(p.id(), ArtefactStatus.IN_PROGRESS);
                changes.add(publish(task.id(), new StatusChange("prd", p.id(), p.status(), ArtefactStatus.IN_PROGRESS)));
            }
        });

        if (!changes.isEmpty()) {
            log.info("Task {} completion cascaded: {}", task.id(), changes);
        }
        return new CascadeResult(changes,
                epic.map(EpicNode::id).orElse(null),
                prd.map(PrdNode::id).orElse(null));
    }

    /**
     * Sets a task's status and publishes {@code task:updated}. No-op when unchanged.
     *
     * @return the change, or empty when the task already had that status
     */
    public Optional<StatusChange> updateTaskStatus(TaskNode task, ArtefactStatus status) {
        TaskNode current = repository.getTask(task.id()).orElse(task);
        if (current.status() == status) {
            return Optional.empty();
        }
        repository.updateTaskStatus(task.id(), status);
        return Optional.of(publish(task.id(), new StatusChange("task", task.id(), current.status(), status)));
    }

    private Optional<EpicNode> epicOf(TaskNode task) {
        return task.epicId() == null ? Optional.empty() : repository.getEpic(task.epicId());
    }

    private Optional<PrdNode> prdOf(TaskNode task) {
        String prdId = task.prdId();
        if (prdId == null) {
            prdId = epicOf(task).map(EpicNode::prdId).orElse(null);
        }
        return prdId == null ? Optional.empty() : repository.getPrd(prdId);
    }

    private StatusChange publish(String taskId, StatusChange change) {
        eventBus.publish(OrchestrationEvent.of(OrchestrationEvent.TASK_UPDATED, taskId, Map.of(
                "kind", change.kind(),
                "id", change.id(),
                "from", change.from().label(),
                "to", change.to().label())));
        return change;
    }
}
