package com.quartermaster.core.model;

import java.util.List;

/**
 * A task as seen by the orchestrator: a read-only snapshot supplied by the artefact store.
 *
 * @param id        normalised task id (e.g. "T042")
 * @param title     human-readable title
 * @param status    current status
 * @param blockedBy ids of tasks that must be Done or Cancelled before this one is ready
 * @param parent    raw parent reference (e.g. "PRD-001 / E002")
 * @param epicId    owning epic id, may be null
 * @param prdId     owning PRD id, may be null
 * @param tags      free-form tags used by ready-task filters
 */
public record TaskNode(
    String id,
    String title,
    ArtefactStatus status,
    List<String> blockedBy,
    String parent,
    String epicId,
    String prdId,
    List<String> tags
) {

    public TaskNode {
        blockedBy = blockedBy == null ? List.of() : List.copyOf(blockedBy);
        tags = tags == null ? List.of() : List.copyOf(tags);
        status = status == null ? ArtefactStatus.UNKNOWN : status;
        id = IdNormalizer.normalize(id);
        epicId = epicId == null ? IdNormalizer.extractEpicId(parent) : IdNormalizer.normalize(epicId);
        prdId = prdId == null ? IdNormalizer.extractPrdId(parent) : IdNormalizer.normalize(prdId);
    }

    public TaskNode withStatus(ArtefactStatus newStatus) {
        return new TaskNode(id, title, newStatus, blockedBy, parent, epicId, prdId, tags);
    }

    public TaskNode withBlockedBy(List<String> newBlockedBy) {
        return new TaskNode(id, title, status, newBlockedBy, parent, epicId, prdId, tags);
    }
}
