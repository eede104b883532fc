package com.quartermaster.core.model;

/**
 * A product requirements document, the top of the backlog hierarchy.
 *
 * @param id        normalised PRD id (e.g. "PRD-001")
 * @param title     human-readable title
 * @param status    current status
 * @param branching branch hierarchy used for this PRD's tasks
 */
public record PrdNode(
    String id,
    String title,
    ArtefactStatus status,
    BranchingStrategy branching
) {

    public PrdNode {
        id = IdNormalizer.normalize(id);
        status = status == null ? ArtefactStatus.UNKNOWN : status;
        branching = branching == null ? BranchingStrategy.FLAT : branching;
    }

    public PrdNode withStatus(ArtefactStatus newStatus) {
        return new PrdNode(id, title, newStatus, branching);
    }
}
