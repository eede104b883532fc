package com.quartermaster.core.model;

/**
 * An epic: groups tasks and rolls their completion up into its own status.
 *
 * @param id     normalised epic id (e.g. "E001")
 * @param prdId  owning PRD id
 * @param title  human-readable title
 * @param status current status
 */
public record EpicNode(
    String id,
    String prdId,
    String title,
    ArtefactStatus status
) {

    public EpicNode {
        id = IdNormalizer.normalize(id);
        prdId = IdNormalizer.normalize(prdId);
        status = status == null ? ArtefactStatus.UNKNOWN : status;
    }

    public EpicNode withStatus(ArtefactStatus newStatus) {
        return new EpicNode(id, prdId, title, newStatus);
    }
}
