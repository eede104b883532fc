package com.quartermaster.core.cascade;

import com.quartermaster.core.model.ArtefactStatus;

import java.util.List;

/**
 * Outcome of {@link StatusCascadeService#cascadeTaskCompletion}.
 *
 * @param changes every status write performed, in order
 * @param epicId  epic that was examined, may be null
 * @param prdId   PRD that was examined, may be null
 */
public record CascadeResult(List<StatusChange> changes, String epicId, String prdId) {

    public CascadeResult {
        changes = List.copyOf(changes);
    }

    public boolean epicAutoDone() {
        return reached("epic", ArtefactStatus.AUTO_DONE);
    }

    public boolean prdAutoDone() {
        return reached("prd", ArtefactStatus.AUTO_DONE);
    }

    private boolean reached(String kind, ArtefactStatus status) {
        return changes.stream().anyMatch(c -> c.kind().equals(kind) && c.to() == status);
    }
}
