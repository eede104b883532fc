package com.quartermaster.core.model;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle state of an agent process bound to a task.
 *
 * <pre>
 *   (absent) → SPAWNED → RUNNING → COMPLETED | ERROR → REAPED | KILLED | REJECTED
 * </pre>
 *
 * A live agent may also be killed or rejected directly, and a reaped or killed agent can
 * still be rejected to discard the worktree it left behind. Absence is modelled by the record
 * not existing in the store.
 */
public enum AgentStatus {
    SPAWNED,
    RUNNING,
    COMPLETED,
    ERROR,
    REAPED,
    KILLED,
    REJECTED;

    private static final Map<AgentStatus, Set<AgentStatus>> TRANSITIONS = Map.of(
            SPAWNED, EnumSet.of(RUNNING, COMPLETED, ERROR, KILLED, REJECTED),
            RUNNING, EnumSet.of(COMPLETED, ERROR, KILLED, REJECTED),
            COMPLETED, EnumSet.of(REAPED, KILLED, REJECTED),
            ERROR, EnumSet.of(REAPED, KILLED, REJECTED),
            REAPED, EnumSet.of(REJECTED),
            KILLED, EnumSet.of(REJECTED),
            REJECTED, EnumSet.noneOf(AgentStatus.class)
    );

    public boolean canTransitionTo(AgentStatus next) {
        return TRANSITIONS.get(this).contains(next);
    }

    /** SPAWNED or RUNNING: a pid is held and the process may still be alive. */
    public boolean isActive() {
        return this == SPAWNED || this == RUNNING;
    }

    /** REAPED, KILLED or REJECTED: nothing more happens until the record is cleared. */
    public boolean isTerminal() {
        return this == REAPED || this == KILLED || this == REJECTED;
    }
}
