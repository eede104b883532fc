package com.quartermaster.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A condition the orchestrator cannot resolve on its own, handed back to the caller.
 *
 * @param reason    one-line description of what went wrong
 * @param nextSteps actions a human or supervising agent can take, in order
 */
public record Escalation(String reason, List<String> nextSteps) implements Serializable {

    public Escalation {
        nextSteps = nextSteps == null ? List.of() : List.copyOf(nextSteps);
    }

    public static Escalation of(String reason, String... nextSteps) {
        return new Escalation(reason, List.of(nextSteps));
    }
}
