package com.quartermaster.agent;

import com.quartermaster.core.model.AgentRecord;
import com.quartermaster.core.model.Escalation;

/**
 * Outcome of a lifecycle operation. Either a success carrying the updated record, or an
 * {@link Escalation} describing what blocked the operation and what to do next.
 *
 * @param success    whether the operation did what was asked
 * @param taskId     task the operation targeted
 * @param record     agent record after the operation, may be null
 * @param escalation set exactly when {@code success} is false
 * @param message    short human-readable summary
 */
public record LifecycleResult(
    boolean success,
    String taskId,
    AgentRecord record,
    Escalation escalation,
    String message
) {

    public static LifecycleResult ok(String taskId, AgentRecord record, String message) {
        return new LifecycleResult(true, taskId, record, null, message);
    }

    public static LifecycleResult escalate(String taskId, AgentRecord record, Escalation escalation) {
        return new LifecycleResult(false, taskId, record, escalation, escalation.reason());
    }

    public boolean isEscalation() {
        return escalation != null;
    }
}
