package com.quartermaster.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by the orchestrator, consumed by dashboards, log followers and supervisors.
 *
 * @param eventType one of the {@code AGENT_*} / {@code TASK_*} constants
 * @param taskId    the task this event relates to
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record OrchestrationEvent(
    String eventType,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String AGENT_SPAWNED = "agent:spawned";
    public static final String AGENT_LOG = "agent:log";
    public static final String AGENT_COMPLETED = "agent:completed";
    public static final String AGENT_KILLED = "agent:killed";
    public static final String AGENT_REAPED = "agent:reaped";
    public static final String TASK_UPDATED = "task:updated";

    public OrchestrationEvent {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static OrchestrationEvent of(String eventType, String taskId, Map<String, Object> payload) {
        return new OrchestrationEvent(eventType, taskId, payload, Instant.now());
    }
}
