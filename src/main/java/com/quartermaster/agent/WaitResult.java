package com.quartermaster.agent;

import com.quartermaster.core.model.AgentRecord;

/**
 * Outcome of waiting for an agent.
 *
 * @param completed whether the agent signalled completion
 * @param timedOut  whether the deadline passed first (the agent keeps running)
 * @param record    latest record, null when there is no agent
 * @param message   short summary
 */
public record WaitResult(boolean completed, boolean timedOut, AgentRecord record, String message) {

    public static WaitResult completed(AgentRecord record) {
        return new WaitResult(true, false, record, "Agent " + record.taskId() + " completed");
    }

    public static WaitResult timedOut(AgentRecord record) {
        return new WaitResult(false, true, record, "Timeout waiting for agent " + record.taskId());
    }

    public static WaitResult ended(AgentRecord record, String message) {
        return new WaitResult(false, false, record, message);
    }

    public static WaitResult noAgent(String taskId) {
        return new WaitResult(false, false, null, "No agent found for task " + taskId);
    }
}
