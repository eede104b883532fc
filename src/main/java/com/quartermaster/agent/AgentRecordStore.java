package com.quartermaster.agent;

import com.quartermaster.core.model.AgentRecord;

import java.util.List;
import java.util.Optional;

/**
 * Keyed store of agent records, one per task id.
 */
public interface AgentRecordStore {

    Optional<AgentRecord> get(String taskId);

    void save(AgentRecord record);

    /**
     * @return true if a record existed
     */
    boolean delete(String taskId);

    List<AgentRecord> list();
}
