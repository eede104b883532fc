package com.quartermaster.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for agent orchestration.
 */
@Service
public class OrchestratorMetrics {

    private final MeterRegistry registry;

    public OrchestratorMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSpawn() {
        Counter.builder("quartermaster.agents.spawned")
                .register(registry)
                .increment();
    }

    public void recordReap(String outcome) {
        Counter.builder("quartermaster.agents.reaped")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordKill() {
        Counter.builder("quartermaster.agents.killed")
                .register(registry)
                .increment();
    }

    public void recordRejection() {
        Counter.builder("quartermaster.agents.rejected")
                .register(registry)
                .increment();
    }

    public void incrementEscalations(String operation) {
        Counter.builder("quartermaster.escalations.total")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    /**
     * Records a conflict found by the pre-merge probe.
     *
     * @param fileCount number of conflicting files
     */
    public void recordMergeConflict(int fileCount) {
        Counter.builder("quartermaster.merge.conflicts")
                .description("Reaps refused because the task branch conflicts with its target")
                .register(registry)
                .increment();
        Counter.builder("quartermaster.merge.conflict_files")
                .register(registry)
                .increment(fileCount);
    }

    public void recordWorktreeOperation(String operation, boolean success) {
        Counter.builder("quartermaster.worktree.operations")
                .tag("operation", operation)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void recordAgentRunDuration(Duration duration) {
        Timer.builder("quartermaster.agent.run.duration")
                .register(registry)
                .record(duration);
    }
}
