package com.quartermaster.dispatch.cli;

import com.quartermaster.agent.AgentLifecycleManager;
import com.quartermaster.agent.AgentLogTailer;
import com.quartermaster.agent.ConflictMatrix;
import com.quartermaster.agent.HavenLayout;
import com.quartermaster.agent.LifecycleResult;
import com.quartermaster.agent.ReapOptions;
import com.quartermaster.agent.SpawnOptions;
import com.quartermaster.agent.SyncReport;
import com.quartermaster.agent.WaitResult;
import com.quartermaster.core.events.EventBus.Subscription;
import com.quartermaster.core.model.AgentRecord;
import com.quartermaster.core.model.IdNormalizer;
import com.quartermaster.core.model.MergeStrategy;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * CLI command group: quartermaster agent &lt;spawn|wait|reap|kill|reject|clear|status|log|sync|conflicts&gt;
 * <p>
 * Every subcommand exits with 0 on success and 1 when the operation escalated.
 */
@Command(name = "agent", mixinStandardHelpOptions = true, description = "Manage task agents")
@Component
public class AgentCommand implements Runnable {

    private static final long FOLLOW_POLL_MS = 1000;

    private final AgentLifecycleManager manager;
    private final AgentLogTailer tailer;
    private final HavenLayout layout;

    public AgentCommand(AgentLifecycleManager manager, AgentLogTailer tailer, HavenLayout layout) {
        this.manager = manager;
        this.tailer = tailer;
        this.layout = layout;
    }

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    @Command(name = "spawn", mixinStandardHelpOptions = true, description = "Launch an agent for a task")
    int spawn(@Parameters(paramLabel = "TASK", description = "Task ID") String taskId,
              @Option(names = {"--timeout"}, description = "Run timeout in seconds") Integer timeout,
              @Option(names = {"--instruction", "-i"}, description = "Instruction text for the agent") String instruction,
              @Option(names = {"--no-worktree"}, description = "Run in the project root instead of a worktree") boolean noWorktree,
              @Option(names = {"--merge-strategy"}, description = "merge, squash or rebase") String mergeStrategy) {
        SpawnOptions options = new SpawnOptions(timeout, instruction,
                noWorktree ? Boolean.FALSE : null,
                mergeStrategy == null ? null : MergeStrategy.parse(mergeStrategy));
        return report(manager.spawn(taskId, options));
    }

    @Command(name = "wait", mixinStandardHelpOptions = true, description = "Wait for an agent to finish")
    int await(@Parameters(paramLabel = "TASK", description = "Task ID") String taskId,
              @Option(names = {"--timeout"}, description = "Seconds to wait (default: ${DEFAULT-VALUE})",
                      defaultValue = "300") int timeoutSeconds) {
        WaitResult result = manager.waitFor(taskId, Duration.ofSeconds(timeoutSeconds));
        if (result.completed()) {
            ConsoleOutput.success(result.message());
            return 0;
        }
        if (result.timedOut()) {
            ConsoleOutput.warning(result.message() + " (agent still running)");
            return 1;
        }
        ConsoleOutput.error(result.message());
        return 1;
    }

    @Command(name = "reap", mixinStandardHelpOptions = true, description = "Merge a finished agent's work")
    int reap(@Parameters(paramLabel = "TASK", description = "Task ID") String taskId,
             @Option(names = {"--no-wait"}, description = "Escalate instead of waiting for a running agent") boolean noWait,
             @Option(names = {"--timeout"}, description = "Seconds to wait (default: ${DEFAULT-VALUE})",
                     defaultValue = "" + ReapOptions.DEFAULT_TIMEOUT_SECONDS) int timeoutSeconds,
             @Option(names = {"--cleanup"}, description = "Remove worktree and branch after merging") Boolean cleanup,
             @Option(names = {"--merge-strategy"}, description = "merge, squash or rebase") String mergeStrategy) {
        ReapOptions options = new ReapOptions(!noWait, timeoutSeconds, cleanup,
                mergeStrategy == null ? null : MergeStrategy.parse(mergeStrategy));
        return report(manager.reap(taskId, options));
    }

    @Command(name = "kill", mixinStandardHelpOptions = true, description = "Stop a running agent")
    int kill(@Parameters(paramLabel = "TASK", description = "Task ID") String taskId) {
        return report(manager.kill(taskId));
    }

    @Command(name = "reject", mixinStandardHelpOptions = true, description = "Discard an agent's work")
    int reject(@Parameters(paramLabel = "TASK", description = "Task ID") String taskId,
               @Option(names = {"--reason", "-r"}, description = "Why the work is rejected",
                       defaultValue = "rejected") String reason) {
        return report(manager.reject(taskId, reason));
    }

    @Command(name = "clear", mixinStandardHelpOptions = true, description = "Forget a finished agent")
    int clear(@Parameters(paramLabel = "TASK", description = "Task ID") String taskId) {
        return report(manager.clear(taskId));
    }

    @Command(name = "status", mixinStandardHelpOptions = true, description = "Show agent status")
    int status(@Parameters(paramLabel = "TASK", arity = "0..1", description = "Task ID (all agents if omitted)") String taskId) {
        if (taskId == null) {
            List<AgentRecord> records = manager.list();
            if (records.isEmpty()) {
                ConsoleOutput.info("No agents.");
                return 0;
            }
            ConsoleOutput.agentHeader();
            records.forEach(ConsoleOutput::agentRecord);
            return 0;
        }
        Optional<AgentRecord> record = manager.status(taskId);
        if (record.isEmpty()) {
            ConsoleOutput.error("No agent found for task " + IdNormalizer.normalize(taskId));
            return 1;
        }
        ConsoleOutput.agentHeader();
        ConsoleOutput.agentRecord(record.get());
        if (record.get().hasWorktree()) {
            ConsoleOutput.info("Worktree: " + record.get().worktree().path());
        }
        return 0;
    }

    @Command(name = "log", mixinStandardHelpOptions = true, description = "Show an agent's output")
    int log(@Parameters(paramLabel = "TASK", description = "Task ID") String taskId,
            @Option(names = {"--lines", "-n"}, description = "Lines of history (default: ${DEFAULT-VALUE})",
                    defaultValue = "50") int lines,
            @Option(names = {"--follow", "-f"}, description = "Keep printing new output while the agent runs") boolean follow) {
        String id = IdNormalizer.normalize(taskId);
        if (!follow) {
            AgentLogTailer.lastLines(layout.logFile(id), lines).forEach(System.out::println);
            return 0;
        }

        Subscription subscription = tailer.follow(id, lines, System.out::println);
        try {
            while (manager.status(id).map(r -> r.status().isActive()).orElse(false)) {
                Thread.sleep(FOLLOW_POLL_MS);
            }
            // let the tailer pick up the last bytes written before exit
            Thread.sleep(FOLLOW_POLL_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            subscription.unsubscribe();
        }
        return 0;
    }

    @Command(name = "sync", mixinStandardHelpOptions = true,
            description = "Reconcile agent records with the worktrees on disk")
    int sync(@Option(names = {"--dry-run"}, description = "Report without changing any record") boolean dryRun) {
        SyncReport report = manager.sync(dryRun);
        ConsoleOutput.syncReport(report);
        return 0;
    }

    @Command(name = "conflicts", mixinStandardHelpOptions = true,
            description = "Show files changed by more than one pending agent")
    int conflicts() {
        ConflictMatrix matrix = manager.conflicts();
        List<String> agents = matrix.agents();
        if (agents.isEmpty()) {
            ConsoleOutput.info("No agents with unmerged worktrees");
            return 0;
        }
        if (agents.size() == 1) {
            ConsoleOutput.info("Only one agent with a worktree: " + agents.get(0) + "; nothing can conflict");
            return 0;
        }
        ConsoleOutput.conflictMatrix(matrix);
        return 0;
    }

    private static int report(LifecycleResult result) {
        if (result.isEscalation()) {
            ConsoleOutput.escalation(result.escalation());
            return 1;
        }
        ConsoleOutput.success(result.message());
        return 0;
    }
}
