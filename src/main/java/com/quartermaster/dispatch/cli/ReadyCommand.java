package com.quartermaster.dispatch.cli;

import com.quartermaster.core.graph.DependencyCycleException;
import com.quartermaster.core.scheduler.ReadyQuery;
import com.quartermaster.core.scheduler.ReadyTask;
import com.quartermaster.core.scheduler.ReadyTaskScheduler;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: quartermaster ready
 * <p>
 * Lists tasks whose blockers are all Done or Cancelled, highest impact first.
 */
@Command(name = "ready", mixinStandardHelpOptions = true, description = "List tasks ready to start")
@Component
public class ReadyCommand implements Callable<Integer> {

    @Option(names = {"--prd"}, description = "Only tasks of this PRD")
    private String prdId;

    @Option(names = {"--epic"}, description = "Only tasks of this epic")
    private String epicId;

    @Option(names = {"--tag", "-t"}, description = "Required tag (repeatable)")
    private List<String> tags = new ArrayList<>();

    @Option(names = {"--limit", "-n"}, description = "Maximum number of tasks (0 = all)", defaultValue = "0")
    private int limit;

    @Option(names = {"--include-in-progress"}, description = "Also list In Progress tasks")
    private boolean includeInProgress;

    private final ReadyTaskScheduler scheduler;

    public ReadyCommand(ReadyTaskScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public Integer call() {
        List<ReadyTask> ready;
        try {
            ready = scheduler.findReady(new ReadyQuery(prdId, epicId, tags, limit, includeInProgress));
        } catch (DependencyCycleException e) {
            ConsoleOutput.error("Dependency cycles block scheduling:");
            for (List<String> cycle : e.getCycles()) {
                ConsoleOutput.error("  " + String.join(" -> ", cycle));
            }
            return 1;
        }

        if (ready.isEmpty()) {
            ConsoleOutput.info("No ready tasks.");
            return 0;
        }

        ConsoleOutput.info(ready.size() + " ready task" + (ready.size() != 1 ? "s" : ""));
        ConsoleOutput.readyHeader();
        ready.forEach(ConsoleOutput::readyTask);
        return 0;
    }
}
