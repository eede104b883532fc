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
import com.quartermaster.core.graph.DependencyCycleException;
import com.quartermaster.core.graph.DependencyValidator;
import com.quartermaster.core.graph.ValidationIssue;
import com.quartermaster.core.graph.ValidationIssue.IssueType;
import com.quartermaster.core.graph.ValidationIssue.Severity;
import com.quartermaster.core.graph.ValidationReport;
import com.quartermaster.core.model.AgentRecord;
import com.quartermaster.core.model.AgentStatus;
import com.quartermaster.core.model.ArtefactStatus;
import com.quartermaster.core.model.Escalation;
import com.quartermaster.core.model.MergeStrategy;
import com.quartermaster.core.model.TaskNode;
import com.quartermaster.core.scheduler.ReadyQuery;
import com.quartermaster.core.scheduler.ReadyTask;
import com.quartermaster.core.scheduler.ReadyTaskScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for the Quartermaster CLI command structure.
 * These tests exercise picocli directly without a Spring context,
 * with mocked services behind every command.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    @TempDir
    Path tempDir;

    private ReadyTaskScheduler scheduler;
    private DependencyValidator validator;
    private AgentLifecycleManager manager;
    private AgentLogTailer tailer;
    private HavenLayout layout;

    @BeforeEach
    void setUp() {
        scheduler = mock(ReadyTaskScheduler.class);
        validator = mock(DependencyValidator.class);
        manager = mock(AgentLifecycleManager.class);
        tailer = mock(AgentLogTailer.class);
        layout = new HavenLayout(tempDir.resolve(".haven"));
    }

    /**
     * Custom picocli IFactory that hands out commands wired to the mocks.
     */
    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == ReadyCommand.class) {
                    return (K) new ReadyCommand(scheduler);
                }
                if (cls == ValidateCommand.class) {
                    return (K) new ValidateCommand(validator);
                }
                if (cls == AgentCommand.class) {
                    return (K) new AgentCommand(manager, tailer, layout);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new QuartermasterCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static TaskNode task(String id, String title) {
        return new TaskNode(id, title, ArtefactStatus.NOT_STARTED, List.of(), "PRD-001 / E001", null, null, List.of());
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists all subcommands")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("ready"));
            assertTrue(result.output().contains("validate"));
            assertTrue(result.output().contains("agent"));
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Quartermaster 0.1.0"));
        }

        @Test
        @DisplayName("agent --help lists the lifecycle operations")
        void agentHelp() {
            CliResult result = execute("agent", "--help");
            assertEquals(0, result.exitCode());
            for (String sub : List.of("spawn", "wait", "reap", "kill", "reject", "clear", "status", "log",
                    "sync", "conflicts")) {
                assertTrue(result.output().contains(sub), "agent help should list '" + sub + "'");
            }
        }

        @Test
        @DisplayName("unknown subcommand is a usage error")
        void unknownSubcommand() {
            CliResult result = execute("deploy");
            assertEquals(2, result.exitCode());
        }
    }

    @Nested
    @DisplayName("ready")
    class ReadyTests {

        @Test
        @DisplayName("prints ranked tasks")
        void printsTasks() {
            when(scheduler.findReady(any(ReadyQuery.class))).thenReturn(List.of(
                    new ReadyTask(task("T1", "Login form"), 3, 4, List.of("T001", "T002", "T003", "T004")),
                    new ReadyTask(task("T5", "Docs"), 0, 1, List.of("T005"))));

            CliResult result = execute("ready");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("2 ready tasks"));
            assertTrue(result.output().contains("T001"));
            assertTrue(result.output().contains("Login form"));
            assertTrue(result.output().indexOf("T001") < result.output().indexOf("T005"));
        }

        @Test
        @DisplayName("passes filters to the scheduler")
        void passesFilters() {
            when(scheduler.findReady(any(ReadyQuery.class))).thenReturn(List.of());

            CliResult result = execute("ready", "--prd", "PRD-001", "--epic", "E001", "-t", "api", "-t", "auth",
                    "-n", "5", "--include-in-progress");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("No ready tasks."));
            var query = ArgumentCaptor.forClass(ReadyQuery.class);
            verify(scheduler).findReady(query.capture());
            assertEquals(new ReadyQuery("PRD-001", "E001", List.of("api", "auth"), 5, true), query.getValue());
        }

        @Test
        @DisplayName("exits 1 and prints cycles when the graph is cyclic")
        void cycle() {
            when(scheduler.findReady(any(ReadyQuery.class)))
                    .thenThrow(new DependencyCycleException(List.of(List.of("T001", "T002", "T001"))));

            CliResult result = execute("ready");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("T001 -> T002 -> T001"));
        }
    }

    @Nested
    @DisplayName("validate")
    class ValidateTests {

        @Test
        @DisplayName("exits 0 with warnings only")
        void warningsOnly() {
            when(validator.validate(null)).thenReturn(new ValidationReport(List.of(
                    new ValidationIssue(IssueType.CANCELLED_BLOCKER, Severity.WARNING, "T002", List.of("T001"),
                            "T002 is blocked by cancelled task T001")), 2));

            CliResult result = execute("validate");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Checked 2 tasks"));
            assertTrue(result.output().contains("[WARN]"));
            assertTrue(result.output().contains("Dependencies valid (1 warning(s))"));
        }

        @Test
        @DisplayName("exits 1 when errors are found")
        void errors() {
            when(validator.validate("PRD-001")).thenReturn(new ValidationReport(List.of(
                    new ValidationIssue(IssueType.MISSING_REF, Severity.ERROR, "T001", List.of("T009"),
                            "T001 depends on unknown task T009")), 1));

            CliResult result = execute("validate", "--prd", "PRD-001");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("[ERROR]"));
            assertTrue(result.output().contains("T001 depends on unknown task T009"));
            assertTrue(result.output().contains("1 error(s) found"));
        }
    }

    @Nested
    @DisplayName("agent")
    class AgentTests {

        private final Escalation blocked = Escalation.of("Agent already running for T001 (PID 4242)",
                "quartermaster agent wait T001", "quartermaster agent kill T001");

        @Test
        @DisplayName("spawn exits 0 and passes options")
        void spawn() {
            when(manager.spawn(anyString(), any())).thenReturn(
                    LifecycleResult.ok("T001", null, "Spawned agent for T001 (PID 4242)"));

            CliResult result = execute("agent", "spawn", "T1", "--timeout", "600", "-i", "Add tests",
                    "--no-worktree", "--merge-strategy", "squash");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Spawned agent for T001 (PID 4242)"));
            verify(manager).spawn("T1", new SpawnOptions(600, "Add tests", false, MergeStrategy.SQUASH));
        }

        @Test
        @DisplayName("spawn escalation exits 1 with reason and numbered next steps")
        void spawnEscalation() {
            when(manager.spawn(anyString(), any())).thenReturn(LifecycleResult.escalate("T001", null, blocked));

            CliResult result = execute("agent", "spawn", "T001");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("BLOCKED: Agent already running for T001 (PID 4242)"));
            assertTrue(result.output().contains("1. quartermaster agent wait T001"));
            assertTrue(result.output().contains("2. quartermaster agent kill T001"));
        }

        @Test
        @DisplayName("wait maps completion and timeout to exit codes")
        void await() {
            when(manager.waitFor(eq("T001"), any())).thenReturn(WaitResult.completed(
                    AgentRecord.spawned("T001", 4242L, null, "m.yaml", "agent.log", 0, MergeStrategy.MERGE)));
            when(manager.waitFor(eq("T002"), any())).thenReturn(WaitResult.timedOut(
                    AgentRecord.spawned("T002", 4343L, null, "m.yaml", "agent.log", 0, MergeStrategy.MERGE)));

            CliResult done = execute("agent", "wait", "T001", "--timeout", "5");
            CliResult timedOut = execute("agent", "wait", "T002");

            assertEquals(0, done.exitCode());
            assertTrue(done.output().contains("Agent T001 completed"));
            assertEquals(1, timedOut.exitCode());
            assertTrue(timedOut.output().contains("agent still running"));
            verify(manager).waitFor("T001", Duration.ofSeconds(5));
            verify(manager).waitFor("T002", Duration.ofSeconds(300));
        }

        @Test
        @DisplayName("reap translates flags into options")
        void reap() {
            when(manager.reap(anyString(), any())).thenReturn(LifecycleResult.ok("T001", null, "Reaped T001"));

            CliResult result = execute("agent", "reap", "T001", "--no-wait", "--cleanup", "--merge-strategy", "rebase");

            assertEquals(0, result.exitCode());
            verify(manager).reap("T001", new ReapOptions(false, ReapOptions.DEFAULT_TIMEOUT_SECONDS, true, MergeStrategy.REBASE));
        }

        @Test
        @DisplayName("kill, reject and clear report their outcome")
        void killRejectClear() {
            when(manager.kill("T001")).thenReturn(LifecycleResult.ok("T001", null, "Killed agent for T001"));
            when(manager.reject("T001", "wrong approach")).thenReturn(LifecycleResult.ok("T001", null, "Rejected T001"));
            when(manager.clear("T001")).thenReturn(LifecycleResult.escalate("T001", null,
                    Escalation.of("Agent for T001 is still running", "quartermaster agent kill T001")));

            assertEquals(0, execute("agent", "kill", "T001").exitCode());
            assertEquals(0, execute("agent", "reject", "T001", "-r", "wrong approach").exitCode());
            CliResult clear = execute("agent", "clear", "T001");

            assertEquals(1, clear.exitCode());
            assertTrue(clear.output().contains("Agent for T001 is still running"));
        }

        @Test
        @DisplayName("status of an unknown task exits 1")
        void statusUnknown() {
            when(manager.status("t9")).thenReturn(Optional.empty());

            CliResult result = execute("agent", "status", "t9");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("No agent found for task T009"));
        }

        @Test
        @DisplayName("status without a task lists every agent")
        void statusAll() {
            when(manager.list()).thenReturn(List.of(
                    AgentRecord.spawned("T001", 4242L, null, "m.yaml", "agent.log", 0, MergeStrategy.MERGE)));

            CliResult result = execute("agent", "status");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("T001"));
            assertTrue(result.output().contains("SPAWNED"));
            assertTrue(result.output().contains("4242"));
        }

        @Test
        @DisplayName("log prints the tail of the agent log")
        void log() throws Exception {
            Path logFile = layout.logFile("T001");
            Files.createDirectories(logFile.getParent());
            Files.writeString(logFile, "one\ntwo\nthree\n");

            CliResult result = execute("agent", "log", "T1", "-n", "2");

            assertEquals(0, result.exitCode());
            assertFalse(result.output().contains("one"));
            assertTrue(result.output().contains("two"));
            assertTrue(result.output().contains("three"));
            verifyNoInteractions(tailer);
        }

        @Test
        @DisplayName("sync --dry-run reports recovered, updated and missing agents")
        void syncDryRun() {
            when(manager.sync(true)).thenReturn(new SyncReport(true,
                    List.of(new SyncReport.Change("T003", null, AgentStatus.COMPLETED, "2 uncommitted file(s)")),
                    List.of(new SyncReport.Change("T001", AgentStatus.SPAWNED, AgentStatus.ERROR, "process 4242 is gone")),
                    List.of(new SyncReport.Change("T002", AgentStatus.COMPLETED, AgentStatus.COMPLETED, "/tmp/wt/T002"))));

            CliResult result = execute("agent", "sync", "--dry-run");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("[dry run] Recovered 1 orphaned worktree(s)"));
            assertTrue(result.output().contains("T001: SPAWNED -> ERROR"));
            assertTrue(result.output().contains("agent clear T002"));
            verify(manager).sync(true);
        }

        @Test
        @DisplayName("sync with nothing to do says so")
        void syncInSync() {
            when(manager.sync(false)).thenReturn(new SyncReport(false, List.of(), List.of(), List.of()));

            CliResult result = execute("agent", "sync");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Agent records match the worktrees on disk"));
        }

        @Test
        @DisplayName("conflicts lists overlapping files and a merge order")
        void conflicts() {
            when(manager.conflicts()).thenReturn(ConflictMatrix.of(Map.of(
                    "T001", List.of("src/App.java", "src/Login.java", "README.md"),
                    "T002", List.of("src/App.java"))));

            CliResult result = execute("agent", "conflicts");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Overlapping files: 1 pair(s)"));
            assertTrue(result.output().contains("- src/App.java"));
            assertTrue(result.output().contains("1. agent reap T002"));
            assertTrue(result.output().contains("2. agent reap T001"));
        }

        @Test
        @DisplayName("conflicts with a single agent has nothing to compare")
        void conflictsSingleAgent() {
            when(manager.conflicts()).thenReturn(ConflictMatrix.of(Map.of("T001", List.of("src/App.java"))));

            CliResult result = execute("agent", "conflicts");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("nothing can conflict"));
        }
    }
}
