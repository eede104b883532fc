package com.quartermaster.agent;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Abstraction for launching and signalling agent processes.
 * Implementations: {@link LocalProcessProvider} (host processes). Sandboxing, if any, is the
 * provider's business.
 */
public interface AgentProcessProvider {

    /**
     * Starts the agent with stdout and stderr appended to {@code logFile}.
     *
     * @param command argv, program first
     * @param cwd     working directory (the worktree, or the project root)
     * @param env     variables added to the inherited environment
     * @param logFile combined output log
     * @param onExit  invoked once, on an arbitrary thread, when the process exits
     * @return the operating-system pid
     * @throws ProcessLaunchException if the process cannot be started
     */
    long launch(List<String> command, Path cwd, Map<String, String> env, Path logFile, ExitListener onExit);

    boolean isAlive(long pid);

    /**
     * Asks the process to stop (SIGTERM).
     *
     * @return true if the signal was delivered or the process is already gone
     */
    boolean terminate(long pid);

    /**
     * Kills the process outright (SIGKILL).
     *
     * @return true if the signal was delivered or the process is already gone
     */
    boolean forceKill(long pid);

    @FunctionalInterface
    interface ExitListener {
        void onExit(long pid, int exitCode);
    }
}
