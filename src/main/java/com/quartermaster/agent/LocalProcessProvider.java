package com.quartermaster.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs agents as child processes of this JVM via {@link ProcessBuilder}; signals them via
 * {@link ProcessHandle}, which also works for pids spawned by an earlier invocation.
 */
public class LocalProcessProvider implements AgentProcessProvider {

    private static final Logger log = LoggerFactory.getLogger(LocalProcessProvider.class);

    @Override
    public long launch(List<String> command, Path cwd, Map<String, String> env, Path logFile,
                       ExitListener onExit) {
        try {
            Files.createDirectories(logFile.toAbsolutePath().getParent());
            var builder = new ProcessBuilder(command)
                    .directory(cwd.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()))
                    .redirectInput(ProcessBuilder.Redirect.from(nullDevice()));
            builder.environment().putAll(env);

            Process process = builder.start();
            long pid = process.pid();
            log.info("Launched agent pid {} in {}: {}", pid, cwd, String.join(" ", command));

            process.onExit().thenAccept(p -> {
                int code = p.exitValue();
                log.info("Agent pid {} exited with code {}", pid, code);
                if (onExit != null) {
                    try {
                        onExit.onExit(pid, code);
                    } catch (RuntimeException e) {
                        log.warn("Exit listener for pid {} failed: {}", pid, e.getMessage(), e);
                    }
                }
            });
            return pid;
        } catch (IOException e) {
            throw new ProcessLaunchException("Failed to start " + String.join(" ", command), e);
        }
    }

    @Override
    public boolean isAlive(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    @Override
    public boolean terminate(long pid) {
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        if (handle.isEmpty() || !handle.get().isAlive()) {
            log.debug("pid {} already gone", pid);
            return true;
        }
        return handle.get().destroy();
    }

    @Override
    public boolean forceKill(long pid) {
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        if (handle.isEmpty() || !handle.get().isAlive()) {
            return true;
        }
        return handle.get().destroyForcibly();
    }

    private static File nullDevice() {
        return new File(System.getProperty("os.name").startsWith("Windows") ? "NUL" : "/dev/null");
    }
}
