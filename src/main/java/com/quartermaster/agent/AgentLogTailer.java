package com.quartermaster.agent;

import com.quartermaster.core.events.EventBus;
import com.quartermaster.core.events.EventBus.Subscription;
import com.quartermaster.core.events.OrchestrationEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Follows agent log files and fans new lines out to any number of subscribers.
 *
 * <p>Each followed file is polled for growth; only the bytes appended since the last poll
 * are read. A new subscriber first receives the last N lines. Every line is also published
 * on the {@link EventBus} as {@code agent:log}.
 */
public class AgentLogTailer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AgentLogTailer.class);

    private final HavenLayout layout;
    private final EventBus eventBus;
    private final long pollIntervalMs;
    private final ScheduledExecutorService scheduler;
    private final Map<String, TailSession> sessions = new ConcurrentHashMap<>();

    public AgentLogTailer(HavenLayout layout, EventBus eventBus, long pollIntervalMs) {
        this.layout = layout;
        this.eventBus = eventBus;
        this.pollIntervalMs = pollIntervalMs;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "agent-log-tailer");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Last {@code n} lines of a file, oldest first. Empty if the file does not exist.
     */
    public static List<String> lastLines(Path file, int n) {
        if (n <= 0 || !Files.isRegularFile(file)) {
            return List.of();
        }
        Deque<String> tail = new ArrayDeque<>(n);
        try (var lines = Files.lines(file, StandardCharsets.UTF_8)) {
            lines.forEach(line -> {
                if (tail.size() == n) {
                    tail.removeFirst();
                }
                tail.addLast(line);
            });
        } catch (IOException | UncheckedIOException e) {
            log.warn("Could not read {}: {}", file, e.getMessage());
        }
        return new ArrayList<>(tail);
    }

    /**
     * Delivers the last {@code lastN} lines of the task's log to {@code consumer}, then every
     * line appended afterwards until the subscription is cancelled.
     */
    public Subscription follow(String taskId, int lastN, Consumer<String> consumer) {
        TailSession session = sessions.compute(taskId, (id, existing) ->
                existing != null ? existing : start(id));
        synchronized (session) {
            for (String line : lastLines(session.file, lastN)) {
                consumer.accept(line);
            }
            session.subscribers.add(consumer);
        }
        return () -> {
            session.subscribers.remove(consumer);
            sessions.computeIfPresent(taskId, (id, s) -> {
                if (s.subscribers.isEmpty()) {
                    s.future.cancel(false);
                    log.debug("Stopped following log for {}", id);
                    return null;
                }
                return s;
            });
        };
    }

    public int activeSessions() {
        return sessions.size();
    }

    private TailSession start(String taskId) {
        Path file = layout.logFile(taskId);
        TailSession session = new TailSession(taskId, file);
        session.offset = sizeOf(file);
        session.future = scheduler.scheduleWithFixedDelay(() -> poll(session),
                pollIntervalMs, pollIntervalMs, TimeUnit.MILLISECONDS);
        log.debug("Following log for {} at {}", taskId, file);
        return session;
    }

    /** Reads whatever was appended since the last poll and pushes complete lines out. */
    void poll(TailSession session) {
        List<String> lines;
        synchronized (session) {
            long size = sizeOf(session.file);
            if (size < session.offset) {
                // truncated or replaced: start over
                session.offset = 0;
                session.partial.reset();
            }
            if (size == session.offset) {
                return;
            }
            lines = readDelta(session, size);
        }
        for (String line : lines) {
            for (Consumer<String> subscriber : session.subscribers) {
                try {
                    subscriber.accept(line);
                } catch (RuntimeException e) {
                    log.warn("Log subscriber for {} failed: {}", session.taskId, e.getMessage());
                }
            }
            eventBus.publish(OrchestrationEvent.of(OrchestrationEvent.AGENT_LOG, session.taskId,
                    Map.of("line", line)));
        }
    }

    /**
     * Lines are cut at the {@code '\n'} byte and only then decoded, so a multi-byte character
     * split across two polls is held back with the unfinished line instead of being mangled.
     */
    private List<String> readDelta(TailSession session, long size) {
        List<String> lines = new ArrayList<>();
        byte[] bytes;
        try (var raf = new RandomAccessFile(session.file.toFile(), "r")) {
            raf.seek(session.offset);
            bytes = new byte[(int) Math.min(size - session.offset, Integer.MAX_VALUE)];
            raf.readFully(bytes);
            session.offset += bytes.length;
        } catch (IOException e) {
            log.warn("Could not read {}: {}", session.file, e.getMessage());
            return lines;
        }
        int start = 0;
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] != '\n') {
                continue;
            }
            session.partial.write(bytes, start, i - start);
            String line = session.partial.toString(StandardCharsets.UTF_8);
            lines.add(line.endsWith("\r") ? line.substring(0, line.length() - 1) : line);
            session.partial.reset();
            start = i + 1;
        }
        session.partial.write(bytes, start, bytes.length - start);
        return lines;
    }

    private static long sizeOf(Path file) {
        try {
            return Files.isRegularFile(file) ? Files.size(file) : 0L;
        } catch (IOException e) {
            return 0L;
        }
    }

    @Override
    public void close() {
        sessions.values().forEach(s -> s.future.cancel(false));
        sessions.clear();
        scheduler.shutdownNow();
    }

    static final class TailSession {
        final String taskId;
        final Path file;
        final List<Consumer<String>> subscribers = new CopyOnWriteArrayList<>();
        final ByteArrayOutputStream partial = new ByteArrayOutputStream();
        long offset;
        ScheduledFuture<?> future;

        TailSession(String taskId, Path file) {
            this.taskId = taskId;
            this.file = file;
        }
    }
}
