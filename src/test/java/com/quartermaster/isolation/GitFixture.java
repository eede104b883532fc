package com.quartermaster.isolation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Builds throwaway git repositories for tests that need the real binary.
 */
final class GitFixture {

    private GitFixture() {}

    static boolean gitAvailable() {
        try {
            Process p = new ProcessBuilder("git", "--version").redirectErrorStream(true).start();
            p.getInputStream().readAllBytes();
            return p.waitFor(10, TimeUnit.SECONDS) && p.exitValue() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /** A repository on branch {@code main} with one commit containing {@code README.md}. */
    static Path initRepo(Path dir) throws IOException, InterruptedException {
        Files.createDirectories(dir);
        git(dir, "init", "-q");
        git(dir, "symbolic-ref", "HEAD", "refs/heads/main");
        git(dir, "config", "user.email", "dev@example.com");
        git(dir, "config", "user.name", "Dev");
        git(dir, "config", "commit.gpgsign", "false");
        commitFile(dir, "README.md", "hello\n", "initial");
        return dir;
    }

    static void commitFile(Path dir, String file, String content, String message)
            throws IOException, InterruptedException {
        Path target = dir.resolve(file);
        Files.createDirectories(target.getParent());
        Files.writeString(target, content, StandardCharsets.UTF_8);
        git(dir, "add", file);
        git(dir, "commit", "-q", "-m", message);
    }

    static String git(Path dir, String... args) throws IOException, InterruptedException {
        List<String> command = new ArrayList<>();
        command.add("git");
        command.addAll(List.of(args));
        Process p = new ProcessBuilder(command).directory(dir.toFile()).redirectErrorStream(true).start();
        String out = new String(p.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        if (p.waitFor() != 0) {
            throw new IllegalStateException(String.join(" ", command) + " failed: " + out);
        }
        return out.trim();
    }
}
