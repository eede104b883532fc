package com.quartermaster.agent;

import com.quartermaster.core.model.MergeStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "quartermaster")
public class QuartermasterProperties {

    private String haven = ".quartermaster";
    private String projectRoot = ".";
    private String backlogFile = "backlog.json";
    private Agent agent = new Agent();
    private Git git = new Git();

    public Path havenPath() {
        Path path = Path.of(haven);
        return path.isAbsolute() ? path : projectRootPath().resolve(path).normalize();
    }

    public Path projectRootPath() {
        return Path.of(projectRoot).toAbsolutePath().normalize();
    }

    public Path backlogPath() {
        Path path = Path.of(backlogFile);
        return path.isAbsolute() ? path : projectRootPath().resolve(path).normalize();
    }

    public String getHaven() { return haven; }
    public void setHaven(String haven) { this.haven = haven; }
    public String getProjectRoot() { return projectRoot; }
    public void setProjectRoot(String projectRoot) { this.projectRoot = projectRoot; }
    public String getBacklogFile() { return backlogFile; }
    public void setBacklogFile(String backlogFile) { this.backlogFile = backlogFile; }
    public Agent getAgent() { return agent; }
    public void setAgent(Agent agent) { this.agent = agent; }
    public Git getGit() { return git; }
    public void setGit(Git git) { this.git = git; }

    public static class Agent {
        /** argv prefix; the mission file path is appended. */
        private List<String> command = new ArrayList<>(List.of("claude", "-p"));
        private boolean useWorktrees = true;
        private int timeoutSeconds = 600;
        private long pollIntervalMs = 5000;
        private long killGraceMs = 5000;
        private MergeStrategy mergeStrategy = MergeStrategy.MERGE;
        private boolean cleanupWorktreeOnReap = false;

        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public boolean isUseWorktrees() { return useWorktrees; }
        public void setUseWorktrees(boolean useWorktrees) { this.useWorktrees = useWorktrees; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public long getPollIntervalMs() { return pollIntervalMs; }
        public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }
        public long getKillGraceMs() { return killGraceMs; }
        public void setKillGraceMs(long killGraceMs) { this.killGraceMs = killGraceMs; }
        public MergeStrategy getMergeStrategy() { return mergeStrategy; }
        public void setMergeStrategy(MergeStrategy mergeStrategy) { this.mergeStrategy = mergeStrategy; }
        public boolean isCleanupWorktreeOnReap() { return cleanupWorktreeOnReap; }
        public void setCleanupWorktreeOnReap(boolean cleanupWorktreeOnReap) { this.cleanupWorktreeOnReap = cleanupWorktreeOnReap; }
    }

    public static class Git {
        private String mainBranch = "main";
        private boolean syncBeforeSpawn = true;
        private boolean syncUpwardOnComplete = false;
        private boolean pushRemoteOnCleanup = true;

        public String getMainBranch() { return mainBranch; }
        public void setMainBranch(String mainBranch) { this.mainBranch = mainBranch; }
        public boolean isSyncBeforeSpawn() { return syncBeforeSpawn; }
        public void setSyncBeforeSpawn(boolean syncBeforeSpawn) { this.syncBeforeSpawn = syncBeforeSpawn; }
        public boolean isSyncUpwardOnComplete() { return syncUpwardOnComplete; }
        public void setSyncUpwardOnComplete(boolean syncUpwardOnComplete) { this.syncUpwardOnComplete = syncUpwardOnComplete; }
        public boolean isPushRemoteOnCleanup() { return pushRemoteOnCleanup; }
        public void setPushRemoteOnCleanup(boolean pushRemoteOnCleanup) { this.pushRemoteOnCleanup = pushRemoteOnCleanup; }
    }
}
