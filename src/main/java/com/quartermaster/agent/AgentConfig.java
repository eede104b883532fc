package com.quartermaster.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.quartermaster.core.events.EventBus;
import com.quartermaster.core.repository.ArtefactRepository;
import com.quartermaster.core.repository.InMemoryArtefactRepository;
import com.quartermaster.isolation.ConflictDetector;
import com.quartermaster.isolation.GitCommandRunner;
import com.quartermaster.isolation.GitMergeTreeConflictDetector;
import com.quartermaster.isolation.MergeService;
import com.quartermaster.isolation.WorktreeManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the on-disk layout, git isolation layer, record store and process provider from
 * {@link QuartermasterProperties}.
 */
@Configuration
public class AgentConfig {

    private static final Logger log = LoggerFactory.getLogger(AgentConfig.class);

    @Bean
    @ConditionalOnMissingBean(ObjectMapper.class)
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Bean
    public HavenLayout havenLayout(QuartermasterProperties properties) {
        log.debug("Haven directory: {}", properties.havenPath());
        return new HavenLayout(properties.havenPath());
    }

    /**
     * Backlog held in memory and written back to {@code quartermaster.backlog-file}.
     * Replace this bean to read artefacts from another source.
     */
    @Bean
    @ConditionalOnMissingBean(ArtefactRepository.class)
    public ArtefactRepository artefactRepository(ObjectMapper objectMapper, QuartermasterProperties properties) {
        return new InMemoryArtefactRepository(objectMapper, properties.backlogPath());
    }

    @Bean
    public GitCommandRunner gitCommandRunner(QuartermasterProperties properties) {
        return new GitCommandRunner(properties.projectRootPath());
    }

    @Bean
    public WorktreeManager worktreeManager(GitCommandRunner git, HavenLayout layout,
                                           QuartermasterProperties properties) {
        return new WorktreeManager(git, layout.worktreesDir(),
                properties.getGit().getMainBranch(),
                properties.getGit().isPushRemoteOnCleanup());
    }

    @Bean
    @ConditionalOnMissingBean(ConflictDetector.class)
    public ConflictDetector conflictDetector(GitCommandRunner git) {
        return new GitMergeTreeConflictDetector(git);
    }

    @Bean
    public MergeService mergeService(GitCommandRunner git, ConflictDetector conflictDetector) {
        return new MergeService(git, conflictDetector);
    }

    @Bean
    @ConditionalOnMissingBean(AgentRecordStore.class)
    public AgentRecordStore agentRecordStore(HavenLayout layout, ObjectMapper objectMapper) {
        return new JsonAgentRecordStore(layout, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean(AgentProcessProvider.class)
    public AgentProcessProvider agentProcessProvider() {
        return new LocalProcessProvider();
    }

    @Bean
    public CompletionSentinel completionSentinel(HavenLayout layout) {
        return new CompletionSentinel(layout);
    }

    @Bean
    public MissionBuilder missionBuilder(HavenLayout layout, QuartermasterProperties properties) {
        return new MissionBuilder(layout, properties.projectRootPath(), properties.backlogPath());
    }

    @Bean(destroyMethod = "close")
    public AgentLogTailer agentLogTailer(HavenLayout layout, EventBus eventBus, QuartermasterProperties properties) {
        return new AgentLogTailer(layout, eventBus, Math.min(properties.getAgent().getPollIntervalMs(), 500));
    }
}
