package com.dcruver.compass.config;

import com.dcruver.compass.store.ContainerFile;
import com.dcruver.compass.store.ContestNormalizer;
import com.dcruver.compass.store.ContestStore;
import com.dcruver.compass.store.JsonRecordCodec;
import com.dcruver.compass.store.ProblemMigrator;
import com.dcruver.compass.store.ProblemStore;
import com.dcruver.compass.store.SolutionStore;
import com.dcruver.compass.sync.CommandRunner;
import com.dcruver.compass.sync.GitClient;
import com.dcruver.compass.sync.GitSyncService;
import com.dcruver.compass.sync.ProcessCommandRunner;
import com.dcruver.compass.sync.SyncConfigCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Clock;
import java.util.Map;

/**
 * Creates the stores and the sync orchestrator once per process.
 */
@Configuration
@Slf4j
public class CompassConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public JsonRecordCodec jsonRecordCodec() {
        return new JsonRecordCodec();
    }

    @Bean
    public ProblemMigrator problemMigrator() {
        return new ProblemMigrator();
    }

    @Bean
    public ContestNormalizer contestNormalizer() {
        return new ContestNormalizer();
    }

    @Bean
    public SolutionStore solutionStore(CompassProperties properties) {
        return new SolutionStore(properties.solutionsPath());
    }

    @Bean
    public ProblemStore problemStore(CompassProperties properties, JsonRecordCodec codec,
                                     ProblemMigrator migrator, SolutionStore solutionStore) throws IOException {
        ProblemStore store = new ProblemStore(new ContainerFile(properties.problemsPath()), codec, migrator, solutionStore);
        store.initialize();
        log.info("Problem store: {}", store.getContainerPath());
        return store;
    }

    @Bean
    public ContestStore contestStore(CompassProperties properties, JsonRecordCodec codec,
                                     ContestNormalizer normalizer) throws IOException {
        ContestStore store = new ContestStore(new ContainerFile(properties.contestsPath()), codec, normalizer);
        store.initialize();
        log.info("Contest store: {}", store.getContainerPath());
        return store;
    }

    @Bean
    public CommandRunner commandRunner() {
        // never block on a credential prompt
        return new ProcessCommandRunner(Map.of("GIT_TERMINAL_PROMPT", "0"));
    }

    @Bean
    public SyncConfigCache syncConfigCache(CompassProperties properties, Clock clock) {
        return new SyncConfigCache(properties.syncConfigPath(), properties.getSync().getDefaultBranch(), clock);
    }

    @Bean
    public GitSyncService gitSyncService(CompassProperties properties, CommandRunner commandRunner,
                                         SyncConfigCache syncConfigCache, Clock clock) {
        GitClient git = new GitClient(commandRunner, properties.getSync().getGitExecutable(), properties.dataPath());
        return new GitSyncService(git, syncConfigCache, properties.getSync().getRemoteName(), clock);
    }
}
