package com.buddy.engine.config;

import com.buddy.engine.definition.JobDefinition;
import com.buddy.engine.definition.JobDefinitionRegistry;
import com.buddy.engine.policy.ConcurrencyPolicy;
import com.buddy.engine.policy.EnvironmentPolicy;
import com.buddy.engine.process.ProcessSupervisor;
import com.buddy.engine.service.ExecutionSettings;
import com.buddy.engine.service.JobRunner;
import com.buddy.engine.store.BuildLedger;
import com.buddy.engine.store.BuildRecordRepository;
import com.buddy.engine.store.JobArchive;
import com.buddy.engine.store.JobRecordRepository;
import com.buddy.engine.store.JobStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.regex.Pattern;

/**
 * Wires the engine's plain-Java components from {@link EngineProperties}.
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfig {

    @Bean
    public JobDefinitionRegistry jobDefinitionRegistry(EngineProperties props) {
        List<JobDefinition> defs = props.jobTypes().entrySet().stream()
                .map(e -> e.getValue().toDefinition(e.getKey()))
                .toList();
        return new JobDefinitionRegistry(defs);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService jobExecutor() {
        return JobRunner.newOwnerPool();
    }

    @Bean
    public ProcessSupervisor processSupervisor(EngineProperties props) {
        return new ProcessSupervisor(props.process().readerDrainTimeout());
    }

    @Bean
    public ExecutionSettings executionSettings(EngineProperties props) {
        return new ExecutionSettings(
                props.process().cancelGracePeriod(),
                props.approval().timeout(),
                Pattern.compile(props.process().progressPattern()));
    }

    @Bean
    public JobArchive jobArchive(JobRecordRepository repository, ObjectMapper objectMapper, EngineProperties props) {
        return new JobArchive(repository, objectMapper,
                props.store().retention(), props.store().archiveOutputLines());
    }

    @Bean
    public BuildLedger buildLedger(BuildRecordRepository repository) {
        return new BuildLedger(repository);
    }

    @Bean
    public JobStore jobStore(JobArchive archive, EngineProperties props) {
        return new JobStore(archive, props.store().recentLimit());
    }

    @Bean
    public EnvironmentPolicy environmentPolicy(EngineProperties props) {
        return new EnvironmentPolicy(props.environment().current(), props.environment().protectedEnvironments());
    }

    @Bean
    public ConcurrencyPolicy concurrencyPolicy(EngineProperties props) {
        return new ConcurrencyPolicy(props.concurrency().maxActiveJobs());
    }
}
