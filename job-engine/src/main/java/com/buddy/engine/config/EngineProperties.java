package com.buddy.engine.config;

import com.buddy.engine.definition.JobDefinition;
import com.buddy.engine.definition.PhaseDefinition;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Everything under {@code buddy.engine} in application.yml.
 */
@ConfigurationProperties(prefix = "buddy.engine")
public record EngineProperties(
        @DefaultValue Process    process,
        @DefaultValue Approval   approval,
        @DefaultValue Store      store,
        @DefaultValue Environment environment,
        @DefaultValue Concurrency concurrency,
        Map<String, JobType>     jobTypes) {

    public EngineProperties {
        jobTypes = jobTypes == null ? Map.of() : jobTypes;
    }

    /**
     * @param cancelGracePeriod  time a process tree gets to exit after a
     *                           graceful signal before it is killed
     * @param readerDrainTimeout time output readers get after process exit
     * @param progressPattern    output lines matching it report progress
     *                           (first group, 0..100)
     */
    public record Process(
            @DefaultValue("5s")                      Duration cancelGracePeriod,
            @DefaultValue("2s")                      Duration readerDrainTimeout,
            @DefaultValue("^\\[progress (\\d{1,3})%]") String  progressPattern) {}

    /** @param timeout auto-reject after this long; unset waits forever */
    public record Approval(Duration timeout) {}

    public record Store(
            @DefaultValue("30")   int recentLimit,
            @DefaultValue("50")   int retention,
            @DefaultValue("1000") int archiveOutputLines) {}

    public record Environment(
            @DefaultValue("dev") String current,
            @DefaultValue        List<String> protectedEnvironments) {}

    /** @param maxActiveJobs 0 means unlimited */
    public record Concurrency(@DefaultValue("0") int maxActiveJobs) {}

    public record JobType(
            String       description,
            boolean      requiresUnprotectedEnvironment,
            List<String> requiredParams,
            List<Phase>  phases,
            boolean      recordsBuild) {

        public JobDefinition toDefinition(String type) {
            List<PhaseDefinition> defs = phases == null ? List.of()
                    : phases.stream().map(Phase::toDefinition).toList();
            return new JobDefinition(type, description, requiresUnprotectedEnvironment, requiredParams, defs,
                    recordsBuild);
        }
    }

    public record Phase(
            String              name,
            String              command,
            List<String>        args,
            String              workingDirectory,
            Map<String, String> env,
            boolean             preview,
            List<Integer>       successExitCodes,
            String              changePattern) {

        PhaseDefinition toDefinition() {
            return new PhaseDefinition(name, command, args, workingDirectory, env, preview,
                    successExitCodes == null ? null : new LinkedHashSet<>(successExitCodes),
                    changePattern == null || changePattern.isBlank() ? null : Pattern.compile(changePattern));
        }
    }
}
