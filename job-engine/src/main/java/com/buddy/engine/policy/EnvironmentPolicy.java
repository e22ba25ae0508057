package com.buddy.engine.policy;

import com.buddy.engine.definition.JobDefinition;
import com.buddy.engine.error.PolicyViolationException;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Keeps deploy-type jobs away from shared environments.
 *
 * The environment a job acts on is its {@code environment} param if given,
 * else the engine's current environment. Names compare case-insensitively.
 */
public class EnvironmentPolicy {

    public static final String ENVIRONMENT_PARAM = "environment";

    private final String      current;
    private final Set<String> protectedNames;

    public EnvironmentPolicy(String current, List<String> protectedEnvironments) {
        this.current        = current;
        this.protectedNames = protectedEnvironments == null ? Set.of() : protectedEnvironments.stream()
                .map(e -> e.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public String environmentFor(Map<String, String> params) {
        String requested = params == null ? null : params.get(ENVIRONMENT_PARAM);
        return requested == null || requested.isBlank() ? current : requested.trim();
    }

    public boolean isProtected(String environment) {
        return environment != null && protectedNames.contains(environment.toLowerCase(Locale.ROOT));
    }

    /**
     * @throws PolicyViolationException if {@code definition} must not run
     *         against the job's environment
     */
    public void check(JobDefinition definition, Map<String, String> params) {
        if (!definition.requiresUnprotectedEnvironment()) {
            return;
        }
        String env = environmentFor(params);
        if (isProtected(env)) {
            throw new PolicyViolationException("Cannot deploy to protected environment \"" + env
                    + "\". Switch to a personal environment first.");
        }
    }
}
