package com.buddy.engine.definition;

import java.util.List;
import java.util.Map;

/**
 * A named kind of job and the ordered phases that implement it.
 *
 * @param type                           lookup key, e.g. "deploy"
 * @param description                    one line for the catalogue listing
 * @param requiresUnprotectedEnvironment refuse to start against a protected environment
 * @param requiredParams                 params that must be present and non-blank
 * @param phases                         run in order; the job completes after the last
 * @param recordsBuild                   remember the outcome as the target's last build
 */
public record JobDefinition(
        String                type,
        String                description,
        boolean               requiresUnprotectedEnvironment,
        List<String>          requiredParams,
        List<PhaseDefinition> phases,
        boolean               recordsBuild) {

    public JobDefinition(String type, String description, boolean requiresUnprotectedEnvironment,
                         List<String> requiredParams, List<PhaseDefinition> phases) {
        this(type, description, requiresUnprotectedEnvironment, requiredParams, phases, false);
    }

    public JobDefinition {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("job type must not be blank");
        }
        if (phases == null || phases.isEmpty()) {
            throw new IllegalArgumentException("job type '" + type + "' declares no phases");
        }
        description    = description == null ? "" : description;
        requiredParams = requiredParams == null ? List.of() : List.copyOf(requiredParams);
        phases         = List.copyOf(phases);
    }

    public boolean requiresApproval() {
        return phases.stream().anyMatch(PhaseDefinition::preview);
    }

    public List<String> missingParams(Map<String, String> params) {
        return requiredParams.stream()
                .filter(p -> params == null || params.get(p) == null || params.get(p).isBlank())
                .toList();
    }
}
