package com.buddy.engine.api.dto;

import com.buddy.engine.definition.JobDefinition;
import com.buddy.engine.definition.PhaseDefinition;

import java.util.List;

/**
 * Catalogue entry for GET /api/job-types. Commands are not exposed.
 */
public record JobTypeResponse(
        String       type,
        String       description,
        boolean      requiresApproval,
        boolean      requiresUnprotectedEnvironment,
        List<String> requiredParams,
        List<String> phases
) {
    public static JobTypeResponse from(JobDefinition def) {
        return new JobTypeResponse(
                def.type(),
                def.description(),
                def.requiresApproval(),
                def.requiresUnprotectedEnvironment(),
                def.requiredParams(),
                def.phases().stream().map(PhaseDefinition::name).toList());
    }
}
