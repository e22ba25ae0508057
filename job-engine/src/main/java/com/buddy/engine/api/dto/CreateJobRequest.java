package com.buddy.engine.api.dto;

import com.buddy.engine.service.CreateJobCommand;

import java.util.Map;

/**
 * Request body for POST /api/jobs.
 *
 * Required: type, target
 * Optional: params, e.g. {"awsFunctionName": "orders-api", "environment": "alice"}
 */
public record CreateJobRequest(String type, String target, Map<String, String> params) {

    public CreateJobCommand toCommand() {
        return new CreateJobCommand(type, target, params);
    }
}
