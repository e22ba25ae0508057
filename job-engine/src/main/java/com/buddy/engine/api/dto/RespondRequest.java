package com.buddy.engine.api.dto;

/** Request body for POST /api/jobs/{id}/respond. A missing flag is a bad request. */
public record RespondRequest(Boolean approved) {}
