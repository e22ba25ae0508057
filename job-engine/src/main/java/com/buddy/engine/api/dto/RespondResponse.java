package com.buddy.engine.api.dto;

public record RespondResponse(boolean success, boolean approved) {}
