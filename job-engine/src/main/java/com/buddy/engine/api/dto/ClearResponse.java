package com.buddy.engine.api.dto;

public record ClearResponse(boolean success, int cleared) {}
