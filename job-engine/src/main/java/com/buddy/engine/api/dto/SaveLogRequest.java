package com.buddy.engine.api.dto;

/** Request body for POST /api/logs. */
public record SaveLogRequest(String target, String name, String content) {}
