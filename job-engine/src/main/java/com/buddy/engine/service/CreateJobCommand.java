package com.buddy.engine.service;

import java.util.Map;
import java.util.stream.Collectors;

/** Request to start a job of {@code type} against {@code target}. Null param values are dropped. */
public record CreateJobCommand(String type, String target, Map<String, String> params) {

    public CreateJobCommand {
        params = params == null ? Map.of() : params.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    public CreateJobCommand(String type, String target) {
        this(type, target, Map.of());
    }
}
