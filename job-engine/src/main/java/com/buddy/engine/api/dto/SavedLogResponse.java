package com.buddy.engine.api.dto;

import com.buddy.engine.logs.SavedLogEntity;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * A saved log. {@code content} is left out of listings.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SavedLogResponse(String id, String target, String name, Instant createdAt, String content) {

    public static SavedLogResponse summary(SavedLogEntity log) {
        return new SavedLogResponse(log.getId(), log.getTarget(), log.getName(), log.getCreatedAt(), null);
    }

    public static SavedLogResponse full(SavedLogEntity log) {
        return new SavedLogResponse(log.getId(), log.getTarget(), log.getName(), log.getCreatedAt(), log.getContent());
    }
}
