package com.buddy.engine.api.dto;

import java.util.Map;

/** Last build per target, keyed by target name. */
public record BuildsResponse(Map<String, BuildInfoResponse> builds) {}
