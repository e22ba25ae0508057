package com.buddy.engine.api.dto;

import java.util.List;

public record JobListResponse(List<JobResponse> jobs) {}
