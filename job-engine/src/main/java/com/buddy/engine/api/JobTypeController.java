package com.buddy.engine.api;

import com.buddy.engine.api.dto.JobTypeResponse;
import com.buddy.engine.service.JobController;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/** GET /api/job-types: the job types this engine can run. */
@RestController
@RequestMapping("/api/job-types")
public class JobTypeController {

    private final JobController jobs;

    public JobTypeController(JobController jobs) {
        this.jobs = jobs;
    }

    @GetMapping
    public List<JobTypeResponse> list() {
        return jobs.jobTypes().stream().map(JobTypeResponse::from).toList();
    }
}
