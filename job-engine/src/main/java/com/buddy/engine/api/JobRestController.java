package com.buddy.engine.api;

import com.buddy.engine.api.dto.BuildInfoResponse;
import com.buddy.engine.api.dto.BuildsResponse;
import com.buddy.engine.api.dto.ClearResponse;
import com.buddy.engine.api.dto.CreateJobRequest;
import com.buddy.engine.api.dto.DiffResponse;
import com.buddy.engine.api.dto.JobEnvelope;
import com.buddy.engine.api.dto.JobListResponse;
import com.buddy.engine.api.dto.JobResponse;
import com.buddy.engine.api.dto.RespondRequest;
import com.buddy.engine.api.dto.RespondResponse;
import com.buddy.engine.approval.ApprovalDecision;
import com.buddy.engine.error.JobNotFoundException;
import com.buddy.engine.model.JobSnapshot;
import com.buddy.engine.service.JobController;
import com.buddy.engine.store.BuildLedger;
import com.buddy.engine.store.BuildRecordEntity;
import com.buddy.engine.stream.OutputSubscription;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST API for jobs.
 *
 * POST /api/jobs                create and start a job
 * GET  /api/jobs?active=        list jobs, newest first
 * GET  /api/jobs/{id}           current state of a job
 * POST /api/jobs/{id}/cancel    stop a job, returns its final state
 * POST /api/jobs/clear          cancel everything and drop finished jobs
 * GET  /api/jobs/{id}/output    live output as server-sent events
 * GET  /api/jobs/{id}/diff      preview awaiting approval
 * POST /api/jobs/{id}/respond   approve or reject the preview
 * GET  /api/jobs/builds         last build outcome per target
 */
@RestController
@RequestMapping("/api/jobs")
public class JobRestController {

    private final JobController  jobs;
    private final OutputStreamer streamer;
    private final BuildLedger    builds;

    public JobRestController(JobController jobs, OutputStreamer streamer, BuildLedger builds) {
        this.jobs     = jobs;
        this.streamer = streamer;
        this.builds   = builds;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:3456/api/jobs \
     *     -H "Content-Type: application/json" \
     *     -d '{"type":"deploy","target":"OrdersStack"}'
     */
    @PostMapping
    public ResponseEntity<JobEnvelope> create(@RequestBody CreateJobRequest req) {
        JobSnapshot job = jobs.create(req.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(JobEnvelope.of(job));
    }

    @GetMapping
    public JobListResponse list(@RequestParam(name = "active", defaultValue = "false") boolean active) {
        return new JobListResponse(jobs.list(active).stream().map(JobResponse::from).toList());
    }

    @GetMapping("/{id}")
    public JobEnvelope get(@PathVariable String id) {
        return jobs.findById(id)
                .map(JobEnvelope::of)
                .orElseThrow(() -> new JobNotFoundException(id));
    }

    @PostMapping("/{id}/cancel")
    public JobEnvelope cancel(@PathVariable String id) {
        return JobEnvelope.of(jobs.cancel(id));
    }

    @PostMapping("/clear")
    public ClearResponse clear() {
        return new ClearResponse(true, jobs.clear());
    }

    /**
     * Every line so far, then live lines, then one {@code {"done":true,"status":...}}
     * event, after which the stream closes.
     */
    @GetMapping(value = "/{id}/output", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter output(@PathVariable String id) {
        OutputSubscription subscription = jobs.subscribe(id);
        return streamer.stream(subscription);
    }

    /** HTTP 409 unless the job captured a preview. */
    @GetMapping("/{id}/diff")
    public DiffResponse diff(@PathVariable String id) {
        return DiffResponse.from(jobs.diff(id));
    }

    @PostMapping("/{id}/respond")
    public RespondResponse respond(@PathVariable String id, @RequestBody RespondRequest req) {
        if (req.approved() == null) {
            throw new IllegalArgumentException("approved must be true or false");
        }
        ApprovalDecision decision = jobs.respond(id, req.approved());
        return new RespondResponse(true, decision == ApprovalDecision.APPROVED);
    }

    @GetMapping("/builds")
    public BuildsResponse builds() {
        Map<String, BuildInfoResponse> byTarget = new LinkedHashMap<>();
        for (BuildRecordEntity row : builds.all()) {
            byTarget.put(row.getTarget(), BuildInfoResponse.from(row));
        }
        return new BuildsResponse(byTarget);
    }
}
