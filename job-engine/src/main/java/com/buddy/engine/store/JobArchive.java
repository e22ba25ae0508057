package com.buddy.engine.store;

import com.buddy.engine.model.JobSnapshot;
import com.buddy.engine.model.JobStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persists terminal jobs so they survive eviction from memory and process
 * restarts.
 *
 * The archive is best effort: a failed write is logged and never changes the
 * state of the job that triggered it. Only the newest {@code retention}
 * records are kept, and output is trimmed to its last {@code outputLines}
 * lines on the way in.
 */
public class JobArchive {

    private static final Logger log = LoggerFactory.getLogger(JobArchive.class);

    private static final TypeReference<List<String>>        LINES  = new TypeReference<>() {};
    private static final TypeReference<Map<String, String>> PARAMS = new TypeReference<>() {};

    private final JobRecordRepository repository;
    private final ObjectMapper        json;
    private final int                 retention;
    private final int                 outputLines;

    public JobArchive(JobRecordRepository repository, ObjectMapper json, int retention, int outputLines) {
        this.repository  = repository;
        this.json        = json;
        this.retention   = retention;
        this.outputLines = outputLines;
    }

    public void save(JobSnapshot job) {
        if (!job.isTerminal()) {
            return;
        }
        try {
            JobRecordEntity row = new JobRecordEntity(job.id(), job.type(), job.target());
            row.setStatus(job.status().name());
            row.setProgress(job.progress());
            row.setOutputJson(json.writeValueAsString(tail(job.output())));
            row.setDiffOutputJson(job.diffOutput() == null ? null : json.writeValueAsString(job.diffOutput()));
            row.setParamsJson(json.writeValueAsString(job.params()));
            row.setError(truncate(job.error()));
            row.setPhase(job.phase());
            row.setStartedAt(job.startedAt());
            row.setCompletedAt(job.completedAt());
            repository.save(row);
            prune();
        } catch (Exception e) {
            log.warn("Could not archive job {} ({}): {}", job.id(), job.status().wireName(), e.getMessage());
        }
    }

    public Optional<JobSnapshot> find(String id) {
        try {
            return repository.findById(id).map(this::toSnapshot);
        } catch (Exception e) {
            log.warn("Could not read archived job {}: {}", id, e.getMessage());
            return Optional.empty();
        }
    }

    public List<JobSnapshot> recent(int limit) {
        try {
            return repository.findAllByOrderByStartedAtDesc(PageRequest.of(0, Math.max(1, limit))).stream()
                    .map(this::toSnapshot)
                    .toList();
        } catch (Exception e) {
            log.warn("Could not list archived jobs: {}", e.getMessage());
            return List.of();
        }
    }

    private void prune() {
        List<String> ids = repository.findIdsNewestFirst();
        if (ids.size() > retention) {
            List<String> stale = ids.subList(retention, ids.size());
            repository.deleteAllById(stale);
            log.debug("Pruned {} archived job(s) beyond retention {}", stale.size(), retention);
        }
    }

    private JobSnapshot toSnapshot(JobRecordEntity row) {
        try {
            List<String> output = json.readValue(row.getOutputJson(), LINES);
            List<String> diff   = row.getDiffOutputJson() == null ? null : json.readValue(row.getDiffOutputJson(), LINES);
            Map<String, String> params = row.getParamsJson() == null ? Map.of() : json.readValue(row.getParamsJson(), PARAMS);
            return new JobSnapshot(row.getId(), row.getType(), row.getTarget(), params,
                    JobStatus.valueOf(row.getStatus()), row.getProgress(), output,
                    row.getStartedAt(), row.getCompletedAt(), row.getError(), diff, row.getPhase());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt archive record " + row.getId(), e);
        }
    }

    private List<String> tail(List<String> lines) {
        return lines.size() <= outputLines ? lines : lines.subList(lines.size() - outputLines, lines.size());
    }

    private static String truncate(String s) {
        return s == null || s.length() <= 4000 ? s : s.substring(0, 4000);
    }
}
