package com.buddy.engine.stream;

import com.buddy.engine.model.JobStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One element of a job's output stream: either a line or the final
 * {@code {done, status}} marker. Serialized as the SSE payload.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OutputEvent(String line, Boolean done, JobStatus status) {

    public static OutputEvent line(String line) {
        return new OutputEvent(line, null, null);
    }

    public static OutputEvent done(JobStatus status) {
        return new OutputEvent(null, Boolean.TRUE, status);
    }

    // Not a bean getter, so it stays out of the JSON payload.
    public boolean endOfStream() {
        return Boolean.TRUE.equals(done);
    }
}
