package com.phillippitts.mockinterview.service.backend;

import com.phillippitts.mockinterview.domain.InterviewConfig;
import com.phillippitts.mockinterview.domain.JobContext;

import java.util.Objects;

/**
 * Validated request to create a session and generate its question set.
 *
 * @param jobContext        role being practiced
 * @param config            interview parameters
 * @param resumeReference   optional reference to an uploaded resume
 */
public record SessionRequest(JobContext jobContext, InterviewConfig config, String resumeReference) {

    public SessionRequest {
        Objects.requireNonNull(jobContext, "jobContext must not be null");
        Objects.requireNonNull(config, "config must not be null");
    }
}
