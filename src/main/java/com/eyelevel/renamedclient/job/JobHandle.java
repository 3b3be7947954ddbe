package com.eyelevel.renamedclient.job;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.Objects;

/**
 * Identifies a running job and how it should be polled.
 *
 * @param statusUrl    Absolute or base-relative URL of the job status endpoint.
 * @param jobId        The job identifier, when the service returned one.
 * @param pollInterval Wait between two status queries.
 * @param maxAttempts  Maximum number of status queries before giving up.
 */
public record JobHandle(String statusUrl, @Nullable String jobId, Duration pollInterval, int maxAttempts) {

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(2);
    public static final int DEFAULT_MAX_ATTEMPTS = 150;

    public JobHandle {
        Objects.requireNonNull(statusUrl, "statusUrl must not be null");
        Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive: " + pollInterval);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
    }

    public JobHandle(String statusUrl, @Nullable String jobId) {
        this(statusUrl, jobId, DEFAULT_POLL_INTERVAL, DEFAULT_MAX_ATTEMPTS);
    }
}
