package com.eyelevel.renamedclient.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The lifecycle states of a long-running job as reported by the status endpoint.
 */
@Getter
@AllArgsConstructor
public enum JobStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed");

    private static final Map<String, JobStatus> VALUE_MAP = Stream.of(values()).collect(
            Collectors.toMap(JobStatus::getValue, Function.identity()));

    @JsonValue
    private final String value;

    /**
     * Converts the wire value into its enum constant. Unknown or missing values map to {@code PROCESSING} so the
     * poller keeps tracking the job.
     *
     * @param value The status string received from the API.
     *
     * @return The matching {@link JobStatus}, or {@code PROCESSING} as a fallback.
     */
    @JsonCreator
    public static JobStatus fromValue(String value) {
        return value == null ? PROCESSING : VALUE_MAP.getOrDefault(value, PROCESSING);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
