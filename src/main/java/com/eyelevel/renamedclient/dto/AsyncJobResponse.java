package com.eyelevel.renamedclient.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Returned by endpoints that start a long-running job.
 *
 * @param statusUrl Where the job status can be polled.
 * @param jobId     The job identifier, if the service returned one. Older deployments name it {@code job_id}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AsyncJobResponse(String statusUrl, @JsonAlias("job_id") String jobId) {
}
