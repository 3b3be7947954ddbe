package com.eyelevel.renamedclient.job;

import com.eyelevel.renamedclient.dto.PdfSplitResult;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.springframework.lang.Nullable;

/**
 * One observation of a job, as returned by its status URL.
 *
 * <p>A failed snapshot always carries an error message. Pending and processing snapshots never carry a
 * result.
 *
 * @param jobId    The job identifier.
 * @param status   The job status.
 * @param progress Completion percentage between 0 and 100, when reported.
 * @param error    The failure message; set only for failed jobs.
 * @param result   The split result; set only for completed jobs.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobStatusSnapshot(String jobId, JobStatus status, @Nullable Integer progress, @Nullable String error,
                                @Nullable PdfSplitResult result) {

    static final String DEFAULT_FAILURE_MESSAGE = "Job failed";

    public JobStatusSnapshot {
        status = status == null ? JobStatus.PROCESSING : status;
        if (status == JobStatus.FAILED && (error == null || error.isBlank())) {
            error = DEFAULT_FAILURE_MESSAGE;
        }
        if (status == JobStatus.PENDING || status == JobStatus.PROCESSING) {
            result = null;
        }
    }

    /**
     * @return true once the job reached a terminal status, successful or not.
     */
    public boolean isComplete() {
        return status.isTerminal();
    }

    /**
     * @return true when the job completed and its result is available.
     */
    public boolean isSuccessful() {
        return status == JobStatus.COMPLETED && result != null;
    }
}
