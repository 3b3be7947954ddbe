package com.eyelevel.renamedclient.exception.apiclient;

import lombok.Getter;
import org.springframework.lang.Nullable;

import java.io.Serial;

/**
 * Exception indicating that a server-side job failed, or that polling it gave up before it finished.
 */
@Getter
public class JobException extends ApiException {

    @Serial
    private static final long serialVersionUID = 3320157071926040613L;

    @Nullable
    private final String jobId;

    public JobException(String message) {
        this(message, null);
    }

    public JobException(String message, @Nullable String jobId) {
        super(ErrorKind.JOB, message, null, jobId, null);
        this.jobId = jobId;
    }
}
