package com.eyelevel.renamedclient.job;

import com.eyelevel.renamedclient.common.apiclient.RequestEngine;
import com.eyelevel.renamedclient.common.apiclient.model.ApiRequest;
import com.eyelevel.renamedclient.common.diagnostics.DiagnosticSink;
import com.eyelevel.renamedclient.common.diagnostics.GuardedDiagnosticSink;
import com.eyelevel.renamedclient.dto.PdfSplitResult;
import com.eyelevel.renamedclient.exception.apiclient.JobException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.Objects;

/**
 * Tracks a long-running job until it completes, fails, times out or is cancelled.
 *
 * <p>Each tick queries the status URL once through the {@link RequestEngine} (so transient failures are retried
 * there), reports the snapshot to the observer, then either finishes or waits for the poll interval. After
 * {@code maxAttempts} queries without a terminal status the poller gives up without issuing another request.
 *
 * <p>A poller drives one wait at a time. {@link #cancel()} may be called from any thread and takes effect at the
 * next wait.
 */
@Slf4j
public class JobPoller {

    static final String TIMEOUT_MESSAGE = "Job polling timeout exceeded";
    static final String CANCELLED_MESSAGE = "Job polling cancelled";

    private final RequestEngine requestEngine;
    @Getter
    private final JobHandle handle;
    private final DiagnosticSink diagnostics;
    private final Object stateLock = new Object();
    private final Sinks.One<Boolean> cancellation = Sinks.one();
    private volatile JobState state = JobState.POLLING;
    @Nullable
    private Mono<PdfSplitResult> outcome;

    public JobPoller(RequestEngine requestEngine, JobHandle handle, DiagnosticSink diagnostics) {
        this.requestEngine = Objects.requireNonNull(requestEngine, "requestEngine must not be null");
        this.handle = Objects.requireNonNull(handle, "handle must not be null");
        this.diagnostics = GuardedDiagnosticSink.wrap(diagnostics);
    }

    public JobState getState() {
        return state;
    }

    @Nullable
    public String getJobId() {
        return handle.jobId();
    }

    /**
     * Queries the job status once. Does not change the poller's state and may be called any number of times.
     */
    public Mono<JobStatusSnapshot> checkStatus() {
        ApiRequest apiRequest = ApiRequest.builder().method(HttpMethod.GET).path(handle.statusUrl()).build();
        return requestEngine.execute(apiRequest, JobStatusSnapshot.class);
    }

    /**
     * Polls until the job reaches a terminal status.
     *
     * @param observer Notified after every status query; may be null.
     *
     * @return A {@link Mono} emitting the result of the completed job, or a {@link JobException} when the job
     * failed, polling timed out or was cancelled. Errors raised by the status queries propagate unchanged.
     * Once the poller has reached a final state, the recorded outcome is replayed without querying again.
     */
    public Mono<PdfSplitResult> awaitResult(@Nullable ProgressObserver observer) {
        return Mono.defer(() -> {
            synchronized (stateLock) {
                if (state != JobState.POLLING) {
                    return recordedOutcome();
                }
            }
            return tick(observer, 0);
        });
    }

    /**
     * Blocking form of {@link #checkStatus()}. Must not be called from a non-blocking thread.
     */
    public JobStatusSnapshot getStatus() {
        return checkStatus().block();
    }

    /**
     * Blocking form of {@link #awaitResult(ProgressObserver)}. Must not be called from a non-blocking thread.
     */
    public PdfSplitResult waitForResult(@Nullable ProgressObserver observer) {
        return awaitResult(observer).block();
    }

    public PdfSplitResult waitForResult() {
        return waitForResult(null);
    }

    /**
     * Stops polling. A wait in progress ends immediately and the pending {@link #awaitResult} fails with
     * {@code Job polling cancelled}. Has no effect once the poller reached a final state.
     */
    public void cancel() {
        synchronized (stateLock) {
            if (state != JobState.POLLING) {
                return;
            }
            state = JobState.CANCELLED;
            outcome = Mono.error(new JobException(CANCELLED_MESSAGE, handle.jobId()));
        }
        log.info("Polling of job {} cancelled", handle.jobId());
        cancellation.tryEmitValue(Boolean.TRUE);
    }

    private Mono<PdfSplitResult> tick(@Nullable ProgressObserver observer, int attemptsSoFar) {
        return checkStatus().flatMap(snapshot -> {
            String jobId = snapshot.jobId() != null ? snapshot.jobId() : handle.jobId();
            diagnostics.jobStatus(jobId, snapshot.status().getValue(), snapshot.progress());
            notifyObserver(observer, snapshot);

            if (snapshot.isSuccessful()) {
                return settle(JobState.COMPLETED, Mono.just(snapshot.result()));
            }
            if (snapshot.status() == JobStatus.FAILED) {
                log.warn("Job {} failed: {}", jobId, snapshot.error());
                return settle(JobState.FAILED, Mono.error(new JobException(snapshot.error(), jobId)));
            }
            if (snapshot.status() == JobStatus.COMPLETED) {
                log.warn("Job {} reported completed without a result, polling again", jobId);
            }

            int attempts = attemptsSoFar + 1;
            if (attempts >= handle.maxAttempts()) {
                log.warn("Job {} still {} after {} status checks, giving up", jobId, snapshot.status().getValue(),
                         attempts);
                return settle(JobState.TIMED_OUT, Mono.error(new JobException(TIMEOUT_MESSAGE, jobId)));
            }
            return pause().then(Mono.defer(() -> state == JobState.CANCELLED
                    ? recordedOutcome()
                    : tick(observer, attempts)));
        });
    }

    private Mono<Void> pause() {
        if (state == JobState.CANCELLED) {
            return Mono.empty();
        }
        return requestEngine.getSuspension().suspend(handle.pollInterval())
                            .takeUntilOther(cancellation.asMono());
    }

    /**
     * Moves from polling to a final state and records its outcome. When another path got there first, for
     * instance a concurrent cancel, that earlier outcome wins.
     */
    private Mono<PdfSplitResult> settle(JobState finalState, Mono<PdfSplitResult> finalOutcome) {
        synchronized (stateLock) {
            if (state == JobState.POLLING) {
                state = finalState;
                outcome = finalOutcome;
            }
            return recordedOutcome();
        }
    }

    private Mono<PdfSplitResult> recordedOutcome() {
        synchronized (stateLock) {
            return outcome != null ? outcome : Mono.error(new JobException(CANCELLED_MESSAGE, handle.jobId()));
        }
    }

    private void notifyObserver(@Nullable ProgressObserver observer, JobStatusSnapshot snapshot) {
        if (observer == null) {
            return;
        }
        try {
            observer.onProgress(snapshot);
        } catch (RuntimeException e) {
            log.warn("Progress observer failed for job {}, continuing", snapshot.jobId(), e);
        }
    }
}
