package com.eyelevel.renamedclient.common.diagnostics;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

/**
 * Wraps a caller-provided {@link DiagnosticSink} so that a failing sink is reported once per event through the
 * client's own logger and never reaches the request or polling logic.
 */
@Slf4j
@RequiredArgsConstructor
public final class GuardedDiagnosticSink implements DiagnosticSink {

    private final DiagnosticSink delegate;

    public static DiagnosticSink wrap(@Nullable DiagnosticSink sink) {
        if (sink == null) {
            return DiagnosticSink.noop();
        }
        if (sink instanceof GuardedDiagnosticSink) {
            return sink;
        }
        return new GuardedDiagnosticSink(sink);
    }

    @Override
    public void clientInitialized(String maskedApiKey, String baseUrl) {
        guard("clientInitialized", () -> delegate.clientInitialized(maskedApiKey, baseUrl));
    }

    @Override
    public void requestCompleted(String method, String path, int statusCode, long elapsedMs) {
        guard("requestCompleted", () -> delegate.requestCompleted(method, path, statusCode, elapsedMs));
    }

    @Override
    public void requestFailed(String method, String path, String errorCode, String message, long elapsedMs) {
        guard("requestFailed", () -> delegate.requestFailed(method, path, errorCode, message, elapsedMs));
    }

    @Override
    public void retryScheduled(int attempt, int maxRetries, long delayMs) {
        guard("retryScheduled", () -> delegate.retryScheduled(attempt, maxRetries, delayMs));
    }

    @Override
    public void fileUploaded(String filename, long sizeBytes) {
        guard("fileUploaded", () -> delegate.fileUploaded(filename, sizeBytes));
    }

    @Override
    public void fileDownloaded(long sizeBytes) {
        guard("fileDownloaded", () -> delegate.fileDownloaded(sizeBytes));
    }

    @Override
    public void jobStatus(@Nullable String jobId, String status, @Nullable Integer progress) {
        guard("jobStatus", () -> delegate.jobStatus(jobId, status, progress));
    }

    private void guard(String event, Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.warn("Diagnostic sink {} failed while handling '{}': {}", delegate.getClass().getName(), event,
                     e.getMessage(), e);
        }
    }
}
