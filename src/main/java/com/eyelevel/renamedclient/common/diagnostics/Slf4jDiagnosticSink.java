package com.eyelevel.renamedclient.common.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * {@link DiagnosticSink} that writes one DEBUG line per event through SLF4J.
 *
 * <p>Event fields are also placed in the MDC for the duration of the call, so structured appenders can index
 * them. The caller's MDC is restored afterwards, including any values it held under the same keys. Lines keep
 * the compact {@code GET /user -> 200 (42ms)} shape.
 */
public class Slf4jDiagnosticSink implements DiagnosticSink {

    public static final String LOGGER_NAME = "renamed.client";
    public static final String EVENT_TYPE = "event_type";

    private final Logger logger;

    public Slf4jDiagnosticSink() {
        this(LoggerFactory.getLogger(LOGGER_NAME));
    }

    public Slf4jDiagnosticSink(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void clientInitialized(String maskedApiKey, String baseUrl) {
        emit("client_initialized", Map.of(),
             () -> logger.debug("Client initialized (api_key={}, base_url={})", maskedApiKey, baseUrl));
    }

    @Override
    public void requestCompleted(String method, String path, int statusCode, long elapsedMs) {
        emit("request_completed",
             Map.of("method", method, "path", path, "statusCode", String.valueOf(statusCode),
                    "elapsedMs", String.valueOf(elapsedMs)),
             () -> logger.debug("{} {} -> {} ({}ms)", method, path, statusCode, elapsedMs));
    }

    @Override
    public void requestFailed(String method, String path, String errorCode, String message, long elapsedMs) {
        emit("request_failed",
             Map.of("method", method, "path", path, "errorCode", errorCode, "elapsedMs", String.valueOf(elapsedMs)),
             () -> logger.debug("{} {} -> {}: {} ({}ms)", method, path, errorCode, message, elapsedMs));
    }

    @Override
    public void retryScheduled(int attempt, int maxRetries, long delayMs) {
        emit("retry_scheduled",
             Map.of("attempt", String.valueOf(attempt), "maxRetries", String.valueOf(maxRetries),
                    "delayMs", String.valueOf(delayMs)),
             () -> logger.debug("Retry attempt {}/{}, waiting {}ms", attempt, maxRetries, delayMs));
    }

    @Override
    public void fileUploaded(String filename, long sizeBytes) {
        emit("file_upload", Map.of("filename", filename, "sizeBytes", String.valueOf(sizeBytes)),
             () -> logger.debug("Upload: {} ({})", filename, DiagnosticFormats.formatSize(sizeBytes)));
    }

    @Override
    public void fileDownloaded(long sizeBytes) {
        emit("file_download", Map.of("sizeBytes", String.valueOf(sizeBytes)),
             () -> logger.debug("Download: {}", DiagnosticFormats.formatSize(sizeBytes)));
    }

    @Override
    public void jobStatus(@Nullable String jobId, String status, @Nullable Integer progress) {
        String shortId = DiagnosticFormats.shortJobId(jobId);
        String fullId = jobId != null ? jobId : shortId;
        if (progress != null) {
            emit("job_status",
                 Map.of("jobId", fullId, "jobStatus", status, "progress", String.valueOf(progress)),
                 () -> logger.debug("Job {}: {} ({}%)", shortId, status, progress));
        } else {
            emit("job_status", Map.of("jobId", fullId, "jobStatus", status),
                 () -> logger.debug("Job {}: {}", shortId, status));
        }
    }

    private void emit(String eventType, Map<String, String> fields, Runnable line) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        try {
            MDC.put(EVENT_TYPE, eventType);
            fields.forEach(MDC::put);
            line.run();
        } finally {
            if (previous != null) {
                MDC.setContextMap(previous);
            } else {
                MDC.clear();
            }
        }
    }
}
