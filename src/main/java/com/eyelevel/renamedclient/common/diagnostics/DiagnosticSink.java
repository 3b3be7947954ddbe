package com.eyelevel.renamedclient.common.diagnostics;

import org.springframework.lang.Nullable;

/**
 * Receives advisory, structured diagnostic events from the client.
 *
 * <p>A sink is handed to the client at construction. Every method has an empty default so implementations only
 * override what they care about. Sinks must not influence control flow; the client isolates failures thrown by a
 * sink (see {@link GuardedDiagnosticSink}).
 */
public interface DiagnosticSink {

    /**
     * @return a sink that discards every event.
     */
    static DiagnosticSink noop() {
        return NoopDiagnosticSink.INSTANCE;
    }

    default void clientInitialized(String maskedApiKey, String baseUrl) {
    }

    /**
     * One completed HTTP exchange, successful or not.
     *
     * @param method     HTTP method.
     * @param path       Display path, stripped of the base URL and query string.
     * @param statusCode Status code returned by the server.
     * @param elapsedMs  Wall-clock duration of the attempt.
     */
    default void requestCompleted(String method, String path, int statusCode, long elapsedMs) {
    }

    /**
     * One attempt that ended without an HTTP exchange (connection failure, timeout).
     */
    default void requestFailed(String method, String path, String errorCode, String message, long elapsedMs) {
    }

    default void retryScheduled(int attempt, int maxRetries, long delayMs) {
    }

    default void fileUploaded(String filename, long sizeBytes) {
    }

    default void fileDownloaded(long sizeBytes) {
    }

    default void jobStatus(@Nullable String jobId, String status, @Nullable Integer progress) {
    }

    /**
     * Sink that ignores everything.
     */
    final class NoopDiagnosticSink implements DiagnosticSink {
        private static final NoopDiagnosticSink INSTANCE = new NoopDiagnosticSink();

        private NoopDiagnosticSink() {
        }
    }
}
