package com.eyelevel.renamedclient.client;

import com.eyelevel.renamedclient.common.apiclient.transport.TransportFactory;
import com.eyelevel.renamedclient.common.diagnostics.DiagnosticFormats;
import com.eyelevel.renamedclient.common.diagnostics.DiagnosticSink;
import com.eyelevel.renamedclient.common.diagnostics.Slf4jDiagnosticSink;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.Getter;
import org.springframework.lang.Nullable;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Immutable configuration of a {@link RenamedClient}. Unset values fall back to the defaults below.
 */
@Getter
public final class RenamedClientSettings {

    public static final String DEFAULT_BASE_URL = "https://www.renamed.to/api/v1";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_RETRIES = 2;
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(2);
    public static final int DEFAULT_MAX_POLL_ATTEMPTS = 150;

    private final String apiKey;
    private final String baseUrl;
    private final Duration timeout;
    private final int maxRetries;
    private final Duration pollInterval;
    private final int maxPollAttempts;
    private final boolean debug;
    @Nullable
    private final DiagnosticSink diagnosticSink;
    @Nullable
    private final WebClient.Builder webClientBuilder;
    @Nullable
    private final TransportFactory transportFactory;
    @Nullable
    private final ObjectMapper objectMapper;

    /**
     * @throws IllegalArgumentException if the API key is blank, {@code maxRetries} is negative, or the timeout,
     *                                  poll interval or poll attempt limit is not positive.
     */
    @Builder
    private RenamedClientSettings(String apiKey, @Nullable String baseUrl, @Nullable Duration timeout,
                                  @Nullable Integer maxRetries, @Nullable Duration pollInterval,
                                  @Nullable Integer maxPollAttempts, boolean debug,
                                  @Nullable DiagnosticSink diagnosticSink,
                                  @Nullable WebClient.Builder webClientBuilder,
                                  @Nullable TransportFactory transportFactory, @Nullable ObjectMapper objectMapper) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("API key is required");
        }
        this.apiKey = apiKey;
        this.baseUrl = baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl;
        this.timeout = requirePositive(timeout == null ? DEFAULT_TIMEOUT : timeout, "timeout");
        this.maxRetries = maxRetries == null ? DEFAULT_MAX_RETRIES : maxRetries;
        if (this.maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + this.maxRetries);
        }
        this.pollInterval = requirePositive(pollInterval == null ? DEFAULT_POLL_INTERVAL : pollInterval,
                                            "pollInterval");
        this.maxPollAttempts = maxPollAttempts == null ? DEFAULT_MAX_POLL_ATTEMPTS : maxPollAttempts;
        if (this.maxPollAttempts < 1) {
            throw new IllegalArgumentException("maxPollAttempts must be at least 1: " + this.maxPollAttempts);
        }
        this.debug = debug;
        this.diagnosticSink = diagnosticSink;
        this.webClientBuilder = webClientBuilder;
        this.transportFactory = transportFactory;
        this.objectMapper = objectMapper;
    }

    /**
     * The sink diagnostics go to: the configured one, otherwise an SLF4J sink in debug mode, otherwise none.
     */
    public DiagnosticSink resolveDiagnosticSink() {
        if (diagnosticSink != null) {
            return diagnosticSink;
        }
        return debug ? new Slf4jDiagnosticSink() : DiagnosticSink.noop();
    }

    private static Duration requirePositive(Duration value, String name) {
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return "RenamedClientSettings[apiKey=" + DiagnosticFormats.maskApiKey(apiKey) + ", baseUrl=" + baseUrl
               + ", timeout=" + timeout + ", maxRetries=" + maxRetries + ", pollInterval=" + pollInterval
               + ", maxPollAttempts=" + maxPollAttempts + ", debug=" + debug + "]";
    }
}
