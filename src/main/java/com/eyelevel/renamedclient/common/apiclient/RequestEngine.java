package com.eyelevel.renamedclient.common.apiclient;

import com.eyelevel.renamedclient.common.apiclient.authentication.Authentication;
import com.eyelevel.renamedclient.common.apiclient.model.ApiRequest;
import com.eyelevel.renamedclient.common.apiclient.model.ApiResponse;
import com.eyelevel.renamedclient.common.apiclient.suspension.Suspension;
import com.eyelevel.renamedclient.common.apiclient.transport.RawResponse;
import com.eyelevel.renamedclient.common.apiclient.transport.Transport;
import com.eyelevel.renamedclient.common.diagnostics.DiagnosticFormats;
import com.eyelevel.renamedclient.common.diagnostics.DiagnosticSink;
import com.eyelevel.renamedclient.common.diagnostics.GuardedDiagnosticSink;
import com.eyelevel.renamedclient.common.json.JsonCodec;
import com.eyelevel.renamedclient.exception.apiclient.ApiException;
import com.eyelevel.renamedclient.exception.apiclient.NetworkException;
import com.eyelevel.renamedclient.exception.apiclient.RequestTimeoutException;
import com.eyelevel.renamedclient.exception.apiclient.ValidationException;
import com.eyelevel.renamedclient.exception.json.JsonCodecException;
import com.eyelevel.renamedclient.upload.MultipartPayloads;
import io.netty.channel.ConnectTimeoutException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.util.MultiValueMap;
import reactor.core.publisher.Mono;

import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes {@link ApiRequest}s against the renamed.to API with bounded retries.
 *
 * <p>A request is attempted at most {@code maxRetries + 1} times. Transport faults, timeouts and 5xx responses are
 * retried after an exponential backoff of {@code 2^n * 100} ms before retry {@code n}. A 4xx response, 429
 * included, fails on its first occurrence so that the caller can honor {@code retryAfter}. When the attempts
 * are exhausted the last error is re-raised. Every failure reaches the caller as an {@link ApiException}.
 *
 * <p>The engine is stateless between calls and safe to share. Waiting is delegated to a {@link Suspension}, so
 * the same engine serves blocking and non-blocking callers.
 */
@Slf4j
public class RequestEngine {

    static final long BASE_BACKOFF_MS = 100;

    private final Transport transport;
    private final Authentication authentication;
    private final JsonCodec jsonCodec;
    private final DiagnosticSink diagnostics;
    @Getter
    private final Suspension suspension;
    @Getter
    private final String baseUrl;
    @Getter
    private final int maxRetries;

    public RequestEngine(Transport transport, Authentication authentication, JsonCodec jsonCodec,
                         DiagnosticSink diagnostics, Suspension suspension, String baseUrl, int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.authentication = Objects.requireNonNull(authentication, "authentication must not be null");
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec must not be null");
        this.diagnostics = GuardedDiagnosticSink.wrap(diagnostics);
        this.suspension = Objects.requireNonNull(suspension, "suspension must not be null");
        this.baseUrl = trimTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl must not be null"));
        this.maxRetries = maxRetries;
    }

    /**
     * Executes the request with retries.
     *
     * @param apiRequest The request to execute. Must not be null.
     *
     * @return A {@link Mono} emitting the successful response, or an {@link ApiException}.
     */
    public Mono<ApiResponse> execute(@NonNull ApiRequest apiRequest) {
        Objects.requireNonNull(apiRequest, "apiRequest must not be null");
        return Mono.defer(() -> {
            URI uri = resolveUri(apiRequest.getPath());
            String displayPath = DiagnosticFormats.displayPath(uri.toString(), baseUrl);
            log.debug("Executing {} {} with up to {} retries", apiRequest.getMethod(), displayPath, maxRetries);
            return attempt(apiRequest, uri, displayPath, 0)
                    .doOnNext(response -> log.debug("{} {} succeeded after {} attempt(s)", apiRequest.getMethod(),
                                                    displayPath, response.getAttempts()));
        });
    }

    /**
     * Executes the request with retries and decodes the JSON body. An empty body decodes as {@code {}}.
     *
     * @throws ApiException with the message {@code Failed to parse response: ...} when decoding fails.
     */
    public <T> Mono<T> execute(@NonNull ApiRequest apiRequest, Class<T> responseType) {
        return execute(apiRequest).map(response -> decode(response, responseType));
    }

    /**
     * Fetches raw bytes with a single authenticated {@code GET}. No retry is performed, but error responses are
     * classified exactly as for {@link #execute(ApiRequest)}.
     *
     * @param url An absolute URL, or a path relative to the base URL.
     */
    public Mono<byte[]> fetchBytes(String url) {
        ApiRequest apiRequest = ApiRequest.builder().method(HttpMethod.GET).path(url).accept(MediaType.ALL).build();
        return Mono.defer(() -> {
            URI uri = resolveUri(apiRequest.getPath());
            String displayPath = DiagnosticFormats.displayPath(uri.toString(), baseUrl);
            return exchangeOnce(apiRequest, uri, displayPath, 1);
        }).map(ApiResponse::getData).doOnNext(bytes -> diagnostics.fileDownloaded(bytes.length));
    }

    /**
     * Resolves a request path: absolute {@code http(s)://} URLs pass through unchanged, anything else is
     * appended to the base URL with exactly one separating slash.
     *
     * @throws ValidationException if the result is not a valid URI.
     */
    public URI resolveUri(String path) {
        Objects.requireNonNull(path, "path must not be null");
        String url;
        if (path.startsWith("http://") || path.startsWith("https://")) {
            url = path;
        } else if (path.startsWith("/")) {
            url = baseUrl + path;
        } else {
            url = baseUrl + "/" + path;
        }
        try {
            return URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid request URL: " + e.getMessage(), e);
        }
    }

    private Mono<ApiResponse> attempt(ApiRequest apiRequest, URI uri, String displayPath, int attemptIndex) {
        return exchangeOnce(apiRequest, uri, displayPath, attemptIndex + 1)
                .onErrorResume(ApiException.class,
                               error -> retryOrFail(apiRequest, uri, displayPath, attemptIndex, error));
    }

    private Mono<ApiResponse> retryOrFail(ApiRequest apiRequest, URI uri, String displayPath, int attemptIndex,
                                          ApiException error) {
        if (!isRetryable(error)) {
            log.debug("{} {} failed with non-retryable {}", apiRequest.getMethod(), displayPath, error.getCode());
            return Mono.error(error);
        }
        int retryNumber = attemptIndex + 1;
        if (retryNumber > maxRetries) {
            log.warn("{} {} failed after {} attempt(s): {}", apiRequest.getMethod(), displayPath, retryNumber,
                     error.toString());
            return Mono.error(error);
        }
        Duration delay = backoffDelay(retryNumber);
        log.warn("{} {} failed with {}, retry {}/{} in {} ms", apiRequest.getMethod(), displayPath, error.getCode(),
                 retryNumber, maxRetries, delay.toMillis());
        diagnostics.retryScheduled(retryNumber, maxRetries, delay.toMillis());
        return suspension.suspend(delay)
                         .then(Mono.defer(() -> attempt(apiRequest, uri, displayPath, retryNumber)));
    }

    private Mono<ApiResponse> exchangeOnce(ApiRequest apiRequest, URI uri, String displayPath, int attemptNumber) {
        return Mono.defer(() -> {
            long startNanos = System.nanoTime();
            String method = apiRequest.getMethod().name();
            HttpHeaders headers = new HttpHeaders();
            headers.setAccept(List.of(apiRequest.getAccept()));
            authentication.applyAuthentication(headers);
            MultiValueMap<String, HttpEntity<?>> multipart = apiRequest.hasMultipartPayload()
                    ? MultipartPayloads.build(apiRequest.getFile(), apiRequest.getFormFields())
                    : null;

            return transport.exchange(apiRequest.getMethod(), uri, headers, multipart)
                            .switchIfEmpty(Mono.error(() -> new NetworkException(NetworkException.DEFAULT_MESSAGE)))
                            .onErrorMap(error -> !(error instanceof ApiException), error -> {
                                ApiException fault = toTransportFault(error);
                                diagnostics.requestFailed(method, displayPath, fault.getCode(), fault.getMessage(),
                                                          elapsedMillis(startNanos));
                                return fault;
                            })
                            .flatMap(raw -> {
                                diagnostics.requestCompleted(method, displayPath, raw.statusCode(),
                                                             elapsedMillis(startNanos));
                                if (raw.statusCode() >= 400) {
                                    return Mono.error(classify(raw));
                                }
                                return Mono.just(toApiResponse(raw, attemptNumber));
                            });
        });
    }

    private ApiException classify(RawResponse raw) {
        Object body = jsonCodec.probeObject(raw.body()).<Object>map(map -> map)
                                .orElseGet(() -> raw.body().length == 0
                                        ? null
                                        : new String(raw.body(), StandardCharsets.UTF_8));
        return ErrorClassifier.classify(raw.statusCode(), raw.reasonPhrase(), body);
    }

    private <T> T decode(ApiResponse response, Class<T> responseType) {
        if (!response.isJsonCompatible()) {
            log.warn("Decoding {} from a {} body", responseType.getSimpleName(), response.getContentType());
        }
        try {
            return jsonCodec.decode(response.getData(), responseType);
        } catch (JsonCodecException e) {
            log.error("Failed to decode {} from response with status {}", responseType.getSimpleName(),
                      response.getStatusCode(), e);
            throw new ApiException("Failed to parse response: " + e.getMessage(), response.getStatusCode(), null);
        }
    }

    /**
     * Maps a fault raised before any response was received.
     */
    static ApiException toTransportFault(Throwable error) {
        String detail = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        if (isTimeout(error)) {
            return new RequestTimeoutException("Request timed out: " + detail, error);
        }
        return new NetworkException(NetworkException.DEFAULT_MESSAGE + ": " + detail, error);
    }

    private static boolean isTimeout(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof TimeoutException || current instanceof SocketTimeoutException
                || current instanceof io.netty.handler.timeout.TimeoutException
                || current instanceof ConnectTimeoutException) {
                return true;
            }
        }
        return false;
    }

    /**
     * Retries network faults, timeouts and server errors. Client errors, rate limiting included, are final.
     */
    static boolean isRetryable(ApiException error) {
        return !error.isClientError();
    }

    /**
     * @param retryNumber 1 for the first retry.
     */
    static Duration backoffDelay(int retryNumber) {
        return Duration.ofMillis((1L << retryNumber) * BASE_BACKOFF_MS);
    }

    private static ApiResponse toApiResponse(RawResponse raw, int attemptNumber) {
        return ApiResponse.builder().data(raw.body()).statusCode(raw.statusCode())
                          .contentType(raw.headers().getContentType()).attempts(attemptNumber).build();
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static String trimTrailingSlash(String url) {
        String trimmed = url;
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
