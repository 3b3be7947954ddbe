package com.eyelevel.renamedclient.common.apiclient.transport;

import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.lang.Nullable;
import org.springframework.util.MultiValueMap;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * Issues exactly one HTTP request.
 *
 * <p>A transport knows nothing about retries or the API's error model: any status code is a successful
 * {@link RawResponse}, and a request that produced no response (connection refused, DNS failure, timeout)
 * terminates the returned {@link Mono} with the raw fault.
 */
public interface Transport extends AutoCloseable {

    /**
     * @param method    The HTTP method.
     * @param uri       The absolute target URI.
     * @param headers   The request headers, authentication included.
     * @param multipart Multipart parts to send as the body, or null for a request without a body.
     *
     * @return A {@link Mono} emitting the raw response.
     */
    Mono<RawResponse> exchange(HttpMethod method, URI uri, HttpHeaders headers,
                               @Nullable MultiValueMap<String, HttpEntity<?>> multipart);

    /**
     * Releases pooled connections. The default does nothing.
     */
    @Override
    default void close() {
    }
}
