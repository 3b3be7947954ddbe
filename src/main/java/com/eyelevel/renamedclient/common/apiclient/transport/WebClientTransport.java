package com.eyelevel.renamedclient.common.apiclient.transport;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.lang.Nullable;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.resources.ConnectionProvider;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * A {@link Transport} backed by Spring's {@link WebClient}.
 *
 * <p>Every response, whatever its status, is read fully into memory and handed back as a {@link RawResponse}.
 * The configured timeout bounds the whole exchange, body included.
 */
@Slf4j
public class WebClientTransport implements Transport {

    private static final byte[] EMPTY_BODY = new byte[0];

    private final WebClient webClient;
    private final Duration timeout;
    @Nullable
    private final ConnectionProvider connectionProvider;

    /**
     * @param webClient          The client used for the exchanges.
     * @param timeout            Upper bound for a single exchange.
     * @param connectionProvider The pool owned by this transport and released by {@link #close()}, or null when
     *                           the pool is managed elsewhere.
     */
    public WebClientTransport(WebClient webClient, Duration timeout, @Nullable ConnectionProvider connectionProvider) {
        this.webClient = Objects.requireNonNull(webClient, "webClient must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.connectionProvider = connectionProvider;
    }

    @Override
    public Mono<RawResponse> exchange(HttpMethod method, URI uri, HttpHeaders headers,
                                      @Nullable MultiValueMap<String, HttpEntity<?>> multipart) {
        log.debug("Sending {} request to {}", method, uri.getPath());
        WebClient.RequestBodySpec requestBodySpec = webClient.method(method).uri(uri)
                                                             .headers(target -> target.addAll(headers));
        WebClient.RequestHeadersSpec<?> requestSpec = multipart == null
                ? requestBodySpec
                : requestBodySpec.body(BodyInserters.fromMultipartData(multipart));

        return requestSpec.exchangeToMono(this::readResponse).timeout(timeout);
    }

    private Mono<RawResponse> readResponse(ClientResponse response) {
        int statusCode = response.statusCode().value();
        HttpHeaders headers = response.headers().asHttpHeaders();
        log.trace("Reading response body, status code: {}", statusCode);
        return response.bodyToMono(byte[].class).defaultIfEmpty(EMPTY_BODY)
                       .map(body -> new RawResponse(statusCode, reasonPhrase(statusCode), headers, body));
    }

    static String reasonPhrase(int statusCode) {
        HttpStatus status = HttpStatus.resolve(statusCode);
        return status != null ? status.getReasonPhrase() : "HTTP " + statusCode;
    }

    @Override
    public void close() {
        if (connectionProvider != null && !connectionProvider.isDisposed()) {
            log.debug("Disposing connection pool '{}'", connectionProvider.name());
            connectionProvider.dispose();
        }
    }
}
