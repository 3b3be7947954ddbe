package com.eyelevel.renamedclient.common.apiclient.transport;

import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Creates one {@link WebClientTransport} per {@link TransportMode}, each on a dedicated reactor-netty
 * connection pool so that blocking callers never starve the non-blocking client, or the other way round.
 */
@Slf4j
public class WebClientTransportFactory implements TransportFactory {

    private static final String POOL_PREFIX = "renamed-client-";

    private final WebClient.Builder webClientBuilder;
    private final Duration timeout;

    /**
     * @param webClientBuilder The template builder. It is cloned for every transport and never mutated.
     * @param timeout          Connect, response and overall exchange timeout.
     */
    public WebClientTransportFactory(WebClient.Builder webClientBuilder, Duration timeout) {
        this.webClientBuilder = Objects.requireNonNull(webClientBuilder, "webClientBuilder must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    @Override
    public Transport create(TransportMode mode) {
        String poolName = POOL_PREFIX + mode.name().toLowerCase(Locale.ROOT).replace('_', '-');
        log.info("Creating {} transport with connection pool '{}' and timeout {}", mode, poolName, timeout);

        ConnectionProvider connectionProvider = ConnectionProvider.builder(poolName)
                                                                  .maxIdleTime(Duration.ofSeconds(30))
                                                                  .build();
        HttpClient httpClient = HttpClient.create(connectionProvider)
                                          .option(ChannelOption.CONNECT_TIMEOUT_MILLIS,
                                                  (int) Math.min(Integer.MAX_VALUE, timeout.toMillis()))
                                          .responseTimeout(timeout);

        WebClient webClient = webClientBuilder.clone()
                                              .clientConnector(new ReactorClientHttpConnector(httpClient))
                                              .codecs(configurer -> configurer.defaultCodecs()
                                                                              .maxInMemorySize(-1))
                                              .build();
        return new WebClientTransport(webClient, timeout, connectionProvider);
    }
}
