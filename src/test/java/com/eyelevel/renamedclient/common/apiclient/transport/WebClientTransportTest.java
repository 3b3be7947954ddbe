package com.eyelevel.renamedclient.common.apiclient.transport;

import com.eyelevel.renamedclient.upload.FileSource;
import com.eyelevel.renamedclient.upload.MultipartPayloads;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class WebClientTransportTest {

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();

    private WebClientTransport transport(ClientResponse response, Duration timeout) {
        WebClient webClient = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(response);
        }).build();
        return new WebClientTransport(webClient, timeout, null);
    }

    @Test
    void returnsErrorStatusesAsResponses() {
        ClientResponse response = ClientResponse.create(HttpStatus.NOT_FOUND)
                                                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                                                .body("{\"error\":\"missing\"}")
                                                .build();
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth("rt_test_key_123456");

        StepVerifier.create(transport(response, Duration.ofSeconds(5))
                                    .exchange(HttpMethod.GET, URI.create("https://api.test/v1/user"), headers, null))
                    .assertNext(raw -> {
                        assertThat(raw.statusCode()).isEqualTo(404);
                        assertThat(raw.reasonPhrase()).isEqualTo("Not Found");
                        assertThat(new String(raw.body(), StandardCharsets.UTF_8)).isEqualTo("{\"error\":\"missing\"}");
                    })
                    .verifyComplete();

        ClientRequest sent = requests.get(0);
        assertThat(sent.method()).isEqualTo(HttpMethod.GET);
        assertThat(sent.url()).hasToString("https://api.test/v1/user");
        assertThat(sent.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer rt_test_key_123456");
    }

    @Test
    void emptyBodyBecomesEmptyArray() {
        ClientResponse response = ClientResponse.create(HttpStatus.NO_CONTENT).build();

        StepVerifier.create(transport(response, Duration.ofSeconds(5))
                                    .exchange(HttpMethod.GET, URI.create("https://api.test/v1/x"), new HttpHeaders(),
                                              null))
                    .assertNext(raw -> assertThat(raw.body()).isEmpty())
                    .verifyComplete();
    }

    @Test
    void sendsMultipartBody() {
        ClientResponse response = ClientResponse.create(HttpStatus.OK).body("{}").build();

        StepVerifier.create(transport(response, Duration.ofSeconds(5))
                                    .exchange(HttpMethod.POST, URI.create("https://api.test/v1/rename"),
                                              new HttpHeaders(),
                                              MultipartPayloads.build(FileSource.of(new byte[]{1}, "a.pdf"),
                                                                      Map.of("template", "{date}"))))
                    .expectNextCount(1)
                    .verifyComplete();

        assertThat(requests.get(0).method()).isEqualTo(HttpMethod.POST);
    }

    @Test
    void slowExchangeTimesOut() {
        WebClient webClient = WebClient.builder().exchangeFunction(request -> Mono.never()).build();
        WebClientTransport transport = new WebClientTransport(webClient, Duration.ofMillis(50), null);

        StepVerifier.create(transport.exchange(HttpMethod.GET, URI.create("https://api.test/v1/x"),
                                               new HttpHeaders(), null))
                    .expectError(TimeoutException.class)
                    .verify(Duration.ofSeconds(5));
    }

    @Test
    void reasonPhraseFallsBackForUnknownStatus() {
        assertThat(WebClientTransport.reasonPhrase(599)).isEqualTo("HTTP 599");
        assertThat(WebClientTransport.reasonPhrase(503)).isEqualTo("Service Unavailable");
    }

    @Test
    void factoryCreatesIndependentTransportsPerMode() {
        WebClientTransportFactory factory = new WebClientTransportFactory(WebClient.builder(), Duration.ofSeconds(1));

        Transport blocking = factory.create(TransportMode.BLOCKING);
        Transport nonBlocking = factory.create(TransportMode.NON_BLOCKING);

        assertThat(blocking).isNotSameAs(nonBlocking);
        blocking.close();
        nonBlocking.close();
    }
}
