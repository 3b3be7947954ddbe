package com.eyelevel.renamedclient.client;

import com.eyelevel.renamedclient.common.apiclient.transport.TransportMode;
import com.eyelevel.renamedclient.dto.ExtractOptions;
import com.eyelevel.renamedclient.dto.PdfSplitOptions;
import com.eyelevel.renamedclient.dto.PdfSplitResult;
import com.eyelevel.renamedclient.dto.RenameOptions;
import com.eyelevel.renamedclient.dto.RenameResult;
import com.eyelevel.renamedclient.dto.SplitMode;
import com.eyelevel.renamedclient.dto.User;
import com.eyelevel.renamedclient.exception.apiclient.ApiException;
import com.eyelevel.renamedclient.exception.apiclient.AuthenticationException;
import com.eyelevel.renamedclient.exception.apiclient.InsufficientCreditsException;
import com.eyelevel.renamedclient.job.JobPoller;
import com.eyelevel.renamedclient.job.JobState;
import com.eyelevel.renamedclient.support.RecordingDiagnosticSink;
import com.eyelevel.renamedclient.support.ScriptedTransport;
import com.eyelevel.renamedclient.upload.FileSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RenamedClientTest {

    private static final String API_KEY = "rt_test_key_123456";
    private static final String BASE_URL = "https://api.test/v1";

    private final Deque<ClientResponse> responses = new ConcurrentLinkedDeque<>();
    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();
    private final List<RenamedClient> clients = new ArrayList<>();

    @TempDir
    Path tempDir;

    @AfterEach
    void closeClients() {
        clients.forEach(RenamedClient::close);
    }

    private RenamedClient.Builder httpClient() {
        WebClient.Builder webClientBuilder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            ClientResponse response = responses.poll();
            return response != null ? Mono.just(response) : Mono.error(new AssertionError("no response scripted"));
        });
        return RenamedClient.builder(API_KEY).baseUrl(BASE_URL).webClientBuilder(webClientBuilder)
                            .pollInterval(Duration.ofMillis(10));
    }

    private RenamedClient track(RenamedClient client) {
        clients.add(client);
        return client;
    }

    private void respond(HttpStatus status, String json) {
        responses.add(ClientResponse.create(status)
                                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                                    .body(json)
                                    .build());
    }

    @Test
    void getUserSendsBearerTokenToUserEndpoint() {
        respond(HttpStatus.OK, "{\"id\":\"u1\",\"email\":\"jane@example.com\",\"name\":\"Jane\",\"credits\":50,"
                               + "\"team\":{\"id\":\"t1\",\"name\":\"Ops\"}}");
        RenamedClient client = track(httpClient().build());

        User user = client.getUser();

        assertThat(user.email()).isEqualTo("jane@example.com");
        assertThat(user.credits()).isEqualTo(50);
        assertThat(user.team().name()).isEqualTo("Ops");
        ClientRequest request = requests.get(0);
        assertThat(request.method()).isEqualTo(HttpMethod.GET);
        assertThat(request.url()).hasToString(BASE_URL + "/user");
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer " + API_KEY);
    }

    @Test
    void renamePostsFileAndReturnsSuggestion() throws IOException {
        respond(HttpStatus.OK, "{\"originalFilename\":\"scan.pdf\",\"suggestedFilename\":\"2024_Acme_Invoice.pdf\","
                               + "\"folderPath\":\"Invoices/Acme\",\"confidence\":0.9}");
        Path file = Files.writeString(tempDir.resolve("scan.pdf"), "%PDF-1.7");
        RenamedClient client = track(httpClient().build());

        RenameResult result = client.rename(file);

        assertThat(result.suggestedFilename()).isEqualTo("2024_Acme_Invoice.pdf");
        assertThat(result.folderPath()).isEqualTo("Invoices/Acme");
        assertThat(requests.get(0).method()).isEqualTo(HttpMethod.POST);
        assertThat(requests.get(0).url()).hasToString(BASE_URL + "/rename");
    }

    @Test
    void errorBodyMessageReachesTheCaller() {
        respond(HttpStatus.UNAUTHORIZED, "{\"error\":\"Invalid API key\"}");
        RenamedClient client = track(httpClient().build());

        assertThatThrownBy(client::getUser)
                .isInstanceOf(AuthenticationException.class)
                .hasMessage("Invalid API key");
        assertThat(requests).hasSize(1);
    }

    @Test
    void insufficientCreditsIsTyped() {
        respond(HttpStatus.PAYMENT_REQUIRED, "{\"error\":\"Out of credits\"}");
        RenamedClient client = track(httpClient().build());

        assertThatThrownBy(() -> client.rename(new byte[]{1}, "a.pdf", null))
                .isInstanceOf(InsufficientCreditsException.class)
                .hasMessage("Out of credits");
    }

    @Test
    void serverErrorsAreRetriedBeforeSucceeding() {
        respond(HttpStatus.SERVICE_UNAVAILABLE, "{}");
        respond(HttpStatus.OK, "{\"id\":\"u1\"}");
        RenamedClient client = track(httpClient().maxRetries(1).build());

        assertThat(client.getUser().id()).isEqualTo("u1");
        assertThat(requests).hasSize(2);
    }

    @Test
    void pdfSplitPollsUntilDone() {
        respond(HttpStatus.OK, "{\"statusUrl\":\"https://api.test/v1/jobs/j-1\",\"jobId\":\"j-1\"}");
        respond(HttpStatus.OK, "{\"jobId\":\"j-1\",\"status\":\"processing\",\"progress\":50}");
        respond(HttpStatus.OK, "{\"jobId\":\"j-1\",\"status\":\"completed\",\"progress\":100,\"result\":"
                               + "{\"originalFilename\":\"bundle.pdf\",\"totalPages\":2,\"documents\":"
                               + "[{\"index\":0,\"filename\":\"one.pdf\",\"pages\":\"1-2\","
                               + "\"downloadUrl\":\"https://cdn.test/one.pdf?sig=abc\",\"size\":10}]}}");
        RenamedClient client = track(httpClient().build());
        List<Integer> progress = new CopyOnWriteArrayList<>();

        JobPoller poller = client.pdfSplit(new ByteArrayInputStream(new byte[]{1, 2}), "bundle.pdf",
                                           PdfSplitOptions.builder().mode(SplitMode.AUTO).build());
        PdfSplitResult result = poller.waitForResult(snapshot -> progress.add(snapshot.progress()));

        assertThat(poller.getJobId()).isEqualTo("j-1");
        assertThat(poller.getState()).isEqualTo(JobState.COMPLETED);
        assertThat(result.documents()).singleElement()
                                      .satisfies(doc -> assertThat(doc.filename()).isEqualTo("one.pdf"));
        assertThat(progress).containsExactly(50, 100);
        assertThat(requests).extracting(request -> request.url().toString())
                            .containsExactly(BASE_URL + "/pdf-split", BASE_URL + "/jobs/j-1",
                                             BASE_URL + "/jobs/j-1");
    }

    @Test
    void downloadIsAuthenticatedAndNotRetried() {
        respond(HttpStatus.INTERNAL_SERVER_ERROR, "{\"error\":\"storage unavailable\"}");
        RenamedClient client = track(httpClient().maxRetries(3).build());

        assertThatThrownBy(() -> client.downloadFile("https://cdn.test/one.pdf?sig=abc"))
                .isInstanceOf(ApiException.class)
                .hasMessage("storage unavailable");
        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer " + API_KEY);
    }

    @Test
    void downloadReturnsBytes() {
        responses.add(ClientResponse.create(HttpStatus.OK)
                                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_PDF_VALUE)
                                    .body("%PDF-1.7")
                                    .build());
        RenamedClient client = track(httpClient().build());

        byte[] content = client.downloadFile("https://cdn.test/one.pdf");

        assertThat(new String(content, StandardCharsets.UTF_8)).isEqualTo("%PDF-1.7");
    }

    @Test
    void multipartFieldsFollowTheOptions() {
        ScriptedTransport transport = new ScriptedTransport()
                .respond(200, "{\"suggestedFilename\":\"x.pdf\"}")
                .respond(200, "{\"statusUrl\":\"/jobs/1\"}")
                .respond(200, "{\"data\":{\"total\":12.5},\"confidence\":0.8}");
        RenamedClient client = track(RenamedClient.builder(API_KEY).baseUrl(BASE_URL)
                                                  .transportFactory(transport.asFactory()).build());
        FileSource file = FileSource.of(new byte[]{1}, "doc.pdf");

        client.rename(file, RenameOptions.builder().template("{date}_{vendor}").build());
        client.pdfSplit(file, PdfSplitOptions.builder().mode(SplitMode.PAGES).pagesPerSplit(0).build());
        var extracted = client.extract(file, ExtractOptions.builder().prompt("Get the total")
                                                           .schema(Map.of("type", "object")).build());

        List<ScriptedTransport.RecordedRequest> sent = transport.requests();
        assertThat(sent.get(0).part("template")).isEqualTo("{date}_{vendor}");
        assertThat(sent.get(0).multipart()).containsOnlyKeys("file", "template");
        assertThat(sent.get(1).part("mode")).isEqualTo("pages");
        assertThat(sent.get(1).multipart()).doesNotContainKey("pagesPerSplit");
        assertThat(sent.get(2).part("prompt")).isEqualTo("Get the total");
        assertThat(sent.get(2).part("schema")).isEqualTo("{\"type\":\"object\"}");
        assertThat(extracted.data()).containsEntry("total", 12.5);
    }

    @Test
    void blankOptionValuesAreNotSent() {
        ScriptedTransport transport = new ScriptedTransport()
                .respond(200, "{\"suggestedFilename\":\"x.pdf\"}")
                .respond(200, "{\"data\":{}}");
        RenamedClient client = track(RenamedClient.builder(API_KEY).baseUrl(BASE_URL)
                                                  .transportFactory(transport.asFactory()).build());
        FileSource file = FileSource.of(new byte[]{1}, "doc.pdf");

        client.rename(file, RenameOptions.builder().template("  ").build());
        client.extract(file, ExtractOptions.builder().prompt("").schema(Map.of()).build());

        List<ScriptedTransport.RecordedRequest> sent = transport.requests();
        assertThat(sent.get(0).multipart()).containsOnlyKeys("file");
        assertThat(sent.get(1).multipart()).containsOnlyKeys("file");
    }

    @Test
    void pdfSplitAcceptsSnakeCaseJobId() {
        ScriptedTransport transport = new ScriptedTransport()
                .respond(200, "{\"statusUrl\":\"/jobs/j-9\",\"job_id\":\"j-9\"}");
        RenamedClient client = track(RenamedClient.builder(API_KEY).baseUrl(BASE_URL)
                                                  .transportFactory(transport.asFactory()).build());

        JobPoller poller = client.pdfSplit(FileSource.of(new byte[]{1}, "bundle.pdf"), null);

        assertThat(poller.getJobId()).isEqualTo("j-9");
        assertThat(poller.getHandle().statusUrl()).isEqualTo("/jobs/j-9");
    }

    @Test
    void diagnosticsAreEmittedWithMaskedKey() {
        RecordingDiagnosticSink sink = new RecordingDiagnosticSink();
        ScriptedTransport transport = new ScriptedTransport().respond(200, "{}");
        RenamedClient client = track(RenamedClient.builder(API_KEY).baseUrl(BASE_URL).diagnosticSink(sink)
                                                  .transportFactory(transport.asFactory()).build());

        client.rename(new byte[2048], "big.pdf", null);

        assertThat(sink.events()).containsExactly("init rt_...3456 " + BASE_URL, "upload big.pdf 2048",
                                                  "request POST /rename 200");
        assertThat(String.join(" ", sink.events())).doesNotContain(API_KEY);
    }

    @Test
    void reactiveViewIsCreatedOnceOnItsOwnTransport() {
        ScriptedTransport transport = new ScriptedTransport().respond(200, "{\"id\":\"u9\"}");
        RenamedClient client = track(RenamedClient.builder(API_KEY).transportFactory(transport.asFactory())
                                                  .build());

        ReactiveRenamedClient reactive = client.reactive();

        assertThat(client.reactive()).isSameAs(reactive);
        assertThat(transport.createdModes()).containsExactly(TransportMode.BLOCKING, TransportMode.NON_BLOCKING);
        StepVerifier.create(reactive.getUser())
                    .assertNext(user -> assertThat(user.id()).isEqualTo("u9"))
                    .verifyComplete();
        assertThat(transport.lastRequest().uri()).hasToString(RenamedClientSettings.DEFAULT_BASE_URL + "/user");
    }

    @Test
    void closedClientRejectsCalls() {
        ScriptedTransport transport = new ScriptedTransport();
        RenamedClient client = RenamedClient.builder(API_KEY).transportFactory(transport.asFactory()).build();

        client.close();
        client.close();

        assertThat(client.isClosed()).isTrue();
        assertThat(transport.isClosed()).isTrue();
        assertThatThrownBy(client::getUser).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(client::reactive).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void settingsAreValidated() {
        assertThatThrownBy(() -> RenamedClient.builder(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("API key is required");
        assertThatThrownBy(() -> RenamedClient.builder(API_KEY).maxRetries(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RenamedClient.builder(API_KEY).timeout(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RenamedClient.builder(API_KEY).pollInterval(Duration.ofSeconds(-1)).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RenamedClient.builder(API_KEY).maxPollAttempts(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void settingsDefaultsAndMaskedToString() {
        RenamedClientSettings settings = RenamedClientSettings.builder().apiKey(API_KEY).build();

        assertThat(settings.getBaseUrl()).isEqualTo("https://www.renamed.to/api/v1");
        assertThat(settings.getTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(settings.getMaxRetries()).isEqualTo(2);
        assertThat(settings.getPollInterval()).isEqualTo(Duration.ofSeconds(2));
        assertThat(settings.getMaxPollAttempts()).isEqualTo(150);
        assertThat(settings.toString()).contains("rt_...3456").doesNotContain(API_KEY);
    }
}
