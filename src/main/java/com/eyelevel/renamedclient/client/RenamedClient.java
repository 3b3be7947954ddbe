package com.eyelevel.renamedclient.client;

import com.eyelevel.renamedclient.common.apiclient.RequestEngine;
import com.eyelevel.renamedclient.common.apiclient.authentication.Authentication;
import com.eyelevel.renamedclient.common.apiclient.authentication.impl.BearerTokenAuthentication;
import com.eyelevel.renamedclient.common.apiclient.suspension.Suspension;
import com.eyelevel.renamedclient.common.apiclient.transport.Transport;
import com.eyelevel.renamedclient.common.apiclient.transport.TransportFactory;
import com.eyelevel.renamedclient.common.apiclient.transport.TransportMode;
import com.eyelevel.renamedclient.common.apiclient.transport.WebClientTransportFactory;
import com.eyelevel.renamedclient.common.diagnostics.DiagnosticSink;
import com.eyelevel.renamedclient.common.diagnostics.GuardedDiagnosticSink;
import com.eyelevel.renamedclient.common.json.JsonCodec;
import com.eyelevel.renamedclient.common.json.jackson.JacksonJsonCodec;
import com.eyelevel.renamedclient.dto.ExtractOptions;
import com.eyelevel.renamedclient.dto.ExtractResult;
import com.eyelevel.renamedclient.dto.PdfSplitOptions;
import com.eyelevel.renamedclient.dto.PdfSplitResult;
import com.eyelevel.renamedclient.dto.RenameOptions;
import com.eyelevel.renamedclient.dto.RenameResult;
import com.eyelevel.renamedclient.dto.User;
import com.eyelevel.renamedclient.job.JobPoller;
import com.eyelevel.renamedclient.job.ProgressObserver;
import com.eyelevel.renamedclient.upload.FileSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.lang.Nullable;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Client for the renamed.to document AI API.
 *
 * <p>All methods block the calling thread until the call completes and throw an
 * {@link com.eyelevel.renamedclient.exception.apiclient.ApiException} subtype on failure. A non-blocking view
 * over the same credentials and settings, with its own connection pool, is available from {@link #reactive()}.
 *
 * <pre>{@code
 * try (RenamedClient client = RenamedClient.builder("rt_...").build()) {
 *     RenameResult result = client.rename(Path.of("invoice.pdf"));
 * }
 * }</pre>
 *
 * <p>Instances are thread-safe. Close the client to release its connection pools.
 */
@Slf4j
public class RenamedClient implements AutoCloseable {

    @Getter
    private final RenamedClientSettings settings;
    private final DiagnosticSink diagnostics;
    private final Authentication authentication;
    private final JsonCodec jsonCodec;
    private final TransportFactory transportFactory;
    private final Transport blockingTransport;
    private final RenamedOperations operations;

    private final Object reactiveLock = new Object();
    @Nullable
    private volatile ReactiveRenamedClient reactiveClient;
    @Nullable
    private volatile Transport reactiveTransport;
    private volatile boolean closed;

    public RenamedClient(String apiKey) {
        this(RenamedClientSettings.builder().apiKey(apiKey).build());
    }

    public RenamedClient(RenamedClientSettings settings) {
        this.settings = settings;
        this.diagnostics = GuardedDiagnosticSink.wrap(settings.resolveDiagnosticSink());
        this.authentication = new BearerTokenAuthentication(settings.getApiKey());

        ObjectMapper objectMapper = settings.getObjectMapper() != null
                ? settings.getObjectMapper()
                : Jackson2ObjectMapperBuilder.json().build();
        this.jsonCodec = new JacksonJsonCodec(objectMapper);

        this.transportFactory = settings.getTransportFactory() != null
                ? settings.getTransportFactory()
                : new WebClientTransportFactory(
                        settings.getWebClientBuilder() != null ? settings.getWebClientBuilder() : WebClient.builder(),
                        settings.getTimeout());
        this.blockingTransport = transportFactory.create(TransportMode.BLOCKING);
        this.operations = newOperations(blockingTransport, Suspension.sleeping());

        log.info("Initialized renamed.to client for {} with key {}", settings.getBaseUrl(),
                 authentication.describe());
        diagnostics.clientInitialized(authentication.describe(), settings.getBaseUrl());
    }

    public static Builder builder(String apiKey) {
        return new Builder(apiKey);
    }

    /**
     * Returns the non-blocking view of this client. Its connection pool is created on first use.
     *
     * @throws IllegalStateException if the client has been closed.
     */
    public ReactiveRenamedClient reactive() {
        ensureOpen();
        ReactiveRenamedClient client = reactiveClient;
        if (client == null) {
            synchronized (reactiveLock) {
                ensureOpen();
                client = reactiveClient;
                if (client == null) {
                    Transport transport = transportFactory.create(TransportMode.NON_BLOCKING);
                    reactiveTransport = transport;
                    client = new ReactiveRenamedClient(newOperations(transport, Suspension.reactive()));
                    reactiveClient = client;
                }
            }
        }
        return client;
    }

    // Rename

    public RenameResult rename(Path file) {
        return rename(FileSource.of(file), null);
    }

    public RenameResult rename(Path file, @Nullable RenameOptions options) {
        return rename(FileSource.of(file), options);
    }

    public RenameResult rename(byte[] content, String filename, @Nullable RenameOptions options) {
        return rename(FileSource.of(content, filename), options);
    }

    public RenameResult rename(InputStream content, String filename, @Nullable RenameOptions options) {
        return rename(FileSource.of(content, filename), options);
    }

    /**
     * Asks the service for a better file name.
     *
     * @param file    The document or image to rename.
     * @param options Optional naming template; null for the default.
     *
     * @return The suggested name and folder.
     */
    public RenameResult rename(FileSource file, @Nullable RenameOptions options) {
        return await(operations.rename(file, options));
    }

    // PDF split

    public JobPoller pdfSplit(Path file, @Nullable PdfSplitOptions options) {
        return pdfSplit(FileSource.of(file), options);
    }

    public JobPoller pdfSplit(byte[] content, String filename, @Nullable PdfSplitOptions options) {
        return pdfSplit(FileSource.of(content, filename), options);
    }

    public JobPoller pdfSplit(InputStream content, String filename, @Nullable PdfSplitOptions options) {
        return pdfSplit(FileSource.of(content, filename), options);
    }

    /**
     * Starts splitting a multi-document PDF. The job runs on the server; use
     * {@link JobPoller#waitForResult(ProgressObserver)} on the returned poller to wait for it.
     */
    public JobPoller pdfSplit(FileSource file, @Nullable PdfSplitOptions options) {
        return await(operations.pdfSplit(file, options));
    }

    public PdfSplitResult pdfSplitAndWait(FileSource file, @Nullable PdfSplitOptions options,
                                          @Nullable ProgressObserver observer) {
        return pdfSplit(file, options).waitForResult(observer);
    }

    /**
     * Resumes tracking of a job started earlier. The poller sleeps between status checks.
     */
    public JobPoller poller(String statusUrl, @Nullable String jobId) {
        ensureOpen();
        return operations.poller(statusUrl, jobId);
    }

    // Extract

    public ExtractResult extract(Path file, @Nullable ExtractOptions options) {
        return extract(FileSource.of(file), options);
    }

    public ExtractResult extract(byte[] content, String filename, @Nullable ExtractOptions options) {
        return extract(FileSource.of(content, filename), options);
    }

    public ExtractResult extract(InputStream content, String filename, @Nullable ExtractOptions options) {
        return extract(FileSource.of(content, filename), options);
    }

    public ExtractResult extract(FileSource file, @Nullable ExtractOptions options) {
        return await(operations.extract(file, options));
    }

    // Account and files

    public User getUser() {
        return await(operations.getUser());
    }

    /**
     * Downloads a file, typically a {@code downloadUrl} of a split document. Performed once, without retry.
     */
    public byte[] downloadFile(String url) {
        return await(operations.downloadFile(url));
    }

    /**
     * Releases both connection pools. Calls made after closing fail with {@link IllegalStateException}.
     */
    @Override
    public void close() {
        synchronized (reactiveLock) {
            if (closed) {
                return;
            }
            closed = true;
        }
        log.info("Closing renamed.to client");
        blockingTransport.close();
        Transport transport = reactiveTransport;
        if (transport != null) {
            transport.close();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    private RenamedOperations newOperations(Transport transport, Suspension suspension) {
        RequestEngine requestEngine = new RequestEngine(transport, authentication, jsonCodec, diagnostics,
                                                        suspension, settings.getBaseUrl(),
                                                        settings.getMaxRetries());
        return new RenamedOperations(requestEngine, jsonCodec, diagnostics, settings.getPollInterval(),
                                     settings.getMaxPollAttempts());
    }

    private <T> T await(Mono<T> call) {
        ensureOpen();
        return call.block();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Client is closed");
        }
    }

    /**
     * Fluent construction of a {@link RenamedClient}.
     */
    public static final class Builder {

        private final RenamedClientSettings.RenamedClientSettingsBuilder settings;

        private Builder(String apiKey) {
            this.settings = RenamedClientSettings.builder().apiKey(apiKey);
        }

        public Builder baseUrl(String baseUrl) {
            settings.baseUrl(baseUrl);
            return this;
        }

        public Builder timeout(Duration timeout) {
            settings.timeout(timeout);
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            settings.maxRetries(maxRetries);
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            settings.pollInterval(pollInterval);
            return this;
        }

        public Builder maxPollAttempts(int maxPollAttempts) {
            settings.maxPollAttempts(maxPollAttempts);
            return this;
        }

        /**
         * Logs every request, retry, upload and job update through SLF4J unless a sink is set.
         */
        public Builder debug(boolean debug) {
            settings.debug(debug);
            return this;
        }

        public Builder diagnosticSink(DiagnosticSink diagnosticSink) {
            settings.diagnosticSink(diagnosticSink);
            return this;
        }

        /**
         * A template for the {@link WebClient}s the client creates, e.g. to add filters. It is cloned, not
         * modified.
         */
        public Builder webClientBuilder(WebClient.Builder webClientBuilder) {
            settings.webClientBuilder(webClientBuilder);
            return this;
        }

        public Builder transportFactory(TransportFactory transportFactory) {
            settings.transportFactory(transportFactory);
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            settings.objectMapper(objectMapper);
            return this;
        }

        /**
         * @throws IllegalArgumentException if a setting is invalid.
         */
        public RenamedClient build() {
            return new RenamedClient(settings.build());
        }
    }
}
