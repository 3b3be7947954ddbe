package com.eyelevel.renamedclient.client;

import com.eyelevel.renamedclient.common.apiclient.RequestEngine;
import com.eyelevel.renamedclient.common.apiclient.model.ApiRequest;
import com.eyelevel.renamedclient.common.diagnostics.DiagnosticSink;
import com.eyelevel.renamedclient.common.json.JsonCodec;
import com.eyelevel.renamedclient.dto.AsyncJobResponse;
import com.eyelevel.renamedclient.dto.ExtractOptions;
import com.eyelevel.renamedclient.dto.ExtractResult;
import com.eyelevel.renamedclient.dto.PdfSplitOptions;
import com.eyelevel.renamedclient.dto.RenameOptions;
import com.eyelevel.renamedclient.dto.RenameResult;
import com.eyelevel.renamedclient.dto.User;
import com.eyelevel.renamedclient.exception.apiclient.ApiException;
import com.eyelevel.renamedclient.exception.apiclient.ValidationException;
import com.eyelevel.renamedclient.exception.json.JsonCodecException;
import com.eyelevel.renamedclient.job.JobHandle;
import com.eyelevel.renamedclient.job.JobPoller;
import com.eyelevel.renamedclient.upload.FileSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.lang.Nullable;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The renamed.to operations, expressed once over a {@link RequestEngine}. The engine's suspension strategy
 * decides whether the resulting pipelines park threads or not.
 */
@Slf4j
@RequiredArgsConstructor
final class RenamedOperations {

    static final String RENAME_PATH = "/rename";
    static final String PDF_SPLIT_PATH = "/pdf-split";
    static final String EXTRACT_PATH = "/extract";
    static final String USER_PATH = "/user";

    private final RequestEngine requestEngine;
    private final JsonCodec jsonCodec;
    private final DiagnosticSink diagnostics;
    private final Duration pollInterval;
    private final int maxPollAttempts;

    Mono<RenameResult> rename(FileSource file, @Nullable RenameOptions options) {
        RenameOptions effective = options != null ? options : RenameOptions.defaults();
        return upload(RENAME_PATH, file, effective.toFormFields(), RenameResult.class);
    }

    Mono<JobPoller> pdfSplit(FileSource file, @Nullable PdfSplitOptions options) {
        PdfSplitOptions effective = options != null ? options : PdfSplitOptions.defaults();
        return upload(PDF_SPLIT_PATH, file, effective.toFormFields(), AsyncJobResponse.class).map(this::newPoller);
    }

    Mono<ExtractResult> extract(FileSource file, @Nullable ExtractOptions options) {
        ExtractOptions effective = options != null ? options : ExtractOptions.defaults();
        return Mono.fromCallable(() -> extractFields(effective))
                   .flatMap(fields -> upload(EXTRACT_PATH, file, fields, ExtractResult.class));
    }

    Mono<User> getUser() {
        ApiRequest apiRequest = ApiRequest.builder().method(HttpMethod.GET).path(USER_PATH).build();
        return requestEngine.execute(apiRequest, User.class);
    }

    Mono<byte[]> downloadFile(String url) {
        Objects.requireNonNull(url, "url must not be null");
        return requestEngine.fetchBytes(url);
    }

    JobPoller poller(String statusUrl, @Nullable String jobId) {
        return new JobPoller(requestEngine, new JobHandle(statusUrl, jobId, pollInterval, maxPollAttempts),
                             diagnostics);
    }

    private JobPoller newPoller(AsyncJobResponse response) {
        if (response.statusUrl() == null || response.statusUrl().isBlank()) {
            throw new ApiException("Failed to parse response: missing statusUrl", null, response);
        }
        log.info("PDF split job {} started, polling {}", response.jobId(), response.statusUrl());
        return poller(response.statusUrl(), response.jobId());
    }

    private Map<String, String> extractFields(ExtractOptions options) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (StringUtils.hasText(options.prompt())) {
            fields.put("prompt", options.prompt());
        }
        if (!CollectionUtils.isEmpty(options.schema())) {
            try {
                fields.put("schema", jsonCodec.encodeFormValue(options.schema()));
            } catch (JsonCodecException e) {
                throw new ValidationException("Invalid extraction schema: " + e.getMessage(), e);
            }
        }
        return fields;
    }

    private <T> Mono<T> upload(String path, FileSource file, Map<String, String> fields, Class<T> responseType) {
        Objects.requireNonNull(file, "file must not be null");
        return Mono.defer(() -> {
            log.debug("Uploading {} to {}", file, path);
            diagnostics.fileUploaded(file.filename(), file.size());
            ApiRequest apiRequest = ApiRequest.builder().method(HttpMethod.POST).path(path).file(file)
                                              .formFields(fields).build();
            return requestEngine.execute(apiRequest, responseType);
        });
    }
}
