package com.eyelevel.renamedclient.common.apiclient.authentication.impl;

import com.eyelevel.renamedclient.common.apiclient.authentication.Authentication;
import com.eyelevel.renamedclient.common.diagnostics.DiagnosticFormats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;

/**
 * An implementation of {@link Authentication} that sends the API key as an OAuth-style bearer token:
 * {@code Authorization: Bearer <key>}.
 */
@Slf4j
public record BearerTokenAuthentication(String apiKey) implements Authentication {

    public BearerTokenAuthentication {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("API key is required");
        }
    }

    @Override
    public void applyAuthentication(HttpHeaders headers) {
        headers.setBearerAuth(apiKey);
        log.trace("Applied bearer token {} to request headers.", describe());
    }

    @Override
    public String describe() {
        return DiagnosticFormats.maskApiKey(apiKey);
    }

    @Override
    public String toString() {
        return "BearerTokenAuthentication[apiKey=" + describe() + "]";
    }
}
