package com.eyelevel.renamedclient.config;

import com.eyelevel.renamedclient.client.RenamedClientSettings;
import com.eyelevel.renamedclient.common.diagnostics.DiagnosticFormats;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Binds {@code renamed.client.*} properties.
 */
@Data
@ConfigurationProperties(prefix = "renamed.client")
public class RenamedClientProperties {

    /**
     * API key from the renamed.to dashboard. The client beans are only created when it is set.
     */
    private String apiKey;

    private String baseUrl = RenamedClientSettings.DEFAULT_BASE_URL;

    private Duration timeout = RenamedClientSettings.DEFAULT_TIMEOUT;

    private int maxRetries = RenamedClientSettings.DEFAULT_MAX_RETRIES;

    private Duration pollInterval = RenamedClientSettings.DEFAULT_POLL_INTERVAL;

    private int maxPollAttempts = RenamedClientSettings.DEFAULT_MAX_POLL_ATTEMPTS;

    /**
     * Log requests, retries, uploads and job updates to the {@code renamed.client} logger.
     */
    private boolean debug;

    @Override
    public String toString() {
        return "RenamedClientProperties[apiKey=" + DiagnosticFormats.maskApiKey(apiKey) + ", baseUrl=" + baseUrl
               + ", timeout=" + timeout + ", maxRetries=" + maxRetries + ", pollInterval=" + pollInterval
               + ", maxPollAttempts=" + maxPollAttempts + ", debug=" + debug + "]";
    }
}
