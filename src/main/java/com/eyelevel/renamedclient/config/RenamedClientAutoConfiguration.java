package com.eyelevel.renamedclient.config;

import com.eyelevel.renamedclient.client.ReactiveRenamedClient;
import com.eyelevel.renamedclient.client.RenamedClient;
import com.eyelevel.renamedclient.common.diagnostics.DiagnosticSink;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Registers a {@link RenamedClient} and its {@link ReactiveRenamedClient} view when
 * {@code renamed.client.api-key} is set.
 *
 * <p>A {@link DiagnosticSink}, {@link WebClient.Builder} or {@link ObjectMapper} bean in the context is picked up
 * when present.
 */
@Slf4j
@AutoConfiguration
@ConditionalOnClass(WebClient.class)
@ConditionalOnProperty(prefix = "renamed.client", name = "api-key")
@EnableConfigurationProperties(RenamedClientProperties.class)
public class RenamedClientAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public RenamedClient renamedClient(RenamedClientProperties properties,
                                       ObjectProvider<DiagnosticSink> diagnosticSink,
                                       ObjectProvider<WebClient.Builder> webClientBuilder,
                                       ObjectProvider<ObjectMapper> objectMapper) {
        log.info("Initializing renamed.to client bean with {}", properties);
        RenamedClient.Builder builder = RenamedClient.builder(properties.getApiKey())
                                                     .baseUrl(properties.getBaseUrl())
                                                     .timeout(properties.getTimeout())
                                                     .maxRetries(properties.getMaxRetries())
                                                     .pollInterval(properties.getPollInterval())
                                                     .maxPollAttempts(properties.getMaxPollAttempts())
                                                     .debug(properties.isDebug());
        diagnosticSink.ifAvailable(builder::diagnosticSink);
        webClientBuilder.ifAvailable(builder::webClientBuilder);
        objectMapper.ifAvailable(builder::objectMapper);
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public ReactiveRenamedClient reactiveRenamedClient(RenamedClient renamedClient) {
        return renamedClient.reactive();
    }
}
