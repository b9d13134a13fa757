package com.bank.aml.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * One RestTemplate per outbound collaborator, each with its own timeouts.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate reasoningRestTemplate(RestTemplateBuilder builder, ReasoningClientConfig config) {
        return builder
                .rootUri(config.getBaseUrl())
                .setConnectTimeout(Duration.ofMillis(config.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(config.getReadTimeoutMs()))
                .build();
    }

    @Bean
    public RestTemplate knowledgeBaseRestTemplate(RestTemplateBuilder builder, KnowledgeBaseConfig config) {
        return builder
                .rootUri(config.getBaseUrl())
                .setConnectTimeout(Duration.ofMillis(config.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(config.getReadTimeoutMs()))
                .build();
    }
}
