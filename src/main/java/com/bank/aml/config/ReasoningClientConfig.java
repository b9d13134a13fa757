package com.bank.aml.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "reasoning")
public class ReasoningClientConfig {

    private String baseUrl = "https://api.anthropic.com";
    private String apiKey;
    private String apiVersion = "2023-06-01";
    private String model = "claude-sonnet-4-20250514";
    private int maxTokens = 1500;
    private double temperature = 0.0;
    private int connectTimeoutMs = 1000;
    private int readTimeoutMs = 3000;
}
