package com.bank.aml.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "knowledge-base")
public class KnowledgeBaseConfig {

    private String baseUrl = "http://localhost:6333";
    private int connectTimeoutMs = 500;
    private int readTimeoutMs = 1000;
}
