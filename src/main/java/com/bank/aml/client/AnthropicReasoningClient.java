package com.bank.aml.client;

import com.bank.aml.config.ReasoningClientConfig;
import com.bank.aml.exception.ExternalServiceUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

/**
 * Reasoning client over the Anthropic Messages API.
 */
@Component
public class AnthropicReasoningClient implements ReasoningClient {

    private static final Logger log = LoggerFactory.getLogger(AnthropicReasoningClient.class);

    static final String SERVICE = "reasoning";

    private final RestTemplate restTemplate;
    private final ReasoningClientConfig config;

    public AnthropicReasoningClient(@Qualifier("reasoningRestTemplate") RestTemplate restTemplate,
                                    ReasoningClientConfig config) {
        this.restTemplate = restTemplate;
        this.config = config;
    }

    @Override
    public String chat(String userMessage, String systemPrompt, String model, int maxTokens, double temperature) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("x-api-key", config.getApiKey() != null ? config.getApiKey() : "");
        headers.set("anthropic-version", config.getApiVersion());

        Map<String, Object> body = Map.of(
                "model", model,
                "max_tokens", maxTokens,
                "temperature", temperature,
                "system", systemPrompt,
                "messages", List.of(Map.of("role", "user", "content", userMessage)));

        JsonNode response;
        try {
            response = restTemplate.postForObject("/v1/messages", new HttpEntity<>(body, headers), JsonNode.class);
        } catch (RestClientException e) {
            log.error("Reasoning call failed for model {}: {}", model, e.getMessage(), e);
            throw new ExternalServiceUnavailableException(SERVICE, e.getMessage(), e);
        }

        if (response == null) {
            return "";
        }
        JsonNode text = response.path("content").path(0).path("text");
        if (text.isMissingNode()) {
            log.warn("Reasoning response for model {} carried no text content", model);
            return "";
        }
        return text.asText();
    }
}
