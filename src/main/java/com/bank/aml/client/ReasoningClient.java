package com.bank.aml.client;

/**
 * Language-model reasoning service.
 *
 * @throws com.bank.aml.exception.ExternalServiceUnavailableException when the service
 *         cannot be reached, times out or rejects the request
 */
public interface ReasoningClient {

    String chat(String userMessage, String systemPrompt, String model, int maxTokens, double temperature);
}
