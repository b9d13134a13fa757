package com.bank.aml.client;

import com.bank.aml.exception.ExternalServiceUnavailableException;
import com.bank.aml.model.KnowledgeDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Knowledge-base client for the vector search service's {@code POST /search} endpoint.
 */
@Component
public class RestKnowledgeBaseClient implements KnowledgeBaseClient {

    private static final Logger log = LoggerFactory.getLogger(RestKnowledgeBaseClient.class);

    static final String SERVICE = "knowledge-base";

    private final RestTemplate restTemplate;

    public RestKnowledgeBaseClient(@Qualifier("knowledgeBaseRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public List<KnowledgeDocument> search(String query, int limit, String sourceFilter) {
        Map<String, Object> request = new HashMap<>();
        request.put("query", query);
        request.put("limit", limit);
        if (sourceFilter != null) {
            request.put("sourceFilter", sourceFilter);
        }

        KnowledgeDocument[] hits;
        try {
            hits = restTemplate.postForObject("/search", request, KnowledgeDocument[].class);
        } catch (RestClientException e) {
            log.error("Knowledge-base search failed for query '{}': {}", query, e.getMessage(), e);
            throw new ExternalServiceUnavailableException(SERVICE, e.getMessage(), e);
        }

        log.debug("Knowledge-base search '{}' returned {} hits", query, hits == null ? 0 : hits.length);
        return hits == null ? List.of() : Arrays.asList(hits);
    }
}
