package com.bank.aml.client;

import com.bank.aml.model.KnowledgeDocument;

import java.util.List;

/**
 * Similarity search over the regulatory knowledge base.
 */
public interface KnowledgeBaseClient {

    /**
     * @param sourceFilter restricts hits to one source collection, or {@code null} for all
     * @return hits ranked by similarity, best first
     */
    List<KnowledgeDocument> search(String query, int limit, String sourceFilter);

    default List<KnowledgeDocument> search(String query, int limit) {
        return search(query, limit, null);
    }
}
