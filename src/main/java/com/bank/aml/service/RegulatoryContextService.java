package com.bank.aml.service;

import com.bank.aml.client.KnowledgeBaseClient;
import com.bank.aml.config.TribunalConfig;
import com.bank.aml.model.AdjudicationInput;
import com.bank.aml.model.KnowledgeDocument;
import com.bank.aml.model.TypologyMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Retrieves regulatory passages relevant to an escalated transaction and
 * formats them as text blocks for the reasoning prompt.
 */
@Service
public class RegulatoryContextService {

    private static final Logger log = LoggerFactory.getLogger(RegulatoryContextService.class);

    static final int RESULTS_PER_QUERY = 3;
    static final int MAX_TYPOLOGY_PASSAGES = 6;
    private static final int DEDUP_PREFIX_CHARS = 100;

    private final KnowledgeBaseClient knowledgeBase;
    private final TribunalConfig config;

    public RegulatoryContextService(KnowledgeBaseClient knowledgeBase, TribunalConfig config) {
        this.knowledgeBase = knowledgeBase;
        this.config = config;
    }

    /**
     * Typology guidance when a primary typology exists, threshold guidance for
     * amounts just under $10,000, and SAR filing requirements, separated by blank lines.
     */
    public String buildContext(AdjudicationInput input, TypologyMatch primary) {
        List<String> blocks = new ArrayList<>();

        if (primary != null) {
            blocks.add("TYPOLOGY GUIDANCE (" + primary.getName() + "):\n" + typologyGuidance(primary.getName()));
        }

        double amount = input.getTransaction().getAmountSent();
        if (amount >= 9000 && amount < 10000) {
            List<KnowledgeDocument> hits =
                    knowledgeBase.search("structuring reporting threshold $10000", RESULTS_PER_QUERY);
            blocks.add("THRESHOLD GUIDANCE:\n" + formatContext(hits));
        }

        List<KnowledgeDocument> sar =
                knowledgeBase.search("suspicious activity report filing requirements", RESULTS_PER_QUERY);
        blocks.add("SAR REQUIREMENTS:\n" + formatContext(sar));

        log.debug("Built regulatory context for txn {} with {} blocks",
                input.getTransaction().getTxnId(), blocks.size());
        return String.join("\n\n", blocks);
    }

    public String typologyGuidance(String typology) {
        List<String> queries = List.of(
                typology + " money laundering typology red flags",
                typology + " suspicious activity indicators",
                typology + " detection methods AML");

        Set<String> seen = new HashSet<>();
        List<KnowledgeDocument> unique = new ArrayList<>();
        for (String query : queries) {
            for (KnowledgeDocument hit : knowledgeBase.search(query, RESULTS_PER_QUERY)) {
                String text = hit.getText() != null ? hit.getText() : "";
                String prefix = text.substring(0, Math.min(DEDUP_PREFIX_CHARS, text.length()));
                if (seen.add(prefix)) {
                    unique.add(hit);
                }
            }
        }
        return formatContext(unique.subList(0, Math.min(MAX_TYPOLOGY_PASSAGES, unique.size())));
    }

    public String formatContext(List<KnowledgeDocument> hits) {
        return formatContext(hits, config.getKnowledgeBase().getContextCharsPerResult());
    }

    public static String formatContext(List<KnowledgeDocument> hits, int maxChars) {
        List<String> parts = new ArrayList<>();
        int i = 1;
        for (KnowledgeDocument hit : hits) {
            String text = hit.getText() != null ? hit.getText() : "";
            parts.add(String.format(Locale.US, "---\nSOURCE %d: [%s] %s (relevance: %.2f)\n%s\n---",
                    i++, hit.getSource(), hit.getFilename(), hit.getScore(),
                    text.substring(0, Math.min(maxChars, text.length()))));
        }
        return String.join("\n", parts);
    }
}
