package com.bank.aml.service;

import com.bank.aml.client.KnowledgeBaseClient;
import com.bank.aml.client.ReasoningClient;
import com.bank.aml.config.ReasoningClientConfig;
import com.bank.aml.model.AdvisorAnswer;
import com.bank.aml.model.KnowledgeDocument;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Question-and-answer access to the regulatory knowledge base for compliance staff.
 */
@Service
public class ComplianceAdvisorService {

    private static final Logger log = LoggerFactory.getLogger(ComplianceAdvisorService.class);

    static final int CONTEXT_PASSAGES = 8;
    static final int ANSWER_MAX_TOKENS = 2000;
    static final int PREVIEW_CHARS = 500;

    static final String SYSTEM_PROMPT =
            "You are a senior AML/CFT compliance expert with 20+ years of experience.\n\n" +
            "Your background:\n" +
            "- Former MLRO (Money Laundering Reporting Officer) at a Tier 1 bank\n" +
            "- Certified Anti-Money Laundering Specialist (CAMS)\n" +
            "- Deep expertise in FATF recommendations, EU AML directives, and UK/US regulations\n" +
            "- Practical knowledge of transaction monitoring, KYC/CDD, and SAR filing\n\n" +
            "Your role:\n" +
            "- Answer questions about AML/CFT compliance with precision\n" +
            "- Explain complex regulatory concepts in clear terms\n" +
            "- Cite specific regulations and guidance when relevant\n" +
            "- Identify red flags and typologies\n\n" +
            "Your style:\n" +
            "- Professional but accessible\n" +
            "- Specific and detailed, not vague\n" +
            "- Always cite sources when available\n" +
            "- Acknowledge uncertainty when appropriate\n";

    private final KnowledgeBaseClient knowledgeBase;
    private final ReasoningClient reasoningClient;
    private final RegulatoryContextService contextService;
    private final ReasoningClientConfig reasoningConfig;

    public ComplianceAdvisorService(KnowledgeBaseClient knowledgeBase,
                                    ReasoningClient reasoningClient,
                                    RegulatoryContextService contextService,
                                    ReasoningClientConfig reasoningConfig) {
        this.knowledgeBase = knowledgeBase;
        this.reasoningClient = reasoningClient;
        this.contextService = contextService;
        this.reasoningConfig = reasoningConfig;
    }

    /**
     * @param sourceFilter restricts context to one source (for example "FATF"), or {@code null}
     */
    @Observed(name = "advisor.ask", contextualName = "ask-compliance-advisor")
    public AdvisorAnswer ask(String question, String sourceFilter) {
        List<KnowledgeDocument> sources = knowledgeBase.search(question, CONTEXT_PASSAGES, sourceFilter);
        log.debug("Advisor question matched {} passages (filter={})", sources.size(), sourceFilter);

        String prompt = "REGULATORY CONTEXT (from knowledge base):\n" +
                contextService.formatContext(sources) + "\n\n" +
                "USER QUESTION:\n" + question + "\n\n" +
                "Provide a comprehensive answer based on the regulatory context above and your expertise.\n" +
                "Structure your response clearly. Cite specific documents when referencing guidance.";

        String answer = reasoningClient.chat(prompt, SYSTEM_PROMPT, reasoningConfig.getModel(),
                ANSWER_MAX_TOKENS, reasoningConfig.getTemperature());

        return AdvisorAnswer.builder()
                .answer(answer)
                .sources(sources)
                .build();
    }

    /**
     * Direct knowledge-base search with passage text cut to a short preview.
     */
    public List<KnowledgeDocument> search(String query, int limit) {
        return knowledgeBase.search(query, limit).stream()
                .map(hit -> {
                    String text = hit.getText() != null ? hit.getText() : "";
                    return hit.toBuilder()
                            .text(text.substring(0, Math.min(PREVIEW_CHARS, text.length())))
                            .build();
                })
                .collect(Collectors.toList());
    }
}
