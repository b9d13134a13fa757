package com.bank.aml.service;

import com.bank.aml.client.KnowledgeBaseClient;
import com.bank.aml.client.ReasoningClient;
import com.bank.aml.config.ReasoningClientConfig;
import com.bank.aml.config.TribunalConfig;
import com.bank.aml.model.AdvisorAnswer;
import com.bank.aml.model.KnowledgeDocument;
import com.bank.aml.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ComplianceAdvisorServiceTest {

    @Mock private KnowledgeBaseClient knowledgeBase;
    @Mock private ReasoningClient reasoningClient;

    private ComplianceAdvisorService advisorService;

    @BeforeEach
    void setUp() {
        ReasoningClientConfig reasoningConfig = new ReasoningClientConfig();
        reasoningConfig.setModel("test-model");
        advisorService = new ComplianceAdvisorService(knowledgeBase, reasoningClient,
                new RegulatoryContextService(knowledgeBase, new TribunalConfig()), reasoningConfig);
    }

    @Test
    void ask_groundsAnswerInFilteredPassages() {
        KnowledgeDocument doc = TestDataFactory.createDocument(
                "Structuring is the splitting of transactions to evade reporting.", "FinCEN", "fincen.pdf", 0.88);
        when(knowledgeBase.search("What is structuring?", 8, "FinCEN")).thenReturn(List.of(doc));
        when(reasoningClient.chat(anyString(), anyString(), eq("test-model"), eq(2000), eq(0.0)))
                .thenReturn("Structuring means...");

        AdvisorAnswer answer = advisorService.ask("What is structuring?", "FinCEN");

        assertThat(answer.getAnswer()).isEqualTo("Structuring means...");
        assertThat(answer.getSources()).containsExactly(doc);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(reasoningClient).chat(prompt.capture(), eq(ComplianceAdvisorService.SYSTEM_PROMPT),
                anyString(), anyInt(), anyDouble());
        assertThat(prompt.getValue())
                .startsWith("REGULATORY CONTEXT (from knowledge base):\n---\nSOURCE 1: [FinCEN] fincen.pdf")
                .contains("USER QUESTION:\nWhat is structuring?");
    }

    @Test
    void search_truncatesPassagesToPreview() {
        KnowledgeDocument longDoc = TestDataFactory.createDocument("a".repeat(800), "FATF", "fatf.pdf", 0.7);
        KnowledgeDocument shortDoc = TestDataFactory.createDocument("short", "FATF", "fatf.pdf", 0.6);
        when(knowledgeBase.search("wire transfers", 5)).thenReturn(List.of(longDoc, shortDoc));

        List<KnowledgeDocument> hits = advisorService.search("wire transfers", 5);

        assertThat(hits).hasSize(2);
        assertThat(hits.get(0).getText()).hasSize(500);
        assertThat(hits.get(0).getScore()).isEqualTo(0.7);
        assertThat(hits.get(0).getSource()).isEqualTo("FATF");
        assertThat(hits.get(1).getText()).isEqualTo("short");
    }
}
