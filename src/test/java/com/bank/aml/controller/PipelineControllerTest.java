package com.bank.aml.controller;

import com.bank.aml.config.TribunalConfig;
import com.bank.aml.exception.AdjudicationTimeoutException;
import com.bank.aml.exception.ExternalServiceUnavailableException;
import com.bank.aml.exception.InvariantViolationException;
import com.bank.aml.model.*;
import com.bank.aml.service.Deadline;
import com.bank.aml.service.ScreeningService;
import com.bank.aml.testutil.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(PipelineController.class)
class PipelineControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private ScreeningService screeningService;

    @MockBean
    private TribunalConfig tribunalConfig;

    @BeforeEach
    void setUp() {
        when(tribunalConfig.getLatency()).thenReturn(new TribunalConfig.Latency());
    }

    private String requestJson(Long timeoutMs) throws Exception {
        return objectMapper.writeValueAsString(PipelineRequest.builder()
                .transaction(TestDataFactory.createTransaction("TXN-1", 9800))
                .history(TestDataFactory.createHistory())
                .timeoutMs(timeoutMs)
                .build());
    }

    private static PipelineResult blockedResult() {
        return PipelineResult.builder()
                .transactionId("TXN-1")
                .statisticalResult(LayerResult.builder()
                        .layer(PipelineLayer.STATISTICAL).score(7.5).passed(false).build())
                .narrativeResult(LayerResult.builder()
                        .layer(PipelineLayer.NARRATIVE).score(0.25).passed(false).build())
                .expertResult(TestDataFactory.createVerdict(Decision.BLOCK, 0.92))
                .finalDecision(Decision.BLOCK)
                .finalConfidence(0.92)
                .totalProcessingTimeMs(21.4)
                .layersInvoked(List.of(PipelineLayer.STATISTICAL, PipelineLayer.NARRATIVE, PipelineLayer.EXPERT))
                .evaluatedAt(TestDataFactory.NOW)
                .build();
    }

    @Test
    void evaluate_success() throws Exception {
        when(screeningService.screen(any(Transaction.class), any(AccountHistory.class), any(Deadline.class)))
                .thenReturn(blockedResult());

        mockMvc.perform(post("/api/v1/pipeline/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestJson(null)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.transactionId").value("TXN-1"))
                .andExpect(jsonPath("$.finalDecision").value("BLOCK"))
                .andExpect(jsonPath("$.finalConfidence").value(0.92))
                .andExpect(jsonPath("$.layersInvoked[2]").value("expert"))
                .andExpect(jsonPath("$.statisticalResult.layer").value("statistical"))
                .andExpect(jsonPath("$.expertResult.typology").value("Structuring"))
                .andExpect(jsonPath("$.exitLayer").doesNotExist());
    }

    @Test
    void evaluate_explicitTimeout_isPassedAsDeadline() throws Exception {
        when(screeningService.screen(any(Transaction.class), any(AccountHistory.class), any(Deadline.class)))
                .thenReturn(blockedResult());

        mockMvc.perform(post("/api/v1/pipeline/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestJson(250L)))
                .andExpect(status().isOk());

        ArgumentCaptor<Deadline> deadline = ArgumentCaptor.forClass(Deadline.class);
        verify(screeningService).screen(any(Transaction.class), any(AccountHistory.class), deadline.capture());
        assertThat(deadline.getValue().getBudget()).isEqualTo(Duration.ofMillis(250));
    }

    @Test
    void evaluate_maximumTimeout_runsWithSaturatedDeadline() throws Exception {
        when(screeningService.screen(any(Transaction.class), any(AccountHistory.class), any(Deadline.class)))
                .thenReturn(blockedResult());

        mockMvc.perform(post("/api/v1/pipeline/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestJson(Long.MAX_VALUE)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.finalDecision").value("BLOCK"));

        ArgumentCaptor<Deadline> deadline = ArgumentCaptor.forClass(Deadline.class);
        verify(screeningService).screen(any(Transaction.class), any(AccountHistory.class), deadline.capture());
        assertThat(deadline.getValue().isBounded()).isTrue();
        assertThat(deadline.getValue().isExpired()).isFalse();
    }

    @Test
    void evaluate_nonPositiveTimeout_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/pipeline/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestJson(0L)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_input"));

        verifyNoInteractions(screeningService);
    }

    @Test
    void evaluate_invariantViolation_returns400() throws Exception {
        when(screeningService.screen(any(Transaction.class), any(AccountHistory.class), any(Deadline.class)))
                .thenThrow(new InvariantViolationException("stats.avgTransactionAmount", "inconsistent"));

        mockMvc.perform(post("/api/v1/pipeline/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestJson(null)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_input"))
                .andExpect(jsonPath("$.message").value("stats.avgTransactionAmount: inconsistent"));
    }

    @Test
    void evaluate_deadlineExceeded_returns504() throws Exception {
        when(screeningService.screen(any(Transaction.class), any(AccountHistory.class), any(Deadline.class)))
                .thenThrow(new AdjudicationTimeoutException("TXN-1", "adjudication", Duration.ofMillis(5000)));

        mockMvc.perform(post("/api/v1/pipeline/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestJson(null)))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.error").value("deadline_exceeded"));
    }

    @Test
    void evaluate_collaboratorUnavailable_returns503() throws Exception {
        when(screeningService.screen(any(Transaction.class), any(AccountHistory.class), any(Deadline.class)))
                .thenThrow(new ExternalServiceUnavailableException("knowledge-base", "connection refused"));

        mockMvc.perform(post("/api/v1/pipeline/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestJson(null)))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("service_unavailable"))
                .andExpect(jsonPath("$.message").value("knowledge-base unavailable: connection refused"));
    }

    @Test
    void getResult_found() throws Exception {
        when(screeningService.findResult("TXN-1")).thenReturn(Optional.of(blockedResult()));

        mockMvc.perform(get("/api/v1/pipeline/results/TXN-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.finalDecision").value("BLOCK"));
    }

    @Test
    void getResult_notFound() throws Exception {
        when(screeningService.findResult("NONEXISTENT")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/pipeline/results/NONEXISTENT"))
                .andExpect(status().isNotFound());
    }
}
