package com.bank.aml.controller;

import com.bank.aml.config.TribunalConfig;
import com.bank.aml.exception.InvariantViolationException;
import com.bank.aml.model.PipelineRequest;
import com.bank.aml.model.PipelineResult;
import com.bank.aml.service.Deadline;
import com.bank.aml.service.ScreeningService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;

@RestController
@RequestMapping("/api/v1/pipeline")
@Tag(name = "Pipeline", description = "Screen transactions through the tribunal and retrieve stored results")
public class PipelineController {

    private final ScreeningService screeningService;
    private final TribunalConfig config;

    public PipelineController(ScreeningService screeningService, TribunalConfig config) {
        this.screeningService = screeningService;
        this.config = config;
    }

    @Operation(summary = "Screen a transaction",
            description = "Runs the statistical gate, then the narrative gate, then adjudication for transactions " +
                    "both gates flag. Returns the final decision (APPROVE/REVIEW/BLOCK), the layers that ran " +
                    "and, for adjudicated transactions, the verdict with its SAR draft.")
    @PostMapping("/evaluate")
    public ResponseEntity<PipelineResult> evaluate(@RequestBody PipelineRequest request) {
        long timeoutMs = request.getTimeoutMs() != null
                ? request.getTimeoutMs() : config.getLatency().getPipelineTimeoutMs();
        if (timeoutMs <= 0) {
            throw new InvariantViolationException("timeoutMs", "must be positive but was " + timeoutMs);
        }

        PipelineResult result = screeningService.screen(request.getTransaction(), request.getHistory(),
                Deadline.after(Duration.ofMillis(timeoutMs)));
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "Get the stored result for a transaction",
            description = "Retrieves the pipeline result of a previously screened transaction.")
    @GetMapping("/results/{txnId}")
    public ResponseEntity<PipelineResult> getResult(
            @Parameter(description = "Transaction ID", example = "TXN-000184")
            @PathVariable String txnId) {
        return screeningService.findResult(txnId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
