package com.bank.aml.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
@Schema(description = "Result of screening one transaction through the tribunal")
public class PipelineResult {

    @Schema(description = "Screened transaction ID", example = "TXN-000184")
    String transactionId;

    @Schema(description = "Statistical gate result (always present)")
    LayerResult statisticalResult;

    @Schema(description = "Narrative gate result, present when the statistical gate flagged", nullable = true)
    LayerResult narrativeResult;

    @Schema(description = "Adjudication verdict, present when both gates flagged", nullable = true)
    Verdict expertResult;

    @Schema(description = "Final decision", example = "APPROVE")
    Decision finalDecision;

    @Schema(description = "Final confidence (0-1)", example = "0.97")
    double finalConfidence;

    @Schema(description = "End-to-end latency in milliseconds", example = "4.8")
    double totalProcessingTimeMs;

    @Schema(description = "Layers that ran, in order", example = "[\"statistical\"]")
    List<PipelineLayer> layersInvoked;

    @Schema(description = "Evaluation timestamp in epoch milliseconds", example = "1739886764000")
    long evaluatedAt;

    @JsonIgnore
    public PipelineLayer getExitLayer() {
        return layersInvoked.get(layersInvoked.size() - 1);
    }
}
