package com.bank.aml.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
@Schema(description = "Outcome of a single gate")
public class LayerResult {

    @Schema(description = "Gate that produced this result", example = "statistical")
    PipelineLayer layer;

    @Schema(description = "Gate score (statistical 0-10, narrative 0-1)", example = "4.2")
    double score;

    @Schema(description = "True if the transaction passed the gate (not flagged)", example = "false")
    boolean passed;

    @Schema(description = "Gate latency in milliseconds", example = "3.1")
    double processingTimeMs;

    @Builder.Default
    @Schema(description = "Gate-specific details")
    Map<String, Object> details = Map.of();
}
