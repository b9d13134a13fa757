package com.bank.aml.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
@Schema(description = "A severity-tagged risk factor identified during adjudication")
public class RiskFactor {

    @Schema(description = "Factor name", example = "Near-Threshold Amount")
    String factor;

    @Schema(description = "Severity", example = "medium", allowableValues = {"low", "medium", "high", "critical"})
    Severity severity;

    @Schema(description = "Human-readable description")
    String description;

    @Builder.Default
    @Schema(description = "Supporting evidence", example = "[\"Amount: $9,500.00\"]")
    List<String> evidence = List.of();
}
