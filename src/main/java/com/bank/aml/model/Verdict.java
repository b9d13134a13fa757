package com.bank.aml.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
@Schema(description = "Final adjudication of an escalated transaction")
public class Verdict {

    @Schema(description = "Final decision after confidence-floor downgrades", example = "REVIEW")
    Decision decision;

    @Schema(description = "Decision confidence (0-1)", example = "0.72")
    double confidence;

    @Schema(description = "Primary detected typology", example = "Structuring", nullable = true)
    String typology;

    @Schema(description = "Confidence of the primary typology", example = "1.0", nullable = true)
    Double typologyConfidence;

    @Builder.Default
    List<RiskFactor> riskFactors = List.of();

    @Schema(description = "Risk score on the statistical 0-10 scale", example = "7.5")
    double riskScore;

    @Builder.Default
    @Schema(description = "Regulatory references cited in the reasoning")
    List<RegulatoryReference> citations = List.of();

    @Schema(description = "SAR draft, present only for BLOCK and REVIEW decisions", nullable = true)
    SarDraft sarDraft;

    @Schema(description = "Reasoning behind the decision")
    String reasoning;

    @Schema(description = "Adjudication wall time in milliseconds", example = "1840.5")
    double processingTimeMs;

    @Schema(description = "Reasoning model identifier", example = "claude-sonnet-4-20250514")
    String modelUsed;
}
