package com.bank.aml.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

/**
 * Confusion matrix of pipeline decisions against ground-truth labels.
 * A transaction counts as flagged when the final decision is not APPROVE.
 */
@Value
@Builder
@Schema(description = "Detection quality against labelled transactions")
public class EvaluationMetrics {

    long truePositives;
    long falsePositives;
    long trueNegatives;
    long falseNegatives;

    @Schema(description = "TP / (TP + FP)", example = "0.18")
    public double getPrecision() {
        long total = truePositives + falsePositives;
        return total > 0 ? (double) truePositives / total : 0.0;
    }

    @Schema(description = "TP / (TP + FN)", example = "0.74")
    public double getRecall() {
        long total = truePositives + falseNegatives;
        return total > 0 ? (double) truePositives / total : 0.0;
    }

    @Schema(description = "Harmonic mean of precision and recall", example = "0.29")
    public double getF1Score() {
        double p = getPrecision();
        double r = getRecall();
        return (p + r) > 0 ? 2 * p * r / (p + r) : 0.0;
    }

    @Schema(description = "(TP + TN) / total", example = "0.97")
    public double getAccuracy() {
        long total = truePositives + falsePositives + trueNegatives + falseNegatives;
        return total > 0 ? (double) (truePositives + trueNegatives) / total : 0.0;
    }
}
