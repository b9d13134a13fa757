package com.bank.aml.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Output of the statistical gate: peer-group deviation on a 0-10 scale.
 */
@Value
@Builder
public class StatisticalGateResult {
    double score;
    boolean passed;
    int clusterId;
    double zScore;
    @Builder.Default
    Map<String, Object> details = Map.of();
}
