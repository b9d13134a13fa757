package com.bank.aml.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Output of the narrative gate: coherence with the account's history on a 0-1 scale.
 */
@Value
@Builder
public class NarrativeGateResult {
    double score;
    boolean passed;
    @Builder.Default
    Map<String, Object> details = Map.of();
}
