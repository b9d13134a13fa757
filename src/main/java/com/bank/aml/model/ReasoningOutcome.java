package com.bank.aml.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Result of decoding the reasoning service's reply: either a well-formed
 * decision or the raw text that could not be decoded.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ReasoningOutcome {

    public enum Kind {
        PARSED,
        MALFORMED
    }

    static final double MALFORMED_CONFIDENCE = 0.5;

    Kind kind;
    Decision decision;
    double confidence;
    String typology;
    String reasoning;
    List<String> keyRiskFactors;
    List<String> regulatoryCitations;
    String raw;

    public static ReasoningOutcome parsed(Decision decision, double confidence, String typology, String reasoning,
                                          List<String> keyRiskFactors, List<String> regulatoryCitations,
                                          String raw) {
        return new ReasoningOutcome(Kind.PARSED, decision, confidence, typology,
                reasoning != null ? reasoning : "",
                keyRiskFactors != null ? List.copyOf(keyRiskFactors) : List.of(),
                regulatoryCitations != null ? List.copyOf(regulatoryCitations) : List.of(),
                raw);
    }

    /**
     * Falls back to REVIEW at 0.5 confidence with the raw text as reasoning.
     */
    public static ReasoningOutcome malformed(String raw) {
        String text = raw != null ? raw : "";
        return new ReasoningOutcome(Kind.MALFORMED, Decision.REVIEW, MALFORMED_CONFIDENCE, null,
                text, List.of(), List.of(), text);
    }

    public boolean isMalformed() {
        return kind == Kind.MALFORMED;
    }
}
