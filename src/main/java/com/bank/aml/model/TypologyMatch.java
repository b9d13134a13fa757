package com.bank.aml.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Schema(description = "A typology detected by one detector invocation")
public class TypologyMatch {

    @Schema(description = "Typology name", example = "Structuring")
    String name;

    @Schema(description = "Detection confidence (0-1)", example = "0.85")
    double confidence;

    @Schema(description = "Signal identifiers in the order they matched",
            example = "[\"amount_near_10k_threshold\", \"round_number_amount\"]")
    List<String> signalsMatched;

    @Schema(description = "Typology description")
    String description;

    @Builder
    private TypologyMatch(String name, double confidence, List<String> signalsMatched, String description) {
        if (signalsMatched == null || signalsMatched.isEmpty()) {
            throw new IllegalArgumentException("A typology match needs at least one signal");
        }
        this.name = name;
        this.confidence = Math.max(0.0, Math.min(confidence, 1.0));
        this.signalsMatched = List.copyOf(signalsMatched);
        this.description = description;
    }

    public static TypologyMatch of(Typology typology, double accumulatedConfidence, List<String> signals) {
        return TypologyMatch.builder()
                .name(typology.getDisplayName())
                .confidence(accumulatedConfidence)
                .signalsMatched(signals)
                .description(typology.getDescription())
                .build();
    }
}
