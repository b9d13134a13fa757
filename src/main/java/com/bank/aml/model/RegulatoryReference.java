package com.bank.aml.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "Citation of a regulatory document or requirement")
public class RegulatoryReference {

    @Schema(description = "Issuing body", example = "FATF")
    String source;

    @Schema(description = "Reference within the source", example = "Recommendation 20")
    String reference;

    @Schema(description = "Why the reference applies", example = "Reporting of suspicious transactions")
    String relevance;

    public static RegulatoryReference of(String source, String reference, String relevance) {
        return RegulatoryReference.builder()
                .source(source)
                .reference(reference)
                .relevance(relevance)
                .build();
    }
}
