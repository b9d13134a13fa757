package com.bank.aml.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "A regulatory knowledge-base passage ranked by similarity")
public class KnowledgeDocument {

    @Schema(description = "Passage text")
    String text;

    @Schema(description = "Origin of the passage")
    Metadata metadata;

    @Schema(description = "Similarity score", example = "0.87")
    double score;

    @JsonIgnore
    public String getSource() {
        return metadata != null && metadata.getSource() != null ? metadata.getSource() : "Unknown";
    }

    @JsonIgnore
    public String getFilename() {
        return metadata != null && metadata.getFilename() != null ? metadata.getFilename() : "Unknown";
    }

    @Value
    @Builder
    @Jacksonized
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Metadata {
        @Schema(description = "Issuing body or collection", example = "FATF")
        String source;

        @Schema(description = "Source document", example = "FATF-Recommendations-2023.pdf")
        String filename;
    }
}
