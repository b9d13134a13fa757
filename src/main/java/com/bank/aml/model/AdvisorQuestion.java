package com.bank.aml.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Question for the compliance advisor")
public class AdvisorQuestion {

    @Schema(description = "Question text", example = "What are the red flags for structuring?")
    private String question;

    @Schema(description = "Restrict context to one source", example = "FATF", nullable = true)
    private String source;
}
