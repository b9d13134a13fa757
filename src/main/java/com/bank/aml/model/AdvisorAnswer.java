package com.bank.aml.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Answer from the compliance advisor with the passages it was grounded on")
public class AdvisorAnswer {

    @Schema(description = "Expert answer text")
    String answer;

    @Schema(description = "Knowledge-base passages used as context")
    List<KnowledgeDocument> sources;
}
