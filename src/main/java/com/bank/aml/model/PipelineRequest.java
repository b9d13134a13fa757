package com.bank.aml.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A transaction to screen together with its account's history")
public class PipelineRequest {

    @Schema(description = "Transaction to screen")
    private Transaction transaction;

    @Schema(description = "History of the sending account")
    private AccountHistory history;

    @Schema(description = "Deadline for the whole run in milliseconds; the configured default applies when absent",
            example = "5000", nullable = true)
    private Long timeoutMs;
}
