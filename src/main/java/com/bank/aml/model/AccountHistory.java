package com.bank.aml.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
@Schema(description = "History context of the account that owns the screened transaction")
public class AccountHistory {

    @Schema(description = "Account identifier", example = "8000EBD30")
    String accountId;

    @Schema(description = "Bank identifier", example = "011")
    String bankId;

    @Schema(description = "Aggregated behavioral statistics")
    AccountStats stats;

    @Builder.Default
    @Schema(description = "Most recent transactions (at most 50)")
    List<Transaction> recentTransactions = List.of();

    @Schema(description = "Behavioral peer-group cluster, when assigned", nullable = true)
    Integer clusterId;

    @Schema(description = "Free-text behavioral profile, when available", nullable = true)
    String profileNarrative;
}
