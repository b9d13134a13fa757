package com.bank.aml.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "Amount details of a transaction")
public class TransactionAmount {

    @Schema(description = "Amount debited from the sender", example = "9800.00")
    double sent;

    @Schema(description = "Amount credited to the receiver", example = "9800.00")
    double received;

    @Builder.Default
    @Schema(description = "Currency of the sent amount", example = "US Dollar")
    String currencySent = "US Dollar";

    @Builder.Default
    @Schema(description = "Currency of the received amount", example = "US Dollar")
    String currencyReceived = "US Dollar";
}
