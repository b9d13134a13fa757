package com.bank.aml.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "Sender or receiver of a transaction")
public class TransactionParty {

    @Schema(description = "Account identifier", example = "8000EBD30")
    String accountId;

    @Schema(description = "Bank identifier", example = "011")
    String bankId;
}
