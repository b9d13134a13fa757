package com.bank.aml.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "A financial transfer submitted for money-laundering screening")
public class Transaction {

    @Schema(description = "Unique transaction identifier", example = "TXN-000184")
    String txnId;

    @Schema(description = "Originating account")
    TransactionParty sender;

    @Schema(description = "Beneficiary account")
    TransactionParty receiver;

    @Schema(description = "Sent and received amounts with their currencies")
    TransactionAmount amount;

    @Schema(description = "Payment format", example = "Wire",
            allowableValues = {"Wire", "Cheque", "ACH", "Reinvestment", "Credit Card", "Cash", "Bitcoin"})
    String paymentFormat;

    @Schema(description = "Transaction timestamp in epoch milliseconds", example = "1739886764000")
    long timestamp;

    @Schema(description = "Ground-truth laundering label, when known (labelled datasets only)", nullable = true)
    Boolean isLaundering;

    @JsonIgnore
    public double getAmountSent() {
        return amount.getSent();
    }
}
