package com.bank.aml.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Aggregated behavioral summary of an account, computed upstream.
 * All counts are non-negative; when totalTransactions > 0 the average
 * equals totalSent / totalTransactions.
 */
@Value
@Builder
@Jacksonized
@Schema(description = "Aggregated behavioral statistics of an account")
public class AccountStats {

    @Schema(description = "Number of transactions on record", example = "100")
    long totalTransactions;

    @Schema(description = "Total amount sent", example = "50000.00")
    double totalSent;

    @Schema(description = "Total amount received", example = "45000.00")
    double totalReceived;

    @Schema(description = "Average transaction amount", example = "500.00")
    double avgTransactionAmount;

    @Schema(description = "Standard deviation of transaction amounts", example = "250.00")
    double stdTransactionAmount;

    @Schema(description = "Distinct counterparties transacted with", example = "10")
    long uniqueCounterparties;

    @Schema(description = "Share of transactions per payment format")
    Map<String, Double> paymentFormatDistribution;

    @Schema(description = "Share of transactions per hour of day (0-23)")
    Map<Integer, Double> hourDistribution;

    @Schema(description = "First transaction timestamp in epoch milliseconds")
    long firstTransaction;

    @Schema(description = "Last transaction timestamp in epoch milliseconds")
    long lastTransaction;

    @Schema(description = "Average number of transactions per day", example = "1.0")
    double transactionFrequencyPerDay;

    /**
     * Sent-to-received ratio, or NaN when either side has no volume.
     * NaN never satisfies a range check, so ratio-based signals stay silent.
     */
    @JsonIgnore
    public double getSentToReceivedRatio() {
        if (totalSent <= 0 || totalReceived <= 0) {
            return Double.NaN;
        }
        return totalSent / totalReceived;
    }
}
