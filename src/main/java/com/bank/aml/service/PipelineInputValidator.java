package com.bank.aml.service;

import com.bank.aml.exception.InvariantViolationException;
import com.bank.aml.model.AccountHistory;
import com.bank.aml.model.AccountStats;
import com.bank.aml.model.NarrativeGateResult;
import com.bank.aml.model.StatisticalGateResult;
import com.bank.aml.model.Transaction;
import com.bank.aml.model.TransactionParty;
import org.springframework.stereotype.Component;

/**
 * Boundary checks for the gate pipeline. Inputs are checked before a run
 * starts; gate scores are checked before they are used.
 */
@Component
public class PipelineInputValidator {

    public void validateInputs(Transaction txn, AccountHistory history) {
        if (txn == null) {
            throw new InvariantViolationException("transaction", "must not be null");
        }
        requireParty("transaction.sender", txn.getSender());
        requireParty("transaction.receiver", txn.getReceiver());
        if (txn.getAmount() == null) {
            throw new InvariantViolationException("transaction.amount", "must not be null");
        }
        requireNonNegative("transaction.amount.sent", txn.getAmount().getSent());
        requireNonNegative("transaction.amount.received", txn.getAmount().getReceived());
        if (txn.getPaymentFormat() == null || txn.getPaymentFormat().isBlank()) {
            throw new InvariantViolationException("transaction.paymentFormat", "must not be blank");
        }

        if (history == null) {
            throw new InvariantViolationException("history", "must not be null");
        }
        if (history.getAccountId() == null || history.getAccountId().isBlank()) {
            throw new InvariantViolationException("history.accountId", "must not be blank");
        }
        validateStats(history.getStats());
    }

    void validateStats(AccountStats stats) {
        if (stats == null) {
            throw new InvariantViolationException("history.stats", "must not be null");
        }
        requireNonNegative("stats.totalTransactions", stats.getTotalTransactions());
        requireNonNegative("stats.totalSent", stats.getTotalSent());
        requireNonNegative("stats.totalReceived", stats.getTotalReceived());
        requireNonNegative("stats.avgTransactionAmount", stats.getAvgTransactionAmount());
        requireNonNegative("stats.stdTransactionAmount", stats.getStdTransactionAmount());
        requireNonNegative("stats.uniqueCounterparties", stats.getUniqueCounterparties());
        requireNonNegative("stats.transactionFrequencyPerDay", stats.getTransactionFrequencyPerDay());

        if (stats.getTotalTransactions() > 0) {
            double expected = stats.getTotalSent() / stats.getTotalTransactions();
            double tolerance = Math.max(0.01, expected * 1e-6);
            if (Math.abs(stats.getAvgTransactionAmount() - expected) > tolerance) {
                throw new InvariantViolationException("stats.avgTransactionAmount",
                        String.format("expected %.4f (totalSent / totalTransactions) but was %.4f",
                                expected, stats.getAvgTransactionAmount()));
            }
        }
    }

    public void validateStatistical(StatisticalGateResult result) {
        if (result == null) {
            throw new InvariantViolationException("statisticalGate", "returned no result");
        }
        requireWithin("statisticalGate.score", result.getScore(), 0.0, 10.0);
    }

    public void validateNarrative(NarrativeGateResult result) {
        if (result == null) {
            throw new InvariantViolationException("narrativeGate", "returned no result");
        }
        requireWithin("narrativeGate.score", result.getScore(), 0.0, 1.0);
    }

    private static void requireParty(String field, TransactionParty party) {
        if (party == null || party.getAccountId() == null || party.getAccountId().isBlank()) {
            throw new InvariantViolationException(field, "account id must not be blank");
        }
    }

    // NaN fails both comparisons
    private static void requireNonNegative(String field, double value) {
        if (!(value >= 0.0)) {
            throw new InvariantViolationException(field, "must be non-negative but was " + value);
        }
    }

    private static void requireWithin(String field, double value, double min, double max) {
        if (!(value >= min && value <= max)) {
            throw new InvariantViolationException(field,
                    "must be within [" + min + ", " + max + "] but was " + value);
        }
    }
}
