package com.bank.aml.model;

import com.bank.aml.exception.InvariantViolationException;
import lombok.Builder;
import lombok.Value;

/**
 * Everything the adjudicator sees about one escalated transaction.
 * Built once by the gate pipeline; score bounds are enforced here.
 */
@Value
public class AdjudicationInput {

    Transaction transaction;

    // 0-10, higher is more anomalous
    double statisticalScore;

    // 0-1, higher is more coherent with history
    double narrativeScore;

    AccountHistory accountHistory;

    TriggerReason triggeredBy;

    @Builder
    private AdjudicationInput(Transaction transaction, double statisticalScore, double narrativeScore,
                              AccountHistory accountHistory, TriggerReason triggeredBy) {
        if (transaction == null) {
            throw new InvariantViolationException("transaction", "must not be null");
        }
        if (accountHistory == null || accountHistory.getStats() == null) {
            throw new InvariantViolationException("accountHistory", "history and stats must not be null");
        }
        if (triggeredBy == null) {
            throw new InvariantViolationException("triggeredBy", "must not be null");
        }
        if (!(statisticalScore >= 0.0 && statisticalScore <= 10.0)) {
            throw new InvariantViolationException("statisticalScore",
                    "must be within [0, 10] but was " + statisticalScore);
        }
        if (!(narrativeScore >= 0.0 && narrativeScore <= 1.0)) {
            throw new InvariantViolationException("narrativeScore",
                    "must be within [0, 1] but was " + narrativeScore);
        }
        this.transaction = transaction;
        this.statisticalScore = statisticalScore;
        this.narrativeScore = narrativeScore;
        this.accountHistory = accountHistory;
        this.triggeredBy = triggeredBy;
    }

    public AccountStats getStats() {
        return accountHistory.getStats();
    }
}
