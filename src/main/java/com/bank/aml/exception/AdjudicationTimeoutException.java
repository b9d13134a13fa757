package com.bank.aml.exception;

import java.time.Duration;

/**
 * The caller's deadline elapsed before the pipeline produced a result.
 */
public class AdjudicationTimeoutException extends ExternalServiceUnavailableException {

    private final String txnId;

    public AdjudicationTimeoutException(String txnId, String stage, Duration budget) {
        super("tribunal", String.format("deadline exceeded during %s for txn %s (budget %d ms)",
                stage, txnId, budget.toMillis()));
        this.txnId = txnId;
    }

    public String getTxnId() {
        return txnId;
    }
}
