package com.bank.aml.gate;

import com.bank.aml.model.AccountHistory;
import com.bank.aml.model.StatisticalGateResult;
import com.bank.aml.model.Transaction;

/**
 * First gate: deviation of a transaction from its account's peer group.
 * Implementations return a score on a 0-10 scale where higher is more anomalous,
 * and set {@code passed} when the transaction needs no further scrutiny.
 *
 * @throws com.bank.aml.exception.ExternalServiceUnavailableException when the scorer cannot be reached
 */
public interface StatisticalGate {

    StatisticalGateResult analyze(Transaction txn, AccountHistory history);
}
