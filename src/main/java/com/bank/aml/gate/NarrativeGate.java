package com.bank.aml.gate;

import com.bank.aml.model.AccountHistory;
import com.bank.aml.model.NarrativeGateResult;
import com.bank.aml.model.Transaction;

/**
 * Second gate: how well a transaction fits the account's behavioral history.
 * Scores are on a 0-1 scale where higher is more coherent.
 */
public interface NarrativeGate {

    NarrativeGateResult analyze(Transaction txn, AccountHistory history);
}
