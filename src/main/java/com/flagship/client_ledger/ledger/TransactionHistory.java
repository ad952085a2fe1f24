package com.flagship.client_ledger.ledger;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Accepted deposits and withdrawals of one replay run, keyed by transaction id.
 * These are the only transactions a dispute, resolve or chargeback can reference.
 */
public class TransactionHistory {

    private final Map<Long, TransactionRecord> entries = new HashMap<>();

    /**
     * Stores the record under its transaction id, replacing any earlier entry.
     */
    public void record(TransactionRecord transaction) {
        entries.put(transaction.getTransactionId(), transaction);
    }

    public Optional<TransactionRecord> lookup(long transactionId) {
        return Optional.ofNullable(entries.get(transactionId));
    }

    public Optional<TransactionRecord> remove(long transactionId) {
        return Optional.ofNullable(entries.remove(transactionId));
    }

    public boolean contains(long transactionId) {
        return entries.containsKey(transactionId);
    }

    public int size() {
        return entries.size();
    }
}
