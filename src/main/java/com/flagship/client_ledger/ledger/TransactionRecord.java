package com.flagship.client_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Immutable transaction record as it enters the ledger.
 *
 * Invariants:
 * - client id fits the unsigned 16-bit range
 * - transaction id fits the unsigned 32-bit range
 * - amount, when present, is not negative
 */
@Value
public class TransactionRecord {

    public static final int MAX_CLIENT_ID = 0xFFFF;
    public static final long MAX_TRANSACTION_ID = 0xFFFF_FFFFL;

    TransactionType type;
    int clientId;
    long transactionId;
    BigDecimal amount;

    public TransactionRecord(TransactionType type, int clientId, long transactionId, BigDecimal amount) {
        this.type = Objects.requireNonNull(type, "type");
        if (clientId < 0 || clientId > MAX_CLIENT_ID) {
            throw new IllegalArgumentException("Client id out of range: " + clientId);
        }
        if (transactionId < 0 || transactionId > MAX_TRANSACTION_ID) {
            throw new IllegalArgumentException("Transaction id out of range: " + transactionId);
        }
        if (amount != null && amount.signum() < 0) {
            throw new IllegalArgumentException("Amount must not be negative: " + amount);
        }
        this.clientId = clientId;
        this.transactionId = transactionId;
        this.amount = amount;
    }

    public static TransactionRecord deposit(int clientId, long transactionId, BigDecimal amount) {
        return new TransactionRecord(TransactionType.DEPOSIT, clientId, transactionId, amount);
    }

    public static TransactionRecord withdrawal(int clientId, long transactionId, BigDecimal amount) {
        return new TransactionRecord(TransactionType.WITHDRAWAL, clientId, transactionId, amount);
    }

    public static TransactionRecord dispute(int clientId, long transactionId) {
        return new TransactionRecord(TransactionType.DISPUTE, clientId, transactionId, null);
    }

    public static TransactionRecord resolve(int clientId, long transactionId) {
        return new TransactionRecord(TransactionType.RESOLVE, clientId, transactionId, null);
    }

    public static TransactionRecord chargeback(int clientId, long transactionId) {
        return new TransactionRecord(TransactionType.CHARGEBACK, clientId, transactionId, null);
    }

    public boolean hasAmount() {
        return amount != null;
    }

    /**
     * Returns a copy of this record carrying the given amount.
     */
    public TransactionRecord withAmount(BigDecimal newAmount) {
        return new TransactionRecord(type, clientId, transactionId, newAmount);
    }
}
