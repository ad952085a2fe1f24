package com.flagship.client_ledger.processing.exception;

/**
 * Fatal conditions that abort a replay run.
 */
public enum ErrorCode {
    /**
     * Deposit or withdrawal without an amount.
     */
    MISSING_AMOUNT,

    /**
     * Transaction type that the ledger does not know.
     */
    UNKNOWN_TRANSACTION_KIND,

    /**
     * Record that could not be parsed into a transaction.
     */
    MALFORMED_RECORD,

    /**
     * The record source failed to read its input.
     */
    READ_FAILURE
}
