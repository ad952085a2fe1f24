package com.flagship.client_ledger.processing;

/**
 * Why a record was skipped without changing the ledger.
 * Rejections are not errors: the replay continues with the next record.
 */
public enum RejectionReason {
    ACCOUNT_LOCKED,
    INSUFFICIENT_AVAILABLE_FUNDS,
    INSUFFICIENT_HELD_FUNDS,
    UNKNOWN_TRANSACTION_REFERENCE,
    NOT_A_DEPOSIT
}
