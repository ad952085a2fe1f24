package com.flagship.client_ledger.ledger;

import com.flagship.client_ledger.processing.exception.ErrorCode;
import com.flagship.client_ledger.processing.exception.TransactionProcessingException;

/**
 * Kind of a transaction record.
 *
 * Deposits and withdrawals move money and are kept in the transaction history.
 * Disputes, resolves and chargebacks only reference an earlier deposit or withdrawal.
 */
public enum TransactionType {
    DEPOSIT("deposit"),
    WITHDRAWAL("withdrawal"),
    DISPUTE("dispute"),
    RESOLVE("resolve"),
    CHARGEBACK("chargeback");

    private final String code;

    TransactionType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Resolves the input code of a transaction type. Codes are lower case and matched
     * exactly, apart from surrounding whitespace.
     *
     * @throws TransactionProcessingException with {@link ErrorCode#UNKNOWN_TRANSACTION_KIND}
     *         if the code names no known type
     */
    public static TransactionType fromCode(String code) {
        if (code != null) {
            String normalized = code.trim();
            for (TransactionType type : values()) {
                if (type.code.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new TransactionProcessingException(ErrorCode.UNKNOWN_TRANSACTION_KIND,
            String.format("Unknown transaction type \"%s\"", code));
    }
}
