package com.flagship.client_ledger.processing.exception;

import lombok.Getter;

/**
 * Fatal replay error. Thrown for malformed input, never for business-rule rejections.
 */
@Getter
public class TransactionProcessingException extends RuntimeException {

    private final ErrorCode errorCode;

    public TransactionProcessingException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public TransactionProcessingException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
