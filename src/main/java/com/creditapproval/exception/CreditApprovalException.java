package com.creditapproval.exception;

import lombok.Getter;

/**
 * Base exception for credit approval errors.
 *
 * Loan rejections are not exceptions: they are regular eligibility results.
 */
@Getter
public class CreditApprovalException extends RuntimeException {

    private final String errorCode;

    public CreditApprovalException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public CreditApprovalException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
