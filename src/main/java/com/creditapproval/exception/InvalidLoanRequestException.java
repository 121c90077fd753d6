package com.creditapproval.exception;

/**
 * Request or registration data violates an input contract (non-positive principal, tenure, income...).
 */
public class InvalidLoanRequestException extends CreditApprovalException {

    public InvalidLoanRequestException(String message) {
        super("INVALID_REQUEST", message);
    }
}
