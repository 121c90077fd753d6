package com.creditapproval.exception;

public class InvalidLoanStateException extends CreditApprovalException {

    public InvalidLoanStateException(String message) {
        super("INVALID_LOAN_STATE", message);
    }
}
