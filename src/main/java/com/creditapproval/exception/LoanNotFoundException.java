package com.creditapproval.exception;

public class LoanNotFoundException extends CreditApprovalException {

    public LoanNotFoundException(Long loanId) {
        super("LOAN_NOT_FOUND", "Loan with ID " + loanId + " not found.");
    }
}
