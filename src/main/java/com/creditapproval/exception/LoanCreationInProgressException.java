package com.creditapproval.exception;

/**
 * Another loan creation for the same customer holds the lock.
 */
public class LoanCreationInProgressException extends CreditApprovalException {

    public LoanCreationInProgressException(Long customerId) {
        super("LOAN_CREATION_IN_PROGRESS",
                "A loan creation for customer " + customerId + " is already in progress.");
    }
}
