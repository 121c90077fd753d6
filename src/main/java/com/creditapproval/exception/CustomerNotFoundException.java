package com.creditapproval.exception;

public class CustomerNotFoundException extends CreditApprovalException {

    public CustomerNotFoundException(Long customerId) {
        super("CUSTOMER_NOT_FOUND", "Customer with ID " + customerId + " not found.");
    }
}
