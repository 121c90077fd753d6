package com.creditapproval.model;

public enum LoanStatus {
    ACTIVE,   // Installments still running
    CLOSED    // Fully repaid or closed early
}
