package com.creditapproval.engine;

public enum ScoreComponentType {
    PAYMENT_HISTORY,   // Installments paid on time / installments due
    LOAN_COUNT,        // Number of loans ever taken
    CURRENT_ACTIVITY,  // Loans started in the current year
    VOLUME             // Active principal / approved limit
}
