package com.creditapproval.dto;

import com.creditapproval.model.LoanRecord;

import java.math.BigDecimal;

public record LoanSummary(
    Long loanId,
    BigDecimal loanAmount,
    BigDecimal interestRate,
    BigDecimal monthlyInstallment,
    int repaymentsLeft
) {
    public static LoanSummary from(LoanRecord loan) {
        return new LoanSummary(
                loan.getId(),
                loan.getPrincipal(),
                loan.getAnnualInterestRate(),
                loan.getMonthlyInstallment(),
                loan.repaymentsLeft());
    }
}
