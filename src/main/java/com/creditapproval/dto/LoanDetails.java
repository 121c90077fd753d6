package com.creditapproval.dto;

import com.creditapproval.model.Customer;
import com.creditapproval.model.LoanRecord;
import com.creditapproval.model.LoanStatus;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A single loan with its owner, as cached in Redis.
 */
public record LoanDetails(
    Long loanId,
    Borrower customer,
    BigDecimal loanAmount,
    BigDecimal interestRate,
    BigDecimal monthlyInstallment,
    int tenure,
    int repaymentsLeft,
    LocalDate startDate,
    LocalDate endDate,
    LoanStatus status
) {
    public record Borrower(Long id, String firstName, String lastName, String phoneNumber, Integer age) {
    }

    public static LoanDetails of(LoanRecord loan, Customer customer) {
        return new LoanDetails(
                loan.getId(),
                new Borrower(customer.getId(), customer.getFirstName(), customer.getLastName(),
                        customer.getPhoneNumber(), customer.getAge()),
                loan.getPrincipal(),
                loan.getAnnualInterestRate(),
                loan.getMonthlyInstallment(),
                loan.getTenureMonths(),
                loan.repaymentsLeft(),
                loan.getStartDate(),
                loan.getEndDate(),
                loan.getStatus());
    }
}
