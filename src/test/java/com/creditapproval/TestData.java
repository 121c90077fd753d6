package com.creditapproval;

import com.creditapproval.model.Customer;
import com.creditapproval.model.LoanRecord;
import com.creditapproval.model.LoanStatus;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Builders for customers and loans used across tests.
 */
public final class TestData {

    public static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2026-06-15T10:00:00Z"), ZoneOffset.UTC);
    public static final LocalDate TODAY = LocalDate.of(2026, 6, 15);

    private TestData() {
    }

    public static Customer customer(Long id, String monthlyIncome, String approvedLimit) {
        Customer customer = new Customer();
        customer.setId(id);
        customer.setFirstName("Asha");
        customer.setLastName("Verma");
        customer.setAge(34);
        customer.setPhoneNumber("9876543210");
        customer.setMonthlyIncome(new BigDecimal(monthlyIncome));
        customer.setApprovedLimit(new BigDecimal(approvedLimit));
        customer.setCurrentDebt(BigDecimal.ZERO);
        return customer;
    }

    public static LoanRecord loan(Long customerId, String principal, int tenureMonths, int emisPaidOnTime,
                                  LocalDate startDate, LoanStatus status) {
        LoanRecord loan = new LoanRecord();
        loan.setCustomerId(customerId);
        loan.setPrincipal(new BigDecimal(principal));
        loan.setAnnualInterestRate(new BigDecimal("12.00"));
        loan.setTenureMonths(tenureMonths);
        loan.setMonthlyInstallment(new BigDecimal("1000.00"));
        loan.setEmisPaidOnTime(emisPaidOnTime);
        loan.setInstallmentsPaid(emisPaidOnTime);
        loan.setStartDate(startDate);
        loan.setEndDate(startDate.plusMonths(tenureMonths));
        loan.setStatus(status);
        return loan;
    }

    public static LoanRecord activeLoan(Long customerId, String principal) {
        return loan(customerId, principal, 24, 0, LocalDate.of(2024, 1, 10), LoanStatus.ACTIVE);
    }
}
