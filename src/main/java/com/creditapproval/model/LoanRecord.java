package com.creditapproval.model;

import com.creditapproval.engine.EmiCalculator;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;

/**
 * A loan held by a customer, past or current.
 *
 * The monthly installment is always derived from principal, rate and tenure:
 * new records are created through {@link #originate}, which runs the EMI formula.
 */
@Entity
@Table(name = "loan_records",
       indexes = @Index(name = "idx_loan_customer_status", columnList = "customerId, status"))
@Data
@NoArgsConstructor
public class LoanRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long customerId;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal principal;

    // Annual percentage rate
    @Column(nullable = false, precision = 5, scale = 2)
    private BigDecimal annualInterestRate;

    @Column(nullable = false)
    private Integer tenureMonths;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal monthlyInstallment;

    @Column(nullable = false)
    private Integer emisPaidOnTime = 0;

    @Column(nullable = false)
    private Integer installmentsPaid = 0;

    private LocalDate startDate;

    private LocalDate endDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private LoanStatus status = LoanStatus.ACTIVE;

    public static LoanRecord originate(Long customerId,
                                       BigDecimal principal,
                                       BigDecimal annualInterestRate,
                                       int tenureMonths,
                                       EmiCalculator emiCalculator,
                                       LocalDate startDate) {
        // Compute from the values as the columns store them
        principal = principal.setScale(EmiCalculator.CURRENCY_SCALE, RoundingMode.HALF_UP);
        annualInterestRate = annualInterestRate.setScale(EmiCalculator.CURRENCY_SCALE, RoundingMode.HALF_UP);

        LoanRecord loan = new LoanRecord();
        loan.setCustomerId(customerId);
        loan.setPrincipal(principal);
        loan.setAnnualInterestRate(annualInterestRate);
        loan.setTenureMonths(tenureMonths);
        loan.setMonthlyInstallment(emiCalculator.computeEmi(principal, annualInterestRate, tenureMonths));
        loan.setEmisPaidOnTime(0);
        loan.setInstallmentsPaid(0);
        loan.setStartDate(startDate);
        loan.setEndDate(startDate.plusMonths(tenureMonths));
        loan.setStatus(LoanStatus.ACTIVE);
        return loan;
    }

    public boolean isActive() {
        return status == LoanStatus.ACTIVE;
    }

    public int repaymentsLeft() {
        return Math.max(0, tenureMonths - installmentsPaid);
    }
}
