package com.creditapproval.service;

import com.creditapproval.dto.LoanCreationResult;
import com.creditapproval.dto.LoanRequest;
import com.creditapproval.engine.EligibilityResult;
import com.creditapproval.engine.EmiCalculator;
import com.creditapproval.event.LoanApproved;
import com.creditapproval.model.Customer;
import com.creditapproval.model.LoanRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Decides and persists a loan in one transaction.
 *
 * The customer row is locked for the whole transaction, so two requests for
 * the same customer cannot both pass the income-burden check against the same
 * EMI total.
 *
 * On approval, in the same transaction:
 * 1. Save the loan at the (possibly corrected) rate
 * 2. Add the principal to the customer's current debt
 * 3. Write a LoanApproved event to the outbox
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanOriginationService {

    private final LoanLedger loanLedger;
    private final EligibilityService eligibilityService;
    private final EmiCalculator emiCalculator;
    private final OutboxWriter outboxWriter;
    private final CustomerService customerService;
    private final Clock clock;

    @Transactional
    public LoanCreationResult originate(LoanRequest request) {
        Customer customer = loanLedger.lockCustomer(request.customerId());

        EligibilityResult eligibility = eligibilityService.evaluate(customer, request);
        if (!eligibility.approved()) {
            log.info("Loan not approved for customer {}: {}", customer.getId(), eligibility.decision());
            return LoanCreationResult.rejected(eligibility);
        }

        LoanRecord loan = loanLedger.saveLoan(LoanRecord.originate(
                customer.getId(),
                request.principal(),
                eligibility.correctedRate(),
                request.tenureMonths(),
                emiCalculator,
                LocalDate.now(clock)));

        customer.setCurrentDebt(customer.getCurrentDebt().add(request.principal()));
        loanLedger.saveCustomer(customer);

        outboxWriter.loanApproved(new LoanApproved(
                UUID.randomUUID().toString(),
                loan.getId(),
                customer.getId(),
                loan.getPrincipal(),
                eligibility.requestedRate(),
                loan.getAnnualInterestRate(),
                loan.getTenureMonths(),
                loan.getMonthlyInstallment(),
                eligibility.score(),
                Instant.now(clock)));

        // Debt changed; eviction is deferred to commit by the transaction-aware cache
        customerService.evictCustomer(customer.getId());

        log.info("Loan {} created for customer {}: amount {}, rate {}, EMI {}",
                loan.getId(), customer.getId(), loan.getPrincipal(),
                loan.getAnnualInterestRate(), loan.getMonthlyInstallment());

        return LoanCreationResult.approved(loan, eligibility);
    }
}
