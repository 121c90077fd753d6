package com.creditapproval.service;

import com.creditapproval.dto.LoanRequest;
import com.creditapproval.engine.CreditScoreEstimator;
import com.creditapproval.engine.EligibilityResolver;
import com.creditapproval.engine.EligibilityResult;
import com.creditapproval.engine.ScoreBreakdown;
import com.creditapproval.model.Customer;
import com.creditapproval.model.LoanRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

/**
 * Read-only eligibility check for a requested loan.
 *
 * Flow:
 * 1. Load the customer's loan history, active loans and current EMI burden
 * 2. Score the customer
 * 3. Resolve the score band, the rate and the income-burden check
 *
 * Loan creation runs the same evaluation, so a check and a creation with the
 * same data always decide the same way.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EligibilityService {

    private final LoanLedger loanLedger;
    private final CreditScoreEstimator creditScoreEstimator;
    private final EligibilityResolver eligibilityResolver;

    @Transactional(readOnly = true)
    public EligibilityResult checkEligibility(LoanRequest request) {
        log.info("Checking eligibility for customer {}: amount {}, rate {}, tenure {}",
                request.customerId(), request.principal(), request.interestRate(), request.tenureMonths());

        Customer customer = loanLedger.loadCustomer(request.customerId());
        return evaluate(customer, request);
    }

    /**
     * Score the customer and decide on the request. No persistence.
     */
    public EligibilityResult evaluate(Customer customer, LoanRequest request) {
        List<LoanRecord> history = loanLedger.loadLoanHistory(customer.getId());
        List<LoanRecord> activeLoans = loanLedger.loadActiveLoans(customer.getId());
        BigDecimal existingEmis = loanLedger.sumActiveMonthlyEmis(customer.getId());

        ScoreBreakdown breakdown = creditScoreEstimator.computeScore(customer, history, activeLoans);

        EligibilityResult result = eligibilityResolver.resolve(
                breakdown.score(),
                request.interestRate(),
                request.principal(),
                request.tenureMonths(),
                customer,
                existingEmis);

        log.info("Eligibility for customer {}: decision {}, score {}, rate {} -> {}, EMI {}",
                customer.getId(), result.decision(), result.score(),
                result.requestedRate(), result.correctedRate(), result.monthlyInstallment());
        return result;
    }
}
