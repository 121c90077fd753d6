package com.creditapproval.service;

import com.creditapproval.dto.LoanSummary;
import com.creditapproval.event.LoanClosed;
import com.creditapproval.exception.InvalidLoanStateException;
import com.creditapproval.exception.LoanNotFoundException;
import com.creditapproval.model.Customer;
import com.creditapproval.model.LoanRecord;
import com.creditapproval.model.LoanStatus;
import com.creditapproval.repository.LoanRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Loan lifecycle after origination: installment payments and closure.
 *
 * Loans are never deleted. A loan closes when its last installment is paid or
 * when it is closed explicitly; closing releases its principal from the
 * customer's current debt. Closed loans stay in the credit history.
 *
 * Every operation locks the loan row before checking its status, then the
 * customer row when closing. Loan creation locks only the customer row, so
 * the lock order cannot deadlock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanRepaymentService {

    private final LoanRecordRepository loanRecordRepository;
    private final LoanLedger loanLedger;
    private final OutboxWriter outboxWriter;
    private final LoanQueryService loanQueryService;
    private final CustomerService customerService;
    private final Clock clock;

    /**
     * Record one paid installment. Paying the last installment closes the loan.
     */
    @Transactional
    public LoanSummary recordInstallment(Long loanId, boolean paidOnTime) {
        LoanRecord loan = loadActiveLoan(loanId);

        loan.setInstallmentsPaid(loan.getInstallmentsPaid() + 1);
        if (paidOnTime) {
            loan.setEmisPaidOnTime(loan.getEmisPaidOnTime() + 1);
        }
        log.info("Installment {}/{} recorded for loan {} (on time: {})",
                loan.getInstallmentsPaid(), loan.getTenureMonths(), loanId, paidOnTime);

        if (loan.getInstallmentsPaid() >= loan.getTenureMonths()) {
            close(loan, true);
        } else {
            loanRecordRepository.save(loan);
        }

        loanQueryService.evictLoan(loanId);
        return LoanSummary.from(loan);
    }

    /**
     * Close a loan before its last installment (foreclosure).
     */
    @Transactional
    public LoanSummary closeLoan(Long loanId) {
        LoanRecord loan = loadActiveLoan(loanId);
        close(loan, false);
        loanQueryService.evictLoan(loanId);
        return LoanSummary.from(loan);
    }

    private LoanRecord loadActiveLoan(Long loanId) {
        LoanRecord loan = loanRecordRepository.findByIdForUpdate(loanId)
                .orElseThrow(() -> new LoanNotFoundException(loanId));
        if (!loan.isActive()) {
            throw new InvalidLoanStateException("Loan " + loanId + " is already closed");
        }
        return loan;
    }

    private void close(LoanRecord loan, boolean repaidInFull) {
        Customer customer = loanLedger.lockCustomer(loan.getCustomerId());

        loan.setStatus(LoanStatus.CLOSED);
        loanLedger.saveLoan(loan);

        BigDecimal remainingDebt = customer.getCurrentDebt().subtract(loan.getPrincipal()).max(BigDecimal.ZERO);
        customer.setCurrentDebt(remainingDebt);
        loanLedger.saveCustomer(customer);

        outboxWriter.loanClosed(new LoanClosed(
                UUID.randomUUID().toString(),
                loan.getId(),
                customer.getId(),
                loan.getInstallmentsPaid(),
                loan.getEmisPaidOnTime(),
                repaidInFull,
                Instant.now(clock)));

        customerService.evictCustomer(customer.getId());

        log.info("Loan {} of customer {} closed (repaid in full: {})", loan.getId(), customer.getId(), repaidInFull);
    }
}
