package com.creditapproval.service;

import com.creditapproval.dto.LoanCreationResult;
import com.creditapproval.dto.LoanRequest;
import com.creditapproval.exception.LoanCreationInProgressException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for loan creation.
 *
 * Holds the per-customer Redis lock around the whole transaction, so the lock
 * is released only after the new loan is committed. A second request for the
 * same customer arriving meanwhile fails fast with
 * {@link LoanCreationInProgressException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanService {

    private final CustomerLoanLock customerLoanLock;
    private final LoanOriginationService loanOriginationService;

    public LoanCreationResult createLoan(LoanRequest request) {
        log.info("Received loan creation request for customer {}: amount {}, rate {}, tenure {}",
                request.customerId(), request.principal(), request.interestRate(), request.tenureMonths());

        String token = customerLoanLock.tryLock(request.customerId())
                .orElseThrow(() -> new LoanCreationInProgressException(request.customerId()));
        try {
            return loanOriginationService.originate(request);
        } finally {
            customerLoanLock.unlock(request.customerId(), token);
        }
    }
}
