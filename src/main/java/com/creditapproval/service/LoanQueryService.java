package com.creditapproval.service;

import com.creditapproval.config.RedisConfig;
import com.creditapproval.dto.LoanDetails;
import com.creditapproval.dto.LoanSummary;
import com.creditapproval.exception.CustomerNotFoundException;
import com.creditapproval.exception.LoanNotFoundException;
import com.creditapproval.model.Customer;
import com.creditapproval.model.LoanRecord;
import com.creditapproval.model.LoanStatus;
import com.creditapproval.repository.CustomerRepository;
import com.creditapproval.repository.LoanRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Loan lookups.
 *
 * Single loans are cached by loan id in the "loans" region and evicted by
 * LoanRepaymentService whenever a repayment or closure changes them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanQueryService {

    private final LoanRecordRepository loanRecordRepository;
    private final CustomerRepository customerRepository;

    @Transactional(readOnly = true)
    @Cacheable(value = RedisConfig.LOANS_CACHE, key = "#loanId")
    public LoanDetails viewLoan(Long loanId) {
        log.debug("Cache miss - fetching loan from database: {}", loanId);
        LoanRecord loan = loanRecordRepository.findById(loanId)
                .orElseThrow(() -> new LoanNotFoundException(loanId));
        Customer customer = customerRepository.findById(loan.getCustomerId())
                .orElseThrow(() -> new CustomerNotFoundException(loan.getCustomerId()));
        return LoanDetails.of(loan, customer);
    }

    /**
     * Active loans of a customer with the installments still to pay.
     */
    @Transactional(readOnly = true)
    public List<LoanSummary> viewLoans(Long customerId) {
        if (!customerRepository.existsById(customerId)) {
            throw new CustomerNotFoundException(customerId);
        }
        return loanRecordRepository.findByCustomerIdAndStatusOrderByIdAsc(customerId, LoanStatus.ACTIVE)
                .stream()
                .map(LoanSummary::from)
                .toList();
    }

    @CacheEvict(value = RedisConfig.LOANS_CACHE, key = "#loanId")
    public void evictLoan(Long loanId) {
        log.debug("Evicted loan from cache: {}", loanId);
    }
}
