package com.creditapproval.service;

import com.creditapproval.exception.CustomerNotFoundException;
import com.creditapproval.model.Customer;
import com.creditapproval.model.LoanRecord;
import com.creditapproval.model.LoanStatus;
import com.creditapproval.repository.CustomerRepository;
import com.creditapproval.repository.LoanRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

@Component
@RequiredArgsConstructor
public class JpaLoanLedger implements LoanLedger {

    private final CustomerRepository customerRepository;
    private final LoanRecordRepository loanRecordRepository;

    @Override
    public Customer loadCustomer(Long customerId) {
        return customerRepository.findById(customerId)
                .orElseThrow(() -> new CustomerNotFoundException(customerId));
    }

    @Override
    public Customer lockCustomer(Long customerId) {
        return customerRepository.findByIdForUpdate(customerId)
                .orElseThrow(() -> new CustomerNotFoundException(customerId));
    }

    @Override
    public List<LoanRecord> loadLoanHistory(Long customerId) {
        return loanRecordRepository.findByCustomerIdOrderByIdAsc(customerId);
    }

    @Override
    public List<LoanRecord> loadActiveLoans(Long customerId) {
        return loanRecordRepository.findByCustomerIdAndStatusOrderByIdAsc(customerId, LoanStatus.ACTIVE);
    }

    @Override
    public BigDecimal sumActiveMonthlyEmis(Long customerId) {
        BigDecimal total = loanRecordRepository.sumMonthlyInstallments(customerId, LoanStatus.ACTIVE);
        return total != null ? total : BigDecimal.ZERO;
    }

    @Override
    public LoanRecord saveLoan(LoanRecord loan) {
        return loanRecordRepository.save(loan);
    }

    @Override
    public Customer saveCustomer(Customer customer) {
        return customerRepository.save(customer);
    }
}
