package com.creditapproval.service;

import com.creditapproval.exception.CustomerNotFoundException;
import com.creditapproval.model.Customer;
import com.creditapproval.model.LoanRecord;

import java.math.BigDecimal;
import java.util.List;

/**
 * Data the eligibility engine reads and writes: customers and their loans.
 */
public interface LoanLedger {

    /**
     * @throws CustomerNotFoundException if no customer has this id
     */
    Customer loadCustomer(Long customerId);

    /**
     * Like {@link #loadCustomer}, additionally holding a write lock on the customer
     * until the surrounding transaction ends.
     *
     * @throws CustomerNotFoundException if no customer has this id
     */
    Customer lockCustomer(Long customerId);

    /**
     * All loans of the customer, active and closed.
     */
    List<LoanRecord> loadLoanHistory(Long customerId);

    List<LoanRecord> loadActiveLoans(Long customerId);

    /**
     * Total monthly installment of the customer's active loans; zero when there are none.
     */
    BigDecimal sumActiveMonthlyEmis(Long customerId);

    LoanRecord saveLoan(LoanRecord loan);

    Customer saveCustomer(Customer customer);
}
