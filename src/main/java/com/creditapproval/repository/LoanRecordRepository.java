package com.creditapproval.repository;

import com.creditapproval.model.LoanRecord;
import com.creditapproval.model.LoanStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Repository for loan records.
 *
 * Key queries:
 * - Single loan under a row lock (repayment and closure)
 * - All loans of a customer (credit history)
 * - Active loans of a customer (current exposure)
 * - Sum of active EMIs (income burden)
 */
@Repository
public interface LoanRecordRepository extends JpaRepository<LoanRecord, Long> {

    /**
     * Load the loan and hold a row lock until the transaction ends.
     * Serializes installments and closure on the same loan.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM LoanRecord l WHERE l.id = :id")
    Optional<LoanRecord> findByIdForUpdate(@Param("id") Long id);

    List<LoanRecord> findByCustomerIdOrderByIdAsc(Long customerId);

    List<LoanRecord> findByCustomerIdAndStatusOrderByIdAsc(Long customerId, LoanStatus status);

    /**
     * Sum of monthly installments, or null when the customer has no loan in that status.
     */
    @Query("SELECT SUM(l.monthlyInstallment) FROM LoanRecord l "
            + "WHERE l.customerId = :customerId AND l.status = :status")
    BigDecimal sumMonthlyInstallments(@Param("customerId") Long customerId, @Param("status") LoanStatus status);
}
