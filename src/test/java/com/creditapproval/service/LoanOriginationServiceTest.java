package com.creditapproval.service;

import com.creditapproval.TestData;
import com.creditapproval.dto.LoanCreationResult;
import com.creditapproval.dto.LoanRequest;
import com.creditapproval.engine.EligibilityDecision;
import com.creditapproval.engine.EligibilityResult;
import com.creditapproval.engine.EmiCalculator;
import com.creditapproval.event.LoanApproved;
import com.creditapproval.model.Customer;
import com.creditapproval.model.LoanRecord;
import com.creditapproval.model.LoanStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;

import static com.creditapproval.TestData.customer;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("LoanOriginationService Unit Tests")
class LoanOriginationServiceTest {

    @Mock
    private LoanLedger loanLedger;

    @Mock
    private EligibilityService eligibilityService;

    @Mock
    private OutboxWriter outboxWriter;

    @Mock
    private CustomerService customerService;

    private LoanOriginationService loanOriginationService;

    private Customer customer;

    @BeforeEach
    void setUp() {
        loanOriginationService = new LoanOriginationService(loanLedger, eligibilityService, new EmiCalculator(),
                outboxWriter, customerService, TestData.FIXED_CLOCK);
        customer = customer(5L, "50000", "1800000");
        customer.setCurrentDebt(new BigDecimal("100000"));
    }

    private EligibilityResult eligibility(String rate, String correctedRate, String emi, EligibilityDecision decision) {
        return new EligibilityResult(5L, 40, new BigDecimal(rate), new BigDecimal(correctedRate), 24,
                new BigDecimal(emi), decision);
    }

    @Test
    @DisplayName("Should save the loan at the corrected rate and add the principal to current debt")
    void shouldCreateLoanAtCorrectedRate() {
        LoanRequest request = new LoanRequest(5L, new BigDecimal("500000"), new BigDecimal("10"), 24);
        when(loanLedger.lockCustomer(5L)).thenReturn(customer);
        when(eligibilityService.evaluate(customer, request))
                .thenReturn(eligibility("10", "12", "23536.74", EligibilityDecision.APPROVED_AT_CORRECTED_RATE));
        when(loanLedger.saveLoan(any(LoanRecord.class))).thenAnswer(invocation -> {
            LoanRecord loan = invocation.getArgument(0);
            loan.setId(42L);
            return loan;
        });

        LoanCreationResult result = loanOriginationService.originate(request);

        assertThat(result.loanApproved()).isTrue();
        assertThat(result.loanId()).isEqualTo(42L);
        assertThat(result.customerId()).isEqualTo(5L);
        assertThat(result.monthlyInstallment()).isEqualByComparingTo("23536.74");
        assertThat(result.message()).isEqualTo("Loan approved successfully.");

        ArgumentCaptor<LoanRecord> loanCaptor = ArgumentCaptor.forClass(LoanRecord.class);
        verify(loanLedger).saveLoan(loanCaptor.capture());
        LoanRecord saved = loanCaptor.getValue();
        assertThat(saved.getAnnualInterestRate()).isEqualByComparingTo("12");
        assertThat(saved.getStartDate()).isEqualTo(TestData.TODAY);
        assertThat(saved.getEndDate()).isEqualTo(TestData.TODAY.plusMonths(24));
        assertThat(saved.getStatus()).isEqualTo(LoanStatus.ACTIVE);
        assertThat(saved.getEmisPaidOnTime()).isZero();

        verify(loanLedger).saveCustomer(customer);
        assertThat(customer.getCurrentDebt()).isEqualByComparingTo("600000");
        verify(customerService).evictCustomer(5L);
    }

    @Test
    @DisplayName("Should write a LoanApproved event with requested and applied rates")
    void shouldWriteLoanApprovedEvent() {
        LoanRequest request = new LoanRequest(5L, new BigDecimal("500000"), new BigDecimal("10"), 24);
        when(loanLedger.lockCustomer(5L)).thenReturn(customer);
        when(eligibilityService.evaluate(customer, request))
                .thenReturn(eligibility("10", "12", "23536.74", EligibilityDecision.APPROVED_AT_CORRECTED_RATE));
        when(loanLedger.saveLoan(any(LoanRecord.class))).thenAnswer(invocation -> {
            LoanRecord loan = invocation.getArgument(0);
            loan.setId(43L);
            return loan;
        });

        loanOriginationService.originate(request);

        ArgumentCaptor<LoanApproved> eventCaptor = ArgumentCaptor.forClass(LoanApproved.class);
        verify(outboxWriter).loanApproved(eventCaptor.capture());
        LoanApproved event = eventCaptor.getValue();
        assertThat(event.loanId()).isEqualTo(43L);
        assertThat(event.customerId()).isEqualTo(5L);
        assertThat(event.requestedRate()).isEqualByComparingTo("10");
        assertThat(event.interestRate()).isEqualByComparingTo("12");
        assertThat(event.monthlyInstallment()).isEqualByComparingTo("23536.74");
        assertThat(event.eventId()).isNotBlank();
    }

    @Test
    @DisplayName("Should persist nothing when eligibility rejects")
    void shouldNotPersistRejectedLoan() {
        LoanRequest request = new LoanRequest(5L, new BigDecimal("500000"), new BigDecimal("15"), 24);
        when(loanLedger.lockCustomer(5L)).thenReturn(customer);
        when(eligibilityService.evaluate(customer, request))
                .thenReturn(eligibility("15", "15", "24243.32", EligibilityDecision.REJECTED_INCOME_BURDEN));

        LoanCreationResult result = loanOriginationService.originate(request);

        assertThat(result.loanApproved()).isFalse();
        assertThat(result.loanId()).isNull();
        assertThat(result.monthlyInstallment()).isNull();
        assertThat(result.message()).contains("half of monthly income");
        assertThat(result.eligibility().decision()).isEqualTo(EligibilityDecision.REJECTED_INCOME_BURDEN);

        verify(loanLedger, never()).saveLoan(any());
        verify(loanLedger, never()).saveCustomer(any());
        verifyNoInteractions(outboxWriter, customerService);
        assertThat(customer.getCurrentDebt()).isEqualByComparingTo("100000");
    }
}
