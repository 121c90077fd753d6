package com.creditapproval;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main Spring Boot application for the Credit Approval Engine.
 *
 * The engine scores a customer's loan history, computes the installment for a
 * requested loan and decides whether the loan can be granted and at which rate.
 *
 * Callers use the service layer directly:
 * - CustomerService: register customers, derive their approved limit
 * - EligibilityService: read-only eligibility check
 * - LoanService: eligibility check + loan creation, serialized per customer
 * - LoanRepaymentService / LoanQueryService: loan lifecycle and lookups
 *
 * Architecture flow:
 * Caller -> Service -> Engine (pure) -> Database (+ Outbox) -> Outbox Publisher -> Kafka
 *
 * To run this application:
 * 1. Start PostgreSQL, Redis and Kafka
 * 2. Run this main class
 */
@SpringBootApplication
@EnableScheduling  // Enable scheduled tasks for Outbox Publisher
public class CreditApprovalApplication {

    public static void main(String[] args) {
        SpringApplication.run(CreditApprovalApplication.class, args);
    }
}
