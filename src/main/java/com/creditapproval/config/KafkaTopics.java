package com.creditapproval.config;

/**
 * Centralized Kafka topic names for the domain events of the engine.
 */
public class KafkaTopics {

    // A customer was registered and received an approved limit
    public static final String CUSTOMER_REGISTERED = "customer.registered";

    // A loan passed the eligibility check and was persisted
    public static final String LOAN_APPROVED = "loan.approved";

    // A loan was fully repaid or closed early
    public static final String LOAN_CLOSED = "loan.closed";

    private KafkaTopics() {
    }
}
