package com.creditapproval.dto;

import com.creditapproval.model.Customer;

import java.math.BigDecimal;

/**
 * Read view of a customer, as cached in Redis.
 */
public record CustomerProfile(
    Long customerId,
    String name,
    Integer age,
    BigDecimal monthlyIncome,
    BigDecimal approvedLimit,
    BigDecimal currentDebt,
    String phoneNumber
) {
    public static CustomerProfile from(Customer customer) {
        return new CustomerProfile(
                customer.getId(),
                customer.fullName(),
                customer.getAge(),
                customer.getMonthlyIncome(),
                customer.getApprovedLimit(),
                customer.getCurrentDebt(),
                customer.getPhoneNumber());
    }
}
