package com.creditapproval.dto;

import com.creditapproval.exception.InvalidLoanRequestException;

import java.math.BigDecimal;

public record CustomerRegistration(
    String firstName,
    String lastName,
    Integer age,
    BigDecimal monthlyIncome,
    String phoneNumber
) {
    public CustomerRegistration {
        if (firstName == null || firstName.isBlank()) {
            throw new InvalidLoanRequestException("First name is required");
        }
        if (lastName == null || lastName.isBlank()) {
            throw new InvalidLoanRequestException("Last name is required");
        }
        if (age != null && age <= 0) {
            throw new InvalidLoanRequestException("Age must be positive");
        }
        if (monthlyIncome == null || monthlyIncome.signum() <= 0) {
            throw new InvalidLoanRequestException("Monthly income must be positive");
        }
        if (phoneNumber == null || phoneNumber.isBlank()) {
            throw new InvalidLoanRequestException("Phone number is required");
        }
        firstName = firstName.strip();
        lastName = lastName.strip();
        phoneNumber = phoneNumber.strip();
    }
}
