package com.creditapproval.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Customer aggregate root. Owns its loan records by id; loans are never removed
 * through the customer.
 *
 * The approved limit is set at registration and changes only through an explicit
 * recalculation.
 */
@Entity
@Table(name = "customers")
@Data
@NoArgsConstructor
public class Customer {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String firstName;

    @Column(nullable = false, length = 100)
    private String lastName;

    private Integer age;

    @Column(nullable = false, length = 20)
    private String phoneNumber;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal monthlyIncome;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal approvedLimit;

    // Sum of principal of the customer's active loans
    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal currentDebt = BigDecimal.ZERO;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant updatedAt;

    public String fullName() {
        return firstName + " " + lastName;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (currentDebt == null) {
            currentDebt = BigDecimal.ZERO;
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
