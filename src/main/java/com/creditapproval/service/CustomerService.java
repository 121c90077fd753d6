package com.creditapproval.service;

import com.creditapproval.config.RedisConfig;
import com.creditapproval.dto.CustomerProfile;
import com.creditapproval.dto.CustomerRegistration;
import com.creditapproval.engine.ApprovedLimitPolicy;
import com.creditapproval.event.CustomerRegistered;
import com.creditapproval.exception.CustomerNotFoundException;
import com.creditapproval.model.Customer;
import com.creditapproval.repository.CustomerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Customer registration and profile lookups.
 *
 * CACHING STRATEGY:
 * =================
 * Profiles are cached by customer id in the "customers" region. Anything that
 * changes a customer's debt or limit must evict the entry (see evictCustomer).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CustomerService {

    private final CustomerRepository customerRepository;
    private final ApprovedLimitPolicy approvedLimitPolicy;
    private final OutboxWriter outboxWriter;

    /**
     * Register a customer. Approved limit = 36 x monthly income, rounded to the nearest lakh.
     */
    @Transactional
    public CustomerProfile registerCustomer(CustomerRegistration registration) {
        Customer customer = new Customer();
        customer.setFirstName(registration.firstName());
        customer.setLastName(registration.lastName());
        customer.setAge(registration.age());
        customer.setPhoneNumber(registration.phoneNumber());
        customer.setMonthlyIncome(registration.monthlyIncome());
        customer.setApprovedLimit(approvedLimitPolicy.computeApprovedLimit(registration.monthlyIncome()));
        customer.setCurrentDebt(BigDecimal.ZERO);

        Customer saved = customerRepository.save(customer);

        outboxWriter.customerRegistered(new CustomerRegistered(
                UUID.randomUUID().toString(),
                saved.getId(),
                saved.getMonthlyIncome(),
                saved.getApprovedLimit(),
                Instant.now()));

        log.info("Registered customer {} with approved limit {}", saved.getId(), saved.getApprovedLimit());
        return CustomerProfile.from(saved);
    }

    /**
     * Derive the approved limit again from the current monthly income.
     * The only way the limit changes after registration.
     */
    @Transactional
    @CacheEvict(value = RedisConfig.CUSTOMERS_CACHE, key = "#customerId")
    public CustomerProfile recalculateApprovedLimit(Long customerId) {
        Customer customer = customerRepository.findByIdForUpdate(customerId)
                .orElseThrow(() -> new CustomerNotFoundException(customerId));

        BigDecimal previous = customer.getApprovedLimit();
        customer.setApprovedLimit(approvedLimitPolicy.computeApprovedLimit(customer.getMonthlyIncome()));
        Customer saved = customerRepository.save(customer);

        log.info("Recalculated approved limit for customer {}: {} -> {}",
                customerId, previous, saved.getApprovedLimit());
        return CustomerProfile.from(saved);
    }

    @Transactional(readOnly = true)
    @Cacheable(value = RedisConfig.CUSTOMERS_CACHE, key = "#customerId")
    public CustomerProfile getCustomer(Long customerId) {
        log.debug("Cache miss - fetching customer from database: {}", customerId);
        return customerRepository.findById(customerId)
                .map(CustomerProfile::from)
                .orElseThrow(() -> new CustomerNotFoundException(customerId));
    }

    @CacheEvict(value = RedisConfig.CUSTOMERS_CACHE, key = "#customerId")
    public void evictCustomer(Long customerId) {
        log.debug("Evicted customer from cache: {}", customerId);
    }
}
