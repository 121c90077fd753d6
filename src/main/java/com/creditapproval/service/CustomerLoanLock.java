package com.creditapproval.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Redis-based guard allowing at most one in-flight loan creation per customer.
 *
 * KEY NAMING CONVENTION:
 * ======================
 * Pattern: loan-creation-lock:{customerId}
 * Value: a random owner token, so only the holder can release the lock.
 *
 * The lock is a lease (SET NX with TTL): a crashed holder cannot block the
 * customer for longer than the TTL.
 *
 * FAILOVER STRATEGY:
 * ==================
 * If Redis is down the guard fails open and returns {@link #UNGUARDED}.
 * Loan creation still locks the customer row in the database, so
 * read-decide-write stays serialized; only the early "already in progress"
 * answer is lost.
 */
@Service
@Slf4j
public class CustomerLoanLock {

    public static final String UNGUARDED = "unguarded";

    private static final String LOCK_PREFIX = "loan-creation-lock:";

    // Delete the key only if it still holds our token
    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final Duration ttl;

    public CustomerLoanLock(StringRedisTemplate redisTemplate,
                            @Value("${credit.lock.ttl:PT30S}") Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.ttl = ttl;
    }

    /**
     * @return the owner token, or empty if another creation holds the lock
     */
    public Optional<String> tryLock(Long customerId) {
        String key = buildKey(customerId);
        String token = UUID.randomUUID().toString();

        try {
            Boolean acquired = redisTemplate.opsForValue().setIfAbsent(key, token, ttl);
            if (Boolean.TRUE.equals(acquired)) {
                log.debug("Acquired loan creation lock for customer {}", customerId);
                return Optional.of(token);
            }
            log.warn("Loan creation already in progress for customer {}", customerId);
            return Optional.empty();

        } catch (Exception e) {
            log.error("Redis error acquiring loan creation lock for customer {}, continuing unguarded",
                    customerId, e);
            return Optional.of(UNGUARDED);
        }
    }

    public void unlock(Long customerId, String token) {
        if (UNGUARDED.equals(token)) {
            return;
        }
        String key = buildKey(customerId);
        try {
            Long released = redisTemplate.execute(RELEASE_SCRIPT, List.of(key), token);
            if (released == null || released == 0) {
                // Lease expired and possibly taken over by another request
                log.warn("Loan creation lock for customer {} was no longer held at release", customerId);
            } else {
                log.debug("Released loan creation lock for customer {}", customerId);
            }
        } catch (Exception e) {
            log.error("Redis error releasing loan creation lock for customer {}; it expires after {}",
                    customerId, ttl, e);
        }
    }

    private String buildKey(Long customerId) {
        return LOCK_PREFIX + customerId;
    }
}
