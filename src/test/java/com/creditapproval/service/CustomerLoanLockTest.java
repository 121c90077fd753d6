package com.creditapproval.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CustomerLoanLock Unit Tests")
class CustomerLoanLockTest {

    private static final Duration TTL = Duration.ofSeconds(30);

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private CustomerLoanLock customerLoanLock;

    @BeforeEach
    void setUp() {
        customerLoanLock = new CustomerLoanLock(redisTemplate, TTL);
    }

    @Test
    @DisplayName("Should return an owner token when the lock is free")
    void shouldAcquireFreeLock() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(eq("loan-creation-lock:9"), anyString(), eq(TTL))).thenReturn(true);

        Optional<String> token = customerLoanLock.tryLock(9L);

        assertThat(token).isPresent();
        assertThat(token.get()).isNotEqualTo(CustomerLoanLock.UNGUARDED);
    }

    @Test
    @DisplayName("Should return empty when another creation holds the lock")
    void shouldNotAcquireHeldLock() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(eq("loan-creation-lock:9"), anyString(), eq(TTL))).thenReturn(false);

        assertThat(customerLoanLock.tryLock(9L)).isEmpty();
    }

    @Test
    @DisplayName("Should continue unguarded when Redis is unavailable")
    void shouldFailOpen() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class)))
                .thenThrow(new RedisConnectionFailureException("Connection refused"));

        assertThat(customerLoanLock.tryLock(9L)).contains(CustomerLoanLock.UNGUARDED);
    }

    @Test
    @DisplayName("Should release the lock with the owner token")
    void shouldReleaseWithToken() {
        when(redisTemplate.execute(any(RedisScript.class), eq(List.of("loan-creation-lock:9")), eq("token-1")))
                .thenReturn(1L);

        customerLoanLock.unlock(9L, "token-1");

        verify(redisTemplate).execute(any(RedisScript.class), eq(List.of("loan-creation-lock:9")), eq("token-1"));
    }

    @Test
    @DisplayName("Should skip release for an unguarded token")
    void shouldSkipUnguardedRelease() {
        customerLoanLock.unlock(9L, CustomerLoanLock.UNGUARDED);

        verifyNoInteractions(redisTemplate);
    }
}
