package com.creditapproval.config;

import com.creditapproval.dto.CustomerProfile;
import com.creditapproval.dto.LoanDetails;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Redis Configuration for Caching.
 *
 * The loan creation lock uses the auto-configured StringRedisTemplate.
 *
 * CACHE REGIONS:
 * ==============
 * - customers: CustomerProfile by customer id (evicted when debt or limit changes)
 * - loans: LoanDetails by loan id (evicted on repayment and closure)
 *
 * Each region gets a serializer bound to its value type, so cached JSON
 * deserializes back into the record instead of a generic map.
 */
@Configuration
@EnableCaching
@Slf4j
public class RedisConfig {

    public static final String CUSTOMERS_CACHE = "customers";
    public static final String LOANS_CACHE = "loans";

    @Value("${credit.cache.customers-ttl:PT30M}")
    private Duration customersTtl;

    @Value("${credit.cache.loans-ttl:PT1H}")
    private Duration loansTtl;

    /**
     * ObjectMapper for JSON serialization (cache values and outbox payloads).
     * Configured to handle Java 8 time types (Instant, LocalDate, etc.)
     */
    @Bean
    public ObjectMapper redisObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        // Write dates as ISO-8601 strings (not timestamps)
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        log.info("Configured ObjectMapper with JavaTimeModule");
        return mapper;
    }

    @Bean
    public CacheManager cacheManager(
            RedisConnectionFactory connectionFactory,
            ObjectMapper redisObjectMapper) {

        RedisCacheConfiguration defaultConfig = RedisCacheConfiguration.defaultCacheConfig()
            .entryTtl(Duration.ofMinutes(30))
            .disableCachingNullValues()
            .serializeKeysWith(
                RedisSerializationContext.SerializationPair.fromSerializer(
                    new StringRedisSerializer()));

        Map<String, RedisCacheConfiguration> cacheConfigurations = new HashMap<>();

        cacheConfigurations.put(CUSTOMERS_CACHE, defaultConfig
            .entryTtl(customersTtl)
            .prefixCacheNameWith("credit:")
            .serializeValuesWith(RedisSerializationContext.SerializationPair.fromSerializer(
                new Jackson2JsonRedisSerializer<>(redisObjectMapper, CustomerProfile.class))));

        cacheConfigurations.put(LOANS_CACHE, defaultConfig
            .entryTtl(loansTtl)
            .prefixCacheNameWith("credit:")
            .serializeValuesWith(RedisSerializationContext.SerializationPair.fromSerializer(
                new Jackson2JsonRedisSerializer<>(redisObjectMapper, LoanDetails.class))));

        RedisCacheManager cacheManager = RedisCacheManager.builder(connectionFactory)
            .cacheDefaults(defaultConfig)
            .withInitialCacheConfigurations(cacheConfigurations)
            .transactionAware()  // Respect @Transactional boundaries
            .build();

        log.info("Configured RedisCacheManager with regions: {} ({}), {} ({})",
                CUSTOMERS_CACHE, customersTtl, LOANS_CACHE, loansTtl);
        return cacheManager;
    }
}
