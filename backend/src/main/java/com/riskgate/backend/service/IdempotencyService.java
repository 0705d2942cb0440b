package com.riskgate.backend.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.riskgate.backend.config.RiskProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * TTL-bounded set of pending order keys. Redis {@code SET NX EX} is authoritative when
 * reachable; every reservation is mirrored into a local Caffeine cache that takes over
 * whenever Redis fails, so submission degrades instead of failing.
 */
@Service
@Slf4j
public class IdempotencyService {

    static final String KEY_PREFIX = "orders:pending:";

    private final StringRedisTemplate redisTemplate;
    private final Duration ttl;
    private final Cache<String, String> localPending;

    @Autowired
    public IdempotencyService(ObjectProvider<StringRedisTemplate> redisTemplate, RiskProperties riskProperties, Clock clock) {
        this(riskProperties.getGuardrails().isRedisIdempotencyEnabled() ? redisTemplate.getIfAvailable() : null,
                riskProperties.getGuardrails().getIdempotencyTtl(), clock);
    }

    public IdempotencyService(StringRedisTemplate redisTemplate, Duration ttl, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.ttl = ttl;
        this.localPending = Caffeine.newBuilder()
                .expireAfterWrite(ttl.toMillis(), TimeUnit.MILLISECONDS)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .maximumSize(100_000)
                .build();
    }

    /**
     * Atomically claims {@code key} for {@code orderId}.
     *
     * @return empty when the claim succeeded, otherwise the order id already holding the key
     */
    public Optional<String> reserve(String key, String orderId) {
        if (redisTemplate != null) {
            try {
                Boolean claimed = redisTemplate.opsForValue().setIfAbsent(KEY_PREFIX + key, orderId, ttl);
                if (Boolean.TRUE.equals(claimed)) {
                    localPending.put(key, orderId);
                    return Optional.empty();
                }
                String holder = redisTemplate.opsForValue().get(KEY_PREFIX + key);
                return Optional.of(holder != null ? holder : orderId);
            } catch (DataAccessException e) {
                log.warn("Redis idempotency unavailable, using in-memory set: {}", e.getMessage());
            }
        }
        String existing = localPending.asMap().putIfAbsent(key, orderId);
        return Optional.ofNullable(existing);
    }

    /**
     * Releases a claim, but only if it is still held by {@code orderId}.
     */
    public void release(String key, String orderId) {
        localPending.asMap().remove(key, orderId);
        if (redisTemplate == null) {
            return;
        }
        try {
            String holder = redisTemplate.opsForValue().get(KEY_PREFIX + key);
            if (Objects.equals(holder, orderId)) {
                redisTemplate.delete(KEY_PREFIX + key);
            }
        } catch (DataAccessException e) {
            log.warn("Redis release of {} failed, key expires with its TTL: {}", key, e.getMessage());
        }
    }

    public boolean isPending(String key) {
        if (redisTemplate != null) {
            try {
                return Boolean.TRUE.equals(redisTemplate.hasKey(KEY_PREFIX + key));
            } catch (DataAccessException e) {
                log.warn("Redis lookup of {} failed: {}", key, e.getMessage());
            }
        }
        return localPending.getIfPresent(key) != null;
    }
}
