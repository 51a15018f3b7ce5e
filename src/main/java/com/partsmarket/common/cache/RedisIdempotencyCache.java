package com.partsmarket.common.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed {@link IdempotencyCache}. Values are stored as JSON strings.
 *
 * <p>Every operation sits behind the {@code idempotencyCache} circuit breaker. A Redis outage
 * degrades to "always miss" and writes are dropped, so the workflows keep going against the
 * database alone.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class RedisIdempotencyCache implements IdempotencyCache {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    @CircuitBreaker(name = "idempotencyCache", fallbackMethod = "setFallback")
    public void set(String key, Object value, long ttlSeconds) {
        redisTemplate.opsForValue().set(key, toJson(value), Duration.ofSeconds(ttlSeconds));
    }

    @Override
    @CircuitBreaker(name = "idempotencyCache", fallbackMethod = "getFallback")
    public <T> Optional<T> get(String key, Class<T> type) {
        String json = redisTemplate.opsForValue().get(key);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cache entry: key={}", key, e);
            redisTemplate.delete(key);
            return Optional.empty();
        }
    }

    @Override
    @CircuitBreaker(name = "idempotencyCache", fallbackMethod = "deleteFallback")
    public void delete(String key) {
        redisTemplate.delete(key);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize cache value of type " + value.getClass().getName(), e);
        }
    }

    @SuppressWarnings("unused")
    private void setFallback(String key, Object value, long ttlSeconds, Throwable t) {
        log.error("Cache write failed, continuing without cache: key={}", key, t);
    }

    @SuppressWarnings("unused")
    private <T> Optional<T> getFallback(String key, Class<T> type, Throwable t) {
        log.warn("Cache read failed, treating as miss: key={}, cause={}", key, t.getMessage());
        return Optional.empty();
    }

    @SuppressWarnings("unused")
    private void deleteFallback(String key, Throwable t) {
        log.error("Cache delete failed: key={}", key, t);
    }
}
