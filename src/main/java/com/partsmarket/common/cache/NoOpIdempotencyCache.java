package com.partsmarket.common.cache;

import java.util.Optional;

/**
 * Cache that stores nothing. Active when {@code partsmarket.cache.enabled=false}.
 */
public class NoOpIdempotencyCache implements IdempotencyCache {

    @Override
    public void set(String key, Object value, long ttlSeconds) {
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        return Optional.empty();
    }

    @Override
    public void delete(String key) {
    }
}
