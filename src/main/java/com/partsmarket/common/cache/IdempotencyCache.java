package com.partsmarket.common.cache;

import java.util.Optional;

/**
 * Short-lived key/value store used to answer duplicate requests without touching the database.
 *
 * <p>The cache is advisory: a hit may short-circuit a request that is known to be complete,
 * a miss always falls through to the ledger. Implementations never throw; an unavailable
 * backend behaves like an empty cache.</p>
 */
public interface IdempotencyCache {

    void set(String key, Object value, long ttlSeconds);

    <T> Optional<T> get(String key, Class<T> type);

    void delete(String key);
}
