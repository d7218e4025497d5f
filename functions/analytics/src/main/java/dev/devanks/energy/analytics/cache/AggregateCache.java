package dev.devanks.energy.analytics.cache;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Short-lived cache in front of the rollup store. Implementations never surface backend failures:
 * a broken cache behaves like an empty one.
 */
public interface AggregateCache {

    /**
     * @return the cached value, or empty on a miss.
     */
    Mono<CachedValue> get(CacheKey key);

    Mono<Void> set(CacheKey key, CachedValue value, Duration ttl);
}
