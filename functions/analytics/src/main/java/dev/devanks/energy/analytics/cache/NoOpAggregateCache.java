package dev.devanks.energy.analytics.cache;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Used when no cache backend is configured. Every read misses, every write is dropped.
 */
public class NoOpAggregateCache implements AggregateCache {

    @Override
    public Mono<CachedValue> get(CacheKey key) {
        return Mono.empty();
    }

    @Override
    public Mono<Void> set(CacheKey key, CachedValue value, Duration ttl) {
        return Mono.empty();
    }
}
