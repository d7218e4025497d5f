package dev.devanks.energy.analytics.cache;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * In-process cache for a single instance, backed by a size-bounded Guava cache that evicts the least
 * recently used entries. Guava drops everything older than {@code maxTtl}; each entry's own jittered
 * expiry is checked on read. Both run on the injected clock.
 */
@Slf4j
public class LocalAggregateCache implements AggregateCache {

    private final Cache<String, Entry> entries;
    private final Clock clock;

    public LocalAggregateCache(Clock clock, int maxEntries, Duration maxTtl) {
        this.clock = clock;
        this.entries = CacheBuilder.newBuilder()
                .maximumSize(maxEntries)
                .expireAfterWrite(maxTtl.toMillis(), TimeUnit.MILLISECONDS)
                .ticker(new Ticker() {
                    @Override
                    public long read() {
                        return TimeUnit.MILLISECONDS.toNanos(clock.instant().toEpochMilli());
                    }
                })
                .build();
    }

    @Override
    public Mono<CachedValue> get(CacheKey key) {
        return Mono.fromSupplier(() -> lookup(key.render()));
    }

    @Override
    public Mono<Void> set(CacheKey key, CachedValue value, Duration ttl) {
        return Mono.fromRunnable(() -> entries.put(key.render(), new Entry(value, clock.instant().plus(ttl))));
    }

    @VisibleForTesting
    long size() {
        entries.cleanUp();
        return entries.size();
    }

    private CachedValue lookup(String key) {
        Entry entry = entries.getIfPresent(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(clock.instant())) {
            entries.asMap().remove(key, entry);
            log.debug("Local cache entry {} expired at {}", key, entry.getExpiresAt());
            return null;
        }
        return entry.getValue();
    }

    @Value
    private static class Entry {
        CachedValue value;
        Instant expiresAt;

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
