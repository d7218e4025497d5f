package dev.devanks.energy.analytics.cache;

import java.time.Duration;
import java.util.random.RandomGenerator;

/**
 * TTL for a new cache entry: the base TTL plus a uniform jitter in {@code [0, jitterMax]}, so entries
 * written together do not all expire together.
 */
public class CacheTtlPolicy {

    private final Duration baseTtl;
    private final Duration jitterMax;
    private final RandomGenerator random;

    public CacheTtlPolicy(Duration baseTtl, Duration jitterMax, RandomGenerator random) {
        if (baseTtl.isNegative() || baseTtl.isZero()) {
            throw new IllegalArgumentException("Base TTL must be positive: " + baseTtl);
        }
        if (jitterMax.isNegative()) {
            throw new IllegalArgumentException("Jitter ceiling must not be negative: " + jitterMax);
        }
        this.baseTtl = baseTtl;
        this.jitterMax = jitterMax;
        this.random = random;
    }

    public Duration nextTtl() {
        long jitterMillis = random.nextLong(jitterMax.toMillis() + 1);
        return baseTtl.plusMillis(jitterMillis);
    }

    /**
     * Longest TTL this policy can hand out.
     */
    public Duration maxTtl() {
        return baseTtl.plus(jitterMax);
    }
}
