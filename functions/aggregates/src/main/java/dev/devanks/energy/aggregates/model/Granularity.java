package dev.devanks.energy.aggregates.model;

import java.time.Duration;
import java.time.Instant;

/**
 * The rollup tables available to readers. Callers pick one by intent: {@link #DEVICE_1M} for alert
 * reactivity, {@link #HOUSEHOLD_5M} for dashboard series, {@link #DEVICE_1H} for rankings.
 */
public enum Granularity {
    DEVICE_1M(Scope.DEVICE, Duration.ofMinutes(1), "device_energy_1m"),
    HOUSEHOLD_5M(Scope.HOUSEHOLD, Duration.ofMinutes(5), "household_energy_5m"),
    DEVICE_1H(Scope.DEVICE, Duration.ofHours(1), "device_energy_1h");

    private final Scope scope;
    private final Duration bucketWidth;
    private final String collectionName;

    Granularity(Scope scope, Duration bucketWidth, String collectionName) {
        this.scope = scope;
        this.bucketWidth = bucketWidth;
        this.collectionName = collectionName;
    }

    public Scope scope() {
        return scope;
    }

    public Duration bucketWidth() {
        return bucketWidth;
    }

    public String collectionName() {
        return collectionName;
    }

    public boolean supports(Scope candidate) {
        return scope == candidate;
    }

    /**
     * Start of the bucket containing the given instant, aligned to the epoch.
     */
    public Instant alignDown(Instant instant) {
        long widthMillis = bucketWidth.toMillis();
        return Instant.ofEpochMilli(Math.floorDiv(instant.toEpochMilli(), widthMillis) * widthMillis);
    }
}
