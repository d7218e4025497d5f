package dev.devanks.energy.alerts.model;

import dev.devanks.energy.aggregates.model.Granularity;
import dev.devanks.energy.aggregates.model.Scope;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Duration;

/**
 * A validated threshold rule. Immutable for the lifetime of the worker.
 */
@Value
@Builder
public class AlertRule {

    private static final Duration HOURLY_WINDOW = Duration.ofHours(1);

    @NonNull String id;
    @NonNull Scope scope;
    @NonNull String scopeId;
    @NonNull AlertMetric metric;
    @NonNull Duration window;
    @NonNull ComparisonOperator operator;
    double threshold;
    @NonNull Duration cooldown;

    /**
     * Household rules read the 5m rollup. Device rules read minute buckets for sub-hour windows
     * and hourly buckets otherwise.
     */
    public Granularity granularity() {
        if (scope == Scope.HOUSEHOLD) {
            return Granularity.HOUSEHOLD_5M;
        }
        return window.compareTo(HOURLY_WINDOW) < 0 ? Granularity.DEVICE_1M : Granularity.DEVICE_1H;
    }

    /**
     * How far back to look for the latest bucket: the configured trailing window, widened to at least
     * two buckets so a just-closed bucket is always in range. {@code settleDelay} is the time a bucket
     * needs after its end to become final; pass zero when provisional buckets are acceptable.
     */
    public Duration fetchWindow(Duration trailingWindow, Duration settleDelay) {
        Duration twoBuckets = granularity().bucketWidth().multipliedBy(2).plus(settleDelay);
        return twoBuckets.compareTo(trailingWindow) > 0 ? twoBuckets : trailingWindow;
    }

    public boolean isBreachedBy(double value) {
        return operator.test(value, threshold);
    }

    public String describe() {
        return id + " (" + scope.wireName() + "/" + scopeId + " " + metric.wireName() + " "
                + operator.symbol() + " " + threshold + ")";
    }
}
