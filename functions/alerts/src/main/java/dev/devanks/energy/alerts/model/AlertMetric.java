package dev.devanks.energy.alerts.model;

import dev.devanks.energy.aggregates.model.AggregateBucket;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

public enum AlertMetric {
    ENERGY_WH_SUM("energy_wh_sum", AggregateBucket::getEnergyWhSum),
    POWER_AVG_W("power_avg_w", AggregateBucket::getPowerAvgW),
    POWER_MAX_W("power_max_w", AggregateBucket::getPowerMaxW);

    private final String wireName;
    private final ToDoubleFunction<AggregateBucket> extractor;

    AlertMetric(String wireName, ToDoubleFunction<AggregateBucket> extractor) {
        this.wireName = wireName;
        this.extractor = extractor;
    }

    public String wireName() {
        return wireName;
    }

    public double valueOf(AggregateBucket bucket) {
        return extractor.applyAsDouble(bucket);
    }

    public static Optional<AlertMetric> fromWireName(String value) {
        return Arrays.stream(values())
                .filter(metric -> metric.wireName.equalsIgnoreCase(value == null ? null : value.trim()))
                .findFirst();
    }
}
