package dev.devanks.energy.aggregates.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class AggregateBucket {

    Scope scope;
    String scopeId;
    Granularity granularity;
    Instant bucketStart;
    double energyWhSum;
    double powerAvgW;
    double powerMaxW;

    /**
     * True while the bucket can still be rewritten by a rollup refresh.
     */
    boolean provisional;

    public Instant bucketEnd() {
        return bucketStart.plus(granularity.bucketWidth());
    }
}
