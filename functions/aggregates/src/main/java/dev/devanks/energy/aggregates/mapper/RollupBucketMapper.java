package dev.devanks.energy.aggregates.mapper;

import dev.devanks.energy.aggregates.config.RollupPolicyProperties;
import dev.devanks.energy.aggregates.entity.DeviceHourRollupEntity;
import dev.devanks.energy.aggregates.entity.DeviceMinuteRollupEntity;
import dev.devanks.energy.aggregates.entity.HouseholdFiveMinuteRollupEntity;
import dev.devanks.energy.aggregates.model.AggregateBucket;
import dev.devanks.energy.aggregates.model.Granularity;
import dev.devanks.energy.aggregates.model.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

@Component
@RequiredArgsConstructor
@Slf4j
public class RollupBucketMapper {

    private final RollupPolicyProperties policyProperties;
    private final Clock clock;

    public AggregateBucket mapToBucket(DeviceMinuteRollupEntity entity) {
        return toBucket(Scope.DEVICE, entity.getDeviceId(), Granularity.DEVICE_1M, entity.getBucketStart(),
                entity.getEnergyWhSum(), entity.getPowerAvgW(), entity.getPowerMaxW());
    }

    public AggregateBucket mapToBucket(HouseholdFiveMinuteRollupEntity entity) {
        return toBucket(Scope.HOUSEHOLD, entity.getHouseholdId(), Granularity.HOUSEHOLD_5M, entity.getBucketStart(),
                entity.getEnergyWhSum(), entity.getPowerAvgW(), entity.getPowerMaxW());
    }

    public AggregateBucket mapToBucket(DeviceHourRollupEntity entity) {
        return toBucket(Scope.DEVICE, entity.getDeviceId(), Granularity.DEVICE_1H, entity.getBucketStart(),
                entity.getEnergyWhSum(), entity.getPowerAvgW(), entity.getPowerMaxW());
    }

    /**
     * A bucket stays provisional until its end plus the table's staleness bound has passed.
     */
    public boolean isProvisional(Granularity granularity, Instant bucketStart, Instant now) {
        Instant settledAt = bucketStart.plus(granularity.bucketWidth())
                .plus(policyProperties.stalenessBound(granularity));
        return settledAt.isAfter(now);
    }

    private AggregateBucket toBucket(Scope scope, String scopeId, Granularity granularity, Instant bucketStart,
                                     Double energyWhSum, Double powerAvgW, Double powerMaxW) {
        if (bucketStart == null) {
            throw new IllegalStateException("Rollup document in " + granularity.collectionName()
                    + " for " + scopeId + " has no bucketStart");
        }
        return AggregateBucket.builder()
                .scope(scope)
                .scopeId(scopeId)
                .granularity(granularity)
                .bucketStart(bucketStart)
                .energyWhSum(energyWhSum != null ? energyWhSum : 0.0)
                .powerAvgW(powerAvgW != null ? powerAvgW : 0.0)
                .powerMaxW(powerMaxW != null ? powerMaxW : 0.0)
                .provisional(isProvisional(granularity, bucketStart, clock.instant()))
                .build();
    }
}
