package dev.devanks.energy.aggregates.service;

import dev.devanks.energy.aggregates.exception.StorageUnavailableException;
import dev.devanks.energy.aggregates.mapper.RollupBucketMapper;
import dev.devanks.energy.aggregates.model.AggregateBucket;
import dev.devanks.energy.aggregates.model.Granularity;
import dev.devanks.energy.aggregates.model.Scope;
import dev.devanks.energy.aggregates.repository.DeviceHourRollupRepository;
import dev.devanks.energy.aggregates.repository.DeviceMinuteRollupRepository;
import dev.devanks.energy.aggregates.repository.HouseholdFiveMinuteRollupRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Instant;
import java.util.Comparator;

import static java.util.Comparator.naturalOrder;
import static java.util.Comparator.nullsFirst;

/**
 * Read-only access to the rollup collections. Performs no caching and no retries; every failure of
 * the backing store surfaces as {@link StorageUnavailableException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AggregateStoreService {

    private static final Comparator<AggregateBucket> BY_BUCKET_START =
            Comparator.comparing(AggregateBucket::getBucketStart);

    private final DeviceMinuteRollupRepository deviceMinuteRepository;
    private final HouseholdFiveMinuteRollupRepository householdFiveMinuteRepository;
    private final DeviceHourRollupRepository deviceHourRepository;
    private final RollupBucketMapper bucketMapper;

    /**
     * Fetches buckets whose start lies in {@code [start, end)}.
     *
     * @param scope       device or household.
     * @param scopeId     id of the device or household.
     * @param granularity rollup table to read; must belong to {@code scope}.
     * @param start       inclusive start.
     * @param end         exclusive end.
     * @return buckets ascending by start; empty when there is no data.
     */
    public Flux<AggregateBucket> getBuckets(Scope scope, String scopeId, Granularity granularity,
                                            Instant start, Instant end) {
        if (!granularity.supports(scope)) {
            return Flux.error(new IllegalArgumentException(
                    "Granularity " + granularity + " does not hold " + scope + " rollups"));
        }
        if (!start.isBefore(end)) {
            log.debug("Empty range [{}, {}) requested for {} {}, skipping store read", start, end, scope, scopeId);
            return Flux.empty();
        }

        Flux<AggregateBucket> buckets = switch (granularity) {
            case DEVICE_1M -> deviceMinuteRepository
                    .findByDeviceIdAndBucketStartGreaterThanEqualAndBucketStartLessThan(scopeId, start, end)
                    .map(bucketMapper::mapToBucket);
            case HOUSEHOLD_5M -> householdFiveMinuteRepository
                    .findByHouseholdIdAndBucketStartGreaterThanEqualAndBucketStartLessThan(scopeId, start, end)
                    .map(bucketMapper::mapToBucket);
            case DEVICE_1H -> deviceHourRepository
                    .findByDeviceIdAndBucketStartGreaterThanEqualAndBucketStartLessThan(scopeId, start, end)
                    .map(bucketMapper::mapToBucket);
        };

        return buckets
                .sort(BY_BUCKET_START)
                .doOnSubscribe(s -> log.debug("Reading {} buckets for {} {} in [{}, {})", granularity, scope, scopeId, start, end))
                .onErrorMap(e -> !(e instanceof StorageUnavailableException), e -> {
                    log.error("Rollup read failed for {} {} {} in [{}, {}): {}",
                            granularity, scope, scopeId, start, end, e.getMessage(), e);
                    return new StorageUnavailableException(
                            "Rollup store unavailable while reading " + granularity.collectionName(), e);
                });
    }

    /**
     * Fetches the hourly buckets of every device that belongs to the household.
     *
     * @return buckets ordered by start, then device id.
     */
    public Flux<AggregateBucket> getDeviceHourBucketsForHousehold(String householdId, Instant start, Instant end) {
        if (!start.isBefore(end)) {
            return Flux.empty();
        }
        return deviceHourRepository
                .findByHouseholdIdAndBucketStartGreaterThanEqualAndBucketStartLessThan(householdId, start, end)
                .map(bucketMapper::mapToBucket)
                .sort(BY_BUCKET_START.thenComparing(AggregateBucket::getScopeId, nullsFirst(naturalOrder())))
                .onErrorMap(e -> !(e instanceof StorageUnavailableException), e -> {
                    log.error("Device-hour read failed for household {} in [{}, {}): {}",
                            householdId, start, end, e.getMessage(), e);
                    return new StorageUnavailableException(
                            "Rollup store unavailable while reading " + Granularity.DEVICE_1H.collectionName(), e);
                });
    }
}
