package dev.devanks.energy.aggregates.repository;

import com.google.cloud.spring.data.firestore.FirestoreReactiveRepository;
import dev.devanks.energy.aggregates.entity.DeviceHourRollupEntity;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.time.Instant;

@Repository
public interface DeviceHourRollupRepository extends FirestoreReactiveRepository<DeviceHourRollupEntity> {

    Flux<DeviceHourRollupEntity> findByDeviceIdAndBucketStartGreaterThanEqualAndBucketStartLessThan(
            String deviceId, Instant inclusiveStart, Instant exclusiveEnd);

    // Every device of the household, used for rankings
    Flux<DeviceHourRollupEntity> findByHouseholdIdAndBucketStartGreaterThanEqualAndBucketStartLessThan(
            String householdId, Instant inclusiveStart, Instant exclusiveEnd);
}
