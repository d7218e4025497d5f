package dev.devanks.energy.aggregates.repository;

import com.google.cloud.spring.data.firestore.FirestoreReactiveRepository;
import dev.devanks.energy.aggregates.entity.DeviceMinuteRollupEntity;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.time.Instant;

@Repository
public interface DeviceMinuteRollupRepository extends FirestoreReactiveRepository<DeviceMinuteRollupEntity> {

    Flux<DeviceMinuteRollupEntity> findByDeviceIdAndBucketStartGreaterThanEqualAndBucketStartLessThan(
            String deviceId, Instant inclusiveStart, Instant exclusiveEnd);
}
