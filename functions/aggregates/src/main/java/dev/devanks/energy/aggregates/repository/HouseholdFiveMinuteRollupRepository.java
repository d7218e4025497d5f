package dev.devanks.energy.aggregates.repository;

import com.google.cloud.spring.data.firestore.FirestoreReactiveRepository;
import dev.devanks.energy.aggregates.entity.HouseholdFiveMinuteRollupEntity;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.time.Instant;

@Repository
public interface HouseholdFiveMinuteRollupRepository extends FirestoreReactiveRepository<HouseholdFiveMinuteRollupEntity> {

    Flux<HouseholdFiveMinuteRollupEntity> findByHouseholdIdAndBucketStartGreaterThanEqualAndBucketStartLessThan(
            String householdId, Instant inclusiveStart, Instant exclusiveEnd);
}
