package dev.devanks.energy.aggregates.entity;

import com.google.cloud.firestore.annotation.DocumentId;
import com.google.cloud.spring.data.firestore.Document;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collectionName = "household_energy_5m")
public class HouseholdFiveMinuteRollupEntity {

    @DocumentId
    private String id;

    private String householdId;
    private Instant bucketStart;
    private Double energyWhSum;
    private Double powerAvgW;
    private Double powerMaxW;
}
