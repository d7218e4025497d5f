package dev.devanks.energy.aggregates.entity;

import com.google.cloud.firestore.annotation.DocumentId;
import com.google.cloud.spring.data.firestore.Document;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

// 1-minute rollup of a single device. Written by the rollup engine, read-only here.
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collectionName = "device_energy_1m")
public class DeviceMinuteRollupEntity {

    @DocumentId
    private String id;

    private String deviceId;
    private String householdId;
    private Instant bucketStart;
    private Double energyWhSum;
    private Double powerAvgW;
    private Double powerMaxW;
}
