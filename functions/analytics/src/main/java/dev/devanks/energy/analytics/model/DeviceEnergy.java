package dev.devanks.energy.analytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceEnergy {
    private String deviceId;
    private double energyKwh;
    private double shareOfTotalPercent;
}
