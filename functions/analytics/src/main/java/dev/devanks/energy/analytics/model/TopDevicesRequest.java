package dev.devanks.energy.analytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopDevicesRequest {
    private String householdId;
    // ISO-8601 duration, e.g. P1D; defaults when absent
    private String window;
    private Integer limit;
}
