package dev.devanks.energy.analytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Input of the {@code energySeries} function. Either {@code start}/{@code end} (ISO-8601) or
 * {@code range} (hour, day, week, month) must be given.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnergySeriesRequest {
    private String scope;
    private String scopeId;
    private String start;
    private String end;
    private String range;
    private String step;
}
