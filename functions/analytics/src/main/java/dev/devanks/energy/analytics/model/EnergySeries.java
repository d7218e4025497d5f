package dev.devanks.energy.analytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnergySeries {

    /**
     * When the series was read from the rollup store. Cache hits keep the original read time.
     */
    private Instant freshAsOf;

    private List<SeriesPoint> series;
}
