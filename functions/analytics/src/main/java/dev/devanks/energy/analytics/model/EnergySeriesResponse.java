package dev.devanks.energy.analytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnergySeriesResponse {

    private String freshAsOf;
    private List<Point> series;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Point {
        private String t;
        private double v;
        private boolean provisional;
    }

    public static EnergySeriesResponse from(EnergySeries energySeries) {
        return EnergySeriesResponse.builder()
                .freshAsOf(energySeries.getFreshAsOf().toString())
                .series(energySeries.getSeries().stream()
                        .map(point -> new Point(point.getT().toString(), point.getV(), point.isProvisional()))
                        .toList())
                .build();
    }
}
