package dev.devanks.energy.analytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

// One step of a series: start of the step and energy in Wh. Provisional while any bucket in the step may still change.
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeriesPoint {
    private Instant t;
    private double v;
    private boolean provisional;

    public SeriesPoint(Instant t, double v) {
        this(t, v, false);
    }

    public static SeriesPoint merge(SeriesPoint left, SeriesPoint right) {
        return new SeriesPoint(left.t, left.v + right.v, left.provisional || right.provisional);
    }
}
