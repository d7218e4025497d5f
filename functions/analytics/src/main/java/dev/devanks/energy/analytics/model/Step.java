package dev.devanks.energy.analytics.model;

import dev.devanks.energy.analytics.exception.InvalidQueryException;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

/**
 * Width of the points in a served series.
 */
public enum Step {
    ONE_MINUTE("1m", Duration.ofMinutes(1)),
    FIVE_MINUTES("5m", Duration.ofMinutes(5)),
    ONE_HOUR("1h", Duration.ofHours(1));

    private final String wireName;
    private final Duration width;

    Step(String wireName, Duration width) {
        this.wireName = wireName;
        this.width = width;
    }

    public String wireName() {
        return wireName;
    }

    public Duration width() {
        return width;
    }

    public Instant alignDown(Instant instant) {
        long widthMillis = width.toMillis();
        return Instant.ofEpochMilli(Math.floorDiv(instant.toEpochMilli(), widthMillis) * widthMillis);
    }

    public static Step fromWireName(String value) {
        return Arrays.stream(values())
                .filter(step -> step.wireName.equalsIgnoreCase(value == null ? null : value.trim()))
                .findFirst()
                .orElseThrow(() -> new InvalidQueryException("Unsupported step: " + value));
    }
}
