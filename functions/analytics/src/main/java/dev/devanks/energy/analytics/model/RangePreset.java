package dev.devanks.energy.analytics.model;

import dev.devanks.energy.analytics.exception.InvalidQueryException;

import java.time.Duration;
import java.util.Arrays;

/**
 * Trailing ranges a dashboard can ask for instead of explicit bounds. Each preset caps how fine the
 * step may be so a month is never served minute by minute.
 */
public enum RangePreset {
    HOUR("hour", Duration.ofHours(1), Step.ONE_MINUTE),
    DAY("day", Duration.ofDays(1), Step.FIVE_MINUTES),
    WEEK("week", Duration.ofDays(7), Step.ONE_HOUR),
    MONTH("month", Duration.ofDays(30), Step.ONE_HOUR);

    private final String wireName;
    private final Duration length;
    private final Step minimumStep;

    RangePreset(String wireName, Duration length, Step minimumStep) {
        this.wireName = wireName;
        this.length = length;
        this.minimumStep = minimumStep;
    }

    public String wireName() {
        return wireName;
    }

    public Duration length() {
        return length;
    }

    public Step minimumStep() {
        return minimumStep;
    }

    public boolean allows(Step step) {
        return step.width().compareTo(minimumStep.width()) >= 0;
    }

    public static RangePreset fromWireName(String value) {
        return Arrays.stream(values())
                .filter(preset -> preset.wireName.equalsIgnoreCase(value == null ? null : value.trim()))
                .findFirst()
                .orElseThrow(() -> new InvalidQueryException("Unknown range preset: " + value));
    }
}
