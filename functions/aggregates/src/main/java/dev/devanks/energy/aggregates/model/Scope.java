package dev.devanks.energy.aggregates.model;

import java.util.Arrays;
import java.util.Locale;

public enum Scope {
    DEVICE("device"),
    HOUSEHOLD("household");

    private final String wireName;

    Scope(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Scope fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Scope must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(scope -> scope.wireName.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown scope: " + value));
    }
}
