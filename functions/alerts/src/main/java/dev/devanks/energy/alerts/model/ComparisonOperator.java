package dev.devanks.energy.alerts.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Threshold comparison of a rule. Both the mathematical symbols and their ASCII spellings are accepted.
 */
public enum ComparisonOperator {
    GT(List.of(">")) {
        @Override
        public boolean test(double value, double threshold) {
            return value > threshold;
        }
    },
    GTE(List.of("≥", ">=")) {
        @Override
        public boolean test(double value, double threshold) {
            return value >= threshold;
        }
    },
    LT(List.of("<")) {
        @Override
        public boolean test(double value, double threshold) {
            return value < threshold;
        }
    },
    LTE(List.of("≤", "<=")) {
        @Override
        public boolean test(double value, double threshold) {
            return value <= threshold;
        }
    };

    private final List<String> symbols;

    ComparisonOperator(List<String> symbols) {
        this.symbols = symbols;
    }

    public abstract boolean test(double value, double threshold);

    public String symbol() {
        return symbols.get(0);
    }

    public static Optional<ComparisonOperator> fromSymbol(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(operator -> operator.symbols.contains(trimmed))
                .findFirst();
    }
}
