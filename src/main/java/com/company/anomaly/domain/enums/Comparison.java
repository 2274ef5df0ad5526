package com.company.anomaly.domain.enums;

public enum Comparison {
    GREATER_THAN(">"),
    LESS_THAN("<");

    private final String symbol;

    Comparison(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean holds(double value, double threshold) {
        return this == GREATER_THAN ? value > threshold : value < threshold;
    }

    public static Comparison fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Comparison is required");
        }
        String normalized = value.trim();
        for (Comparison comparison : values()) {
            if (comparison.symbol.equals(normalized)
                    || comparison.name().equalsIgnoreCase(normalized.replace('-', '_'))) {
                return comparison;
            }
        }
        throw new IllegalArgumentException("Unknown comparison: " + value);
    }
}
