package com.company.anomaly.domain.enums;

public enum Severity {
    WARNING(1, "Warning - requires attention"),
    CRITICAL(2, "Critical - immediate action required");

    private final int level;
    private final String description;

    Severity(int level, String description) {
        this.level = level;
        this.description = description;
    }

    public int getLevel() {
        return level;
    }

    public String getDescription() {
        return description;
    }

    public boolean isHigherThan(Severity other) {
        return this.level > other.level;
    }

    public boolean isAtLeast(Severity other) {
        return this.level >= other.level;
    }

    public static Severity fromString(String severity) {
        if (severity == null) {
            throw new IllegalArgumentException("Severity is required");
        }
        return Severity.valueOf(severity.trim().toUpperCase());
    }
}
