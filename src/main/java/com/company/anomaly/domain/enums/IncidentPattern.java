package com.company.anomaly.domain.enums;

public enum IncidentPattern {
    CASCADE("broker→processor→store cascade"),
    RESOURCE_EXHAUSTION("resource exhaustion");

    private final String label;

    IncidentPattern(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
