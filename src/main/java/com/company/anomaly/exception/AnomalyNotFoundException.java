package com.company.anomaly.exception;

public class AnomalyNotFoundException extends RuntimeException {
    public AnomalyNotFoundException(String anomalyId) {
        super("Anomaly event not found: " + anomalyId);
    }
}
