package com.company.anomaly.exception;

public enum InputErrorCode {
    MISSING_TIMESTAMP,
    MISSING_COMPONENT,
    UNKNOWN_COMPONENT,
    MISSING_METRIC_NAME,
    NON_FINITE_VALUE
}
