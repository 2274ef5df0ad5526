package com.company.anomaly.exception;

public class RuleTableLoadException extends RuntimeException {
    public RuleTableLoadException(String message) {
        super(message);
    }

    public RuleTableLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
