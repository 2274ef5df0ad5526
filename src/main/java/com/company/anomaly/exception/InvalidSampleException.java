package com.company.anomaly.exception;

import lombok.Getter;

@Getter
public class InvalidSampleException extends RuntimeException {
    private final InputErrorCode code;

    public InvalidSampleException(InputErrorCode code, String message) {
        super(message);
        this.code = code;
    }
}
