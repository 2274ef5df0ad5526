package com.company.anomaly.exception;

public class StorageWriteException extends RuntimeException {
    public StorageWriteException(String store, Throwable cause) {
        super("Write to " + store + " failed: " + cause.getMessage(), cause);
    }
}
