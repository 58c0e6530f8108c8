package com.giftsbuyer.application.ports;

public class SnapshotStoreException extends RuntimeException {

    public SnapshotStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
